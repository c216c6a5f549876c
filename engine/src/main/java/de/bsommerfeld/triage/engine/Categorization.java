package de.bsommerfeld.triage.engine;

/**
 * Result of categorizing one text.
 *
 * @param category   winning category name
 * @param confidence normalized rule strength in [0, 1], not a probability
 * @param rawScore   accumulated keyword and pattern points of the winner
 */
public record Categorization(String category, double confidence, int rawScore) {

    public boolean isFallback() {
        return rawScore == 0;
    }
}
