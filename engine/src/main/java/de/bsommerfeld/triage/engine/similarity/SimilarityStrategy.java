package de.bsommerfeld.triage.engine.similarity;

/**
 * How two messages are compared. Implementations must be symmetric:
 * {@code similarity(a, b) == similarity(b, a)}.
 */
public interface SimilarityStrategy {

    /**
     * Builds the comparison profile of an already normalized text.
     * Called once per message.
     */
    TextProfile profile(String normalizedText);

    /**
     * @return blended similarity in [0, 1]
     */
    double similarity(TextProfile a, TextProfile b);

    /**
     * Minimum similarity a candidate needs to be reported.
     */
    double threshold();
}
