package de.bsommerfeld.triage.engine.similarity;

/**
 * Jaccard word overlap. Needs no model and is the default strategy.
 */
public final class LexicalSimilarity implements SimilarityStrategy {

    private final double threshold;

    public LexicalSimilarity(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public TextProfile profile(String normalizedText) {
        return new TextProfile(normalizedText, Profiles.words(normalizedText), null);
    }

    @Override
    public double similarity(TextProfile a, TextProfile b) {
        return Profiles.jaccard(a.words(), b.words());
    }

    @Override
    public double threshold() {
        return threshold;
    }
}
