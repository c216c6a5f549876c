package de.bsommerfeld.triage.engine.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;

/**
 * Sentence-embedding cosine blended with {@link FuzzyRatio}.
 * Negative cosine values count as zero. Blank texts are not sent to the
 * model and score zero on the semantic side.
 */
public final class EmbeddingSimilarity implements SimilarityStrategy {

    private final EmbeddingModel model;
    private final double semanticWeight;
    private final double fuzzyWeight;
    private final double threshold;

    public EmbeddingSimilarity(EmbeddingModel model, double semanticWeight, double fuzzyWeight, double threshold) {
        this.model = model;
        this.semanticWeight = semanticWeight;
        this.fuzzyWeight = fuzzyWeight;
        this.threshold = threshold;
    }

    @Override
    public TextProfile profile(String normalizedText) {
        Embedding embedding = normalizedText.isBlank() ? null : model.embed(normalizedText).content();
        return new TextProfile(normalizedText, Profiles.words(normalizedText), embedding);
    }

    @Override
    public double similarity(TextProfile a, TextProfile b) {
        double semantic = 0.0;
        if (a.hasEmbedding() && b.hasEmbedding()) {
            double cosine = CosineSimilarity.between(a.embedding(), b.embedding());
            semantic = Double.isNaN(cosine) ? 0.0 : Math.max(0.0, Math.min(cosine, 1.0));
        }
        double fuzzy = FuzzyRatio.ratio(a.text(), b.text());
        return Math.min(semanticWeight * semantic + fuzzyWeight * fuzzy, 1.0);
    }

    @Override
    public double threshold() {
        return threshold;
    }
}
