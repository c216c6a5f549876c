package de.bsommerfeld.triage.core.config;

/**
 * Which signals the similarity search blends.
 */
public enum SimilarityMode {

    /** Jaccard word overlap only. No model dependency. */
    LEXICAL,

    /** Sentence-embedding cosine blended with a fuzzy edit-distance ratio. */
    EMBEDDING
}
