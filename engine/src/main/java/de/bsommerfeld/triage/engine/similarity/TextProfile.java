package de.bsommerfeld.triage.engine.similarity;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Set;

/**
 * Everything a {@link SimilarityStrategy} needs to compare one text,
 * computed once per message and reused for every later comparison.
 *
 * @param text      normalized text
 * @param words     distinct whitespace-separated tokens of {@code text}
 * @param embedding dense vector, {@code null} when the strategy has none or
 *                  the text is blank
 */
public record TextProfile(String text, Set<String> words, Embedding embedding) {

    public TextProfile {
        words = Set.copyOf(words);
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }
}
