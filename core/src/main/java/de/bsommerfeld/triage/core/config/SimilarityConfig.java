package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Similarity search parameters. The embedding settings are only read when
 * {@link #getMode()} is {@link SimilarityMode#EMBEDDING}.
 */
public class SimilarityConfig {

    @JsonProperty("mode")
    private SimilarityMode mode = SimilarityMode.LEXICAL;

    @JsonProperty("top-k")
    private int topK = 5;

    @JsonProperty("lexical-threshold")
    private double lexicalThreshold = 0.2;

    @JsonProperty("embedding-threshold")
    private double embeddingThreshold = 0.3;

    @JsonProperty("semantic-weight")
    private double semanticWeight = 0.7;

    @JsonProperty("fuzzy-weight")
    private double fuzzyWeight = 0.3;

    @JsonProperty("max-key-phrases")
    private int maxKeyPhrases = 3;

    @JsonProperty("key-phrase-min-word-length")
    private int keyPhraseMinWordLength = 4;

    @JsonProperty("ollama-base-url")
    private String ollamaBaseUrl = "http://localhost:11434";

    @JsonProperty("embedding-model")
    private String embeddingModel = "all-minilm";

    @JsonProperty("embedding-timeout-seconds")
    private long embeddingTimeoutSeconds = 60;

    public SimilarityMode getMode() {
        return mode;
    }

    public void setMode(SimilarityMode mode) {
        this.mode = mode;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public double getLexicalThreshold() {
        return lexicalThreshold;
    }

    public double getEmbeddingThreshold() {
        return embeddingThreshold;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public double getFuzzyWeight() {
        return fuzzyWeight;
    }

    public int getMaxKeyPhrases() {
        return maxKeyPhrases;
    }

    public int getKeyPhraseMinWordLength() {
        return keyPhraseMinWordLength;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public long getEmbeddingTimeoutSeconds() {
        return embeddingTimeoutSeconds;
    }
}
