package de.bsommerfeld.triage.engine.similarity;

import de.bsommerfeld.triage.core.config.SimilarityConfig;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds the embedding model used in {@code EMBEDDING} mode.
 */
public final class EmbeddingModels {

    private static final Logger LOG = LoggerFactory.getLogger(EmbeddingModels.class);

    private EmbeddingModels() {
    }

    public static EmbeddingModel ollama(SimilarityConfig config) {
        LOG.info("Initializing Vector Embedding Model: {} at {}", config.getEmbeddingModel(),
                config.getOllamaBaseUrl());
        return OllamaEmbeddingModel.builder()
                .baseUrl(config.getOllamaBaseUrl())
                .modelName(config.getEmbeddingModel())
                .timeout(Duration.ofSeconds(config.getEmbeddingTimeoutSeconds()))
                .build();
    }
}
