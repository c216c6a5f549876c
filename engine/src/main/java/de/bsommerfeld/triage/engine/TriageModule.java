package de.bsommerfeld.triage.engine;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.triage.core.config.SimilarityConfig;
import de.bsommerfeld.triage.core.config.TriageConfig;
import de.bsommerfeld.triage.core.config.TriageConfigLoader;
import de.bsommerfeld.triage.engine.similarity.EmbeddingModels;
import de.bsommerfeld.triage.engine.similarity.EmbeddingSimilarity;
import de.bsommerfeld.triage.engine.similarity.LexicalSimilarity;
import de.bsommerfeld.triage.engine.similarity.SimilarityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring a {@link TriageEngine} from a {@link TriageConfig}.
 * The similarity strategy follows the configured mode; one engine (and so one
 * message store) exists per injector.
 */
public class TriageModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(TriageModule.class);

    private final TriageConfig config;

    public TriageModule(TriageConfig config) {
        this.config = config;
    }

    public static TriageModule fromFile(Path configPath) {
        return new TriageModule(TriageConfigLoader.load(configPath));
    }

    @Override
    protected void configure() {
        bind(TriageConfig.class).toInstance(config);
        bind(SimilarityConfig.class).toInstance(config.getSimilarity());
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(TriageEngine.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    SimilarityStrategy similarityStrategy(SimilarityConfig similarity) {
        LOG.info("Similarity mode: {}", similarity.getMode());
        switch (similarity.getMode()) {
            case EMBEDDING:
                return new EmbeddingSimilarity(EmbeddingModels.ollama(similarity), similarity.getSemanticWeight(),
                        similarity.getFuzzyWeight(), similarity.getEmbeddingThreshold());
            case LEXICAL:
            default:
                return new LexicalSimilarity(similarity.getLexicalThreshold());
        }
    }
}
