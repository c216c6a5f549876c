package de.bsommerfeld.triage.engine;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.triage.core.config.SimilarityMode;
import de.bsommerfeld.triage.core.config.TriageConfig;
import de.bsommerfeld.triage.core.domain.MessageRecord;
import de.bsommerfeld.triage.engine.similarity.EmbeddingSimilarity;
import de.bsommerfeld.triage.engine.similarity.LexicalSimilarity;
import de.bsommerfeld.triage.engine.similarity.SimilarityStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TriageModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldProvideSingleEngine() {
        Injector injector = Guice.createInjector(new TriageModule(new TriageConfig()));

        TriageEngine engine = injector.getInstance(TriageEngine.class);

        assertSame(engine, injector.getInstance(TriageEngine.class));
        assertInstanceOf(LexicalSimilarity.class, injector.getInstance(SimilarityStrategy.class));
    }

    @Test
    void injector_shouldSelectEmbeddingStrategy() {
        var config = new TriageConfig();
        config.getSimilarity().setMode(SimilarityMode.EMBEDDING);

        Injector injector = Guice.createInjector(new TriageModule(config));

        SimilarityStrategy strategy = injector.getInstance(SimilarityStrategy.class);
        assertInstanceOf(EmbeddingSimilarity.class, strategy);
        assertEquals(0.3, strategy.threshold(), 1e-9);
    }

    @Test
    void fromFile_shouldApplyConfiguration() throws IOException {
        Path file = tempDir.resolve("triage.toml");
        Files.writeString(file, """
                [similarity]
                top-k = 1
                """);
        Injector injector = Guice.createInjector(TriageModule.fromFile(file));
        TriageEngine engine = injector.getInstance(TriageEngine.class);

        engine.process(new MessageRecord("server down in prod", null));
        engine.process(new MessageRecord("server down in prod!", null));
        var third = engine.process(new MessageRecord("server down in prod?", null));

        assertEquals(1, third.getSimilarMessages().size());
    }
}
