package de.bsommerfeld.triage.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TriageConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnDefaultsForMissingFile() {
        TriageConfig config = TriageConfigLoader.load(tempDir.resolve("absent.toml"));

        assertEquals(7, config.getCategories().size());
        assertEquals(SimilarityMode.LEXICAL, config.getSimilarity().getMode());
    }

    @Test
    void parse_shouldReturnDefaultsForBlankDocument() {
        TriageConfig config = TriageConfigLoader.parse("   ");

        assertEquals("general", config.getFallbackCategory());
    }

    @Test
    void parse_shouldOverrideOnlyGivenKeys() {
        String toml = """
                confidence-normalization = 3.0

                [similarity]
                mode = "embedding"
                top-k = 10

                [priority]
                urgency-bonus = 0.3
                """;

        TriageConfig config = TriageConfigLoader.parse(toml);

        assertEquals(3.0, config.getConfidenceNormalization(), 0.001);
        assertEquals(SimilarityMode.EMBEDDING, config.getSimilarity().getMode());
        assertEquals(10, config.getSimilarity().getTopK());
        assertEquals(0.3, config.getPriority().getUrgencyBonus(), 0.001);
        // Untouched keys keep their defaults
        assertEquals(0.2, config.getSimilarity().getLexicalThreshold(), 0.001);
        assertEquals(200, config.getPriority().getLongLengthThreshold());
        assertEquals(7, config.getCategories().size());
    }

    @Test
    void parse_shouldReplaceCategoryListInOrder() {
        String toml = """
                fallback-category = "other"

                [[categories]]
                name = "billing"
                keywords = ["invoice", "refund"]
                patterns = ["charged.*twice"]
                color = "#123456"
                priority-boost = 0.5

                [[categories]]
                name = "other"
                """;

        TriageConfig config = TriageConfigLoader.parse(toml);

        assertEquals("other", config.getFallbackCategory());
        assertEquals(2, config.getCategories().size());
        CategoryConfig billing = config.getCategories().get(0);
        assertEquals("billing", billing.getName());
        assertEquals(2, billing.getKeywords().size());
        assertEquals("charged.*twice", billing.getPatterns().get(0));
        assertEquals(0.5, billing.getPriorityBoost(), 0.001);
        CategoryConfig other = config.getCategories().get(1);
        assertTrue(other.getKeywords().isEmpty());
        assertEquals(0.0, other.getPriorityBoost());
    }

    @Test
    void load_shouldReadFileFromDisk() throws IOException {
        Path file = tempDir.resolve("triage.toml");
        Files.writeString(file, "[analytics]\ntop-words = 3\n");

        TriageConfig config = TriageConfigLoader.load(file);

        assertEquals(3, config.getAnalytics().getTopWords());
        assertEquals(5, config.getAnalytics().getTopContributors());
    }

    @Test
    void parse_shouldWrapMalformedToml() {
        assertThrows(TriageConfigurationException.class,
                () -> TriageConfigLoader.parse("this is = = not toml ["));
    }
}
