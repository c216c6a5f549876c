package de.bsommerfeld.triage.engine.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingSimilarityTest {

    /**
     * Looks vectors up by text so cosine values are known up front.
     */
    private static class FixedEmbeddingModel implements EmbeddingModel {

        private final Map<String, float[]> vectors;
        private int calls;

        FixedEmbeddingModel(Map<String, float[]> vectors) {
            this.vectors = vectors;
        }

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
            List<Embedding> embeddings = new ArrayList<>();
            for (TextSegment segment : segments) {
                calls++;
                embeddings.add(Embedding.from(vectors.getOrDefault(segment.text(), new float[] { 0f, 1f })));
            }
            return Response.from(embeddings);
        }
    }

    private final FixedEmbeddingModel model = new FixedEmbeddingModel(Map.of(
            "server down", new float[] { 1f, 0f },
            "server is down", new float[] { 1f, 0f },
            "good", new float[] { 1f, 0f },
            "bad", new float[] { -1f, 0f }));

    private final EmbeddingSimilarity similarity = new EmbeddingSimilarity(model, 0.7, 0.3, 0.3);

    @Test
    void similarity_shouldBlendCosineAndFuzzyRatio() {
        TextProfile a = similarity.profile("server down");
        TextProfile b = similarity.profile("server is down");

        // cosine 1.0, fuzzy 2 * 11 / 25 = 0.88
        assertEquals(0.7 + 0.3 * 0.88, similarity.similarity(a, b), 1e-6);
    }

    @Test
    void similarity_shouldTreatNegativeCosineAsZero() {
        TextProfile a = similarity.profile("good");
        TextProfile b = similarity.profile("bad");

        // only the fuzzy side contributes: lcs("good", "bad") = 1
        assertEquals(0.3 * 2.0 / 7.0, similarity.similarity(a, b), 1e-6);
    }

    @Test
    void similarity_shouldBeOneForIdenticalText() {
        TextProfile a = similarity.profile("server down");

        assertEquals(1.0, similarity.similarity(a, similarity.profile("server down")), 1e-6);
    }

    @Test
    void profile_shouldNotEmbedBlankText() {
        TextProfile blank = similarity.profile("");

        assertFalse(blank.hasEmbedding());
        assertTrue(blank.words().isEmpty());
        assertEquals(0, model.calls);
    }

    @Test
    void threshold_shouldBeConfiguredValue() {
        assertEquals(0.3, similarity.threshold(), 1e-9);
    }
}
