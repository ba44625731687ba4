package me.golemcore.knowledge.adapter.outbound.embedding;

import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingAdapterTest {

    private static final double EPSILON = 1e-6;

    private HashingEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        KnowledgeProperties properties = new KnowledgeProperties();
        properties.getEmbedding().setDimension(128);
        adapter = new HashingEmbeddingAdapter(properties);
    }

    @Test
    void shouldProduceVectorsOfConfiguredDimension() {
        float[] vector = adapter.embed("UserService").join();

        assertEquals(128, vector.length);
        assertEquals(128, adapter.getDimension());
    }

    @Test
    void shouldBeDeterministic() {
        float[] first = adapter.embed("calculateTotal").join();
        float[] second = adapter.embed("calculateTotal").join();

        assertArrayEquals(first, second);
        assertEquals(1.0, adapter.cosineSimilarity(first, second), EPSILON);
    }

    @Test
    void shouldNormalizeToUnitLength() {
        float[] vector = adapter.vectorize("function validateUser(user) { return true; }");

        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        assertEquals(1.0, Math.sqrt(norm), 1e-4);
    }

    @Test
    void shouldReturnZeroVectorForBlankText() {
        float[] vector = adapter.vectorize("   ");

        for (float v : vector) {
            assertEquals(0.0f, v);
        }
        assertEquals(0.0, adapter.cosineSimilarity(vector, adapter.vectorize("anything")));
    }

    @Test
    void shouldRankRelatedIdentifiersCloserThanUnrelated() {
        float[] user = adapter.vectorize("getUserProfile");
        float[] related = adapter.vectorize("updateUserProfile");
        float[] unrelated = adapter.vectorize("parseXml");

        double relatedSimilarity = adapter.cosineSimilarity(user, related);
        double unrelatedSimilarity = adapter.cosineSimilarity(user, unrelated);

        assertTrue(relatedSimilarity > unrelatedSimilarity,
                "related=" + relatedSimilarity + " unrelated=" + unrelatedSimilarity);
    }

    @Test
    void shouldEmbedBatchInOrder() {
        List<float[]> vectors = adapter.embedBatch(List.of("alpha", "beta")).join();

        assertEquals(2, vectors.size());
        assertArrayEquals(adapter.vectorize("alpha"), vectors.get(0));
        assertArrayEquals(adapter.vectorize("beta"), vectors.get(1));
    }

    @Test
    void shouldAlwaysBeAvailable() {
        assertTrue(adapter.isAvailable());
        assertEquals("feature-hashing", adapter.getModel());
    }
}
