package me.golemcore.knowledge.adapter.outbound.embedding;

import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    private KnowledgeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new KnowledgeProperties();
        properties.getEmbedding().setProvider("openai");
        properties.getEmbedding().setApiKey(null);
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailEmbeddingWithoutApiKey() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.embed("hello").join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldUseConfiguredDimensionForV3Models() {
        properties.getEmbedding().setModel("text-embedding-3-small");
        properties.getEmbedding().setDimension(256);

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertEquals("text-embedding-3-small", adapter.getModel());
        assertEquals(256, adapter.getDimension());
    }

    @Test
    void shouldUseNativeDimensionForLegacyModel() {
        properties.getEmbedding().setModel("text-embedding-ada-002");
        properties.getEmbedding().setDimension(256);

        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertEquals(1536, adapter.getDimension());
    }
}
