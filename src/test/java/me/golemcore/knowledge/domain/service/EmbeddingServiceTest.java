package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EmbeddingServiceTest {

    private EmbeddingPort embeddingPort;
    private KnowledgeProperties properties;
    private EmbeddingService service;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        properties = new KnowledgeProperties();
        properties.getEmbedding().setCacheSize(2);
        service = new EmbeddingService(embeddingPort, properties);
    }

    @Test
    void shouldCacheEmbeddingsByExactText() {
        when(embeddingPort.embed("foo")).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));

        Optional<float[]> first = service.embed("foo");
        Optional<float[]> second = service.embed("foo");

        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        verify(embeddingPort, times(1)).embed("foo");
        assertEquals(1, service.cacheSize());
    }

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        when(embeddingPort.embed(anyString())).thenAnswer(
                invocation -> CompletableFuture.completedFuture(new float[] { 1f }));

        service.embed("a");
        service.embed("b");
        service.embed("a");
        service.embed("c");

        assertEquals(2, service.cacheSize());
        service.embed("a");
        service.embed("b");
        verify(embeddingPort, times(1)).embed("a");
        verify(embeddingPort, times(2)).embed("b");
    }

    @Test
    void shouldReturnEmptyWhenProviderFails() {
        when(embeddingPort.embed("boom")).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("provider down")));

        assertTrue(service.embed("boom").isEmpty());
        assertEquals(0, service.cacheSize());
    }

    @Test
    void shouldReturnEmptyForNullText() {
        assertTrue(service.embed(null).isEmpty());
        verifyNoInteractions(embeddingPort);
    }

    @Test
    void shouldDelegateSimilarityToPort() {
        float[] a = { 1f, 0f };
        float[] b = { 0f, 1f };
        when(embeddingPort.cosineSimilarity(a, b)).thenReturn(0.25);

        assertEquals(0.25, service.similarity(a, b));
    }

    @Test
    void shouldClearCache() {
        when(embeddingPort.embed("x")).thenReturn(CompletableFuture.completedFuture(new float[] { 1f }));
        service.embed("x");

        service.clearCache();

        assertEquals(0, service.cacheSize());
    }
}
