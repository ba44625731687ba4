package me.golemcore.knowledge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Caching front for {@link EmbeddingPort}. Vectors are cached by exact text in
 * a bounded LRU map so repeated entities and queries are embedded once.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingPort embeddingPort;
    private final Map<String, float[]> cache;

    public EmbeddingService(EmbeddingPort embeddingPort, KnowledgeProperties properties) {
        this.embeddingPort = embeddingPort;
        int capacity = Math.max(1, properties.getEmbedding().getCacheSize());
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Embed text, returning empty when the provider fails.
     */
    public Optional<float[]> embed(String text) {
        if (text == null) {
            return Optional.empty();
        }

        synchronized (cache) {
            float[] cached = cache.get(text);
            if (cached != null) {
                return Optional.of(cached);
            }
        }

        try {
            float[] vector = embeddingPort.embed(text).join();
            if (vector == null) {
                return Optional.empty();
            }
            synchronized (cache) {
                cache.put(text, vector);
            }
            return Optional.of(vector);
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Embedding] Failed to embed text ({} chars): {}", text.length(), cause.getMessage());
            return Optional.empty();
        }
    }

    public double similarity(float[] a, float[] b) {
        return embeddingPort.cosineSimilarity(a, b);
    }

    public int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public void clearCache() {
        synchronized (cache) {
            cache.clear();
        }
    }
}
