package me.golemcore.knowledge.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.EmbeddingPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Default model: text-embedding-3-small (1536 dimensions). The model is created
 * lazily on first use. Third-generation models are asked for
 * {@code knowledge.embedding.dimension} dimensions so vectors stay comparable
 * with the rest of the graph; older models keep their native size.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code knowledge.embedding.provider=openai} - activates this adapter
 * <li>{@code knowledge.embedding.api-key} - OpenAI API key
 * <li>{@code knowledge.embedding.model} - embedding model name
 * <li>{@code knowledge.embedding.dimension} - requested vector size (v3 models)
 * </ul>
 *
 * @see EmbeddingPort
 */
@Component
@ConditionalOnProperty(prefix = "knowledge.embedding", name = "provider", havingValue = "openai")
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final KnowledgeProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final String V3_MODEL_PREFIX = "text-embedding-3-";
    private static final Map<String, Integer> NATIVE_DIMENSIONS = Map.of(
            "text-embedding-3-small", 1536,
            "text-embedding-3-large", 3072,
            "text-embedding-ada-002", 1536);

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        String apiKey = properties.getEmbedding().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model);
            if (supportsCustomDimensions(model)) {
                builder.dimensions(getDimension());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] OpenAI model initialized: {} ({} dims)", model, getDimension());
        } catch (Exception e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            if (texts.isEmpty()) {
                return List.<float[]>of();
            }

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = embeddingModel.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public int getDimension() {
        String model = getModel();
        int requested = properties.getEmbedding().getDimension();
        if (supportsCustomDimensions(model) && requested > 0) {
            return requested;
        }
        return NATIVE_DIMENSIONS.getOrDefault(model, 1536);
    }

    private boolean supportsCustomDimensions(String model) {
        return model.startsWith(V3_MODEL_PREFIX);
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
