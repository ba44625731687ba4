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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.EmbeddingPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, offline embedding adapter based on signed feature hashing.
 *
 * <p>
 * Every text is broken into features:
 * <ul>
 * <li>lower-cased word tokens</li>
 * <li>camelCase / snake_case sub-words of each token</li>
 * <li>character trigrams of each token, with boundary markers</li>
 * </ul>
 * Each feature is hashed (FNV-1a) into one of {@code dimension} buckets with a
 * hash-derived sign, and the vector is L2-normalised. Identical texts always
 * produce identical vectors, which keeps extraction and search reproducible.
 *
 * <p>
 * Active when {@code knowledge.embedding.provider=hashing} (the default).
 */
@Component
@ConditionalOnProperty(prefix = "knowledge.embedding", name = "provider", havingValue = "hashing", matchIfMissing = true)
@Slf4j
public class HashingEmbeddingAdapter implements EmbeddingPort {

    private static final String MODEL = "feature-hashing";
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9_$]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|_+");
    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;

    public HashingEmbeddingAdapter(KnowledgeProperties properties) {
        int configured = properties.getEmbedding().getDimension();
        this.dimension = configured > 0 ? configured : 384;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorize(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getModel() {
        return MODEL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    float[] vectorize(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            String lower = token.toLowerCase(Locale.ROOT);
            addFeature(vector, "w:" + lower, 1.0f);

            String[] parts = CAMEL_BOUNDARY.split(token);
            if (parts.length > 1) {
                for (String part : parts) {
                    if (!part.isEmpty()) {
                        addFeature(vector, "p:" + part.toLowerCase(Locale.ROOT), 0.5f);
                    }
                }
            }

            String bounded = "^" + lower + "$";
            for (int i = 0; i + 3 <= bounded.length(); i++) {
                addFeature(vector, "t:" + bounded.substring(i, i + 3), 0.5f);
            }
        }

        normalize(vector);
        return vector;
    }

    private void addFeature(float[] vector, String feature, float weight) {
        int hash = fnv1a(feature);
        int bucket = Math.floorMod(hash, dimension);
        float sign = ((hash >>> 31) == 0) ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }

    private static int fnv1a(String feature) {
        int hash = FNV_OFFSET;
        for (byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
