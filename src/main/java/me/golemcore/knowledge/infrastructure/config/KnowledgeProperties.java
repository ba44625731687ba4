package me.golemcore.knowledge.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the knowledge graph and memory pipeline.
 *
 * <p>
 * All settings are organized under the {@code knowledge.*} prefix:
 * <ul>
 * <li>{@link EmbeddingProperties} - embedding provider and cache</li>
 * <li>{@link GraphProperties} - similarity and clustering thresholds</li>
 * <li>{@link EventsProperties} - batch loop, retries and pattern detection</li>
 * <li>{@link MemoryProperties} - in-memory store limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "knowledge")
@Data
public class KnowledgeProperties {

    private EmbeddingProperties embedding = new EmbeddingProperties();
    private GraphProperties graph = new GraphProperties();
    private EventsProperties events = new EventsProperties();
    private MemoryProperties memory = new MemoryProperties();

    @Data
    public static class EmbeddingProperties {
        /**
         * {@code hashing} (deterministic, offline) or {@code openai}.
         */
        private String provider = "hashing";
        private int dimension = 384;
        private String model = "text-embedding-3-small";
        private String apiKey;
        private int cacheSize = 1000;
    }

    @Data
    public static class GraphProperties {
        private double clusterThreshold = 0.7;
        private double similarityThreshold = 0.8;
        private int defaultTopK = 10;
        private double defaultMinSimilarity = 0.5;
    }

    @Data
    public static class EventsProperties {
        private boolean enabled = true;
        private int batchSize = 10;
        private Duration processingInterval = Duration.ofMillis(1000);
        private int maxRetries = 3;
        private double criticalThreshold = 0.9;
        private double highThreshold = 0.7;
        private double mediumThreshold = 0.5;
        private Duration patternWindow = Duration.ofSeconds(60);
        private int patternMinOccurrences = 3;
        private int patternBufferSize = 100;
        private int patternMaxSessions = 1000;
    }

    @Data
    public static class MemoryProperties {
        private int maxEntriesPerTarget = 1000;
    }
}
