package me.golemcore.knowledge.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Graph vertex derived from one or more extracted entities. Access statistics
 * are updated whenever the node is read through the graph service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class KnowledgeNode {

    private String id;
    private NodeType type;
    private String name;
    private String content;
    private float[] embedding;
    private double confidence;
    private Instant lastAccessed;
    private long accessCount;
    private NodeMetadata metadata;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
