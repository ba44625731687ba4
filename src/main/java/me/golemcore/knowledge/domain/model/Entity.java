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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transient mention of a code construct or concept produced by a single
 * extraction call. Entities become {@link KnowledgeNode}s when merged into the
 * graph.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Entity {

    public static final String ATTR_SOURCE = "source";
    public static final String SOURCE_PATTERN = "pattern_extraction";
    public static final String SOURCE_IMPORT = "import";
    public static final String SOURCE_INFERRED = "inferred";

    private String id;
    private String text;
    private EntityType type;
    private TextPosition position;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    private float[] embedding;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public String getSource() {
        Object source = attributes != null ? attributes.get(ATTR_SOURCE) : null;
        return source != null ? source.toString() : null;
    }
}
