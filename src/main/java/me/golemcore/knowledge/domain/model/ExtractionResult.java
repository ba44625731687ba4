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

import lombok.Builder;

import java.util.List;

/**
 * Output of one extraction pass: entities, the relationships among them, and an
 * overall confidence in [0, 0.95].
 */
@Builder
public record ExtractionResult(
        List<Entity> entities,
        List<Relationship> relationships,
        double confidence
) {

    public ExtractionResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), 0.0);
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
