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

import java.util.Map;

/**
 * Typed link between two entities. Both endpoints must be part of the same
 * extraction or already present in the graph when the link is merged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Relationship {

    private String id;
    private String sourceEntityId;
    private String targetEntityId;
    private RelationshipType type;
    private double confidence;
    private boolean bidirectional;
    private Map<String, Object> metadata;

    public boolean touches(String entityId) {
        return entityId.equals(sourceEntityId) || entityId.equals(targetEntityId);
    }
}
