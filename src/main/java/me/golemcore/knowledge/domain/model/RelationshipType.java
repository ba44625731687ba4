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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed directed links between entities and between graph nodes.
 */
public enum RelationshipType {
    IMPLEMENTS("implements"),
    EXTENDS("extends"),
    USES("uses"),
    DEPENDS_ON("depends_on"),
    SIMILAR_TO("similar_to"),
    CONTRADICTS("contradicts"),
    IMPROVES("improves"),
    REPLACES("replaces");

    private final String code;

    RelationshipType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
