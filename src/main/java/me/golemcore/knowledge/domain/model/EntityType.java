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
 * Kinds of mentions the extractor recognises in text.
 */
public enum EntityType {
    FUNCTION("function"),
    CLASS("class"),
    VARIABLE("variable"),
    CONCEPT("concept"),
    BUSINESS_LOGIC("business_logic"),
    PREFERENCE("preference"),
    TEAM_PATTERN("team_pattern");

    private final String code;

    EntityType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
