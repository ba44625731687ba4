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
 * Kinds of development activity fed into the memory pipeline.
 */
public enum MemoryEventType {
    CODE_GENERATION("code_generation"),
    BUG_FIX("bug_fix"),
    QUALITY_IMPROVEMENT("quality_improvement"),
    TEAM_INTERACTION("team_interaction"),
    LEARNING_UPDATE("learning_update"),
    PATTERN_RECOGNITION("pattern_recognition"),
    MODE_CHANGE("mode_change");

    private final String code;

    MemoryEventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
