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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome every event processor returns. Successful results carry memory
 * updates for the external store plus optional graph updates and learning
 * triggers. Missing lists read as empty.
 */
@Data
@Builder
public class ProcessingResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;

    @Builder.Default
    private List<MemoryUpdate> memoryUpdates = new ArrayList<>();

    @Builder.Default
    private List<GraphUpdate> graphUpdates = new ArrayList<>();

    @Builder.Default
    private List<LearningTrigger> learningTriggers = new ArrayList<>();

    private Throwable error;

    /**
     * Creates a failed result wrapping the given error.
     */
    public static ProcessingResult failure(Throwable error) {
        return ProcessingResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    public List<MemoryUpdate> getMemoryUpdates() {
        return memoryUpdates != null ? memoryUpdates : List.of();
    }

    public List<GraphUpdate> getGraphUpdates() {
        return graphUpdates != null ? graphUpdates : List.of();
    }

    public List<LearningTrigger> getLearningTriggers() {
        return learningTriggers != null ? learningTriggers : List.of();
    }

    public String getErrorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
