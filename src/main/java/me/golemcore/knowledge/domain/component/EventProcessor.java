package me.golemcore.knowledge.domain.component;

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

import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.ProcessingResult;

import java.util.concurrent.CompletableFuture;

/**
 * Type-specific handler of memory events. At most one processor is registered
 * per event type; events without one go to the default processing path.
 */
public interface EventProcessor {

    /**
     * Returns the event type this processor handles.
     *
     * @return the handled event type
     */
    MemoryEventType getType();

    /**
     * Returns the intrinsic priority in [0, 1]. Events of the handled type are
     * queued with at least this priority.
     *
     * @return the intrinsic priority
     */
    double getPriority();

    /**
     * Processes a single event. Implementations may either throw or complete the
     * future exceptionally; both are reported as a failed result.
     *
     * @param event
     *            the event to process
     * @return a future containing the processing result
     */
    CompletableFuture<ProcessingResult> process(MemoryEvent event);
}
