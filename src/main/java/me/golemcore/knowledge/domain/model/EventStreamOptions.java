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
import lombok.Getter;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Options for a live event stream. A positive {@code bufferSize} switches the
 * stream to batch emission.
 */
@Getter
@Builder
public class EventStreamOptions {

    private final Predicate<MemoryEvent> filter;
    private final UnaryOperator<MemoryEvent> transform;
    private final Integer bufferSize;

    public static EventStreamOptions defaults() {
        return EventStreamOptions.builder().build();
    }

    public boolean isBuffered() {
        return bufferSize != null && bufferSize > 0;
    }
}
