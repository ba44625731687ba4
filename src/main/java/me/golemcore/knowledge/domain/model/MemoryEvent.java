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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Immutable record of external activity submitted to the pipeline.
 *
 * <p>
 * {@code data} is an untyped envelope: producers may attach a source string, a
 * map, or any other payload regardless of the event type. The only mutable part
 * is the retry counter maintained by the processing service.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@EqualsAndHashCode(exclude = "retryCount")
@ToString(exclude = { "data", "retryCount" })
public class MemoryEvent {

    private final String id;
    private final MemoryEventType type;
    private final Instant timestamp;
    private final String userId;
    private final String sessionId;
    private final Object data;
    private final ReasoningTrace reasoning;
    private final EventMetadata metadata;

    @Builder.Default
    private final AtomicInteger retryCount = new AtomicInteger();

    public int getRetries() {
        return retryCount.get();
    }

    public int incrementRetries() {
        return retryCount.incrementAndGet();
    }

    public Optional<String> dataAsText() {
        return data instanceof String text ? Optional.of(text) : Optional.empty();
    }
}
