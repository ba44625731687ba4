package me.golemcore.knowledge.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detects repeated activity within a session: an event completes a pattern
 * when, together with earlier same-type events of its session that lie within
 * the configured window, it reaches the minimum occurrence count.
 *
 * <p>
 * Every observed event is recorded in a per-session rolling buffer, capped at
 * the configured size (oldest evicted first). Events without a session share
 * one anonymous buffer. At most {@code patternMaxSessions} sessions are
 * tracked; the least recently active one is forgotten first.
 */
@Component
@Slf4j
public class SessionPatternDetector {

    private static final String ANONYMOUS_SESSION = "";

    private final Duration window;
    private final int minOccurrences;
    private final int bufferSize;

    private final Map<String, Deque<Observation>> buffers;

    public SessionPatternDetector(KnowledgeProperties properties) {
        KnowledgeProperties.EventsProperties events = properties.getEvents();
        this.window = events.getPatternWindow();
        this.minOccurrences = events.getPatternMinOccurrences();
        this.bufferSize = Math.max(1, events.getPatternBufferSize());
        int maxSessions = Math.max(1, events.getPatternMaxSessions());
        this.buffers = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<Observation>> eldest) {
                return size() > maxSessions;
            }
        };
    }

    /**
     * Record the event and report whether it completes a repetition pattern.
     */
    public synchronized boolean observe(MemoryEvent event) {
        String sessionKey = event.getSessionId() != null ? event.getSessionId() : ANONYMOUS_SESSION;
        Deque<Observation> buffer = buffers.computeIfAbsent(sessionKey, key -> new ArrayDeque<>());
        Instant timestamp = event.getTimestamp();

        int occurrences = 1;
        for (Observation previous : buffer) {
            if (previous.type() == event.getType() && withinWindow(previous.timestamp(), timestamp)) {
                occurrences++;
            }
        }

        if (buffer.size() >= bufferSize) {
            buffer.removeFirst();
        }
        buffer.addLast(new Observation(event.getType(), timestamp));

        boolean detected = occurrences >= minOccurrences;
        if (detected) {
            log.debug("[Events] Pattern detected: {} x{} in session '{}'",
                    event.getType().getCode(), occurrences, sessionKey);
        }
        return detected;
    }

    synchronized int trackedSessions() {
        return buffers.size();
    }

    synchronized int bufferedCount(String sessionId) {
        Deque<Observation> buffer = buffers.get(sessionId != null ? sessionId : ANONYMOUS_SESSION);
        return buffer != null ? buffer.size() : 0;
    }

    private boolean withinWindow(Instant previous, Instant current) {
        if (previous == null || current == null) {
            return false;
        }
        return Duration.between(previous, current).abs().compareTo(window) <= 0;
    }

    private record Observation(MemoryEventType type, Instant timestamp) {
    }
}
