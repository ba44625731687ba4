package me.golemcore.knowledge.adapter.outbound.memory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.MemoryQuery;
import me.golemcore.knowledge.domain.model.MemoryQueryType;
import me.golemcore.knowledge.domain.model.MemoryResponse;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local stand-in for the dual memory store.
 *
 * <p>
 * Each system keeps a bounded list of entries per target (for example
 * {@code system1/pastInteractions}):
 * <ul>
 * <li>{@code add} appends, evicting the oldest entry when the target is
 * full</li>
 * <li>{@code update} replaces all entries of the target</li>
 * <li>{@code remove} drops entries equal to the update data, or the whole
 * target when no data is given</li>
 * </ul>
 *
 * <p>
 * Queries match case-insensitively against the JSON form of each entry. Nothing
 * survives a restart.
 */
@Component
@Slf4j
public class InMemoryMemoryStoreAdapter implements MemoryStorePort {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxEntriesPerTarget;

    private final Map<String, Deque<Object>> system1 = new ConcurrentHashMap<>();
    private final Map<String, Deque<Object>> system2 = new ConcurrentHashMap<>();

    public InMemoryMemoryStoreAdapter(ObjectMapper objectMapper, Clock clock, KnowledgeProperties properties) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        int configured = properties.getMemory().getMaxEntriesPerTarget();
        this.maxEntriesPerTarget = configured > 0 ? configured : 1000;
    }

    @Override
    public CompletableFuture<Void> updateSystem1(MemoryUpdate update) {
        return apply(system1, "system1", update);
    }

    @Override
    public CompletableFuture<Void> updateSystem2(MemoryUpdate update) {
        return apply(system2, "system2", update);
    }

    @Override
    public CompletableFuture<MemoryResponse> query(MemoryQuery query) {
        long start = clock.millis();
        MemoryTarget source = resolveSource(query.type());
        String needle = query.query() != null ? query.query().toLowerCase(Locale.ROOT) : "";
        int limit = query.limit() != null && query.limit() > 0 ? query.limit() : Integer.MAX_VALUE;

        List<Object> matches = new ArrayList<>();
        if (source != MemoryTarget.SYSTEM2) {
            collectMatches(system1, needle, limit, matches);
        }
        if (source != MemoryTarget.SYSTEM1) {
            collectMatches(system2, needle, limit, matches);
        }

        double confidence = matches.isEmpty() ? 0.0 : Math.min(0.95, 0.5 + 0.05 * matches.size());
        log.debug("[Memory] Query '{}' ({}) matched {} entries", query.query(), source.getCode(), matches.size());
        return CompletableFuture.completedFuture(MemoryResponse.builder()
                .data(matches)
                .source(source)
                .confidence(confidence)
                .latency(clock.millis() - start)
                .cached(false)
                .build());
    }

    /**
     * Snapshot of the entries stored for a target.
     */
    public List<Object> getEntries(MemoryTarget system, String target) {
        Map<String, Deque<Object>> store = system == MemoryTarget.SYSTEM2 ? system2 : system1;
        Deque<Object> entries = store.get(target);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    private CompletableFuture<Void> apply(Map<String, Deque<Object>> store, String systemName, MemoryUpdate update) {
        if (update == null || update.target() == null || update.target().isBlank()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Memory update must name a target"));
        }
        if (update.operation() == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Memory update must name an operation"));
        }

        Deque<Object> entries = store.computeIfAbsent(update.target(), key -> new ArrayDeque<>());
        synchronized (entries) {
            switch (update.operation()) {
            case ADD -> {
                if (update.data() != null) {
                    if (entries.size() >= maxEntriesPerTarget) {
                        entries.removeFirst();
                    }
                    entries.addLast(update.data());
                }
            }
            case UPDATE -> {
                entries.clear();
                if (update.data() != null) {
                    entries.addLast(update.data());
                }
            }
            case REMOVE -> {
                if (update.data() == null) {
                    entries.clear();
                } else {
                    entries.removeIf(entry -> Objects.equals(entry, update.data()));
                }
            }
            }
        }
        log.debug("[Memory] {} {} {} (entries={})", systemName, update.operation().getCode(), update.target(),
                entries.size());
        return CompletableFuture.completedFuture(null);
    }

    private void collectMatches(Map<String, Deque<Object>> store, String needle, int limit, List<Object> matches) {
        for (Deque<Object> entries : store.values()) {
            List<Object> snapshot;
            synchronized (entries) {
                snapshot = new ArrayList<>(entries);
            }
            for (Object entry : snapshot) {
                if (matches.size() >= limit) {
                    return;
                }
                if (needle.isEmpty() || render(entry).contains(needle)) {
                    matches.add(entry);
                }
            }
        }
    }

    private String render(Object entry) {
        try {
            return objectMapper.writeValueAsString(entry).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException e) {
            log.debug("[Memory] Failed to serialize entry for matching: {}", e.getMessage());
            return String.valueOf(entry).toLowerCase(Locale.ROOT);
        }
    }

    private static MemoryTarget resolveSource(MemoryQueryType type) {
        if (type == null) {
            return MemoryTarget.BOTH;
        }
        return switch (type) {
        case KNOWLEDGE, PATTERN -> MemoryTarget.SYSTEM1;
        case REASONING, QUALITY -> MemoryTarget.SYSTEM2;
        case PREFERENCE -> MemoryTarget.BOTH;
        };
    }
}
