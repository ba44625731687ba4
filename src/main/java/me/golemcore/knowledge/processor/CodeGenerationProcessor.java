package me.golemcore.knowledge.processor;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.component.EventProcessor;
import me.golemcore.knowledge.domain.model.ExtractionResult;
import me.golemcore.knowledge.domain.model.GraphUpdate;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.domain.model.UpdateOperation;
import me.golemcore.knowledge.domain.service.EntityExtractor;
import me.golemcore.knowledge.domain.service.KnowledgeGraphService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Extracts code entities from generated code, merges them into the knowledge
 * graph and records the code as a fast-memory pattern.
 *
 * <p>
 * The event data is either the code itself or a map carrying it under
 * {@code code}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CodeGenerationProcessor implements EventProcessor {

    static final String TARGET = "codePatterns";
    private static final double PRIORITY = 0.8;

    private final EntityExtractor entityExtractor;
    private final KnowledgeGraphService knowledgeGraphService;

    @Override
    public MemoryEventType getType() {
        return MemoryEventType.CODE_GENERATION;
    }

    @Override
    public double getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ProcessingResult> process(MemoryEvent event) {
        String code = event.dataAsText().orElseGet(() -> codeFromMap(event.getData()));
        ExtractionResult extraction = entityExtractor.extract(code,
                Map.of("type", MemoryEventType.CODE_GENERATION.getCode()));

        List<GraphUpdate> graphUpdates = new ArrayList<>();
        if (!extraction.isEmpty()) {
            knowledgeGraphService.addToGraph(extraction);
            graphUpdates.add(GraphUpdate.nodesAdded(extraction));
        }

        Map<String, Object> pattern = new LinkedHashMap<>();
        pattern.put("code", code);
        pattern.put("entities", extraction.entities());

        log.debug("[CodeGeneration] Event {}: {} entities extracted", event.getId(), extraction.entities().size());

        return CompletableFuture.completedFuture(ProcessingResult.builder()
                .success(true)
                .memoryUpdates(List.of(MemoryUpdate.builder()
                        .type(MemoryTarget.SYSTEM1)
                        .operation(UpdateOperation.ADD)
                        .target(TARGET)
                        .data(pattern)
                        .build()))
                .graphUpdates(graphUpdates)
                .build());
    }

    private static String codeFromMap(Object data) {
        if (data instanceof Map<?, ?> map && map.get("code") instanceof String text) {
            return text;
        }
        return null;
    }
}
