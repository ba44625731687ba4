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
import me.golemcore.knowledge.domain.model.ExtractionResult;
import me.golemcore.knowledge.domain.model.GraphUpdate;
import me.golemcore.knowledge.domain.model.LearningAction;
import me.golemcore.knowledge.domain.model.LearningTrigger;
import me.golemcore.knowledge.domain.model.LearningTriggerType;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.domain.model.UpdateOperation;
import me.golemcore.knowledge.domain.service.EntityExtractor;
import me.golemcore.knowledge.domain.service.KnowledgeGraphService;
import me.golemcore.knowledge.domain.service.SessionPatternDetector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback for event types without a registered processor.
 *
 * <p>
 * Text payloads are mined for entities and merged into the graph. Every event
 * is recorded as a past interaction in fast memory, its reasoning trace (if
 * any) goes to reasoning memory, and repeated activity within a session raises
 * a {@code pattern_detected} trigger.
 *
 * <p>
 * Not an {@code EventProcessor} itself: it is never registered for a type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultEventProcessor {

    static final String PAST_INTERACTIONS = "pastInteractions";
    static final String REASONING_TRACES = "reasoningTraces";

    private final EntityExtractor entityExtractor;
    private final KnowledgeGraphService knowledgeGraphService;
    private final SessionPatternDetector patternDetector;

    public CompletableFuture<ProcessingResult> process(MemoryEvent event) {
        List<MemoryUpdate> memoryUpdates = new ArrayList<>();
        List<GraphUpdate> graphUpdates = new ArrayList<>();
        List<LearningTrigger> learningTriggers = new ArrayList<>();

        String text = event.dataAsText().orElse(null);
        if (text != null) {
            ExtractionResult extraction = entityExtractor.extract(text);
            if (!extraction.isEmpty()) {
                knowledgeGraphService.addToGraph(extraction);
                graphUpdates.add(GraphUpdate.nodesAdded(extraction));
            }
        }

        Map<String, Object> interactionMetadata = new HashMap<>();
        interactionMetadata.put("timestamp", event.getTimestamp());
        memoryUpdates.add(MemoryUpdate.builder()
                .type(MemoryTarget.SYSTEM1)
                .operation(UpdateOperation.ADD)
                .target(PAST_INTERACTIONS)
                .data(event)
                .metadata(interactionMetadata)
                .build());

        if (event.getReasoning() != null) {
            memoryUpdates.add(MemoryUpdate.builder()
                    .type(MemoryTarget.SYSTEM2)
                    .operation(UpdateOperation.ADD)
                    .target(REASONING_TRACES)
                    .data(event.getReasoning())
                    .metadata(Map.of("eventId", event.getId()))
                    .build());
        }

        if (patternDetector.observe(event)) {
            learningTriggers.add(
                    new LearningTrigger(LearningTriggerType.PATTERN_DETECTED, event, LearningAction.ADAPT));
        }

        log.debug("[Events] Default processing of {} ({}): {} updates, {} graph changes, {} triggers",
                event.getId(), event.getType().getCode(), memoryUpdates.size(), graphUpdates.size(),
                learningTriggers.size());

        return CompletableFuture.completedFuture(ProcessingResult.builder()
                .success(true)
                .memoryUpdates(memoryUpdates)
                .graphUpdates(graphUpdates)
                .learningTriggers(learningTriggers)
                .build());
    }
}
