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

import me.golemcore.knowledge.domain.component.EventProcessor;
import me.golemcore.knowledge.domain.model.LearningAction;
import me.golemcore.knowledge.domain.model.LearningTrigger;
import me.golemcore.knowledge.domain.model.LearningTriggerType;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.domain.model.UpdateOperation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces the current working mode held by the reasoning memory. A mode
 * switch is a threshold signal for adaptive learners.
 */
@Component
public class ModeChangeProcessor implements EventProcessor {

    static final String TARGET = "currentMode";
    private static final double PRIORITY = 0.7;

    @Override
    public MemoryEventType getType() {
        return MemoryEventType.MODE_CHANGE;
    }

    @Override
    public double getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ProcessingResult> process(MemoryEvent event) {
        Object modeData = event.getData();
        return CompletableFuture.completedFuture(ProcessingResult.builder()
                .success(true)
                .memoryUpdates(List.of(MemoryUpdate.builder()
                        .type(MemoryTarget.SYSTEM2)
                        .operation(UpdateOperation.UPDATE)
                        .target(TARGET)
                        .data(modeData)
                        .build()))
                .learningTriggers(List.of(
                        new LearningTrigger(LearningTriggerType.THRESHOLD_REACHED, modeData, LearningAction.ADAPT)))
                .build());
    }
}
