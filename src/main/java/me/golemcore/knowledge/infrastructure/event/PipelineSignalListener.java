package me.golemcore.knowledge.infrastructure.event;

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
import me.golemcore.knowledge.domain.model.GraphUpdatedEvent;
import me.golemcore.knowledge.domain.model.PipelineSignal;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs pipeline signals and graph merges. Failures surface at WARN, routine
 * traffic at DEBUG.
 */
@Component
@Slf4j
public class PipelineSignalListener {

    @EventListener
    public void onSignal(PipelineSignal signal) {
        String eventId = signal.event() != null ? signal.event().getId() : null;
        switch (signal.type()) {
        case EVENT_ERROR, CRITICAL_EVENT_ERROR, UPDATE_ERROR -> log.warn("[Events] {} event={} error={}",
                signal.type(), eventId, signal.error());
        case EVENT_DROPPED -> log.warn("[Events] {} event={} retries={} error={}", signal.type(), eventId,
                signal.event() != null ? signal.event().getRetries() : 0, signal.error());
        case LEARNING_TRIGGER -> log.info("[Events] {} {} -> {}", signal.type(),
                signal.trigger().type().getCode(), signal.trigger().action().getCode());
        case PROCESSOR_REGISTERED -> log.info("[Events] {} type={}", signal.type(),
                signal.processorType() != null ? signal.processorType().getCode() : null);
        default -> log.debug("[Events] {} event={}", signal.type(), eventId);
        }
    }

    @EventListener
    public void onGraphUpdated(GraphUpdatedEvent event) {
        log.debug("[Graph] Updated: +{} nodes, +{} edges (total {} nodes, {} edges)",
                event.nodesAdded(), event.edgesAdded(), event.totalNodes(), event.totalEdges());
    }
}
