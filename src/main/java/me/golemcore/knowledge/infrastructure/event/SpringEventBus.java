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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Event bus implementation using Spring's ApplicationEventPublisher.
 *
 * <p>
 * Graph and pipeline signals ({@code GraphUpdatedEvent},
 * {@code PipelineSignal}) are published through this facade and delivered
 * synchronously to every {@code @EventListener} method.
 *
 * <pre>{@code
 * eventBus.publish(new GraphUpdatedEvent(3, 1, 10, 4));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * Publish an event. Listener failures are logged and never reach the
     * publisher.
     */
    public void publish(Object event) {
        log.debug("Publishing event: {}", event.getClass().getSimpleName());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
