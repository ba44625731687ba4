package me.golemcore.knowledge.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.service.EventProcessingService;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives the event pipeline's batch loop on a single daemon thread at the
 * configured processing interval. Overlapping batches are prevented by the
 * processing service itself.
 */
@Component
@Slf4j
public class EventBatchScheduler {

    private final EventProcessingService eventProcessingService;
    private final KnowledgeProperties.EventsProperties config;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public EventBatchScheduler(EventProcessingService eventProcessingService, KnowledgeProperties properties) {
        this.eventProcessingService = eventProcessingService;
        this.config = properties.getEvents();
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("[EventScheduler] Batch processing disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-batch-scheduler");
            t.setDaemon(true);
            return t;
        });

        long intervalMillis = Math.max(1, config.getProcessingInterval().toMillis());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[EventScheduler] Started with interval: {}ms, batch size: {}", intervalMillis,
                config.getBatchSize());
    }

    @PreDestroy
    public void shutdown() {
        eventProcessingService.stop();
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[EventScheduler] Shut down");
    }

    boolean isRunning() {
        return tickTask != null && !tickTask.isCancelled();
    }

    void tick() {
        try {
            if (eventProcessingService.isStopped()) {
                if (tickTask != null) {
                    tickTask.cancel(false);
                }
                return;
            }
            int processed = eventProcessingService.processBatch();
            if (processed > 0) {
                log.debug("[EventScheduler] Tick: {} events processed", processed);
            }
        } catch (Exception e) {
            log.error("[EventScheduler] Tick failed: {}", e.getMessage(), e);
        }
    }
}
