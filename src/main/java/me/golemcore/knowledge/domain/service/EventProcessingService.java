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
import me.golemcore.knowledge.domain.component.EventProcessor;
import me.golemcore.knowledge.domain.model.EventMetadata;
import me.golemcore.knowledge.domain.model.EventStatistics;
import me.golemcore.knowledge.domain.model.EventStreamOptions;
import me.golemcore.knowledge.domain.model.LearningTrigger;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.PipelineSignal;
import me.golemcore.knowledge.domain.model.PipelineSignalType;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.infrastructure.event.SpringEventBus;
import me.golemcore.knowledge.port.outbound.MemoryStorePort;
import me.golemcore.knowledge.processor.DefaultEventProcessor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event-driven memory synchronization pipeline.
 *
 * <p>
 * Submitted events are validated, prioritized and queued. The batch loop
 * (driven by {@code EventBatchScheduler}) drains up to {@code batchSize} events
 * at a time, dispatches each to its type-specific processor (or the default
 * path), applies the resulting memory updates and publishes
 * {@link PipelineSignal}s. Failed events are requeued until the retry bound is
 * reached, then dropped.
 *
 * <p>
 * Events whose priority reaches the critical threshold are additionally
 * processed on the submitting thread. They stay queued and are processed again
 * on their batch turn; consumers needing exactly-once semantics dedupe by event
 * id.
 */
@Service
@Slf4j
public class EventProcessingService {

    private static final double BASE_PRIORITY = 0.5;
    private static final double CONFIDENCE_BOOST_THRESHOLD = 0.8;
    private static final double CONFIDENCE_BOOST = 1.2;
    private static final double STATS_ALPHA = 0.1;

    private final MemoryStorePort memoryStore;
    private final DefaultEventProcessor defaultProcessor;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final KnowledgeProperties.EventsProperties config;

    private final Map<MemoryEventType, EventProcessor> processors = new ConcurrentHashMap<>();
    private final EventPriorityQueue queue = new EventPriorityQueue();
    private final List<EventStream> streams = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final Object statsLock = new Object();
    private long totalEvents;
    private final Map<MemoryEventType, Long> eventsByType = new EnumMap<>(MemoryEventType.class);
    private double averageProcessingTime;
    private double successRate = 1.0;
    private Instant lastProcessedTime;

    public EventProcessingService(MemoryStorePort memoryStore, DefaultEventProcessor defaultProcessor,
            List<EventProcessor> builtInProcessors, SpringEventBus eventBus, Clock clock,
            KnowledgeProperties properties) {
        this.memoryStore = memoryStore;
        this.defaultProcessor = defaultProcessor;
        this.eventBus = eventBus;
        this.clock = clock;
        this.config = properties.getEvents();
        this.lastProcessedTime = clock.instant();
        for (EventProcessor processor : builtInProcessors) {
            processors.put(processor.getType(), processor);
        }
        log.info("[Events] Registered {} built-in processors: {}", processors.size(), processors.keySet());
    }

    // ===== Submission =====

    /**
     * Validate, prioritize and enqueue an event. Critical events are also
     * processed before this method returns.
     *
     * @throws IllegalArgumentException
     *             if a required field is missing
     */
    public void submitEvent(MemoryEvent event) {
        validateEvent(event);

        double priority = calculatePriority(event);
        queue.enqueue(event, priority);

        synchronized (statsLock) {
            totalEvents++;
            eventsByType.merge(event.getType(), 1L, Long::sum);
        }

        log.debug("[Events] Received {} ({}) priority={} [{}]", event.getId(), event.getType().getCode(),
                priority, priorityLabel(priority));
        publish(PipelineSignal.builder()
                .type(PipelineSignalType.EVENT_RECEIVED)
                .event(event));
        for (EventStream stream : streams) {
            stream.accept(event);
        }

        if (priority >= config.getCriticalThreshold()) {
            processImmediate(event);
        }
    }

    /**
     * Replace the processor for its event type.
     */
    public void registerProcessor(EventProcessor processor) {
        if (processor == null || processor.getType() == null) {
            throw new IllegalArgumentException("Processor and its type are required");
        }
        EventProcessor previous = processors.put(processor.getType(), processor);
        log.info("[Events] Processor for {} registered{}", processor.getType().getCode(),
                previous != null ? " (replaced " + previous.getClass().getSimpleName() + ")" : "");
        publish(PipelineSignal.builder()
                .type(PipelineSignalType.PROCESSOR_REGISTERED)
                .processorType(processor.getType()));
    }

    public EventStream createEventStream(EventStreamOptions options) {
        EventStream stream = new EventStream(options, streams::remove);
        streams.add(stream);
        return stream;
    }

    double calculatePriority(MemoryEvent event) {
        double priority = BASE_PRIORITY;

        EventMetadata metadata = event.getMetadata();
        if (metadata.getPriority() != null) {
            priority = metadata.getPriority().getWeight();
        }

        EventProcessor processor = processors.get(event.getType());
        if (processor != null) {
            priority = Math.max(priority, processor.getPriority());
        }

        if (metadata.getConfidence() > CONFIDENCE_BOOST_THRESHOLD) {
            priority = Math.min(1.0, priority * CONFIDENCE_BOOST);
        }
        return priority;
    }

    private void validateEvent(MemoryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event is required");
        }
        if (event.getId() == null || event.getId().isBlank() || event.getType() == null
                || event.getTimestamp() == null) {
            throw new IllegalArgumentException("Invalid event structure: id, type and timestamp are required");
        }
        if (event.getMetadata() == null) {
            throw new IllegalArgumentException("Invalid event metadata: metadata is required");
        }
    }

    private String priorityLabel(double priority) {
        if (priority >= config.getCriticalThreshold()) {
            return "critical";
        }
        if (priority >= config.getHighThreshold()) {
            return "high";
        }
        if (priority >= config.getMediumThreshold()) {
            return "medium";
        }
        return "low";
    }

    // ===== Processing =====

    /**
     * Drain and process one batch. Returns immediately if a batch is already
     * running, the queue is empty or the pipeline has been stopped.
     *
     * @return number of events dequeued
     */
    public int processBatch() {
        if (stopped.get() || queue.isEmpty()) {
            return 0;
        }
        if (!processing.compareAndSet(false, true)) {
            log.debug("[Events] Batch skipped: previous batch still in progress");
            return 0;
        }

        try {
            List<MemoryEvent> batch = queue.drain(config.getBatchSize());
            if (batch.isEmpty()) {
                return 0;
            }
            long startTime = clock.millis();

            List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>(batch.size());
            for (MemoryEvent event : batch) {
                futures.add(dispatch(event));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            int successCount = 0;
            for (int i = 0; i < batch.size(); i++) {
                MemoryEvent event = batch.get(i);
                ProcessingResult result = futures.get(i).join();
                if (!result.isSuccess()) {
                    handleFailure(event, result);
                    continue;
                }
                try {
                    applyMemoryUpdates(result);
                    publish(PipelineSignal.builder()
                            .type(PipelineSignalType.EVENT_PROCESSED)
                            .event(event)
                            .result(result));
                    successCount++;
                } catch (RuntimeException e) {
                    log.warn("[Events] Applying result of {} failed: {}", event.getId(), e.getMessage(), e);
                    handleFailure(event, ProcessingResult.failure(e));
                }
            }

            updateStatistics(batch.size(), successCount, clock.millis() - startTime);
            log.debug("[Events] Batch of {} processed: {} succeeded, {} queued", batch.size(), successCount,
                    queue.size());
            return batch.size();
        } finally {
            processing.set(false);
        }
    }

    private void processImmediate(MemoryEvent event) {
        ProcessingResult result = dispatch(event).join();
        if (result.isSuccess()) {
            try {
                applyMemoryUpdates(result);
                publish(PipelineSignal.builder()
                        .type(PipelineSignalType.CRITICAL_EVENT_PROCESSED)
                        .event(event)
                        .result(result));
                return;
            } catch (RuntimeException e) {
                result = ProcessingResult.failure(e);
            }
        }
        log.warn("[Events] Critical event {} failed: {}", event.getId(), result.getErrorMessage());
        publish(PipelineSignal.builder()
                .type(PipelineSignalType.CRITICAL_EVENT_ERROR)
                .event(event)
                .result(result)
                .error(result.getErrorMessage()));
    }

    /**
     * Run the processor for the event. Synchronous throws, exceptional futures
     * and missing results all become failed results; the returned future never
     * completes exceptionally.
     */
    private CompletableFuture<ProcessingResult> dispatch(MemoryEvent event) {
        EventProcessor processor = processors.get(event.getType());
        CompletableFuture<ProcessingResult> future;
        try {
            future = processor != null ? processor.process(event) : defaultProcessor.process(event);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ProcessingResult.failure(e));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(
                    ProcessingResult.failure(new IllegalStateException("Processor returned no result")));
        }
        return future.handle((result, error) -> {
            if (error != null) {
                return ProcessingResult.failure(unwrap(error));
            }
            if (result == null) {
                return ProcessingResult.failure(new IllegalStateException("Processor returned no result"));
            }
            return result;
        });
    }

    private void handleFailure(MemoryEvent event, ProcessingResult result) {
        publish(PipelineSignal.builder()
                .type(PipelineSignalType.EVENT_ERROR)
                .event(event)
                .result(result)
                .error(result.getErrorMessage()));

        if (event.getRetries() < config.getMaxRetries()) {
            int attempt = event.incrementRetries();
            queue.enqueue(event, calculatePriority(event));
            log.debug("[Events] Event {} failed ({}), retry {}/{}", event.getId(), result.getErrorMessage(),
                    attempt, config.getMaxRetries());
            return;
        }

        log.warn("[Events] Event {} dropped after {} retries: {}", event.getId(), event.getRetries(),
                result.getErrorMessage());
        publish(PipelineSignal.builder()
                .type(PipelineSignalType.EVENT_DROPPED)
                .event(event)
                .result(result)
                .error(result.getErrorMessage()));
    }

    /**
     * Apply each update to its memory system(s), then publish learning triggers.
     * A rejected update is reported and does not prevent the others.
     */
    private void applyMemoryUpdates(ProcessingResult result) {
        for (MemoryUpdate update : result.getMemoryUpdates()) {
            if (update == null) {
                continue;
            }
            try {
                applyMemoryUpdate(update);
            } catch (RuntimeException e) {
                Throwable cause = unwrap(e);
                log.warn("[Memory] Update of {} failed: {}", update.target(), cause.getMessage());
                publish(PipelineSignal.builder()
                        .type(PipelineSignalType.UPDATE_ERROR)
                        .update(update)
                        .error(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()));
            }
        }

        for (LearningTrigger trigger : result.getLearningTriggers()) {
            publish(PipelineSignal.builder()
                    .type(PipelineSignalType.LEARNING_TRIGGER)
                    .trigger(trigger));
        }
    }

    private void applyMemoryUpdate(MemoryUpdate update) {
        if (update.type() == null) {
            throw new IllegalArgumentException("Memory update has no target system");
        }
        switch (update.type()) {
        case SYSTEM1 -> memoryStore.updateSystem1(update).join();
        case SYSTEM2 -> memoryStore.updateSystem2(update).join();
        case BOTH -> {
            memoryStore.updateSystem1(update).join();
            memoryStore.updateSystem2(update).join();
        }
        }
    }

    // ===== Statistics & lifecycle =====

    private void updateStatistics(int batchSize, int successCount, long processingTime) {
        double batchSuccessRate = (double) successCount / batchSize;
        synchronized (statsLock) {
            successRate = successRate * (1 - STATS_ALPHA) + batchSuccessRate * STATS_ALPHA;
            averageProcessingTime = averageProcessingTime * (1 - STATS_ALPHA) + processingTime * STATS_ALPHA;
            lastProcessedTime = clock.instant();
        }
    }

    public EventStatistics getStatistics() {
        synchronized (statsLock) {
            return EventStatistics.builder()
                    .totalEvents(totalEvents)
                    .eventsByType(Map.copyOf(eventsByType))
                    .averageProcessingTime(averageProcessingTime)
                    .successRate(successRate)
                    .queueSize(queue.size())
                    .lastProcessedTime(lastProcessedTime)
                    .build();
        }
    }

    public int getQueueSize() {
        return queue.size();
    }

    /**
     * Stop batch processing. Queued events stay queued; submissions are still
     * accepted and critical events are still processed immediately.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("[Events] Batch processing stopped ({} events left in queue)", queue.size());
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private void publish(PipelineSignal.PipelineSignalBuilder signal) {
        eventBus.publish(signal.timestamp(clock.instant()).build());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
