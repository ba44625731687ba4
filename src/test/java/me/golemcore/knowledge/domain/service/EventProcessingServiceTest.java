package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.domain.component.EventProcessor;
import me.golemcore.knowledge.domain.model.EventMetadata;
import me.golemcore.knowledge.domain.model.EventPriority;
import me.golemcore.knowledge.domain.model.EventSource;
import me.golemcore.knowledge.domain.model.EventStatistics;
import me.golemcore.knowledge.domain.model.EventStreamOptions;
import me.golemcore.knowledge.domain.model.LearningTriggerType;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.PipelineSignal;
import me.golemcore.knowledge.domain.model.PipelineSignalType;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.domain.model.UpdateOperation;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.infrastructure.event.SpringEventBus;
import me.golemcore.knowledge.port.outbound.MemoryStorePort;
import me.golemcore.knowledge.processor.BugFixProcessor;
import me.golemcore.knowledge.processor.DefaultEventProcessor;
import me.golemcore.knowledge.processor.ModeChangeProcessor;
import me.golemcore.knowledge.processor.TeamInteractionProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EventProcessingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MemoryStorePort memoryStore;
    private DefaultEventProcessor defaultProcessor;
    private SpringEventBus eventBus;
    private KnowledgeProperties properties;
    private EventProcessingService service;

    @BeforeEach
    void setUp() {
        memoryStore = mock(MemoryStorePort.class);
        when(memoryStore.updateSystem1(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(memoryStore.updateSystem2(any())).thenReturn(CompletableFuture.completedFuture(null));

        defaultProcessor = mock(DefaultEventProcessor.class);
        when(defaultProcessor.process(any())).thenReturn(CompletableFuture.completedFuture(
                ProcessingResult.builder().success(true).build()));

        eventBus = mock(SpringEventBus.class);
        properties = new KnowledgeProperties();
        service = createService();
    }

    private EventProcessingService createService() {
        return new EventProcessingService(memoryStore, defaultProcessor,
                List.of(new BugFixProcessor(), new TeamInteractionProcessor(), new ModeChangeProcessor()),
                eventBus, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    // ===== Validation & priority =====

    @Test
    void shouldRejectStructurallyInvalidEvents() {
        assertThrows(IllegalArgumentException.class, () -> service.submitEvent(null));
        assertThrows(IllegalArgumentException.class,
                () -> service.submitEvent(event("", MemoryEventType.BUG_FIX, EventPriority.LOW)));
        assertThrows(IllegalArgumentException.class, () -> service.submitEvent(MemoryEvent.builder()
                .id("no-metadata")
                .type(MemoryEventType.BUG_FIX)
                .timestamp(NOW)
                .build()));
        assertThrows(IllegalArgumentException.class, () -> service.submitEvent(MemoryEvent.builder()
                .id("no-timestamp")
                .type(MemoryEventType.BUG_FIX)
                .metadata(metadata(EventPriority.LOW, 0.5))
                .build()));

        assertEquals(0, service.getQueueSize());
        assertEquals(0, service.getStatistics().totalEvents());
    }

    @Test
    void shouldCalculatePriorityFromMetadataProcessorAndConfidence() {
        assertEquals(0.25, service.calculatePriority(
                event("a", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW)), 1e-9);
        assertEquals(0.6, service.calculatePriority(
                event("b", MemoryEventType.TEAM_INTERACTION, EventPriority.LOW)), 1e-9);
        assertEquals(0.72, service.calculatePriority(
                event("c", MemoryEventType.TEAM_INTERACTION, EventPriority.LOW, 0.9)), 1e-9);
        assertEquals(1.0, service.calculatePriority(
                event("d", MemoryEventType.LEARNING_UPDATE, EventPriority.CRITICAL, 0.95)), 1e-9);
        assertEquals(0.5, service.calculatePriority(
                event("e", MemoryEventType.LEARNING_UPDATE, null)), 1e-9);
    }

    // ===== Critical vs. batched processing =====

    @Test
    void shouldProcessCriticalEventImmediately() {
        MemoryEvent bug = event("bug-1", MemoryEventType.BUG_FIX, EventPriority.HIGH);

        service.submitEvent(bug);

        verify(memoryStore).updateSystem1(argThat(update -> "bugPatterns".equals(update.target())));
        verify(memoryStore).updateSystem2(argThat(update -> "bugPatterns".equals(update.target())));
        assertEquals(1, signals(PipelineSignalType.CRITICAL_EVENT_PROCESSED).size());
        assertEquals(1, service.getQueueSize());
    }

    @Test
    void shouldProcessCriticalEventAgainOnBatchTurn() {
        service.submitEvent(event("bug-1", MemoryEventType.BUG_FIX, EventPriority.HIGH));

        service.processBatch();

        verify(memoryStore, times(2)).updateSystem1(any());
        assertEquals(1, signals(PipelineSignalType.CRITICAL_EVENT_PROCESSED).size());
        assertEquals(1, signals(PipelineSignalType.EVENT_PROCESSED).size());
        assertEquals(0, service.getQueueSize());
    }

    @Test
    void shouldDeferLowPriorityEventsToBatch() {
        MemoryEvent low = event("low-1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW);

        service.submitEvent(low);

        verify(defaultProcessor, never()).process(any());
        assertTrue(signals(PipelineSignalType.EVENT_PROCESSED).isEmpty());

        assertEquals(1, service.processBatch());

        verify(defaultProcessor).process(low);
        List<PipelineSignal> processed = signals(PipelineSignalType.EVENT_PROCESSED);
        assertEquals(1, processed.size());
        assertEquals(low, processed.get(0).event());
        assertEquals(NOW, processed.get(0).timestamp());
    }

    @Test
    void shouldReportCriticalFailureWithoutRetrying() {
        service.registerProcessor(failingProcessor(MemoryEventType.QUALITY_IMPROVEMENT, new AtomicInteger()));

        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.CRITICAL));

        List<PipelineSignal> errors = signals(PipelineSignalType.CRITICAL_EVENT_ERROR);
        assertEquals(1, errors.size());
        assertEquals("quality check crashed", errors.get(0).error());
        assertEquals(1, service.getQueueSize());
    }

    // ===== Batching =====

    @Test
    void shouldDrainAtMostBatchSize() {
        properties.getEvents().setBatchSize(2);
        service = createService();
        for (int i = 0; i < 3; i++) {
            service.submitEvent(event("e" + i, MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));
        }

        assertEquals(2, service.processBatch());
        assertEquals(1, service.getQueueSize());
        assertEquals(1, service.processBatch());
        assertEquals(0, service.processBatch());
    }

    @Test
    void shouldSkipBatchWhileAnotherIsRunning() {
        AtomicInteger nestedResult = new AtomicInteger(-1);
        service.registerProcessor(processor(MemoryEventType.QUALITY_IMPROVEMENT, event -> {
            nestedResult.set(service.processBatch());
            return CompletableFuture.completedFuture(ProcessingResult.builder().success(true).build());
        }));
        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));
        service.submitEvent(event("q-2", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));
        properties.getEvents().setBatchSize(1);

        service.processBatch();

        assertEquals(0, nestedResult.get());
        assertEquals(1, service.getQueueSize());
    }

    @Test
    void shouldApplyUpdatesAndPublishLearningTriggers() {
        service.submitEvent(event("mode-1", MemoryEventType.MODE_CHANGE, EventPriority.LOW));

        service.processBatch();

        verify(memoryStore).updateSystem2(argThat(update -> "currentMode".equals(update.target())
                && update.operation() == UpdateOperation.UPDATE));
        List<PipelineSignal> triggers = signals(PipelineSignalType.LEARNING_TRIGGER);
        assertEquals(1, triggers.size());
        assertEquals(LearningTriggerType.THRESHOLD_REACHED, triggers.get(0).trigger().type());
    }

    @Test
    void shouldReportFailedUpdateAndContinueWithOthers() {
        when(memoryStore.updateSystem1(any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("system1 offline")));
        MemoryUpdate first = MemoryUpdate.builder()
                .type(MemoryTarget.SYSTEM1).operation(UpdateOperation.ADD).target("one").data("x").build();
        MemoryUpdate second = MemoryUpdate.builder()
                .type(MemoryTarget.SYSTEM2).operation(UpdateOperation.ADD).target("two").data("y").build();
        service.registerProcessor(processor(MemoryEventType.QUALITY_IMPROVEMENT,
                event -> CompletableFuture.completedFuture(ProcessingResult.builder()
                        .success(true)
                        .memoryUpdates(List.of(first, second))
                        .build())));

        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));
        service.processBatch();

        verify(memoryStore).updateSystem2(second);
        List<PipelineSignal> updateErrors = signals(PipelineSignalType.UPDATE_ERROR);
        assertEquals(1, updateErrors.size());
        assertEquals(first, updateErrors.get(0).update());
        assertEquals("system1 offline", updateErrors.get(0).error());
        assertEquals(1, signals(PipelineSignalType.EVENT_PROCESSED).size());
    }

    @Test
    void shouldTreatMissingResultListsAsEmpty() {
        service.registerProcessor(processor(MemoryEventType.QUALITY_IMPROVEMENT,
                event -> CompletableFuture.completedFuture(ProcessingResult.builder()
                        .success(true)
                        .memoryUpdates(null)
                        .graphUpdates(null)
                        .learningTriggers(null)
                        .build())));
        MemoryEvent quality = event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW);
        MemoryEvent learning = event("l-1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW);
        service.submitEvent(quality);
        service.submitEvent(learning);

        int drained = service.processBatch();

        assertEquals(2, drained);

        List<MemoryEvent> processed = signals(PipelineSignalType.EVENT_PROCESSED).stream()
                .map(PipelineSignal::event)
                .toList();
        assertEquals(2, processed.size());
        assertTrue(processed.containsAll(List.of(quality, learning)));
        assertTrue(signals(PipelineSignalType.LEARNING_TRIGGER).isEmpty());
        assertEquals(1.0, service.getStatistics().successRate());
    }

    @Test
    void shouldRetryEventWhoseResultCannotBeApplied() {
        doThrow(new IllegalStateException("trigger sink down")).when(eventBus).publish(argThat(signal ->
                signal instanceof PipelineSignal pipelineSignal
                        && pipelineSignal.type() == PipelineSignalType.LEARNING_TRIGGER));
        MemoryEvent mode = event("m-1", MemoryEventType.MODE_CHANGE, EventPriority.LOW);
        MemoryEvent learning = event("l-1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW);
        service.submitEvent(mode);
        service.submitEvent(learning);

        int drained = service.processBatch();

        assertEquals(2, drained);

        List<PipelineSignal> processed = signals(PipelineSignalType.EVENT_PROCESSED);
        assertEquals(1, processed.size());
        assertEquals(learning, processed.get(0).event());
        List<PipelineSignal> errors = signals(PipelineSignalType.EVENT_ERROR);
        assertEquals(1, errors.size());
        assertEquals(mode, errors.get(0).event());
        assertEquals("trigger sink down", errors.get(0).error());
        assertEquals(1, service.getQueueSize());
        assertEquals(1, mode.getRetries());
    }

    @Test
    void shouldReportCriticalEventWithMissingListsAsProcessed() {
        service.registerProcessor(processor(MemoryEventType.QUALITY_IMPROVEMENT,
                event -> CompletableFuture.completedFuture(ProcessingResult.builder()
                        .success(true)
                        .learningTriggers(null)
                        .build())));

        assertDoesNotThrow(() -> service.submitEvent(
                event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.CRITICAL)));

        assertEquals(1, signals(PipelineSignalType.CRITICAL_EVENT_PROCESSED).size());
    }

    // ===== Retries =====

    @Test
    void shouldRetryFailingEventThenDropIt() {
        AtomicInteger attempts = new AtomicInteger();
        service.registerProcessor(failingProcessor(MemoryEventType.QUALITY_IMPROVEMENT, attempts));
        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));

        for (int i = 0; i < 10; i++) {
            service.processBatch();
        }

        assertEquals(properties.getEvents().getMaxRetries() + 1, attempts.get());
        assertEquals(4, signals(PipelineSignalType.EVENT_ERROR).size());
        List<PipelineSignal> dropped = signals(PipelineSignalType.EVENT_DROPPED);
        assertEquals(1, dropped.size());
        assertEquals(3, dropped.get(0).event().getRetries());
        assertEquals(0, service.getQueueSize());

        EventStatistics statistics = service.getStatistics();
        assertEquals(1, statistics.totalEvents());
        assertEquals(1L, statistics.eventsByType().get(MemoryEventType.QUALITY_IMPROVEMENT));
        assertEquals(1, signals(PipelineSignalType.EVENT_RECEIVED).size());
    }

    @Test
    void shouldTreatSynchronousThrowAsFailure() {
        service.registerProcessor(processor(MemoryEventType.QUALITY_IMPROVEMENT, event -> {
            throw new IllegalStateException("sync failure");
        }));
        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));

        service.processBatch();

        List<PipelineSignal> errors = signals(PipelineSignalType.EVENT_ERROR);
        assertEquals(1, errors.size());
        assertEquals("sync failure", errors.get(0).error());
        assertEquals(1, service.getQueueSize());
    }

    @Test
    void shouldHonourConfiguredMaxRetries() {
        properties.getEvents().setMaxRetries(0);
        service = createService();
        AtomicInteger attempts = new AtomicInteger();
        service.registerProcessor(failingProcessor(MemoryEventType.QUALITY_IMPROVEMENT, attempts));
        service.submitEvent(event("q-1", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));

        service.processBatch();
        service.processBatch();

        assertEquals(1, attempts.get());
        assertEquals(1, signals(PipelineSignalType.EVENT_DROPPED).size());
    }

    // ===== Registration, streams, statistics, lifecycle =====

    @Test
    void shouldReplaceProcessorAndPublishRegistration() {
        AtomicInteger calls = new AtomicInteger();
        service.registerProcessor(processor(MemoryEventType.BUG_FIX, event -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(ProcessingResult.builder().success(true).build());
        }));

        service.submitEvent(event("bug-1", MemoryEventType.BUG_FIX, EventPriority.LOW));
        service.processBatch();

        assertEquals(1, calls.get());
        verify(memoryStore, never()).updateSystem1(any());
        List<PipelineSignal> registered = signals(PipelineSignalType.PROCESSOR_REGISTERED);
        assertEquals(1, registered.size());
        assertEquals(MemoryEventType.BUG_FIX, registered.get(0).processorType());
        assertThrows(IllegalArgumentException.class, () -> service.registerProcessor(null));
    }

    @Test
    void shouldEmitOneBatchFromBufferedFilteredStream() {
        EventStream stream = service.createEventStream(EventStreamOptions.builder()
                .filter(e -> e.getType() == MemoryEventType.LEARNING_UPDATE)
                .bufferSize(2)
                .build());
        List<List<MemoryEvent>> batches = new ArrayList<>();
        stream.onBatch(batches::add);

        service.submitEvent(event("1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));
        service.submitEvent(event("2", MemoryEventType.PATTERN_RECOGNITION, EventPriority.LOW));
        service.submitEvent(event("3", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));
        service.submitEvent(event("4", MemoryEventType.PATTERN_RECOGNITION, EventPriority.LOW));

        assertEquals(1, batches.size());
        assertEquals(List.of("1", "3"), batches.get(0).stream().map(MemoryEvent::getId).toList());
    }

    @Test
    void shouldDetachClosedStream() {
        EventStream stream = service.createEventStream(EventStreamOptions.defaults());
        List<MemoryEvent> received = new ArrayList<>();
        stream.onData(received::add);

        service.submitEvent(event("1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));
        stream.close();
        service.submitEvent(event("2", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));

        assertEquals(1, received.size());
    }

    @Test
    void shouldTrackStatisticsWithMovingAverages() {
        EventStatistics initial = service.getStatistics();
        assertEquals(1.0, initial.successRate());
        assertEquals(0.0, initial.averageProcessingTime());

        service.registerProcessor(failingProcessor(MemoryEventType.QUALITY_IMPROVEMENT, new AtomicInteger()));
        service.submitEvent(event("ok", MemoryEventType.LEARNING_UPDATE, EventPriority.HIGH));
        service.submitEvent(event("bad", MemoryEventType.QUALITY_IMPROVEMENT, EventPriority.LOW));
        service.processBatch();

        EventStatistics statistics = service.getStatistics();
        assertEquals(2, statistics.totalEvents());
        assertEquals(1.0 * 0.9 + 0.5 * 0.1, statistics.successRate(), 1e-9);
        assertEquals(0.0, statistics.averageProcessingTime());
        assertEquals(1, statistics.queueSize());
        assertEquals(NOW, statistics.lastProcessedTime());
    }

    @Test
    void shouldStopBatchProcessing() {
        service.submitEvent(event("1", MemoryEventType.LEARNING_UPDATE, EventPriority.LOW));

        service.stop();

        assertTrue(service.isStopped());
        assertEquals(0, service.processBatch());
        assertEquals(1, service.getQueueSize());
    }

    private List<PipelineSignal> signals(PipelineSignalType type) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, atLeast(0)).publish(captor.capture());
        return captor.getAllValues().stream()
                .filter(PipelineSignal.class::isInstance)
                .map(PipelineSignal.class::cast)
                .filter(signal -> signal.type() == type)
                .toList();
    }

    private static EventProcessor failingProcessor(MemoryEventType type, AtomicInteger attempts) {
        return processor(type, event -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("quality check crashed"));
        });
    }

    private static EventProcessor processor(MemoryEventType type,
            Function<MemoryEvent, CompletableFuture<ProcessingResult>> handler) {
        return new EventProcessor() {
            @Override
            public MemoryEventType getType() {
                return type;
            }

            @Override
            public double getPriority() {
                return 0.3;
            }

            @Override
            public CompletableFuture<ProcessingResult> process(MemoryEvent event) {
                return handler.apply(event);
            }
        };
    }

    private static MemoryEvent event(String id, MemoryEventType type, EventPriority priority) {
        return event(id, type, priority, 0.5);
    }

    private static MemoryEvent event(String id, MemoryEventType type, EventPriority priority, double confidence) {
        return MemoryEvent.builder()
                .id(id)
                .type(type)
                .timestamp(NOW)
                .userId("user-1")
                .sessionId("session-1")
                .data("payload " + id)
                .metadata(metadata(priority, confidence))
                .build();
    }

    private static EventMetadata metadata(EventPriority priority, double confidence) {
        return EventMetadata.builder()
                .confidence(confidence)
                .source(EventSource.USER_INPUT)
                .priority(priority)
                .build();
    }
}
