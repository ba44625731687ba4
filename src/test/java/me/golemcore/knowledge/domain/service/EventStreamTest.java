package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.domain.model.EventMetadata;
import me.golemcore.knowledge.domain.model.EventStreamOptions;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamTest {

    @Test
    void shouldEmitEachEventAsDataWhenUnbuffered() {
        EventStream stream = new EventStream(EventStreamOptions.defaults(), null);
        List<MemoryEvent> received = new ArrayList<>();
        stream.onData(received::add);

        stream.accept(event("a", MemoryEventType.BUG_FIX));
        stream.accept(event("b", MemoryEventType.MODE_CHANGE));

        assertEquals(List.of("a", "b"), received.stream().map(MemoryEvent::getId).toList());
    }

    @Test
    void shouldFilterThenTransform() {
        EventStream stream = new EventStream(EventStreamOptions.builder()
                .filter(e -> e.getType() == MemoryEventType.BUG_FIX)
                .transform(e -> e.toBuilder().id(e.getId().toUpperCase()).build())
                .build(), null);
        List<MemoryEvent> received = new ArrayList<>();
        stream.onData(received::add);

        stream.accept(event("a", MemoryEventType.BUG_FIX));
        stream.accept(event("b", MemoryEventType.MODE_CHANGE));

        assertEquals(List.of("A"), received.stream().map(MemoryEvent::getId).toList());
    }

    @Test
    void shouldEmitBatchWhenBufferFills() {
        EventStream stream = new EventStream(EventStreamOptions.builder()
                .filter(e -> e.getType() == MemoryEventType.BUG_FIX)
                .bufferSize(2)
                .build(), null);
        List<List<MemoryEvent>> batches = new ArrayList<>();
        List<MemoryEvent> data = new ArrayList<>();
        stream.onBatch(batches::add);
        stream.onData(data::add);

        stream.accept(event("1", MemoryEventType.BUG_FIX));
        stream.accept(event("2", MemoryEventType.MODE_CHANGE));
        stream.accept(event("3", MemoryEventType.BUG_FIX));
        stream.accept(event("4", MemoryEventType.MODE_CHANGE));

        assertEquals(1, batches.size());
        assertEquals(List.of("1", "3"), batches.get(0).stream().map(MemoryEvent::getId).toList());
        assertTrue(data.isEmpty());
    }

    @Test
    void shouldFlushPartialBuffer() {
        EventStream stream = new EventStream(EventStreamOptions.builder().bufferSize(5).build(), null);
        List<List<MemoryEvent>> batches = new ArrayList<>();
        stream.onBatch(batches::add);

        stream.accept(event("1", MemoryEventType.BUG_FIX));
        stream.flush();
        stream.flush();

        assertEquals(1, batches.size());
        assertEquals(1, batches.get(0).size());
    }

    @Test
    void shouldExposeDataAsFlux() {
        EventStream stream = new EventStream(EventStreamOptions.defaults(), null);

        StepVerifier.create(stream.data())
                .then(() -> stream.accept(event("a", MemoryEventType.BUG_FIX)))
                .then(() -> stream.accept(event("b", MemoryEventType.BUG_FIX)))
                .then(stream::close)
                .expectNextMatches(e -> e.getId().equals("a"))
                .expectNextMatches(e -> e.getId().equals("b"))
                .verifyComplete();
    }

    @Test
    void shouldExposeBatchesAsFluxAndFlushOnClose() {
        EventStream stream = new EventStream(EventStreamOptions.builder().bufferSize(2).build(), null);

        StepVerifier.create(stream.batches())
                .then(() -> stream.accept(event("1", MemoryEventType.BUG_FIX)))
                .then(() -> stream.accept(event("2", MemoryEventType.BUG_FIX)))
                .then(() -> stream.accept(event("3", MemoryEventType.BUG_FIX)))
                .then(stream::close)
                .expectNextMatches(batch -> batch.size() == 2)
                .expectNextMatches(batch -> batch.size() == 1 && batch.get(0).getId().equals("3"))
                .verifyComplete();
    }

    @Test
    void shouldStopReceivingAfterClose() {
        List<EventStream> closed = new ArrayList<>();
        EventStream stream = new EventStream(EventStreamOptions.defaults(), closed::add);
        List<MemoryEvent> received = new ArrayList<>();
        stream.onData(received::add);

        stream.close();
        stream.close();
        stream.accept(event("late", MemoryEventType.BUG_FIX));

        assertTrue(stream.isClosed());
        assertTrue(received.isEmpty());
        assertEquals(List.of(stream), closed);
    }

    @Test
    void shouldSurviveFailingListenerAndTransform() {
        EventStream stream = new EventStream(EventStreamOptions.builder()
                .transform(e -> {
                    if (e.getId().equals("bad")) {
                        throw new IllegalStateException("boom");
                    }
                    return e;
                })
                .build(), null);
        List<MemoryEvent> received = new ArrayList<>();
        stream.onData(e -> {
            throw new IllegalStateException("listener boom");
        });
        stream.onData(received::add);

        stream.accept(event("bad", MemoryEventType.BUG_FIX));
        stream.accept(event("good", MemoryEventType.BUG_FIX));

        assertEquals(List.of("good"), received.stream().map(MemoryEvent::getId).toList());
    }

    private static MemoryEvent event(String id, MemoryEventType type) {
        return MemoryEvent.builder()
                .id(id)
                .type(type)
                .timestamp(Instant.EPOCH)
                .metadata(new EventMetadata())
                .build();
    }
}
