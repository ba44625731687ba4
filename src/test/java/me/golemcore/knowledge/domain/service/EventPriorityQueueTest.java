package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.domain.model.EventMetadata;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventPriorityQueueTest {

    @Test
    void shouldServeHigherPrioritiesFirst() {
        EventPriorityQueue queue = new EventPriorityQueue();
        queue.enqueue(event("low"), 0.25);
        queue.enqueue(event("critical"), 0.95);
        queue.enqueue(event("medium"), 0.5);

        assertEquals(List.of("critical", "medium", "low"), ids(queue.drain(10)));
    }

    @Test
    void shouldKeepFifoOrderForEqualPriorities() {
        EventPriorityQueue queue = new EventPriorityQueue();
        queue.enqueue(event("first"), 0.5);
        queue.enqueue(event("high"), 0.9);
        queue.enqueue(event("second"), 0.5);
        queue.enqueue(event("third"), 0.5);

        assertEquals(List.of("high", "first", "second", "third"), ids(queue.drain(10)));
    }

    @Test
    void shouldDrainAtMostRequestedCount() {
        EventPriorityQueue queue = new EventPriorityQueue();
        for (int i = 0; i < 5; i++) {
            queue.enqueue(event("e" + i), 0.5);
        }

        assertEquals(List.of("e0", "e1"), ids(queue.drain(2)));
        assertEquals(3, queue.size());
        assertTrue(queue.drain(0).isEmpty());
    }

    @Test
    void shouldReportEmptiness() {
        EventPriorityQueue queue = new EventPriorityQueue();
        assertTrue(queue.isEmpty());

        queue.enqueue(event("x"), 0.1);
        assertFalse(queue.isEmpty());

        queue.drain(5);
        assertTrue(queue.isEmpty());
        assertTrue(queue.drain(5).isEmpty());
    }

    private static MemoryEvent event(String id) {
        return MemoryEvent.builder()
                .id(id)
                .type(MemoryEventType.LEARNING_UPDATE)
                .timestamp(Instant.EPOCH)
                .metadata(new EventMetadata())
                .build();
    }

    private static List<String> ids(List<MemoryEvent> events) {
        return events.stream().map(MemoryEvent::getId).toList();
    }
}
