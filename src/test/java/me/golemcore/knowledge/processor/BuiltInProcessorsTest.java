package me.golemcore.knowledge.processor;

import me.golemcore.knowledge.domain.model.EventMetadata;
import me.golemcore.knowledge.domain.model.LearningAction;
import me.golemcore.knowledge.domain.model.LearningTrigger;
import me.golemcore.knowledge.domain.model.LearningTriggerType;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import me.golemcore.knowledge.domain.model.MemoryEventType;
import me.golemcore.knowledge.domain.model.MemoryTarget;
import me.golemcore.knowledge.domain.model.MemoryUpdate;
import me.golemcore.knowledge.domain.model.ProcessingResult;
import me.golemcore.knowledge.domain.model.UpdateOperation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuiltInProcessorsTest {

    // ===== Bug fix =====

    @Test
    void shouldStoreBugFixInBothSystemsAndTrain() {
        BugFixProcessor processor = new BugFixProcessor();
        Map<String, String> fix = Map.of("bug", "NPE in parser", "fix", "null check");

        ProcessingResult result = processor.process(event(MemoryEventType.BUG_FIX, fix)).join();

        assertEquals(MemoryEventType.BUG_FIX, processor.getType());
        assertEquals(0.9, processor.getPriority());
        assertTrue(result.isSuccess());
        MemoryUpdate update = result.getMemoryUpdates().get(0);
        assertEquals(MemoryTarget.BOTH, update.type());
        assertEquals(UpdateOperation.ADD, update.operation());
        assertEquals("bugPatterns", update.target());
        assertEquals(fix, update.data());
        assertEquals(List.of(new LearningTrigger(LearningTriggerType.PATTERN_DETECTED, fix, LearningAction.TRAIN)),
                result.getLearningTriggers());
    }

    // ===== Team interaction =====

    @Test
    void shouldStoreTeamInteractionAsFastPattern() {
        TeamInteractionProcessor processor = new TeamInteractionProcessor();

        ProcessingResult result = processor.process(event(MemoryEventType.TEAM_INTERACTION, "pair review")).join();

        assertEquals(0.6, processor.getPriority());
        MemoryUpdate update = result.getMemoryUpdates().get(0);
        assertEquals(MemoryTarget.SYSTEM1, update.type());
        assertEquals("teamPatterns", update.target());
        assertEquals("pair review", update.data());
        assertTrue(result.getLearningTriggers().isEmpty());
    }

    // ===== Mode change =====

    @Test
    void shouldReplaceCurrentModeAndSignalThreshold() {
        ModeChangeProcessor processor = new ModeChangeProcessor();

        ProcessingResult result = processor.process(event(MemoryEventType.MODE_CHANGE, "deep_focus")).join();

        assertEquals(0.7, processor.getPriority());
        MemoryUpdate update = result.getMemoryUpdates().get(0);
        assertEquals(MemoryTarget.SYSTEM2, update.type());
        assertEquals(UpdateOperation.UPDATE, update.operation());
        assertEquals("currentMode", update.target());
        assertEquals(LearningTriggerType.THRESHOLD_REACHED, result.getLearningTriggers().get(0).type());
        assertEquals(LearningAction.ADAPT, result.getLearningTriggers().get(0).action());
    }

    private static MemoryEvent event(MemoryEventType type, Object data) {
        return MemoryEvent.builder()
                .id("evt-1")
                .type(type)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .data(data)
                .metadata(new EventMetadata())
                .build();
    }
}
