package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IdAllocatorTest {

    @Test
    void shouldGenerateTypeNameWithSixHexDigits() {
        IdAllocator ids = new IdAllocator(new Random(7));

        assertTrue(ids.generateId("exclusiveGateway").matches("ExclusiveGateway_[0-9A-F]{6}"));
        assertTrue(ids.generateId(NodeKind.START_EVENT).matches("StartEvent_[0-9A-F]{6}"));
        assertTrue(ids.generateId("sequenceFlow").matches("Flow_[0-9A-F]{6}"));
        assertTrue(ids.generateId("messageFlow").matches("MessageFlow_[0-9A-F]{6}"));
    }

    @Test
    void shouldUseElementForUnknownTags() {
        IdAllocator ids = new IdAllocator();

        assertTrue(ids.generateId("conversation").startsWith("Element_"));
        assertTrue(ids.generateId((String) null).startsWith("Element_"));
    }

    @Test
    void shouldBeReproducibleWithSameSeed() {
        IdAllocator first = new IdAllocator(new Random(42));
        IdAllocator second = new IdAllocator(new Random(42));

        for (int i = 0; i < 5; i++) {
            assertEquals(first.generateId("task"), second.generateId("task"));
        }
    }

    @Test
    void shouldAvoidTakenIds() {
        // same seed twice: the first draw of the second allocator is already taken
        String taken = new IdAllocator(new Random(3)).generateId("task");
        IdAllocator ids = new IdAllocator(new Random(3));

        String id = ids.generateId("task", Set.of(taken));

        assertNotEquals(taken, id);
        assertTrue(id.startsWith("Task_"));
    }

    @Test
    void shouldFallBackToCounterWhenEveryDrawIsTaken() {
        IdAllocator ids = new IdAllocator(new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        });

        String id = ids.generateId("task", Set.of("Task_000000", "task_1"));

        assertEquals("task_2", id);
    }

    @Test
    void shouldCountFallbackIdsFromOne() {
        IdAllocator ids = new IdAllocator();

        assertEquals("task_1", ids.nextFallbackId("task"));
        assertEquals("gateway_2", ids.nextFallbackId("gateway"));
    }

    @Test
    void shouldReseedPastObservedSuffixes() {
        IdAllocator ids = new IdAllocator();

        ids.reseedFrom(List.of("task_3", "Flow_17", "Gateway_0abc", "Process_1"));

        assertEquals(18, ids.peekCounter());
        assertEquals("endEvent_18", ids.nextFallbackId("endEvent"));
    }

    @Test
    void shouldNeverMoveCounterBackwards() {
        IdAllocator ids = new IdAllocator();
        ids.reseed(10);

        ids.reseed(4);

        assertEquals(11, ids.peekCounter());
    }

    @Test
    void shouldIgnoreSuffixesTooLongForACounter() {
        IdAllocator ids = new IdAllocator();

        ids.reseedFrom(List.of("Task_12345678901234567890", "Task_5"));

        assertEquals(6, ids.peekCounter());
    }

    @Test
    void shouldRarelyRepeatRandomIds() {
        IdAllocator ids = new IdAllocator(new Random(1));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 200; i++) {
            seen.add(ids.generateId("task", seen));
        }

        assertEquals(200, seen.size());
    }
}
