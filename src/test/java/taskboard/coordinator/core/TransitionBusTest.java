package taskboard.coordinator.core;

import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransitionBusTest {

    private static TransitionEvent event() {
        return new TransitionEvent("task-1", TaskStatus.UNCLAIMED, TaskStatus.CLAIMED,
                Instant.parse("2024-05-01T10:00:00Z"), "agent-a", Board.WORKING);
    }

    @Test
    void deliversToEveryListenerInOrder() {
        List<String> seen = new ArrayList<>();
        TransitionBus bus = new TransitionBus()
                .subscribe(e -> seen.add("first:" + e.taskId()))
                .subscribe(e -> seen.add("second:" + e.newStatus()));

        bus.onTransition(event());

        assertEquals(List.of("first:task-1", "second:CLAIMED"), seen);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<TransitionEvent> seen = new ArrayList<>();
        TransitionBus bus = new TransitionBus()
                .subscribe(e -> {
                    throw new IllegalStateException("listener down");
                })
                .subscribe(seen::add);

        assertDoesNotThrow(() -> bus.onTransition(event()));
        assertEquals(1, seen.size());
    }

    @Test
    void unsubscribedListenerIsSkipped() {
        List<TransitionEvent> seen = new ArrayList<>();
        TransitionListener listener = seen::add;
        TransitionBus bus = new TransitionBus().subscribe(listener);

        bus.unsubscribe(listener);
        bus.onTransition(event());

        assertTrue(seen.isEmpty());
        assertTrue(bus.listeners().isEmpty());
    }
}
