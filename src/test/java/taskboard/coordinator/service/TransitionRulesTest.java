package taskboard.coordinator.service;

import taskboard.coordinator.error.InvalidTransitionException;
import taskboard.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static taskboard.coordinator.model.TaskStatus.*;

class TransitionRulesTest {

    @Test
    void happyPathIsAllowed() {
        assertTrue(TransitionRules.isAllowed(UNCLAIMED, CLAIMED));
        assertTrue(TransitionRules.isAllowed(CLAIMED, WORKING));
        assertTrue(TransitionRules.isAllowed(WORKING, COMPLETED_PENDING_REVIEW));
        assertTrue(TransitionRules.isAllowed(COMPLETED_PENDING_REVIEW, COMPLETED));
        assertTrue(TransitionRules.isAllowed(COMPLETED, ARCHIVED));
    }

    @Test
    void archivedIsFinal() {
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TransitionRules.isAllowed(ARCHIVED, target), target.name());
        }
    }

    @Test
    void onlyFinishedTasksArchive() {
        for (TaskStatus from : TaskStatus.values()) {
            boolean expected = from == COMPLETED || from == FAILED;
            assertEquals(expected, TransitionRules.isAllowed(from, ARCHIVED), from.name());
        }
    }

    @Test
    void unclaimedCannotFail() {
        assertEquals(Set.of(CLAIMED), TransitionRules.allowedFrom(UNCLAIMED));
    }

    @Test
    void checkThrowsWithBothStatuses() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> TransitionRules.check("task-1", COMPLETED, WORKING));

        assertEquals(COMPLETED, e.from());
        assertEquals(WORKING, e.to());
        assertEquals("task-1", e.taskId());
    }
}
