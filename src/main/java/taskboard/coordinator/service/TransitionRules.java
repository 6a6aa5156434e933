package taskboard.coordinator.service;

import taskboard.coordinator.error.InvalidTransitionException;
import taskboard.coordinator.model.TaskStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static taskboard.coordinator.model.TaskStatus.*;

/**
 * The task state machine. Every transition not listed here is rejected.
 */
public final class TransitionRules {

    private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED = new EnumMap<>(TaskStatus.class);

    static {
        ALLOWED.put(UNCLAIMED, EnumSet.of(CLAIMED));
        ALLOWED.put(CLAIMED, EnumSet.of(WORKING, COMPLETED_PENDING_REVIEW, FAILED));
        ALLOWED.put(WORKING, EnumSet.of(BLOCKED, COMPLETED_PENDING_REVIEW, FAILED));
        ALLOWED.put(BLOCKED, EnumSet.of(WORKING, FAILED));
        ALLOWED.put(COMPLETED_PENDING_REVIEW, EnumSet.of(COMPLETED, FAILED));
        ALLOWED.put(COMPLETED, EnumSet.of(ARCHIVED));
        ALLOWED.put(FAILED, EnumSet.of(ARCHIVED));
        ALLOWED.put(ARCHIVED, EnumSet.noneOf(TaskStatus.class));
    }

    private TransitionRules() {
    }

    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<TaskStatus> allowedFrom(TaskStatus from) {
        return Set.copyOf(ALLOWED.get(from));
    }

    /**
     * @throws InvalidTransitionException if the state machine has no such edge
     */
    public static void check(String taskId, TaskStatus from, TaskStatus to) {
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(taskId, from, to);
        }
    }
}
