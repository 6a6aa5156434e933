package taskboard.coordinator.error;

import taskboard.coordinator.model.TaskStatus;

/**
 * Thrown for a status change the lifecycle state machine does not allow.
 */
public class InvalidTransitionException extends TaskBoardException {

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super(taskId, "Task " + taskId + ": transition " + from + " -> " + to + " is not allowed");
        this.from = from;
        this.to = to;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
