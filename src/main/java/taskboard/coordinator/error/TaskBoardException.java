package taskboard.coordinator.error;

/**
 * Base class of every typed failure raised by the task board core.
 * Carries the offending task id when the failure concerns one task.
 */
public class TaskBoardException extends RuntimeException {

    private final String taskId;

    public TaskBoardException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public TaskBoardException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    /** Offending task id, or null for board-level failures */
    public String taskId() {
        return taskId;
    }
}
