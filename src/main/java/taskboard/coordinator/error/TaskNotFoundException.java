package taskboard.coordinator.error;

/**
 * Thrown when a task is absent from the board an operation works on.
 */
public class TaskNotFoundException extends TaskBoardException {
    public TaskNotFoundException(String taskId, String message) {
        super(taskId, message);
    }
}
