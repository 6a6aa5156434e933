package taskboard.coordinator.error;

/**
 * Thrown when an agent acts on a task assigned to someone else.
 */
public class TaskPermissionException extends TaskBoardException {
    public TaskPermissionException(String taskId, String message) {
        super(taskId, message);
    }
}
