package taskboard.coordinator.error;

/**
 * Thrown when a new task reuses an id that already exists on some board.
 */
public class DuplicateTaskException extends TaskBoardException {
    public DuplicateTaskException(String taskId, String message) {
        super(taskId, message);
    }
}
