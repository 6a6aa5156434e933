package taskboard.coordinator.error;

/**
 * Wraps an I/O failure of the board directory that is neither a lock
 * timeout nor a corrupted artifact.
 */
public class BoardStoreException extends TaskBoardException {
    public BoardStoreException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
