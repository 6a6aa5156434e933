package taskboard.coordinator.error;

import java.time.Duration;

/**
 * Thrown when a board lock could not be acquired within the timeout, or
 * the wait for it was interrupted. The caller never held the lock, so the
 * board is unaffected.
 */
public class LockTimeoutException extends TaskBoardException {

    private final String scope;
    private final int attempts;

    public LockTimeoutException(String scope, Duration timeout, int attempts, String currentHolder) {
        super(null, "Timed out after " + timeout.toMillis() + "ms (" + attempts + " attempts) waiting for lock '"
                + scope + "' held by " + (currentHolder != null ? currentHolder : "unknown holder"));
        this.scope = scope;
        this.attempts = attempts;
    }

    /** The wait was interrupted before the lock became free */
    public LockTimeoutException(String scope, int attempts, InterruptedException cause) {
        super(null, "Interrupted after " + attempts + " attempts waiting for lock '" + scope + "'", cause);
        this.scope = scope;
        this.attempts = attempts;
    }

    public boolean isInterrupted() {
        return getCause() instanceof InterruptedException;
    }

    public String scope() {
        return scope;
    }

    public int attempts() {
        return attempts;
    }
}
