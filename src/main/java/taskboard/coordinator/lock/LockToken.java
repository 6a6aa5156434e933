package taskboard.coordinator.lock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of a held board lock, returned by {@link BoardLockManager#acquire}.
 */
public final class LockToken {

    private final String scope;
    private final String holderId;
    private final String token;
    private final Instant acquiredAt;
    private final Path sentinel;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockToken(String scope, String holderId, String token, Instant acquiredAt, Path sentinel) {
        this.scope = scope;
        this.holderId = holderId;
        this.token = token;
        this.acquiredAt = acquiredAt;
        this.sentinel = sentinel;
    }

    public String scope() {
        return scope;
    }

    public String holderId() {
        return holderId;
    }

    public String token() {
        return token;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public Path sentinel() {
        return sentinel;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** @return true only for the first call */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "LockToken{scope='" + scope + "', holder='" + holderId + "', acquiredAt=" + acquiredAt + "}";
    }
}
