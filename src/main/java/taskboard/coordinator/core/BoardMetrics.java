package taskboard.coordinator.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters of board activity. Exposed as a snapshot map for
 * whatever telemetry collaborator wants them.
 */
public final class BoardMetrics {

    private final AtomicLong reads = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong lockAcquisitions = new AtomicLong();
    private final AtomicLong lockTimeouts = new AtomicLong();
    private final AtomicLong staleLocksBroken = new AtomicLong();
    private final AtomicLong backupsCreated = new AtomicLong();
    private final AtomicLong corruptionsDetected = new AtomicLong();
    private final AtomicLong validationFailures = new AtomicLong();

    public void recordRead() {
        reads.incrementAndGet();
    }

    public void recordWrite() {
        writes.incrementAndGet();
    }

    public void recordLockAcquired() {
        lockAcquisitions.incrementAndGet();
    }

    public void recordLockTimeout() {
        lockTimeouts.incrementAndGet();
    }

    public void recordStaleLockBroken() {
        staleLocksBroken.incrementAndGet();
    }

    public void recordBackup() {
        backupsCreated.incrementAndGet();
    }

    public void recordCorruption() {
        corruptionsDetected.incrementAndGet();
    }

    public void recordValidationFailure() {
        validationFailures.incrementAndGet();
    }

    public long staleLocksBroken() {
        return staleLocksBroken.get();
    }

    public long lockTimeouts() {
        return lockTimeouts.get();
    }

    public long writes() {
        return writes.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        snapshot.put("read_operations", reads.get());
        snapshot.put("write_operations", writes.get());
        snapshot.put("lock_acquisitions", lockAcquisitions.get());
        snapshot.put("lock_timeouts", lockTimeouts.get());
        snapshot.put("stale_locks_broken", staleLocksBroken.get());
        snapshot.put("backups_created", backupsCreated.get());
        snapshot.put("corruptions_detected", corruptionsDetected.get());
        snapshot.put("validation_failures", validationFailures.get());
        return snapshot;
    }
}
