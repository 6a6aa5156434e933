package taskboard.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only history record of a task.
 *
 * @param timestamp when the change was persisted
 * @param oldStatus status before the change, null for the creation entry
 * @param newStatus status after the change
 * @param actor     agent, reviewer or component that made the change
 * @param note      free-form detail
 */
public record HistoryEntry(
        Instant timestamp,
        TaskStatus oldStatus,
        TaskStatus newStatus,
        String actor,
        String note) {

    public HistoryEntry {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(newStatus, "newStatus is required");
    }

    /** Check if this entry changed the status (updates keep it) */
    public boolean isTransition() {
        return oldStatus != newStatus;
    }
}
