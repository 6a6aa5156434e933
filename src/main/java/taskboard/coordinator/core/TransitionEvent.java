package taskboard.coordinator.core;

import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * A persisted status change of one task.
 *
 * @param taskId    the task
 * @param oldStatus status before the change, null when the task was created
 * @param newStatus status after the change
 * @param timestamp time recorded in the task history
 * @param actor     who made the change
 * @param board     board holding the task after the change
 */
public record TransitionEvent(
        String taskId,
        TaskStatus oldStatus,
        TaskStatus newStatus,
        Instant timestamp,
        String actor,
        Board board) {
}
