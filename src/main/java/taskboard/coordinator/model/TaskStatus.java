package taskboard.coordinator.model;

/**
 * Task lifecycle status.
 * The board holding a task is derived from its status, see {@link #board()}.
 */
public enum TaskStatus {
    /** Task created, waiting to be claimed */
    UNCLAIMED,
    /** Task exclusively assigned to an agent, work not started yet */
    CLAIMED,
    /** Agent is executing the task */
    WORKING,
    /** Agent reported a blocker */
    BLOCKED,
    /** Agent reported completion, waiting for review */
    COMPLETED_PENDING_REVIEW,
    /** Review accepted the result */
    COMPLETED,
    /** Task failed, kept visible for re-triage */
    FAILED,
    /** Task moved out of the active boards */
    ARCHIVED;

    /** Board that holds tasks in this status */
    public Board board() {
        return switch (this) {
            case UNCLAIMED -> Board.BACKLOG;
            case ARCHIVED -> Board.ARCHIVE;
            default -> Board.WORKING;
        };
    }

    /** Check if a task in this status must carry an assigned agent */
    public boolean requiresAgent() {
        return this != UNCLAIMED && this != ARCHIVED;
    }

    /** Check if this status may only move on to ARCHIVED */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
