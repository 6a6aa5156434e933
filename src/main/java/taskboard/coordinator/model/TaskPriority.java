package taskboard.coordinator.model;

/**
 * Ordered task priority. Only used as a tie-break hint when listing
 * available work, never enforced.
 */
public enum TaskPriority {
    CRITICAL(0),
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    /** Lower rank is more urgent */
    public int rank() {
        return rank;
    }

    /** Check if this priority is at least as urgent as the other one */
    public boolean atLeast(TaskPriority other) {
        return rank <= other.rank;
    }
}
