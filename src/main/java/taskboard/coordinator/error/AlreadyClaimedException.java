package taskboard.coordinator.error;

/**
 * Thrown when a claim loses the race: the task was no longer UNCLAIMED
 * once the board lock was held.
 */
public class AlreadyClaimedException extends TaskBoardException {

    private final String holderAgentId;

    public AlreadyClaimedException(String taskId, String holderAgentId, String message) {
        super(taskId, message);
        this.holderAgentId = holderAgentId;
    }

    /** Agent holding the task, null if unknown */
    public String holderAgentId() {
        return holderAgentId;
    }
}
