package taskboard.coordinator.error;

import java.util.List;

/**
 * Thrown when dependencies are unknown, not yet completed, or form a cycle.
 */
public class DependencyUnresolvedException extends TaskBoardException {

    private final List<String> dependencyIds;

    public DependencyUnresolvedException(String taskId, List<String> dependencyIds, String message) {
        super(taskId, message);
        this.dependencyIds = List.copyOf(dependencyIds);
    }

    /** Offending dependency ids, or the cycle path for cycle violations */
    public List<String> dependencyIds() {
        return dependencyIds;
    }
}
