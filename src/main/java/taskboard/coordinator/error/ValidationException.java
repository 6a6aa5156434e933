package taskboard.coordinator.error;

import taskboard.coordinator.validation.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown for a malformed or incomplete task record or patch.
 */
public class ValidationException extends TaskBoardException {

    private final List<Violation> violations;

    public ValidationException(String taskId, List<Violation> violations) {
        super(taskId, "Task " + (taskId != null ? taskId : "<no id>") + " rejected: "
                + violations.stream().map(Violation::toString).collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }
}
