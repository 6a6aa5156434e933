package taskboard.coordinator.validation;

import taskboard.coordinator.error.DependencyUnresolvedException;
import taskboard.coordinator.error.DuplicateTaskException;
import taskboard.coordinator.error.ValidationException;
import taskboard.coordinator.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a validation: either an accepted normalized task or the list
 * of violations.
 */
public final class ValidationResult {

    private final String taskId;
    private final Task task;
    private final List<Violation> violations;
    private final List<String> dependencyIds;

    private ValidationResult(String taskId, Task task, List<Violation> violations, List<String> dependencyIds) {
        this.taskId = taskId;
        this.task = task;
        this.violations = List.copyOf(violations);
        this.dependencyIds = List.copyOf(dependencyIds);
    }

    public static ValidationResult accepted(Task task) {
        return new ValidationResult(task.id(), task, List.of(), List.of());
    }

    public static ValidationResult rejected(String taskId, List<Violation> violations) {
        return new ValidationResult(taskId, null, violations, List.of());
    }

    /**
     * Rejection caused by dependencies.
     *
     * @param dependencyIds unresolved ids, or the cycle path
     */
    public static ValidationResult rejectedDependencies(String taskId, List<Violation> violations,
            List<String> dependencyIds) {
        return new ValidationResult(taskId, null, violations, dependencyIds);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public Optional<Task> task() {
        return Optional.ofNullable(task);
    }

    public List<Violation> violations() {
        return violations;
    }

    /**
     * Return the accepted task or throw the typed failure matching the
     * most specific violation.
     */
    public Task orThrow() {
        if (isValid()) {
            return task;
        }
        for (Violation v : violations) {
            if (v.kind() == Violation.Kind.DUPLICATE) {
                throw new DuplicateTaskException(taskId, "Task " + taskId + ": " + v.message());
            }
        }
        for (Violation v : violations) {
            if (v.kind() == Violation.Kind.UNRESOLVED_DEPENDENCY || v.kind() == Violation.Kind.CYCLE) {
                throw new DependencyUnresolvedException(taskId, dependencyIds, "Task " + taskId + ": " + v.message());
            }
        }
        throw new ValidationException(taskId, violations);
    }
}
