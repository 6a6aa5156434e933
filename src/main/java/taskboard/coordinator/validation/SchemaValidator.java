package taskboard.coordinator.validation;

import taskboard.coordinator.model.HistoryEntry;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskPriority;
import taskboard.coordinator.model.TaskRecords;
import taskboard.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks task records against {@link TaskSchema} and the board's
 * referential rules. Pure: every check works on the snapshot passed in.
 *
 * <p>Dependencies must already exist on some board when a task is created
 * or patched; forward references are rejected.
 */
public class SchemaValidator {

    /**
     * Validate a record for add_task and normalize it into a new UNCLAIMED task.
     *
     * @param record   caller supplied record
     * @param existing every task currently on any board
     * @param actor    who creates the task, recorded in history
     * @param now      creation timestamp
     */
    public ValidationResult validateNew(Map<String, ?> record, Collection<Task> existing, String actor, Instant now) {
        String taskId = record.get(TaskRecords.TASK_ID) instanceof String s ? s : null;

        List<Violation> violations = checkFields(record, TaskSchema.NEW_TASK);
        for (String managed : TaskSchema.MANAGED) {
            if (record.get(managed) != null) {
                violations.add(Violation.schema(managed, "is managed by the board and cannot be supplied"));
            }
        }
        Object status = record.get(TaskRecords.STATUS);
        if (status != null && !TaskStatus.UNCLAIMED.name().equals(status)) {
            violations.add(Violation.schema(TaskRecords.STATUS, "new tasks must start UNCLAIMED, got " + status));
        }
        if (!violations.isEmpty()) {
            return ValidationResult.rejected(taskId, violations);
        }

        Map<String, Task> byId = index(existing);
        if (byId.containsKey(taskId)) {
            return ValidationResult.rejected(taskId, List.of(new Violation(Violation.Kind.DUPLICATE, TaskRecords.TASK_ID,
                    "id already exists on board " + byId.get(taskId).board())));
        }

        List<String> dependencies = stringList(record.get(TaskRecords.DEPENDENCIES));
        Optional<ValidationResult> dependencyFailure = checkDependencies(taskId, dependencies, byId);
        if (dependencyFailure.isPresent()) {
            return dependencyFailure.get();
        }

        Task task = Task.builder()
                .id(taskId)
                .name((String) record.get(TaskRecords.NAME))
                .description((String) record.get(TaskRecords.DESCRIPTION))
                .status(TaskStatus.UNCLAIMED)
                .priority(record.get(TaskRecords.PRIORITY) != null
                        ? TaskPriority.valueOf((String) record.get(TaskRecords.PRIORITY))
                        : TaskPriority.NORMAL)
                .dependencies(dependencies)
                .tags(stringList(record.get(TaskRecords.TAGS)))
                .summary((String) record.get(TaskRecords.SUMMARY))
                .outputs(objectMap(record.get(TaskRecords.OUTPUTS)))
                .extensions(TaskRecords.extensions(record))
                .createdAt(now)
                .updatedAt(now)
                .appendHistory(new HistoryEntry(now, null, TaskStatus.UNCLAIMED, actor, "created"))
                .build();
        return ValidationResult.accepted(task);
    }

    /**
     * Validate an update_task patch and apply it to the current task.
     * History and timestamps are left to the caller.
     *
     * @param existing every task currently on any board (the current task included)
     */
    public ValidationResult validatePatch(Task current, Map<String, ?> patch, Collection<Task> existing) {
        List<Violation> violations = new ArrayList<>();
        if (patch.isEmpty()) {
            violations.add(Violation.schema(null, "patch is empty"));
        }
        for (String key : patch.keySet()) {
            if (TaskSchema.IMMUTABLE_ON_PATCH.contains(key)) {
                violations.add(Violation.schema(key, "cannot be changed by an update"));
            }
        }
        for (FieldSpec spec : TaskSchema.PATCH) {
            if (patch.containsKey(spec.name())) {
                Object value = patch.get(spec.name());
                String problem = value == null && spec.nonBlank() ? "must not be null" : spec.check(value);
                if (problem != null) {
                    violations.add(Violation.schema(spec.name(), problem));
                }
            }
        }
        if (!violations.isEmpty()) {
            return ValidationResult.rejected(current.id(), violations);
        }

        Task.Builder builder = current.toBuilder();
        if (patch.containsKey(TaskRecords.NAME))
            builder.name((String) patch.get(TaskRecords.NAME));
        if (patch.containsKey(TaskRecords.DESCRIPTION))
            builder.description((String) patch.get(TaskRecords.DESCRIPTION));
        if (patch.get(TaskRecords.PRIORITY) != null)
            builder.priority(TaskPriority.valueOf((String) patch.get(TaskRecords.PRIORITY)));
        if (patch.containsKey(TaskRecords.TAGS))
            builder.tags(stringList(patch.get(TaskRecords.TAGS)));

        Map<String, Object> extensions = new LinkedHashMap<>(current.extensions());
        extensions.putAll(TaskRecords.extensions(patch));
        builder.extensions(extensions);

        if (patch.containsKey(TaskRecords.DEPENDENCIES)) {
            List<String> dependencies = stringList(patch.get(TaskRecords.DEPENDENCIES));
            Map<String, Task> byId = index(existing);
            Optional<ValidationResult> dependencyFailure = checkDependencies(current.id(), dependencies, byId);
            if (dependencyFailure.isPresent()) {
                return dependencyFailure.get();
            }
            builder.dependencies(dependencies);
        }
        return ValidationResult.accepted(builder.build());
    }

    /**
     * Check a persisted record against the stored-task schema.
     */
    public List<Violation> checkStored(Map<String, ?> record) {
        return checkFields(record, TaskSchema.STORED_TASK);
    }

    /**
     * Check the lifecycle invariants of one task: agent assignment matches
     * status, history ends in the current status, timestamps never go back.
     */
    public List<Violation> checkInvariants(Task task) {
        List<Violation> violations = new ArrayList<>();
        boolean assigned = task.assignedAgentId() != null;
        if (task.status().requiresAgent() && !assigned) {
            violations.add(invariant(TaskRecords.ASSIGNED_AGENT_ID, "status " + task.status() + " requires an assigned agent"));
        } else if (!task.status().requiresAgent() && assigned) {
            violations.add(invariant(TaskRecords.ASSIGNED_AGENT_ID, "status " + task.status() + " must not have an assigned agent"));
        }
        if (task.updatedAt().isBefore(task.createdAt())) {
            violations.add(invariant(TaskRecords.UPDATED_AT, "is before created_at"));
        }
        HistoryEntry last = task.lastHistoryEntry();
        if (last == null) {
            if (task.status() != TaskStatus.UNCLAIMED) {
                violations.add(invariant(TaskRecords.HISTORY, "is empty for status " + task.status()));
            }
        } else if (last.newStatus() != task.status()) {
            violations.add(invariant(TaskRecords.HISTORY, "last entry ends in " + last.newStatus()
                    + " but status is " + task.status()));
        }
        Instant previous = null;
        for (HistoryEntry entry : task.history()) {
            if (previous != null && entry.timestamp().isBefore(previous)) {
                violations.add(invariant(TaskRecords.HISTORY, "timestamps go backwards at " + entry.timestamp()));
                break;
            }
            previous = entry.timestamp();
        }
        if (previous != null && task.updatedAt().isBefore(previous)) {
            violations.add(invariant(TaskRecords.UPDATED_AT, "is before the last history entry"));
        }
        return violations;
    }

    /**
     * Check referential integrity across all boards: every dependency
     * resolves and no dependency cycle exists.
     */
    public List<Violation> checkIntegrity(Collection<Task> allTasks) {
        List<Violation> violations = new ArrayList<>();
        Map<String, Task> byId = index(allTasks);
        for (Task task : allTasks) {
            for (String dependency : task.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    violations.add(new Violation(Violation.Kind.UNRESOLVED_DEPENDENCY, TaskRecords.DEPENDENCIES,
                            "task " + task.id() + " depends on unknown task " + dependency));
                }
            }
        }
        DependencyGraph graph = DependencyGraph.of(allTasks);
        for (Task task : allTasks) {
            Optional<List<String>> cycle = graph.findCycleFrom(task.id());
            if (cycle.isPresent()) {
                violations.add(new Violation(Violation.Kind.CYCLE, TaskRecords.DEPENDENCIES,
                        "dependency cycle " + String.join(" -> ", cycle.get())));
                break;
            }
        }
        return violations;
    }

    private Optional<ValidationResult> checkDependencies(String taskId, List<String> dependencies, Map<String, Task> byId) {
        if (dependencies.contains(taskId)) {
            return Optional.of(ValidationResult.rejectedDependencies(taskId,
                    List.of(new Violation(Violation.Kind.CYCLE, TaskRecords.DEPENDENCIES, "task depends on itself")),
                    List.of(taskId, taskId)));
        }
        List<String> unknown = dependencies.stream().filter(d -> !byId.containsKey(d)).toList();
        if (!unknown.isEmpty()) {
            return Optional.of(ValidationResult.rejectedDependencies(taskId,
                    List.of(new Violation(Violation.Kind.UNRESOLVED_DEPENDENCY, TaskRecords.DEPENDENCIES,
                            "unknown dependencies " + unknown + " (create dependencies first)")),
                    unknown));
        }
        DependencyGraph graph = DependencyGraph.of(byId.values()).put(taskId, dependencies);
        Optional<List<String>> cycle = graph.findCycleFrom(taskId);
        return cycle.map(path -> ValidationResult.rejectedDependencies(taskId,
                List.of(new Violation(Violation.Kind.CYCLE, TaskRecords.DEPENDENCIES,
                        "dependency cycle " + String.join(" -> ", path))),
                path));
    }

    private static List<Violation> checkFields(Map<String, ?> record, List<FieldSpec> fields) {
        List<Violation> violations = new ArrayList<>();
        for (FieldSpec spec : fields) {
            String problem = spec.check(record.get(spec.name()));
            if (problem != null) {
                violations.add(Violation.schema(spec.name(), problem));
            }
        }
        return violations;
    }

    private static Violation invariant(String field, String message) {
        return new Violation(Violation.Kind.INVARIANT, field, message);
    }

    private static Map<String, Task> index(Collection<Task> tasks) {
        Map<String, Task> byId = new HashMap<>();
        for (Task task : tasks) {
            byId.put(task.id(), task);
        }
        return byId;
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add((String) item);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> objectMap(Object value) {
        return value == null ? Map.of() : (Map<String, Object>) value;
    }
}
