package taskboard.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of work on a board.
 * Every change produces a new instance through {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String name;
    private final String description;
    private final TaskStatus status;
    private final String assignedAgentId; // null while UNCLAIMED or ARCHIVED
    private final List<String> dependencies;
    private final TaskPriority priority;
    private final List<HistoryEntry> history;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String summary;
    private final Map<String, Object> outputs;
    private final String failureReason;
    private final List<String> tags;
    private final Map<String, Object> extensions; // unknown fields, kept verbatim

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.description = Objects.requireNonNull(builder.description, "description is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.assignedAgentId = builder.assignedAgentId;
        this.dependencies = List.copyOf(new LinkedHashSet<>(builder.dependencies));
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.history = List.copyOf(builder.history);
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.summary = builder.summary;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.failureReason = builder.failureReason;
        this.tags = List.copyOf(builder.tags);
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extensions));
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public TaskStatus status() {
        return status;
    }

    public String assignedAgentId() {
        return assignedAgentId;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public TaskPriority priority() {
        return priority;
    }

    public List<HistoryEntry> history() {
        return history;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public String summary() {
        return summary;
    }

    public Map<String, Object> outputs() {
        return outputs;
    }

    public String failureReason() {
        return failureReason;
    }

    public List<String> tags() {
        return tags;
    }

    public Map<String, Object> extensions() {
        return extensions;
    }

    /** Board this task belongs on */
    public Board board() {
        return status.board();
    }

    public boolean isAssignedTo(String agentId) {
        return assignedAgentId != null && assignedAgentId.equals(agentId);
    }

    /** Check if the task reached COMPLETED at some point (also true once archived after review) */
    public boolean wasCompleted() {
        if (status == TaskStatus.COMPLETED) {
            return true;
        }
        return status == TaskStatus.ARCHIVED
                && history.stream().anyMatch(e -> e.newStatus() == TaskStatus.COMPLETED);
    }

    /** Last history entry, or null for a record without history */
    public HistoryEntry lastHistoryEntry() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .status(status)
                .assignedAgentId(assignedAgentId)
                .dependencies(dependencies)
                .priority(priority)
                .history(history)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .summary(summary)
                .outputs(outputs)
                .failureReason(failureReason)
                .tags(tags)
                .extensions(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private TaskStatus status = TaskStatus.UNCLAIMED;
        private String assignedAgentId;
        private List<String> dependencies = new ArrayList<>();
        private TaskPriority priority = TaskPriority.NORMAL;
        private List<HistoryEntry> history = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;
        private String summary;
        private Map<String, Object> outputs = new LinkedHashMap<>();
        private String failureReason;
        private List<String> tags = new ArrayList<>();
        private Map<String, Object> extensions = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedAgentId(String assignedAgentId) {
            this.assignedAgentId = assignedAgentId;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = new ArrayList<>(dependencies);
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder history(List<HistoryEntry> history) {
            this.history = new ArrayList<>(history);
            return this;
        }

        /** Append one entry; the builder's history is never rewritten */
        public Builder appendHistory(HistoryEntry entry) {
            this.history.add(entry);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = new LinkedHashMap<>(outputs);
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder extensions(Map<String, Object> extensions) {
            this.extensions = new LinkedHashMap<>(extensions);
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", assignedAgentId='" + assignedAgentId + "'}";
    }
}
