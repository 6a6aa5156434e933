package taskboard.coordinator.model;

import java.util.Set;

/**
 * Filter for task listings. Null fields match everything.
 *
 * @param status      exact status to match
 * @param agentId     assigned agent to match
 * @param minPriority least urgent priority still included
 * @param tags        every listed tag must be present on the task
 * @param limit       maximum results, 0 for no limit
 */
public record TaskFilter(
        TaskStatus status,
        String agentId,
        TaskPriority minPriority,
        Set<String> tags,
        int limit) {

    public TaskFilter {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
    }

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, Set.of(), 0);
    }

    public TaskFilter withStatus(TaskStatus status) {
        return new TaskFilter(status, agentId, minPriority, tags, limit);
    }

    public TaskFilter withAgent(String agentId) {
        return new TaskFilter(status, agentId, minPriority, tags, limit);
    }

    public TaskFilter withMinPriority(TaskPriority minPriority) {
        return new TaskFilter(status, agentId, minPriority, tags, limit);
    }

    public TaskFilter withTags(Set<String> tags) {
        return new TaskFilter(status, agentId, minPriority, tags, limit);
    }

    public TaskFilter withLimit(int limit) {
        return new TaskFilter(status, agentId, minPriority, tags, limit);
    }

    public boolean matches(Task task) {
        if (status != null && task.status() != status)
            return false;
        if (agentId != null && !agentId.equals(task.assignedAgentId()))
            return false;
        if (minPriority != null && !task.priority().atLeast(minPriority))
            return false;
        return task.tags().containsAll(tags);
    }
}
