package taskboard.coordinator.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between {@link Task} and the plain structured record used on
 * disk and at the coordinator API: a string-keyed map with snake_case keys,
 * ISO-8601 timestamps and enum names.
 *
 * <p>{@link #fromRecord(Map)} expects a record that already passed the
 * stored-record schema; anything else fails with
 * {@link IllegalArgumentException}.
 */
public final class TaskRecords {

    public static final String TASK_ID = "task_id";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String STATUS = "status";
    public static final String PRIORITY = "priority";
    public static final String ASSIGNED_AGENT_ID = "assigned_agent_id";
    public static final String DEPENDENCIES = "dependencies";
    public static final String TAGS = "tags";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String SUMMARY = "summary";
    public static final String OUTPUTS = "outputs";
    public static final String FAILURE_REASON = "failure_reason";
    public static final String HISTORY = "history";

    public static final String HISTORY_TIMESTAMP = "timestamp";
    public static final String HISTORY_OLD_STATUS = "old_status";
    public static final String HISTORY_NEW_STATUS = "new_status";
    public static final String HISTORY_ACTOR = "actor";
    public static final String HISTORY_NOTE = "note";

    /** Every field with a dedicated Task property; the rest are extensions */
    public static final Set<String> KNOWN_FIELDS = Set.of(
            TASK_ID, NAME, DESCRIPTION, STATUS, PRIORITY, ASSIGNED_AGENT_ID, DEPENDENCIES, TAGS,
            CREATED_AT, UPDATED_AT, SUMMARY, OUTPUTS, FAILURE_REASON, HISTORY);

    private TaskRecords() {
    }

    public static Map<String, Object> toRecord(Task task) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(TASK_ID, task.id());
        if (task.name() != null) {
            record.put(NAME, task.name());
        }
        record.put(DESCRIPTION, task.description());
        record.put(STATUS, task.status().name());
        record.put(PRIORITY, task.priority().name());
        if (task.assignedAgentId() != null) {
            record.put(ASSIGNED_AGENT_ID, task.assignedAgentId());
        }
        record.put(DEPENDENCIES, new ArrayList<>(task.dependencies()));
        record.put(TAGS, new ArrayList<>(task.tags()));
        record.put(CREATED_AT, task.createdAt().toString());
        record.put(UPDATED_AT, task.updatedAt().toString());
        if (task.summary() != null) {
            record.put(SUMMARY, task.summary());
        }
        if (!task.outputs().isEmpty()) {
            record.put(OUTPUTS, new LinkedHashMap<>(task.outputs()));
        }
        if (task.failureReason() != null) {
            record.put(FAILURE_REASON, task.failureReason());
        }
        List<Map<String, Object>> history = new ArrayList<>();
        for (HistoryEntry entry : task.history()) {
            history.add(historyRecord(entry));
        }
        record.put(HISTORY, history);
        task.extensions().forEach(record::putIfAbsent);
        return record;
    }

    public static Map<String, Object> historyRecord(HistoryEntry entry) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(HISTORY_TIMESTAMP, entry.timestamp().toString());
        record.put(HISTORY_OLD_STATUS, entry.oldStatus() != null ? entry.oldStatus().name() : null);
        record.put(HISTORY_NEW_STATUS, entry.newStatus().name());
        record.put(HISTORY_ACTOR, entry.actor());
        record.put(HISTORY_NOTE, entry.note());
        return record;
    }

    public static Task fromRecord(Map<String, ?> record) {
        try {
            Task.Builder builder = Task.builder()
                    .id(string(record, TASK_ID))
                    .name(string(record, NAME))
                    .description(string(record, DESCRIPTION))
                    .status(TaskStatus.valueOf(string(record, STATUS)))
                    .priority(record.get(PRIORITY) != null
                            ? TaskPriority.valueOf(string(record, PRIORITY))
                            : TaskPriority.NORMAL)
                    .assignedAgentId(string(record, ASSIGNED_AGENT_ID))
                    .dependencies(stringList(record, DEPENDENCIES))
                    .tags(stringList(record, TAGS))
                    .createdAt(Instant.parse(string(record, CREATED_AT)))
                    .updatedAt(Instant.parse(string(record, UPDATED_AT)))
                    .summary(string(record, SUMMARY))
                    .outputs(object(record, OUTPUTS))
                    .failureReason(string(record, FAILURE_REASON))
                    .extensions(extensions(record));

            Object history = record.get(HISTORY);
            if (history != null) {
                for (Object item : (List<?>) history) {
                    builder.appendHistory(historyEntry((Map<?, ?>) item));
                }
            }
            return builder.build();
        } catch (ClassCastException | DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Malformed task record " + record.get(TASK_ID) + ": " + e.getMessage(), e);
        }
    }

    /** Fields a record carries beyond the known task properties */
    public static Map<String, Object> extensions(Map<String, ?> record) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        record.forEach((key, value) -> {
            if (!KNOWN_FIELDS.contains(key)) {
                extensions.put(key, value);
            }
        });
        return extensions;
    }

    private static HistoryEntry historyEntry(Map<?, ?> item) {
        Object oldStatus = item.get(HISTORY_OLD_STATUS);
        return new HistoryEntry(
                Instant.parse((String) item.get(HISTORY_TIMESTAMP)),
                oldStatus != null ? TaskStatus.valueOf((String) oldStatus) : null,
                TaskStatus.valueOf((String) item.get(HISTORY_NEW_STATUS)),
                (String) item.get(HISTORY_ACTOR),
                (String) item.get(HISTORY_NOTE));
    }

    static String string(Map<String, ?> record, String key) {
        return (String) record.get(key);
    }

    static List<String> stringList(Map<String, ?> record, String key) {
        Object value = record.get(key);
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
    static Map<String, Object> object(Map<String, ?> record, String key) {
        Object value = record.get(key);
        return value == null ? Map.of() : (Map<String, Object>) value;
    }
}
