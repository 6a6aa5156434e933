package taskboard.coordinator.validation;

import taskboard.coordinator.model.TaskRecords;
import taskboard.coordinator.model.TaskStatus;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Value types a task record field may declare.
 */
public enum FieldType {
    STRING,
    STRING_LIST,
    OBJECT,
    ENUM,
    TIMESTAMP,
    HISTORY;

    /**
     * Check a non-null value against this type.
     *
     * @return problem description, or null when the value conforms
     */
    String check(Object value, FieldSpec spec) {
        return switch (this) {
            case STRING -> {
                if (!(value instanceof String s))
                    yield "expected string, got " + typeName(value);
                yield spec.nonBlank() && s.isBlank() ? "must not be blank" : null;
            }
            case STRING_LIST -> {
                if (!(value instanceof List<?> list))
                    yield "expected array of strings, got " + typeName(value);
                for (Object item : list) {
                    if (!(item instanceof String s) || s.isBlank())
                        yield "expected non-blank string elements, got " + typeName(item);
                }
                yield null;
            }
            case OBJECT -> value instanceof Map<?, ?> ? null : "expected object, got " + typeName(value);
            case ENUM -> {
                if (!(value instanceof String s))
                    yield "expected one of " + spec.allowedValues() + ", got " + typeName(value);
                yield spec.allowedValues().contains(s) ? null
                        : "'" + s + "' is not one of " + spec.allowedValues();
            }
            case TIMESTAMP -> checkTimestamp(value);
            case HISTORY -> checkHistory(value);
        };
    }

    private static String checkTimestamp(Object value) {
        if (!(value instanceof String s))
            return "expected ISO-8601 timestamp, got " + typeName(value);
        try {
            Instant.parse(s);
            return null;
        } catch (DateTimeParseException e) {
            return "'" + s + "' is not an ISO-8601 timestamp";
        }
    }

    private static String checkHistory(Object value) {
        if (!(value instanceof List<?> list))
            return "expected array of history entries, got " + typeName(value);
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> entry))
                return "entry " + i + ": expected object";
            String problem = checkTimestamp(entry.get(TaskRecords.HISTORY_TIMESTAMP));
            if (problem != null)
                return "entry " + i + " " + TaskRecords.HISTORY_TIMESTAMP + ": " + problem;
            if (!isStatus(entry.get(TaskRecords.HISTORY_NEW_STATUS)))
                return "entry " + i + ": illegal " + TaskRecords.HISTORY_NEW_STATUS;
            Object old = entry.get(TaskRecords.HISTORY_OLD_STATUS);
            if (old != null && !isStatus(old))
                return "entry " + i + ": illegal " + TaskRecords.HISTORY_OLD_STATUS;
            Object actor = entry.get(TaskRecords.HISTORY_ACTOR);
            Object note = entry.get(TaskRecords.HISTORY_NOTE);
            if ((actor != null && !(actor instanceof String)) || (note != null && !(note instanceof String)))
                return "entry " + i + ": actor and note must be strings";
        }
        return null;
    }

    private static boolean isStatus(Object value) {
        if (!(value instanceof String s))
            return false;
        for (TaskStatus status : TaskStatus.values()) {
            if (status.name().equals(s))
                return true;
        }
        return false;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
