package taskboard.coordinator.validation;

import taskboard.coordinator.model.TaskPriority;
import taskboard.coordinator.model.TaskStatus;

import java.util.List;
import java.util.Set;

import static taskboard.coordinator.model.TaskRecords.*;

/**
 * Explicit task record schemas.
 * Unknown fields are allowed everywhere and kept as extensions.
 */
public final class TaskSchema {

    /** Record accepted by add_task */
    public static final List<FieldSpec> NEW_TASK = List.of(
            FieldSpec.required(TASK_ID, FieldType.STRING),
            FieldSpec.required(DESCRIPTION, FieldType.STRING),
            FieldSpec.optional(NAME, FieldType.STRING),
            FieldSpec.enumOf(STATUS, false, TaskStatus.class),
            FieldSpec.enumOf(PRIORITY, false, TaskPriority.class),
            FieldSpec.optional(DEPENDENCIES, FieldType.STRING_LIST),
            FieldSpec.optional(TAGS, FieldType.STRING_LIST),
            FieldSpec.optional(SUMMARY, FieldType.STRING),
            FieldSpec.optional(OUTPUTS, FieldType.OBJECT));

    /** Record as persisted on a board file */
    public static final List<FieldSpec> STORED_TASK = List.of(
            FieldSpec.required(TASK_ID, FieldType.STRING),
            FieldSpec.required(DESCRIPTION, FieldType.STRING),
            FieldSpec.optional(NAME, FieldType.STRING),
            FieldSpec.enumOf(STATUS, true, TaskStatus.class),
            FieldSpec.enumOf(PRIORITY, true, TaskPriority.class),
            FieldSpec.optional(ASSIGNED_AGENT_ID, FieldType.STRING),
            FieldSpec.optional(DEPENDENCIES, FieldType.STRING_LIST),
            FieldSpec.optional(TAGS, FieldType.STRING_LIST),
            FieldSpec.required(CREATED_AT, FieldType.TIMESTAMP),
            FieldSpec.required(UPDATED_AT, FieldType.TIMESTAMP),
            FieldSpec.optional(SUMMARY, FieldType.STRING),
            FieldSpec.optional(OUTPUTS, FieldType.OBJECT),
            FieldSpec.optional(FAILURE_REASON, FieldType.STRING),
            FieldSpec.required(HISTORY, FieldType.HISTORY));

    /** Fields update_task may change */
    public static final List<FieldSpec> PATCH = List.of(
            FieldSpec.optional(NAME, FieldType.STRING),
            new FieldSpec(DESCRIPTION, FieldType.STRING, false, true, Set.of()),
            FieldSpec.enumOf(PRIORITY, false, TaskPriority.class),
            FieldSpec.optional(DEPENDENCIES, FieldType.STRING_LIST),
            FieldSpec.optional(TAGS, FieldType.STRING_LIST));

    /** Fields owned by the board; callers may not set them on create or patch */
    public static final Set<String> MANAGED = Set.of(
            ASSIGNED_AGENT_ID, HISTORY, CREATED_AT, UPDATED_AT, FAILURE_REASON);

    /** Fields that never change through update_task */
    public static final Set<String> IMMUTABLE_ON_PATCH = Set.of(
            TASK_ID, STATUS, ASSIGNED_AGENT_ID, HISTORY, CREATED_AT, UPDATED_AT,
            SUMMARY, OUTPUTS, FAILURE_REASON);

    private TaskSchema() {
    }
}
