package taskboard.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRecordsTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void recordUsesSnakeCaseKeys() {
        Task task = Task.builder()
                .id("task-1")
                .description("d")
                .status(TaskStatus.CLAIMED)
                .assignedAgentId("agent-a")
                .createdAt(T0)
                .appendHistory(new HistoryEntry(T0, TaskStatus.UNCLAIMED, TaskStatus.CLAIMED, "agent-a", null))
                .build();

        Map<String, Object> record = TaskRecords.toRecord(task);

        assertEquals("task-1", record.get("task_id"));
        assertEquals("agent-a", record.get("assigned_agent_id"));
        assertEquals("CLAIMED", record.get("status"));
        assertEquals("2024-05-01T10:00:00Z", record.get("created_at"));
        List<?> history = (List<?>) record.get("history");
        assertEquals("UNCLAIMED", ((Map<?, ?>) history.get(0)).get("old_status"));
        assertFalse(record.containsKey("summary"));
    }

    @Test
    void unknownFieldsSurviveAsExtensions() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("task_id", "task-1");
        record.put("description", "d");
        record.put("status", "UNCLAIMED");
        record.put("priority", "LOW");
        record.put("created_at", T0.toString());
        record.put("updated_at", T0.toString());
        record.put("history", List.of());
        record.put("estimate_hours", 4);
        record.put("notes", "see ticket");

        Task task = TaskRecords.fromRecord(record);

        assertEquals(TaskPriority.LOW, task.priority());
        assertEquals(Map.of("estimate_hours", 4, "notes", "see ticket"), task.extensions());
        assertEquals(4, TaskRecords.toRecord(task).get("estimate_hours"));
    }

    @Test
    void malformedRecordIsRejected() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("task_id", "task-1");
        record.put("description", "d");
        record.put("status", "UNCLAIMED");
        record.put("created_at", "yesterday");
        record.put("updated_at", T0.toString());

        assertThrows(IllegalArgumentException.class, () -> TaskRecords.fromRecord(record));
    }
}
