package taskboard.coordinator.store;

import taskboard.coordinator.MutableClock;
import taskboard.coordinator.core.BoardMetrics;
import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.error.BoardStoreException;
import taskboard.coordinator.error.ValidationException;
import taskboard.coordinator.lock.BackoffPolicy;
import taskboard.coordinator.lock.BoardLockManager;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.HistoryEntry;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskStatus;
import taskboard.coordinator.repository.BoardSnapshot;
import taskboard.coordinator.validation.SchemaValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileBoardRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private MutableClock clock;
    private BoardMetrics metrics;
    private FileBoardRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        metrics = new BoardMetrics();
        SchemaValidator validator = new SchemaValidator();
        BoardLockManager locks = new BoardLockManager(dir, "test", Duration.ofSeconds(60),
                BackoffPolicy.defaults(), clock, metrics);
        BackupManager backups = new BackupManager(dir.resolve("backups"), 3, clock, metrics);
        repository = new FileBoardRepository(dir, locks, validator, backups, Duration.ofSeconds(2), metrics);
    }

    static Task unclaimed(String id) {
        return Task.builder()
                .id(id)
                .description("task " + id)
                .createdAt(T0)
                .appendHistory(new HistoryEntry(T0, null, TaskStatus.UNCLAIMED, "planner", "created"))
                .build();
    }

    static Task claimed(String id, String agent) {
        Task task = unclaimed(id);
        return task.toBuilder()
                .status(TaskStatus.CLAIMED)
                .assignedAgentId(agent)
                .appendHistory(new HistoryEntry(T0, TaskStatus.UNCLAIMED, TaskStatus.CLAIMED, agent, null))
                .build();
    }

    private void writeRaw(Board board, String content) throws IOException {
        Files.writeString(dir.resolve(board.fileName()), content, StandardCharsets.UTF_8);
    }

    @Test
    void missingBoardLoadsEmpty() {
        BoardSnapshot snapshot = repository.load(Board.BACKLOG);

        assertEquals(0, snapshot.size());
        assertFalse(repository.isQuarantined(Board.BACKLOG));
    }

    @Test
    void savedBoardLoadsBackIdentically() {
        Task withExtras = unclaimed("task-2").toBuilder()
                .tags(List.of("backend"))
                .extensions(Map.of("estimate_hours", 4))
                .build();
        repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"), withExtras)));

        List<Task> loaded = repository.load(Board.BACKLOG).tasks();

        assertEquals(List.of("task-1", "task-2"), loaded.stream().map(Task::id).toList());
        Task second = loaded.get(1);
        assertEquals(List.of("backend"), second.tags());
        assertEquals(4, second.extensions().get("estimate_hours"));
        assertEquals(withExtras.history(), second.history());
        assertEquals(withExtras.createdAt(), second.createdAt());
    }

    @Test
    void boardFileIsPrettyPrintedJsonArray() throws IOException {
        repository.save(Board.WORKING, new BoardSnapshot(Board.WORKING, List.of(claimed("task-1", "agent-a"))));

        String content = Files.readString(dir.resolve("working.json"));

        assertTrue(content.startsWith("["));
        assertTrue(content.contains("\"task_id\" : \"task-1\""), content);
        assertTrue(content.contains("\"assigned_agent_id\" : \"agent-a\""), content);
        assertTrue(content.contains("\n"));
    }

    @Test
    void failedSaveKeepsPreviousContent() throws IOException {
        repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"))));
        byte[] before = Files.readAllBytes(dir.resolve("backlog.json"));

        Task unserializable = unclaimed("task-2").toBuilder()
                .outputs(Map.of("handle", new Object()))
                .build();
        assertThrows(BoardStoreException.class, () -> repository.save(Board.BACKLOG,
                new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"), unserializable))));

        assertArrayEquals(before, Files.readAllBytes(dir.resolve("backlog.json")));
        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
        assertFalse(Files.exists(dir.resolve("backlog.lock")));
    }

    @Test
    void taskOnWrongBoardIsNotWritten() {
        ValidationException e = assertThrows(ValidationException.class, () -> repository.save(Board.BACKLOG,
                new BoardSnapshot(Board.BACKLOG, List.of(claimed("task-1", "agent-a")))));

        assertEquals("task-1", e.taskId());
        assertFalse(Files.exists(dir.resolve("backlog.json")));
    }

    @Test
    void invalidJsonQuarantinesBoard() throws IOException {
        writeRaw(Board.BACKLOG, "[{\"task_id\": ");

        assertThrows(BoardCorruptedException.class, () -> repository.load(Board.BACKLOG));

        assertTrue(repository.isQuarantined(Board.BACKLOG));
        assertTrue(Files.exists(dir.resolve("backlog.quarantine")));
        assertTrue(repository.quarantineReason(Board.BACKLOG).orElseThrow().contains("not valid JSON"));
        // other boards stay usable
        repository.save(Board.WORKING, new BoardSnapshot(Board.WORKING, List.of(claimed("task-1", "agent-a"))));
        assertEquals(1, repository.load(Board.WORKING).size());
    }

    @Test
    void quarantinedBoardRefusesMutationUntilCleared() throws IOException {
        writeRaw(Board.BACKLOG, "");
        assertThrows(BoardCorruptedException.class, () -> repository.load(Board.BACKLOG));

        // content fixed externally, marker still present
        writeRaw(Board.BACKLOG, "[]");
        BoardCorruptedException e = assertThrows(BoardCorruptedException.class,
                () -> repository.withLock(Board.BACKLOG, backlog -> {
                    backlog.add(unclaimed("task-1"));
                    return null;
                }));
        assertEquals(Board.BACKLOG, e.board());

        repository.clearQuarantine(Board.BACKLOG);
        repository.withLock(Board.BACKLOG, backlog -> {
            backlog.add(unclaimed("task-1"));
            return null;
        });
        assertEquals(1, repository.load(Board.BACKLOG).size());
    }

    @Test
    void structuralProblemsAreCorruption() throws IOException {
        String oneTask = new String(new BoardCodec(new SchemaValidator()).encode(List.of(unclaimed("task-1"))),
                StandardCharsets.UTF_8);
        String body = oneTask.substring(oneTask.indexOf('{'), oneTask.lastIndexOf('}') + 1);

        for (String content : List.of(
                "{}",
                "[1, 2]",
                "[{\"task_id\": \"t\"}]",
                "[" + body + "," + body + "]",
                "[" + body + "] trailing")) {
            writeRaw(Board.BACKLOG, content);
            repository.clearQuarantine(Board.BACKLOG);
            assertThrows(BoardCorruptedException.class, () -> repository.load(Board.BACKLOG), content);
        }
    }

    @Test
    void taskInWrongStatusForBoardIsCorruption() throws IOException {
        byte[] working = new BoardCodec(new SchemaValidator()).encode(List.of(claimed("task-1", "agent-a")));
        Files.write(dir.resolve("archive.json"), working);

        BoardCorruptedException e = assertThrows(BoardCorruptedException.class,
                () -> repository.load(Board.ARCHIVE));
        assertTrue(e.getMessage().contains("belongs on board WORKING"), e.getMessage());
    }

    @Test
    void backupsAreRetained() throws IOException {
        for (int i = 1; i <= 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            Task[] tasks = new Task[i];
            for (int j = 0; j < i; j++) {
                tasks[j] = unclaimed("task-" + j);
            }
            repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(tasks)));
        }

        List<Path> backups = repository.backups(Board.BACKLOG);

        // first save had nothing to back up, retention keeps three
        assertEquals(3, backups.size());
        assertEquals(4, repository.loadArtifact(Board.BACKLOG, backups.get(0)).size());
        assertEquals(2, repository.loadArtifact(Board.BACKLOG, backups.get(2)).size());
    }

    @Test
    void failingWorkDiscardsChangesAndReleasesLocks() {
        repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"))));

        assertThrows(IllegalStateException.class, () -> repository.withLocks(
                EnumSet.of(Board.BACKLOG, Board.WORKING), locked -> {
                    locked.get(Board.BACKLOG).remove("task-1");
                    throw new IllegalStateException("boom");
                }));

        assertEquals(1, repository.load(Board.BACKLOG).size());
        assertFalse(Files.exists(dir.resolve("backlog.lock")));
        assertFalse(Files.exists(dir.resolve("working.lock")));
    }

    @Test
    void relocationWritesBothBoards() {
        repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"))));

        repository.withLocks(EnumSet.of(Board.BACKLOG, Board.WORKING), locked -> {
            locked.get(Board.BACKLOG).remove("task-1");
            locked.get(Board.WORKING).add(claimed("task-1", "agent-a"));
            return null;
        });

        assertEquals(0, repository.load(Board.BACKLOG).size());
        assertEquals(TaskStatus.CLAIMED, repository.load(Board.WORKING).find("task-1").orElseThrow().status());
    }

    @Test
    void unchangedBoardIsNotRewritten() {
        repository.save(Board.BACKLOG, new BoardSnapshot(Board.BACKLOG, List.of(unclaimed("task-1"))));
        long writes = metrics.writes();

        repository.withLock(Board.BACKLOG, backlog -> backlog.size());

        assertEquals(writes, metrics.writes());
    }
}
