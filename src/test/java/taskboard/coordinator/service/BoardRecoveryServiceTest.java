package taskboard.coordinator.service;

import taskboard.coordinator.MutableClock;
import taskboard.coordinator.config.BoardConfig;
import taskboard.coordinator.config.Dependencies;
import taskboard.coordinator.core.TransitionEvent;
import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.error.InvalidTransitionException;
import taskboard.coordinator.error.TaskNotFoundException;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskFilter;
import taskboard.coordinator.model.TaskStatus;
import taskboard.coordinator.repository.BoardRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BoardRecoveryServiceTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private Dependencies deps;
    private TaskLifecycleService lifecycle;
    private BoardRecoveryService recovery;
    private BoardRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        deps = Dependencies.create(BoardConfig.defaults()
                .withBoardDirectory(dir)
                .withHolderId("test")
                .withLockTimeout(Duration.ofSeconds(2)), clock);
        lifecycle = deps.lifecycle();
        recovery = deps.recovery();
        repository = deps.repository();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private void add(String id) {
        clock.advance(Duration.ofSeconds(1));
        lifecycle.addTask(Map.of("task_id", id, "description", "work item " + id));
    }

    private Path live(Board board) {
        return dir.resolve(board.fileName());
    }

    /**
     * Run the operation, then put the source board file back as it was,
     * as if the process died after writing the destination board.
     */
    private void crashBeforeSourceWrite(Board source, Runnable operation) throws IOException {
        byte[] before = Files.readAllBytes(live(source));
        operation.run();
        Files.write(live(source), before);
    }

    @Test
    @DisplayName("Crash between archive writes leaves one visible copy")
    void crashDuringArchiveNeverLosesTask() throws IOException {
        add("T1");
        lifecycle.claimTask("T1", "A");
        lifecycle.completeTask("T1", "A", "done", Map.of());

        crashBeforeSourceWrite(Board.WORKING, () -> lifecycle.archiveTask("T1", "reviewer"));

        // both files hold it on disk, readers see the archived copy once
        assertTrue(repository.load(Board.WORKING).contains("T1"));
        assertTrue(repository.load(Board.ARCHIVE).contains("T1"));
        assertEquals(TaskStatus.ARCHIVED, lifecycle.getTask("T1").orElseThrow().status());
        assertEquals(1, lifecycle.listTasks(TaskFilter.all()).size());

        ReconcileReport report = recovery.reconcile();

        assertEquals(1, report.repairs().size());
        ReconcileReport.Repair repair = report.repairs().get(0);
        assertEquals("T1", repair.taskId());
        assertEquals(Board.ARCHIVE, repair.keptOn());
        assertEquals(List.of(Board.WORKING), repair.removedOn());
        assertFalse(repository.load(Board.WORKING).contains("T1"));
        assertTrue(recovery.reconcile().isClean());
    }

    @Test
    void retriedArchiveHealsDuplicate() throws IOException {
        add("T1");
        lifecycle.claimTask("T1", "A");
        lifecycle.failTask("T1", "A", "broken");

        crashBeforeSourceWrite(Board.WORKING, () -> lifecycle.archiveTask("T1", "reviewer"));

        assertThrows(TaskNotFoundException.class, () -> lifecycle.archiveTask("T1", "reviewer"));
        assertFalse(repository.load(Board.WORKING).contains("T1"));
        assertEquals(TaskStatus.ARCHIVED, repository.load(Board.ARCHIVE).find("T1").orElseThrow().status());
    }

    @Test
    @DisplayName("Stale working copy of an archived task rejects transitions")
    void staleWorkingCopyRejectsTransitions() throws IOException {
        archiveWithCrash("T1");
        List<TransitionEvent> events = new ArrayList<>();
        deps.transitionBus().subscribe(events::add);

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> lifecycle.failTask("T1", "ops", "cancelled"));

        assertEquals(TaskStatus.ARCHIVED, e.from());
        assertEquals(TaskStatus.FAILED, e.to());
        assertTrue(events.isEmpty());
        assertFalse(repository.load(Board.WORKING).contains("T1"));
        Task archived = lifecycle.getTask("T1").orElseThrow();
        assertEquals(TaskStatus.ARCHIVED, archived.status());
        assertNull(archived.failureReason());
    }

    @Test
    void staleWorkingCopyRejectsUpdate() throws IOException {
        archiveWithCrash("T1");

        assertThrows(TaskNotFoundException.class,
                () -> lifecycle.updateTask("T1", "A", Map.of("name", "renamed")));

        assertFalse(repository.load(Board.WORKING).contains("T1"));
        assertNull(lifecycle.getTask("T1").orElseThrow().name());
    }

    @Test
    void staleWorkingCopyIsDroppedByStaleFail() throws IOException {
        archiveWithCrash("T1");

        assertTrue(lifecycle.failStaleTask("T1", clock.instant().plusSeconds(60), "stale").isEmpty());
        assertFalse(repository.load(Board.WORKING).contains("T1"));
        assertTrue(recovery.reconcile().isClean());
    }

    private void archiveWithCrash(String id) throws IOException {
        add(id);
        lifecycle.claimTask(id, "A");
        lifecycle.completeTask(id, "A", "done", Map.of());
        crashBeforeSourceWrite(Board.WORKING, () -> lifecycle.archiveTask(id, "reviewer"));
        assertTrue(repository.load(Board.WORKING).contains(id));
    }

    @Test
    void crashDuringClaimIsHealedByNextClaim() throws IOException {
        add("T1");

        crashBeforeSourceWrite(Board.BACKLOG, () -> lifecycle.claimTask("T1", "A"));
        assertTrue(repository.load(Board.BACKLOG).contains("T1"));
        assertTrue(lifecycle.listAvailable(TaskFilter.all()).isEmpty());

        assertThrows(taskboard.coordinator.error.AlreadyClaimedException.class,
                () -> lifecycle.claimTask("T1", "B"));
        assertFalse(repository.load(Board.BACKLOG).contains("T1"));
        assertEquals("A", lifecycle.getTask("T1").orElseThrow().assignedAgentId());
    }

    @Test
    void verifyReportsEachBoard() throws IOException {
        add("T1");
        Files.writeString(live(Board.ARCHIVE), "[ not json");

        Map<Board, BoardHealth> health = recovery.verify();

        assertTrue(health.get(Board.BACKLOG).isOk());
        assertEquals(1, health.get(Board.BACKLOG).taskCount());
        assertTrue(health.get(Board.WORKING).isOk());
        assertEquals(BoardHealth.Status.CORRUPTED, health.get(Board.ARCHIVE).status());
        assertNotNull(health.get(Board.ARCHIVE).reason());
        assertTrue(repository.isQuarantined(Board.ARCHIVE));
    }

    @Test
    void repairLiftsQuarantineOnlyForValidContent() throws IOException {
        Files.writeString(live(Board.BACKLOG), "{}");
        assertThrows(BoardCorruptedException.class, () -> repository.load(Board.BACKLOG));

        assertThrows(BoardCorruptedException.class, () -> recovery.repair(Board.BACKLOG));
        assertTrue(repository.isQuarantined(Board.BACKLOG));

        Files.writeString(live(Board.BACKLOG), "[]");
        BoardHealth health = recovery.repair(Board.BACKLOG);

        assertTrue(health.isOk());
        assertFalse(repository.isQuarantined(Board.BACKLOG));
        add("T1");
    }

    @Test
    void restoreUsesNewestValidBackup() throws IOException {
        add("T1");
        add("T2");
        add("T3");
        Files.writeString(live(Board.BACKLOG), "garbage");
        assertThrows(BoardCorruptedException.class, () -> lifecycle.claimTask("T1", "A"));
        assertTrue(repository.isQuarantined(Board.BACKLOG));

        Path restored = recovery.restoreFromBackup(Board.BACKLOG);

        assertTrue(restored.getFileName().toString().startsWith("backlog."));
        assertFalse(repository.isQuarantined(Board.BACKLOG));
        List<Task> tasks = repository.load(Board.BACKLOG).tasks();
        // the newest backup predates the third add
        assertEquals(List.of("T1", "T2"), tasks.stream().map(Task::id).toList());
        assertEquals(TaskStatus.CLAIMED, lifecycle.claimTask("T1", "A").status());
    }

    @Test
    void restoreWithoutBackupFails() {
        assertThrows(BoardCorruptedException.class, () -> recovery.restoreFromBackup(Board.WORKING));
    }

    @Test
    void reconcileReportsDanglingDependency() throws IOException {
        add("T1");
        lifecycle.addTask(Map.of("task_id", "T2", "description", "d", "dependencies", List.of("T1")));
        String backlog = Files.readString(live(Board.BACKLOG));
        // drop T1 behind the coordinator's back
        Files.writeString(live(Board.BACKLOG), backlog.replace("\"task_id\" : \"T1\"", "\"task_id\" : \"T0\""));

        ReconcileReport report = recovery.reconcile();

        assertTrue(report.repairs().isEmpty());
        assertEquals(1, report.integrityViolations().size());
        assertFalse(report.isClean());
    }
}
