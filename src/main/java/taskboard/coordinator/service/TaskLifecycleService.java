package taskboard.coordinator.service;

import taskboard.coordinator.core.TransitionEvent;
import taskboard.coordinator.core.TransitionListener;
import taskboard.coordinator.error.AlreadyClaimedException;
import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.error.DependencyUnresolvedException;
import taskboard.coordinator.error.InvalidTransitionException;
import taskboard.coordinator.error.TaskNotFoundException;
import taskboard.coordinator.error.TaskPermissionException;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.HistoryEntry;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskFilter;
import taskboard.coordinator.model.TaskRecords;
import taskboard.coordinator.model.TaskStatus;
import taskboard.coordinator.repository.BoardRepository;
import taskboard.coordinator.repository.BoardSnapshot;
import taskboard.coordinator.validation.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Service layer for the task lifecycle.
 * Every mutation runs inside one locked section spanning the boards it
 * touches; listeners are notified only after the change is on disk.
 */
public class TaskLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleService.class);

    public static final String SYSTEM_ACTOR = "system";
    public static final String REAPER_ACTOR = "reaper";

    /** Priority first, then oldest first */
    private static final Comparator<Task> AVAILABILITY_ORDER = Comparator
            .comparingInt((Task t) -> t.priority().rank())
            .thenComparing(Task::createdAt)
            .thenComparing(Task::id);

    private final BoardRepository repository;
    private final SchemaValidator validator;
    private final TransitionListener listener;
    private final Clock clock;

    public TaskLifecycleService(BoardRepository repository, SchemaValidator validator,
            TransitionListener listener, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.listener = listener;
        this.clock = clock;
    }

    // ---------------------------------------------------------------
    // Creation
    // ---------------------------------------------------------------

    public String addTask(Map<String, ?> record) {
        return addTask(record, SYSTEM_ACTOR);
    }

    /**
     * Validate a task record and insert it into the backlog as UNCLAIMED.
     *
     * @return the new task id
     * @throws taskboard.coordinator.error.ValidationException           on schema violations
     * @throws taskboard.coordinator.error.DuplicateTaskException        if the id exists on any board
     * @throws DependencyUnresolvedException if a dependency is unknown or forms a cycle
     */
    public String addTask(Map<String, ?> record, String actor) {
        if (record == null) {
            throw new IllegalArgumentException("record is required");
        }
        requireText(actor, "actor");

        Task created = repository.withLock(Board.BACKLOG, backlog -> {
            // ids reach WORKING and ARCHIVE only through relocations that hold the backlog
            // lock or write their destination first, so lock-free reads are enough here
            List<Task> existing = new ArrayList<>(backlog.tasks());
            existing.addAll(repository.load(Board.WORKING).tasks());
            existing.addAll(repository.load(Board.ARCHIVE).tasks());

            Task task = validator.validateNew(record, existing, actor, clock.instant()).orThrow();
            backlog.add(task);
            return task;
        });

        log.info("Task {} added to backlog with priority {}", created.id(), created.priority());
        publish(created, 1);
        return created.id();
    }

    /** Generate a fresh task id */
    public String generateTaskId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ---------------------------------------------------------------
    // Claiming
    // ---------------------------------------------------------------

    /**
     * UNCLAIMED backlog tasks whose dependencies are all completed, most
     * urgent first. Lock-free.
     */
    public List<Task> listAvailable(TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.all();
        List<Task> working = repository.load(Board.WORKING).tasks();
        Set<String> relocated = new HashSet<>();
        working.forEach(t -> relocated.add(t.id()));
        CompletedIndex completed = new CompletedIndex(working);

        Stream<Task> available = repository.load(Board.BACKLOG).tasks().stream()
                .filter(t -> t.status() == TaskStatus.UNCLAIMED)
                .filter(t -> !relocated.contains(t.id()))
                .filter(effective::matches)
                .filter(t -> completed.pending(t).isEmpty())
                .sorted(AVAILABILITY_ORDER);
        if (effective.limit() > 0) {
            available = available.limit(effective.limit());
        }
        return available.toList();
    }

    /**
     * Claim a backlog task for an agent and move it to the working board.
     * Of several concurrent claims on one task exactly one wins.
     *
     * @throws TaskNotFoundException         if no board holds the task
     * @throws AlreadyClaimedException       if another agent got there first
     * @throws DependencyUnresolvedException if a dependency is not completed yet
     */
    public Task claimTask(String taskId, String agentId) {
        requireText(taskId, "taskId");
        requireText(agentId, "agentId");

        ClaimOutcome outcome = repository.withLocks(EnumSet.of(Board.BACKLOG, Board.WORKING), locked -> {
            BoardSnapshot backlog = locked.get(Board.BACKLOG);
            BoardSnapshot working = locked.get(Board.WORKING);

            Optional<Task> claimed = working.find(taskId);
            if (claimed.isPresent()) {
                if (backlog.remove(taskId).isPresent()) {
                    log.warn("Task {} was on BACKLOG and WORKING, dropped the stale backlog copy", taskId);
                }
                return ClaimOutcome.conflict(claimed.get());
            }

            Optional<Task> candidate = backlog.find(taskId);
            if (candidate.isEmpty()) {
                Optional<Task> archived = repository.load(Board.ARCHIVE).find(taskId);
                if (archived.isPresent()) {
                    return ClaimOutcome.conflict(archived.get());
                }
                throw new TaskNotFoundException(taskId, "Task " + taskId + " not found on any board");
            }

            Task task = candidate.get();
            List<String> pending = new CompletedIndex(working.tasks()).pending(task);
            if (!pending.isEmpty()) {
                throw new DependencyUnresolvedException(taskId, pending,
                        "Task " + taskId + " waits on unfinished dependencies " + pending);
            }

            Task next = advance(task, TaskStatus.CLAIMED, agentId, "claimed by " + agentId,
                    b -> b.assignedAgentId(agentId));
            working.add(next);
            backlog.remove(taskId);
            return ClaimOutcome.success(next);
        });

        Task task = outcome.task();
        if (!outcome.won()) {
            String holder = task.assignedAgentId() != null ? task.assignedAgentId() : lastActor(task);
            log.debug("Claim of task {} by {} lost to {}", taskId, agentId, holder);
            throw new AlreadyClaimedException(taskId, holder,
                    "Task " + taskId + " is already claimed by " + holder + " (status " + task.status() + ")");
        }
        log.info("Task {} claimed by {}", taskId, agentId);
        publish(task, 1);
        return task;
    }

    // ---------------------------------------------------------------
    // Working board transitions
    // ---------------------------------------------------------------

    public Task startTask(String taskId, String agentId) {
        requireText(agentId, "agentId");
        return transition(taskId, agentId, true, EnumSet.of(TaskStatus.CLAIMED), TaskStatus.WORKING,
                "started", UnaryOperator.identity());
    }

    public Task blockTask(String taskId, String agentId, String reason) {
        requireText(agentId, "agentId");
        requireText(reason, "reason");
        return transition(taskId, agentId, true, EnumSet.of(TaskStatus.WORKING), TaskStatus.BLOCKED,
                reason, UnaryOperator.identity());
    }

    public Task unblockTask(String taskId, String agentId, String note) {
        requireText(agentId, "agentId");
        return transition(taskId, agentId, true, EnumSet.of(TaskStatus.BLOCKED), TaskStatus.WORKING,
                note != null ? note : "unblocked", UnaryOperator.identity());
    }

    /**
     * Report completion. Only the assigned agent may complete a task.
     *
     * @param outputs structured results, may be null
     */
    public Task completeTask(String taskId, String agentId, String summary, Map<String, Object> outputs) {
        requireText(agentId, "agentId");
        requireText(summary, "summary");
        Map<String, Object> results = outputs != null ? outputs : Map.of();
        return transition(taskId, agentId, true, EnumSet.of(TaskStatus.CLAIMED, TaskStatus.WORKING),
                TaskStatus.COMPLETED_PENDING_REVIEW, "completed",
                b -> b.summary(summary).outputs(results));
    }

    public Task approveTask(String taskId, String reviewer, String note) {
        requireText(reviewer, "reviewer");
        return transition(taskId, reviewer, false, EnumSet.of(TaskStatus.COMPLETED_PENDING_REVIEW),
                TaskStatus.COMPLETED,
                note != null ? note : "approved", UnaryOperator.identity());
    }

    public Task failTask(String taskId, String actor, String reason) {
        requireText(actor, "actor");
        requireText(reason, "reason");
        return transition(taskId, actor, false, EnumSet.allOf(TaskStatus.class), TaskStatus.FAILED, reason,
                b -> b.failureReason(reason));
    }

    /**
     * Fail a task that made no progress since {@code cutoff}. Staleness is
     * re-checked under the lock, so a task touched in between is left alone.
     *
     * @return the failed task, or empty if it is gone or no longer stale
     */
    public Optional<Task> failStaleTask(String taskId, Instant cutoff, String reason) {
        requireText(taskId, "taskId");
        Optional<Task> failed = repository.withLock(Board.WORKING, working -> {
            Optional<Task> found = working.find(taskId);
            if (found.isEmpty() || dropIfArchived(working, taskId)) {
                return Optional.<Task>empty();
            }
            Task task = found.get();
            boolean active = task.status() == TaskStatus.CLAIMED || task.status() == TaskStatus.WORKING;
            if (!active || !task.updatedAt().isBefore(cutoff)) {
                return Optional.<Task>empty();
            }
            Task next = advance(task, TaskStatus.FAILED, REAPER_ACTOR, reason, b -> b.failureReason(reason));
            working.replace(next);
            return Optional.of(next);
        });
        failed.ifPresent(task -> {
            log.warn("Task {} failed as stale: {}", taskId, reason);
            publish(task, 1);
        });
        return failed;
    }

    /**
     * Apply a metadata patch to a task on the working board. The status is
     * unchanged and no transition is published.
     *
     * @throws TaskNotFoundException   if the task is not on the working board
     * @throws TaskPermissionException if the agent does not own the task
     */
    public Task updateTask(String taskId, String agentId, Map<String, ?> patch) {
        requireText(taskId, "taskId");
        requireText(agentId, "agentId");
        if (patch == null) {
            throw new IllegalArgumentException("patch is required");
        }

        // new dependency edges must be checked against a backlog nobody is appending to
        Set<Board> boards = patch.containsKey(TaskRecords.DEPENDENCIES)
                ? EnumSet.of(Board.BACKLOG, Board.WORKING)
                : EnumSet.of(Board.WORKING);

        Optional<Task> changed = repository.withLocks(boards, locked -> {
            BoardSnapshot working = locked.get(Board.WORKING);
            Task task = working.find(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId,
                            "Task " + taskId + " is not on the working board"));
            if (dropIfArchived(working, taskId)) {
                return Optional.<Task>empty();
            }
            requireOwner(task, agentId);

            List<Task> existing = new ArrayList<>(working.tasks());
            existing.addAll(locked.boards().contains(Board.BACKLOG)
                    ? locked.get(Board.BACKLOG).tasks()
                    : repository.load(Board.BACKLOG).tasks());
            existing.addAll(repository.load(Board.ARCHIVE).tasks());

            Task patched = validator.validatePatch(task, patch, existing).orThrow();
            Instant now = monotonicNow(task);
            Task next = patched.toBuilder()
                    .updatedAt(now)
                    .appendHistory(new HistoryEntry(now, task.status(), task.status(), agentId,
                            "updated " + new TreeSet<>(patch.keySet())))
                    .build();
            working.replace(next);
            return Optional.of(next);
        });

        Task updated = changed.orElseThrow(() -> new TaskNotFoundException(taskId,
                "Task " + taskId + " is already archived"));
        log.info("Task {} updated by {}: {}", taskId, agentId, patch.keySet());
        return updated;
    }

    /**
     * Move a finished task to the archive. A task still pending review is
     * approved implicitly on the way.
     *
     * @throws TaskNotFoundException      if the task is not on the working board, archived ones included
     * @throws InvalidTransitionException if the task is not finished
     */
    public Task archiveTask(String taskId, String actor) {
        requireText(taskId, "taskId");
        requireText(actor, "actor");

        Relocation relocation = repository.withLocks(EnumSet.of(Board.WORKING, Board.ARCHIVE), locked -> {
            BoardSnapshot working = locked.get(Board.WORKING);
            BoardSnapshot archive = locked.get(Board.ARCHIVE);

            Optional<Task> found = working.find(taskId);
            if (archive.contains(taskId)) {
                if (found.isPresent()) {
                    working.remove(taskId);
                    log.warn("Task {} was on WORKING and ARCHIVE, dropped the stale working copy", taskId);
                }
                return Relocation.ALREADY_ARCHIVED;
            }
            if (found.isEmpty()) {
                if (repository.load(Board.BACKLOG).contains(taskId)) {
                    throw new InvalidTransitionException(taskId, TaskStatus.UNCLAIMED, TaskStatus.ARCHIVED);
                }
                throw new TaskNotFoundException(taskId, "Task " + taskId + " not found on any board");
            }

            Task task = found.get();
            int transitions = 1;
            if (task.status() == TaskStatus.COMPLETED_PENDING_REVIEW) {
                task = advance(task, TaskStatus.COMPLETED, actor, "approved on archive", UnaryOperator.identity());
                transitions++;
            }
            Task next = advance(task, TaskStatus.ARCHIVED, actor, "archived", b -> b.assignedAgentId(null));
            archive.add(next);
            working.remove(taskId);
            return new Relocation(next, transitions);
        });

        if (relocation == Relocation.ALREADY_ARCHIVED) {
            throw new TaskNotFoundException(taskId, "Task " + taskId + " is already archived");
        }
        log.info("Task {} archived by {}", taskId, actor);
        publish(relocation.task(), relocation.transitions());
        return relocation.task();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Find a task on any board. If an interrupted relocation left two
     * copies, the one with the longer history wins.
     */
    public Optional<Task> getTask(String taskId) {
        requireText(taskId, "taskId");
        return Stream.of(Board.values())
                .map(board -> repository.load(board).find(taskId))
                .flatMap(Optional::stream)
                .max(BoardRecoveryService.PREFERRED_COPY);
    }

    /** Same as {@link #getTask(String)}, as a plain record */
    public Optional<Map<String, Object>> getTaskRecord(String taskId) {
        return getTask(taskId).map(TaskRecords::toRecord);
    }

    public List<Task> listTasks(TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.all();
        Stream<Task> tasks = allTasks().stream()
                .filter(effective::matches)
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id));
        if (effective.limit() > 0) {
            tasks = tasks.limit(effective.limit());
        }
        return tasks.toList();
    }

    /**
     * Case-insensitive substring search over id, name, description and tags.
     */
    public List<Task> searchTasks(String query) {
        requireText(query, "query");
        String needle = query.toLowerCase(Locale.ROOT);
        return allTasks().stream()
                .filter(t -> matchesQuery(t, needle))
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
                .toList();
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    /**
     * Apply one state change to a task on the working board.
     *
     * @param from statuses this operation starts from, checked before the state machine
     */
    private Task transition(String taskId, String actor, boolean ownerOnly, Set<TaskStatus> from,
            TaskStatus target, String note, UnaryOperator<Task.Builder> changes) {
        requireText(taskId, "taskId");
        Optional<Task> changed = repository.withLock(Board.WORKING, working -> {
            Task task = working.find(taskId).orElseThrow(() -> missingFromWorking(taskId, target));
            if (dropIfArchived(working, taskId)) {
                return Optional.<Task>empty();
            }
            if (!from.contains(task.status())) {
                throw new InvalidTransitionException(taskId, task.status(), target);
            }
            if (ownerOnly) {
                requireOwner(task, actor);
            }
            Task next = advance(task, target, actor, note, changes);
            working.replace(next);
            return Optional.of(next);
        });
        // thrown after the lock section so the stale copy removal is written
        Task updated = changed.orElseThrow(() -> new InvalidTransitionException(taskId, TaskStatus.ARCHIVED, target));
        log.info("Task {} {} -> {} by {}", taskId, updated.lastHistoryEntry().oldStatus(), target, actor);
        publish(updated, 1);
        return updated;
    }

    /**
     * Remove the working copy of a task that an interrupted archive already
     * wrote to the archive board. The archive is written first, so a lock-free
     * read sees every completed archive.
     *
     * @return true if the working copy was stale and has been dropped
     */
    private boolean dropIfArchived(BoardSnapshot working, String taskId) {
        boolean archived;
        try {
            archived = repository.load(Board.ARCHIVE).contains(taskId);
        } catch (BoardCorruptedException e) {
            log.warn("Archive unreadable, cannot rule out a stale copy of task {}: {}", taskId, e.getMessage());
            return false;
        }
        if (!archived) {
            return false;
        }
        working.remove(taskId);
        log.warn("Task {} was on WORKING and ARCHIVE, dropped the stale working copy", taskId);
        return true;
    }

    /** Error for a task that the working board does not hold */
    private RuntimeException missingFromWorking(String taskId, TaskStatus target) {
        if (repository.load(Board.BACKLOG).contains(taskId)) {
            return new InvalidTransitionException(taskId, TaskStatus.UNCLAIMED, target);
        }
        if (repository.load(Board.ARCHIVE).contains(taskId)) {
            return new InvalidTransitionException(taskId, TaskStatus.ARCHIVED, target);
        }
        return new TaskNotFoundException(taskId, "Task " + taskId + " not found on any board");
    }

    private Task advance(Task task, TaskStatus target, String actor, String note, UnaryOperator<Task.Builder> changes) {
        TransitionRules.check(task.id(), task.status(), target);
        Instant now = monotonicNow(task);
        Task.Builder builder = task.toBuilder()
                .status(target)
                .updatedAt(now)
                .appendHistory(new HistoryEntry(now, task.status(), target, actor, note));
        return changes.apply(builder).build();
    }

    /** Current time, never earlier than the task's last change */
    private Instant monotonicNow(Task task) {
        Instant now = clock.instant();
        return now.isBefore(task.updatedAt()) ? task.updatedAt() : now;
    }

    private void publish(Task task, int entries) {
        List<HistoryEntry> history = task.history();
        for (HistoryEntry entry : history.subList(history.size() - entries, history.size())) {
            Board board = entry.newStatus().board();
            listener.onTransition(new TransitionEvent(task.id(), entry.oldStatus(), entry.newStatus(),
                    entry.timestamp(), entry.actor(), board));
        }
    }

    private List<Task> allTasks() {
        Map<String, Task> byId = new LinkedHashMap<>();
        for (Board board : Board.values()) {
            for (Task task : repository.load(board).tasks()) {
                byId.merge(task.id(), task, (a, b) -> BoardRecoveryService.PREFERRED_COPY.compare(a, b) >= 0 ? a : b);
            }
        }
        return new ArrayList<>(byId.values());
    }

    private static boolean matchesQuery(Task task, String needle) {
        return contains(task.id(), needle)
                || contains(task.name(), needle)
                || contains(task.description(), needle)
                || task.tags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static void requireOwner(Task task, String agentId) {
        if (!task.isAssignedTo(agentId)) {
            throw new TaskPermissionException(task.id(),
                    "Task " + task.id() + " is assigned to " + task.assignedAgentId() + ", not " + agentId);
        }
    }

    private static String lastActor(Task task) {
        HistoryEntry last = task.lastHistoryEntry();
        return last != null ? last.actor() : null;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    /**
     * Completed task ids, read from the working board passed in and, only
     * when needed, from the archive.
     */
    private final class CompletedIndex {
        private final Set<String> completed = new HashSet<>();
        private boolean archiveLoaded;

        CompletedIndex(Collection<Task> working) {
            for (Task task : working) {
                if (task.wasCompleted()) {
                    completed.add(task.id());
                }
            }
        }

        List<String> pending(Task task) {
            List<String> missing = unresolved(task);
            if (!missing.isEmpty() && !archiveLoaded) {
                for (Task archived : repository.load(Board.ARCHIVE).tasks()) {
                    if (archived.wasCompleted()) {
                        completed.add(archived.id());
                    }
                }
                archiveLoaded = true;
                missing = unresolved(task);
            }
            return missing;
        }

        private List<String> unresolved(Task task) {
            return task.dependencies().stream().filter(d -> !completed.contains(d)).toList();
        }
    }

    private record ClaimOutcome(Task task, boolean won) {
        static ClaimOutcome success(Task task) {
            return new ClaimOutcome(task, true);
        }

        static ClaimOutcome conflict(Task task) {
            return new ClaimOutcome(task, false);
        }
    }

    private record Relocation(Task task, int transitions) {
        static final Relocation ALREADY_ARCHIVED = new Relocation(null, 0);
    }
}
