package taskboard.coordinator.service;

import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.repository.BoardRepository;
import taskboard.coordinator.repository.BoardSnapshot;
import taskboard.coordinator.validation.SchemaValidator;
import taskboard.coordinator.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consistency checks and repairs across boards: duplicate resolution after
 * interrupted relocations, health checks, and the repair step that lifts
 * a quarantine.
 */
public class BoardRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(BoardRecoveryService.class);

    /**
     * Order of preference between two copies of one task: the copy that
     * went further (longer history) wins, then the most recently updated.
     */
    public static final Comparator<Task> PREFERRED_COPY = Comparator
            .comparingInt((Task t) -> t.history().size())
            .thenComparing(Task::updatedAt);

    private final BoardRepository repository;
    private final SchemaValidator validator;

    public BoardRecoveryService(BoardRepository repository, SchemaValidator validator) {
        this.repository = repository;
        this.validator = validator;
    }

    /**
     * Remove task copies left on more than one board, keeping the preferred
     * copy, and report referential problems. Runs under every board lock.
     *
     * @throws BoardCorruptedException if a board is quarantined
     */
    public ReconcileReport reconcile() {
        return repository.withLocks(EnumSet.allOf(Board.class), locked -> {
            Map<String, Map<Board, Task>> copies = new LinkedHashMap<>();
            List<Task> all = new ArrayList<>();
            for (Board board : Board.values()) {
                for (Task task : locked.get(board).tasks()) {
                    copies.computeIfAbsent(task.id(), id -> new EnumMap<>(Board.class)).put(board, task);
                }
            }

            List<ReconcileReport.Repair> repairs = new ArrayList<>();
            for (Map.Entry<String, Map<Board, Task>> entry : copies.entrySet()) {
                Map<Board, Task> found = entry.getValue();
                Board keep = found.entrySet().stream()
                        .max(Map.Entry.comparingByValue(PREFERRED_COPY))
                        .map(Map.Entry::getKey)
                        .orElseThrow();
                all.add(found.get(keep));
                if (found.size() == 1) {
                    continue;
                }
                List<Board> dropped = new ArrayList<>();
                for (Board board : found.keySet()) {
                    if (board != keep) {
                        locked.get(board).remove(entry.getKey());
                        dropped.add(board);
                    }
                }
                log.warn("Task {} found on {} boards, kept the {} copy, removed from {}",
                        entry.getKey(), found.size(), keep, dropped);
                repairs.add(new ReconcileReport.Repair(entry.getKey(), keep, dropped));
            }

            List<Violation> integrity = validator.checkIntegrity(all);
            for (Violation violation : integrity) {
                log.warn("Board integrity problem: {}", violation.message());
            }
            return new ReconcileReport(repairs, integrity);
        });
    }

    /**
     * Load and validate every board. A board that fails to load is
     * quarantined by the store as a side effect.
     */
    public Map<Board, BoardHealth> verify() {
        Map<Board, BoardHealth> health = new EnumMap<>(Board.class);
        for (Board board : Board.values()) {
            health.put(board, check(board));
        }
        return health;
    }

    /**
     * Re-validate the live artifact of a board and lift its quarantine.
     *
     * @throws BoardCorruptedException if the artifact is still invalid
     */
    public BoardHealth repair(Board board) {
        BoardSnapshot snapshot = repository.loadArtifact(board, repository.artifactPath(board));
        if (repository.isQuarantined(board)) {
            repository.clearQuarantine(board);
        }
        log.info("Board {} repaired, {} task(s) valid", board, snapshot.size());
        return BoardHealth.ok(board, snapshot.size());
    }

    /**
     * Replace the live board with its newest backup that still parses and
     * validates, then lift the quarantine.
     *
     * @return the backup that was restored
     * @throws BoardCorruptedException if no usable backup exists
     */
    public Path restoreFromBackup(Board board) {
        for (Path backup : repository.backups(board)) {
            BoardSnapshot snapshot;
            try {
                snapshot = repository.loadArtifact(board, backup);
            } catch (BoardCorruptedException e) {
                log.warn("Skipping unusable backup {}: {}", backup.getFileName(), e.getMessage());
                continue;
            }
            repository.overwrite(board, snapshot);
            if (repository.isQuarantined(board)) {
                repository.clearQuarantine(board);
            }
            log.info("Board {} restored from {} ({} task(s))", board, backup.getFileName(), snapshot.size());
            return backup;
        }
        throw new BoardCorruptedException(board, "No valid backup of board " + board + " to restore");
    }

    private BoardHealth check(Board board) {
        try {
            BoardSnapshot snapshot = repository.load(board);
            if (repository.isQuarantined(board)) {
                return BoardHealth.corrupted(board, repository.quarantineReason(board).orElse("quarantined"));
            }
            return BoardHealth.ok(board, snapshot.size());
        } catch (BoardCorruptedException e) {
            return BoardHealth.corrupted(board, e.getMessage());
        }
    }
}
