package taskboard.coordinator.repository;

import taskboard.coordinator.model.Board;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Repository interface for board persistence.
 * Implementations must never expose a partially written board and must
 * not cache boards across calls.
 */
public interface BoardRepository {

    /**
     * Read a board without locking.
     *
     * @param board the board
     * @return current content, empty if the board was never written
     * @throws taskboard.coordinator.error.BoardCorruptedException if the artifact is unreadable
     */
    BoardSnapshot load(Board board);

    /**
     * Replace a board's content under its lock.
     *
     * @param board    the board
     * @param snapshot content to persist
     */
    void save(Board board, BoardSnapshot snapshot);

    /**
     * Run {@code work} once with exclusive access to one board and persist
     * the snapshot if it changed.
     *
     * @param board the board to lock
     * @param work  critical section; throwing discards every change
     * @return the value returned by {@code work}
     */
    <T> T withLock(Board board, Function<BoardSnapshot, T> work);

    /**
     * Run {@code work} with exclusive access to several boards. Locks are
     * taken in board declaration order. Changed boards that received tasks
     * are written before boards that only lost tasks, so an interruption
     * leaves a duplicate rather than a lost task.
     *
     * @param boards boards to lock
     * @param work   critical section; throwing discards every change
     * @return the value returned by {@code work}
     */
    <T> T withLocks(Set<Board> boards, Function<LockedBoards, T> work);

    /**
     * Read an arbitrary artifact (live file or backup) as a board.
     *
     * @throws taskboard.coordinator.error.BoardCorruptedException if the artifact is unreadable
     */
    BoardSnapshot loadArtifact(Board board, Path artifact);

    /** Location of the live board file */
    Path artifactPath(Board board);

    /** Backups of a board, newest first */
    List<Path> backups(Board board);

    /**
     * Replace a board under its lock even while it is quarantined.
     * Used by the repair step only.
     */
    void overwrite(Board board, BoardSnapshot snapshot);

    boolean isQuarantined(Board board);

    /** Reason recorded when the board was quarantined */
    Optional<String> quarantineReason(Board board);

    /** Lift the quarantine of a board once it was re-validated */
    void clearQuarantine(Board board);
}
