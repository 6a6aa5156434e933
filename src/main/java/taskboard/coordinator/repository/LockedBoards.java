package taskboard.coordinator.repository;

import taskboard.coordinator.model.Board;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Snapshots of the boards held under lock by one critical section.
 */
public final class LockedBoards {

    private final Map<Board, BoardSnapshot> snapshots;

    public LockedBoards(Map<Board, BoardSnapshot> snapshots) {
        this.snapshots = Collections.unmodifiableMap(new EnumMap<>(snapshots));
    }

    /**
     * @throws IllegalStateException if the board is not locked by this section
     */
    public BoardSnapshot get(Board board) {
        BoardSnapshot snapshot = snapshots.get(board);
        if (snapshot == null) {
            throw new IllegalStateException("Board " + board + " is not locked in this section");
        }
        return snapshot;
    }

    public Set<Board> boards() {
        return snapshots.keySet();
    }

    public Map<Board, BoardSnapshot> asMap() {
        return snapshots;
    }
}
