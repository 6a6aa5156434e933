package taskboard.coordinator.error;

import taskboard.coordinator.model.Board;

/**
 * Thrown when a board artifact cannot be parsed or breaks the schema,
 * and for every mutation attempted on a quarantined board.
 */
public class BoardCorruptedException extends TaskBoardException {

    private final Board board;

    public BoardCorruptedException(Board board, String message) {
        super(null, message);
        this.board = board;
    }

    public BoardCorruptedException(Board board, String message, Throwable cause) {
        super(null, message, cause);
        this.board = board;
    }

    public Board board() {
        return board;
    }
}
