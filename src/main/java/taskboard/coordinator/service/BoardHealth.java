package taskboard.coordinator.service;

import taskboard.coordinator.model.Board;

/**
 * Result of verifying one board.
 *
 * @param board     the board
 * @param status    OK or CORRUPTED
 * @param taskCount tasks read, 0 when corrupted
 * @param reason    why the board is corrupted, null when OK
 */
public record BoardHealth(Board board, Status status, int taskCount, String reason) {

    public enum Status {
        OK,
        CORRUPTED
    }

    public static BoardHealth ok(Board board, int taskCount) {
        return new BoardHealth(board, Status.OK, taskCount, null);
    }

    public static BoardHealth corrupted(Board board, String reason) {
        return new BoardHealth(board, Status.CORRUPTED, 0, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
