package taskboard.coordinator.model;

/**
 * Lifecycle partition backed by one JSON file.
 * Declaration order is also the lock acquisition order.
 */
public enum Board {
    BACKLOG("backlog"),
    WORKING("working"),
    ARCHIVE("archive");

    private final String fileStem;

    Board(String fileStem) {
        this.fileStem = fileStem;
    }

    /** Name used for the board file, its lock sentinel and its backups */
    public String fileStem() {
        return fileStem;
    }

    public String fileName() {
        return fileStem + ".json";
    }

    public static Board forStatus(TaskStatus status) {
        return status.board();
    }
}
