package taskboard.coordinator.store;

import taskboard.coordinator.error.BoardStoreException;
import taskboard.coordinator.model.Board;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persistent {@code <board>.quarantine} markers. A marked board refuses
 * mutations in every process until the repair step clears the marker.
 */
public class QuarantineMarkers {

    private final Path directory;

    public QuarantineMarkers(Path directory) {
        this.directory = directory;
    }

    public void mark(Board board, String reason) {
        try {
            Files.writeString(markerPath(board), reason, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to quarantine board " + board, e);
        }
    }

    public boolean isMarked(Board board) {
        return Files.exists(markerPath(board));
    }

    public Optional<String> reason(Board board) {
        try {
            return Optional.of(Files.readString(markerPath(board), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BoardStoreException("Failed to read quarantine marker of " + board, e);
        }
    }

    public void clear(Board board) {
        try {
            Files.deleteIfExists(markerPath(board));
        } catch (IOException e) {
            throw new BoardStoreException("Failed to clear quarantine of " + board, e);
        }
    }

    public Path markerPath(Board board) {
        return directory.resolve(board.fileStem() + ".quarantine");
    }
}
