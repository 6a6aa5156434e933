package taskboard.coordinator.store;

import taskboard.coordinator.core.BoardMetrics;
import taskboard.coordinator.error.BoardStoreException;
import taskboard.coordinator.model.Board;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps the newest copies of each board file under {@code backups/}.
 * A copy is taken before every overwrite of the live file.
 */
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private final Path backupDir;
    private final int retention;
    private final Clock clock;
    private final BoardMetrics metrics;

    /**
     * @param retention copies kept per board, 0 disables backups
     */
    public BackupManager(Path backupDir, int retention, Clock clock, BoardMetrics metrics) {
        this.backupDir = backupDir;
        this.retention = retention;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Copy the live board file, then drop copies beyond the retention.
     *
     * @return the backup, empty when disabled or the board was never written
     */
    public Optional<Path> backup(Board board, Path live) {
        if (retention <= 0 || !Files.exists(live)) {
            return Optional.empty();
        }
        try {
            Files.createDirectories(backupDir);
            String stamp = STAMP.format(clock.instant());
            for (int seq = 0; seq < 1000; seq++) {
                Path target = backupDir.resolve(String.format("%s.%s-%03d.bak", board.fileStem(), stamp, seq));
                try {
                    Files.copy(live, target, StandardCopyOption.COPY_ATTRIBUTES);
                    metrics.recordBackup();
                    log.debug("Backed up {} to {}", board, target.getFileName());
                    prune(board);
                    return Optional.of(target);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Backup name {} taken, trying next sequence number", target.getFileName());
                }
            }
            throw new BoardStoreException("No free backup name for " + board + " at " + stamp, null);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to back up board " + board, e);
        }
    }

    /** Backups of a board, newest first */
    public List<Path> list(Board board) {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        String prefix = board.fileStem() + ".";
        try (Stream<Path> files = Files.list(backupDir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(".bak");
                    })
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            throw new BoardStoreException("Failed to list backups of " + board, e);
        }
    }

    private void prune(Board board) throws IOException {
        List<Path> all = list(board);
        for (Path old : all.subList(Math.min(retention, all.size()), all.size())) {
            Files.deleteIfExists(old);
            log.debug("Pruned backup {}", old.getFileName());
        }
    }
}
