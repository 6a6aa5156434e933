package taskboard.coordinator.store;

import taskboard.coordinator.core.BoardMetrics;
import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.error.BoardStoreException;
import taskboard.coordinator.error.ValidationException;
import taskboard.coordinator.lock.BoardLockManager;
import taskboard.coordinator.lock.LockToken;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.repository.BoardRepository;
import taskboard.coordinator.repository.BoardSnapshot;
import taskboard.coordinator.repository.LockedBoards;
import taskboard.coordinator.validation.SchemaValidator;
import taskboard.coordinator.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * File-backed implementation of BoardRepository.
 * One JSON file per board in a shared directory, guarded by one lock
 * sentinel per board. Writes go to a temp file in the same directory which
 * then atomically replaces the live file.
 */
public class FileBoardRepository implements BoardRepository {

    private static final Logger log = LoggerFactory.getLogger(FileBoardRepository.class);

    private final Path directory;
    private final BoardLockManager lockManager;
    private final BoardCodec codec;
    private final SchemaValidator validator;
    private final BackupManager backups;
    private final QuarantineMarkers quarantine;
    private final Duration lockTimeout;
    private final BoardMetrics metrics;

    public FileBoardRepository(Path directory, BoardLockManager lockManager, SchemaValidator validator,
            BackupManager backups, Duration lockTimeout, BoardMetrics metrics) {
        this.directory = directory;
        this.lockManager = lockManager;
        this.codec = new BoardCodec(validator);
        this.validator = validator;
        this.backups = backups;
        this.quarantine = new QuarantineMarkers(directory);
        this.lockTimeout = lockTimeout;
        this.metrics = metrics;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to create board directory " + directory, e);
        }
    }

    @Override
    public BoardSnapshot load(Board board) {
        try {
            return read(board, artifactPath(board));
        } catch (BoardCorruptedException e) {
            quarantine(board, e);
            throw e;
        }
    }

    @Override
    public BoardSnapshot loadArtifact(Board board, Path artifact) {
        return read(board, artifact);
    }

    @Override
    public void save(Board board, BoardSnapshot snapshot) {
        LockToken token = lockManager.acquire(board.fileStem(), lockTimeout);
        try {
            ensureNotQuarantined(board);
            write(board, snapshot.tasks());
        } finally {
            lockManager.release(token);
        }
    }

    @Override
    public void overwrite(Board board, BoardSnapshot snapshot) {
        LockToken token = lockManager.acquire(board.fileStem(), lockTimeout);
        try {
            write(board, snapshot.tasks());
        } finally {
            lockManager.release(token);
        }
    }

    @Override
    public <T> T withLock(Board board, Function<BoardSnapshot, T> work) {
        return withLocks(EnumSet.of(board), locked -> work.apply(locked.get(board)));
    }

    @Override
    public <T> T withLocks(Set<Board> boards, Function<LockedBoards, T> work) {
        if (boards.isEmpty()) {
            throw new IllegalArgumentException("at least one board is required");
        }
        Deque<LockToken> held = new ArrayDeque<>();
        try {
            // EnumSet iterates in declaration order, the global lock order
            for (Board board : EnumSet.copyOf(boards)) {
                held.push(lockManager.acquire(board.fileStem(), lockTimeout));
            }

            Map<Board, BoardSnapshot> snapshots = new EnumMap<>(Board.class);
            for (Board board : EnumSet.copyOf(boards)) {
                BoardSnapshot snapshot = load(board);
                ensureNotQuarantined(board);
                snapshots.put(board, snapshot);
            }

            T result = work.apply(new LockedBoards(snapshots));

            List<BoardSnapshot> receiving = new ArrayList<>();
            List<BoardSnapshot> others = new ArrayList<>();
            for (BoardSnapshot snapshot : snapshots.values()) {
                if (!snapshot.isDirty())
                    continue;
                (snapshot.hasAdditions() ? receiving : others).add(snapshot);
            }
            for (BoardSnapshot snapshot : receiving) {
                write(snapshot.board(), snapshot.tasks());
            }
            for (BoardSnapshot snapshot : others) {
                write(snapshot.board(), snapshot.tasks());
            }
            return result;
        } finally {
            while (!held.isEmpty()) {
                lockManager.release(held.pop());
            }
        }
    }

    @Override
    public Path artifactPath(Board board) {
        return directory.resolve(board.fileName());
    }

    @Override
    public List<Path> backups(Board board) {
        return backups.list(board);
    }

    @Override
    public boolean isQuarantined(Board board) {
        return quarantine.isMarked(board);
    }

    @Override
    public Optional<String> quarantineReason(Board board) {
        return quarantine.reason(board);
    }

    @Override
    public void clearQuarantine(Board board) {
        quarantine.clear(board);
        log.info("Quarantine of board {} lifted", board);
    }

    public Path directory() {
        return directory;
    }

    private BoardSnapshot read(Board board, Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return BoardSnapshot.empty(board);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to read board " + board + " from " + file, e);
        }
        List<Task> tasks = codec.decode(board, content, file.getFileName().toString());
        metrics.recordRead();
        log.debug("Loaded {} task(s) from board {}", tasks.size(), board);
        return new BoardSnapshot(board, tasks);
    }

    private void write(Board board, List<Task> tasks) {
        for (Task task : tasks) {
            List<Violation> violations = validator.checkInvariants(task);
            if (task.board() != board) {
                violations = new ArrayList<>(violations);
                violations.add(new Violation(Violation.Kind.INVARIANT, "status",
                        task.status() + " belongs on board " + task.board() + ", not " + board));
            }
            if (!violations.isEmpty()) {
                metrics.recordValidationFailure();
                throw new ValidationException(task.id(), violations);
            }
        }

        byte[] content;
        try {
            content = codec.encode(tasks);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to encode board " + board, e);
        }

        Path live = artifactPath(board);
        backups.backup(board, live);

        Path temp = null;
        try {
            temp = Files.createTempFile(directory, board.fileStem() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, live, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            metrics.recordWrite();
            log.debug("Wrote {} task(s) to board {}", tasks.size(), board);
        } catch (IOException e) {
            throw new BoardStoreException("Failed to write board " + board, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private void ensureNotQuarantined(Board board) {
        if (quarantine.isMarked(board)) {
            String reason = quarantine.reason(board).orElse("unknown reason");
            throw new BoardCorruptedException(board, "Board " + board + " is quarantined until repaired: " + reason);
        }
    }

    private void quarantine(Board board, BoardCorruptedException e) {
        metrics.recordCorruption();
        if (!quarantine.isMarked(board)) {
            quarantine.mark(board, e.getMessage());
            log.error("Board {} quarantined: {}", board, e.getMessage());
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }
}
