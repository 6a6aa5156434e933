package taskboard.coordinator.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import taskboard.coordinator.core.BoardMetrics;
import taskboard.coordinator.error.BoardStoreException;
import taskboard.coordinator.error.LockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Cross-process mutual exclusion backed by sentinel files.
 *
 * <p>A lock on scope {@code X} is the file {@code X.lock} in the board
 * directory, created with create-new semantics and carrying the holder id,
 * acquisition time and a unique token. A sentinel older than the staleness
 * TTL belongs to a crashed holder and is broken by the next acquirer.
 * Acquisition retries with exponential backoff and gives up with
 * {@link LockTimeoutException} once the timeout elapses.
 */
public class BoardLockManager {

    private static final Logger log = LoggerFactory.getLogger(BoardLockManager.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path directory;
    private final String holderId;
    private final Duration staleTtl;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final BoardMetrics metrics;

    public BoardLockManager(Path directory, String holderId, Duration staleTtl, BackoffPolicy backoff,
            Clock clock, BoardMetrics metrics) {
        this.directory = directory;
        this.holderId = holderId;
        this.staleTtl = staleTtl;
        this.backoff = backoff;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Acquire the lock for a scope.
     *
     * @param scope   lock scope, one per board file
     * @param timeout upper bound on the total wait
     * @return the held lock
     * @throws LockTimeoutException if the lock stays held by someone else
     */
    public LockToken acquire(String scope, Duration timeout) {
        Path sentinel = sentinelPath(scope);
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;

        while (true) {
            attempts++;
            Optional<LockToken> token = tryCreate(scope, sentinel);
            if (token.isPresent()) {
                metrics.recordLockAcquired();
                log.debug("Acquired lock {} as {} after {} attempt(s)", scope, holderId, attempts);
                return token.get();
            }

            if (breakIfStale(scope, sentinel)) {
                continue;
            }

            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0) {
                metrics.recordLockTimeout();
                String holder = readSentinel(sentinel).map(LockSentinel::holderId).orElse(null);
                log.warn("Lock {} not acquired within {}ms ({} attempts), held by {}",
                        scope, timeout.toMillis(), attempts, holder);
                throw new LockTimeoutException(scope, timeout, attempts, holder);
            }

            try {
                Thread.sleep(Math.min(backoff.delayMillis(attempts), remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for lock {} after {} attempt(s)", scope, attempts);
                throw new LockTimeoutException(scope, attempts, e);
            }
        }
    }

    /**
     * Release a lock. Only the first call has an effect. A sentinel that no
     * longer carries this token was broken as stale and is left alone.
     */
    public void release(LockToken token) {
        if (token == null || !token.markReleased()) {
            return;
        }
        Optional<LockSentinel> current = readSentinel(token.sentinel());
        if (current.isEmpty()) {
            log.warn("Lock {} already gone on release by {}", token.scope(), token.holderId());
            return;
        }
        if (!token.token().equals(current.get().token())) {
            log.warn("Lock {} was broken while held by {} and is now held by {}",
                    token.scope(), token.holderId(), current.get().holderId());
            return;
        }
        try {
            Files.deleteIfExists(token.sentinel());
            log.debug("Released lock {} held by {}", token.scope(), token.holderId());
        } catch (IOException e) {
            throw new BoardStoreException("Failed to release lock " + token.scope(), e);
        }
    }

    /** Current holder of a scope, if the sentinel exists and is readable */
    public Optional<LockSentinel> currentHolder(String scope) {
        return readSentinel(sentinelPath(scope));
    }

    public Path sentinelPath(String scope) {
        return directory.resolve(scope + ".lock");
    }

    public String holderId() {
        return holderId;
    }

    private Optional<LockToken> tryCreate(String scope, Path sentinel) {
        Instant now = clock.instant();
        String tokenValue = UUID.randomUUID().toString();
        byte[] content;
        try {
            content = MAPPER.writeValueAsBytes(new LockSentinel(holderId, now.toString(), tokenValue));
        } catch (IOException e) {
            throw new BoardStoreException("Failed to encode lock sentinel for " + scope, e);
        }
        try (OutputStream out = Files.newOutputStream(sentinel, StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE)) {
            out.write(content);
        } catch (FileAlreadyExistsException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BoardStoreException("Failed to create lock sentinel " + sentinel, e);
        }
        return Optional.of(new LockToken(scope, holderId, tokenValue, now, sentinel));
    }

    /**
     * Break the sentinel if its holder is presumed dead.
     *
     * @return true if the caller should retry immediately
     */
    private boolean breakIfStale(String scope, Path sentinel) {
        Optional<LockSentinel> seen = readSentinel(sentinel);
        Optional<Instant> acquiredAt = seen.flatMap(LockSentinel::acquiredAtInstant)
                .or(() -> lastModified(sentinel));
        if (acquiredAt.isEmpty()) {
            // vanished between our create attempt and now
            return !Files.exists(sentinel);
        }
        Duration age = Duration.between(acquiredAt.get(), clock.instant());
        if (age.compareTo(staleTtl) <= 0) {
            return false;
        }
        return breakSentinel(scope, sentinel, seen, acquiredAt.get());
    }

    /**
     * Move a sentinel judged stale out of the way. The moved sentinel is put
     * back if it is not the one that was judged, empty or unreadable included.
     *
     * @param seen       sentinel content read when staleness was decided
     * @param acquiredAt acquisition time the decision was based on
     * @return true if the caller should retry immediately
     */
    boolean breakSentinel(String scope, Path sentinel, Optional<LockSentinel> seen, Instant acquiredAt) {
        Path broken = directory.resolve(scope + ".lock.broken-" + UUID.randomUUID());
        try {
            Files.move(sentinel, broken, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            throw new BoardStoreException("Failed to break stale lock " + sentinel, e);
        }

        Optional<LockSentinel> moved = readSentinel(broken);
        String seenToken = seen.map(LockSentinel::token).orElse(null);
        String movedToken = moved.map(LockSentinel::token).orElse(null);
        boolean replaced = !Objects.equals(seenToken, movedToken)
                || movedToken == null && lastModified(broken).map(t -> t.isAfter(acquiredAt)).orElse(false);
        if (replaced) {
            // a fresh holder replaced the stale sentinel between our read and our move
            restore(broken, sentinel);
            return true;
        }

        metrics.recordStaleLockBroken();
        log.warn("Broke stale lock {} held by {} since {} (age {}ms > ttl {}ms)",
                scope, seen.map(LockSentinel::holderId).orElse("unknown holder"), acquiredAt,
                Duration.between(acquiredAt, clock.instant()).toMillis(), staleTtl.toMillis());
        try {
            Files.deleteIfExists(broken);
        } catch (IOException e) {
            log.warn("Could not delete broken sentinel {}: {}", broken, e.getMessage());
        }
        return true;
    }

    private void restore(Path broken, Path sentinel) {
        try {
            Files.move(broken, sentinel);
        } catch (FileAlreadyExistsException e) {
            log.error("Lock {} lost its sentinel to a concurrent stale-lock break", sentinel.getFileName());
            try {
                Files.deleteIfExists(broken);
            } catch (IOException ex) {
                log.warn("Could not delete broken sentinel {}: {}", broken, ex.getMessage());
            }
        } catch (IOException e) {
            throw new BoardStoreException("Failed to restore lock sentinel " + sentinel, e);
        }
    }

    private static Optional<LockSentinel> readSentinel(Path sentinel) {
        try {
            byte[] bytes = Files.readAllBytes(sentinel);
            if (bytes.length == 0) {
                return Optional.empty();
            }
            return Optional.of(MAPPER.readValue(bytes, LockSentinel.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            // partially written by a holder that crashed during acquisition
            log.debug("Unreadable lock sentinel {}: {}", sentinel, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Instant> lastModified(Path sentinel) {
        try {
            return Optional.of(Files.getLastModifiedTime(sentinel).toInstant());
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
