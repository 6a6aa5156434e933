package taskboard.coordinator.config;

import taskboard.coordinator.core.BoardMetrics;
import taskboard.coordinator.core.TransitionBus;
import taskboard.coordinator.lock.BoardLockManager;
import taskboard.coordinator.repository.BoardRepository;
import taskboard.coordinator.scheduler.Scheduler;
import taskboard.coordinator.scheduler.StaleTaskReaper;
import taskboard.coordinator.service.BoardRecoveryService;
import taskboard.coordinator.service.TaskLifecycleService;
import taskboard.coordinator.store.BackupManager;
import taskboard.coordinator.store.FileBoardRepository;
import taskboard.coordinator.validation.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the board store, the lifecycle coordinator and the
 * background maintenance.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(BoardConfig.fromEnv());
 * deps.transitionBus().subscribe(event -> ...);
 * deps.startScheduler(); // start background maintenance
 * TaskLifecycleService lifecycle = deps.lifecycle();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final BoardConfig config;
    private final Clock clock;
    private final BoardMetrics metrics;
    private final SchemaValidator validator;
    private final BoardLockManager lockManager;
    private final BoardRepository repository;
    private final TransitionBus transitionBus;
    private final TaskLifecycleService lifecycle;
    private final BoardRecoveryService recovery;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(BoardConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.metrics = new BoardMetrics();
        this.validator = new SchemaValidator();
        this.lockManager = new BoardLockManager(config.boardDirectory(), config.holderId(),
                config.lockStaleTtl(), config.backoffPolicy(), clock, metrics);
        BackupManager backups = new BackupManager(config.backupDirectory(), config.backupRetention(), clock, metrics);

        // Repository
        this.repository = new FileBoardRepository(config.boardDirectory(), lockManager, validator, backups,
                config.lockTimeout(), metrics);

        // Services
        this.transitionBus = new TransitionBus();
        this.lifecycle = new TaskLifecycleService(repository, validator, transitionBus, clock);
        this.recovery = new BoardRecoveryService(repository, validator);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(BoardConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static Dependencies create(BoardConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(BoardConfig.fromEnv());
    }

    // Getters
    public BoardConfig config() {
        return config;
    }

    public BoardMetrics metrics() {
        return metrics;
    }

    public SchemaValidator validator() {
        return validator;
    }

    public BoardLockManager lockManager() {
        return lockManager;
    }

    public BoardRepository repository() {
        return repository;
    }

    public TransitionBus transitionBus() {
        return transitionBus;
    }

    public TaskLifecycleService lifecycle() {
        return lifecycle;
    }

    public BoardRecoveryService recovery() {
        return recovery;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            StaleTaskReaper reaper = new StaleTaskReaper(lifecycle, repository, config, clock);
            scheduler = new Scheduler(reaper, recovery::reconcile, config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            stopScheduler();
        } catch (RuntimeException e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }
        log.info("Dependencies closed. Metrics: {}", metrics.snapshot());
    }
}
