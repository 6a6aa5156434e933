package taskboard.coordinator.scheduler;

import taskboard.coordinator.config.BoardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background maintenance:
 * - StaleTaskReaper: fails tasks abandoned by their agent
 * - reconciler: removes duplicates left by interrupted relocations
 *
 * Uses a single-threaded executor so the two never overlap in this process.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleTaskReaper reaper;
    private final Runnable reconciler;
    private final BoardConfig config;

    private volatile boolean running = false;

    /**
     * @param reaper     stale task reaper
     * @param reconciler runnable reconciling the boards (typically
     *                   {@code BoardRecoveryService::reconcile})
     * @param config     intervals
     */
    public Scheduler(StaleTaskReaper reaper, Runnable reconciler, BoardConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskboard-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.reaper = reaper;
        this.reconciler = reconciler;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(reaper, reaperIntervalMs, reaperIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Stale task reaper scheduled every {}ms", reaperIntervalMs);

        long reconcileIntervalMs = config.reconcileInterval().toMillis();
        executor.scheduleAtFixedRate(wrapRunnable("reconciler", reconciler),
                reconcileIntervalMs, reconcileIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Reconciler scheduled every {}ms", reconcileIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler, waiting a few seconds for a running pass.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** The reaper, for a manual pass */
    public StaleTaskReaper reaper() {
        return reaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
