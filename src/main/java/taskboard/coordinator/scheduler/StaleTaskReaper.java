package taskboard.coordinator.scheduler;

import taskboard.coordinator.config.BoardConfig;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskStatus;
import taskboard.coordinator.repository.BoardRepository;
import taskboard.coordinator.service.TaskLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Background task that fails claimed work nobody is moving forward.
 *
 * Tasks get stuck if:
 * - An agent crashes after claiming
 * - An agent loses track of its task and never reports back
 *
 * The reaper finds CLAIMED or WORKING tasks whose last change is older
 * than the threshold and fails them so they show up for re-triage.
 * BLOCKED tasks are waiting on purpose and are left alone.
 */
public class StaleTaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskReaper.class);

    private final TaskLifecycleService lifecycle;
    private final BoardRepository repository;
    private final BoardConfig config;
    private final Clock clock;

    public StaleTaskReaper(TaskLifecycleService lifecycle, BoardRepository repository, BoardConfig config,
            Clock clock) {
        this.lifecycle = lifecycle;
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStaleTasks();
        } catch (Exception e) {
            log.error("Stale task reaper error", e);
        }
    }

    /**
     * Find and fail stale tasks.
     *
     * @return number of tasks failed
     */
    public int reapStaleTasks() {
        Instant cutoff = clock.instant().minus(config.reaperStaleThreshold());

        List<Task> stale = repository.load(Board.WORKING).tasks().stream()
                .filter(t -> t.status() == TaskStatus.CLAIMED || t.status() == TaskStatus.WORKING)
                .filter(t -> t.updatedAt().isBefore(cutoff))
                .toList();

        if (stale.isEmpty()) {
            log.debug("No stale tasks found");
            return 0;
        }

        int failed = 0;
        for (Task task : stale) {
            String reason = "stale: no progress from " + task.assignedAgentId() + " since " + task.updatedAt();
            try {
                if (lifecycle.failStaleTask(task.id(), cutoff, reason).isPresent()) {
                    failed++;
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Stale task reaper: {} failed, {} candidates", failed, stale.size());
        return failed;
    }
}
