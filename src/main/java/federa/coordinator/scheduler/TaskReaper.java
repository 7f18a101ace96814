package federa.coordinator.scheduler;

import federa.coordinator.config.CoordinatorConfig;
import federa.coordinator.store.JdbcTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background task that deletes instructions and results older than the
 * retention window, whether or not they were delivered.
 *
 * Keeps the queue tables bounded when a node never answers or an orchestrator
 * gives up on a call and never pulls its result.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final JdbcTaskQueue taskQueue;
    private final CoordinatorConfig config;

    public TaskReaper(JdbcTaskQueue taskQueue, CoordinatorConfig config) {
        this.taskQueue = taskQueue;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpiredTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Delete tasks created before {@code now - retention}.
     *
     * @return number of tasks deleted
     */
    public int reapExpiredTasks() {
        Instant cutoff = Instant.now().minus(config.taskRetention());

        int deleted = taskQueue.deleteExpired(cutoff);

        if (deleted == 0) {
            log.debug("No expired tasks found");
        } else {
            log.info("Task reaper: deleted {} tasks created before {}", deleted, cutoff);
        }

        return deleted;
    }
}
