package federa.coordinator.scheduler;

import federa.coordinator.config.CoordinatorConfig;
import federa.coordinator.store.JdbcTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the queue's background housekeeping on a single daemon thread.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(JdbcTaskQueue taskQueue, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "federa-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = new TaskReaper(taskQueue, config);
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.taskReaperInterval().toMillis();
        executor.scheduleAtFixedRate(taskReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms (retention {})", intervalMs, config.taskRetention());
    }

    /**
     * Stop the scheduler gracefully.
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

    public TaskReaper taskReaper() {
        return taskReaper;
    }
}
