package federa.coordinator.config;

import federa.coordinator.driver.Driver;
import federa.coordinator.driver.RoundExecutor;
import federa.coordinator.scheduler.Scheduler;
import federa.coordinator.simulation.SimulationService;
import federa.coordinator.store.Database;
import federa.coordinator.store.JdbcTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the queue store and the orchestrator-side services.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background housekeeping
 * List&lt;ClientProxy&gt; proxies = deps.driver().clientProxies();
 * RoundResult&lt;FitRes&gt; round = deps.roundExecutor().fit(proxies, fitIns, timeout);
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final JdbcTaskQueue taskQueue;
    private final Driver driver;

    // Lazy-initialized
    private RoundExecutor roundExecutor;
    private Scheduler scheduler;
    private SimulationService simulationService;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskQueue = new JdbcTaskQueue(database);

        // Orchestrator
        this.driver = new Driver(taskQueue, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    /** The queue, serving both the orchestrator side and the node side. */
    public JdbcTaskQueue taskQueue() {
        return taskQueue;
    }

    public Driver driver() {
        return driver;
    }

    public synchronized RoundExecutor roundExecutor() {
        if (roundExecutor == null) {
            roundExecutor = new RoundExecutor(config);
        }
        return roundExecutor;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(taskQueue, config);
        }
        return scheduler;
    }

    public synchronized SimulationService simulationService() {
        if (simulationService == null) {
            simulationService = new SimulationService(taskQueue, config);
        }
        return simulationService;
    }

    /**
     * Start the background scheduler for expired task cleanup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background scheduler.
     */
    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop in-process nodes first so they stop polling the database
        if (simulationService != null) {
            try {
                simulationService.stop();
            } catch (Exception e) {
                log.warn("Error stopping simulation: {}", e.getMessage());
            }
        }

        if (roundExecutor != null) {
            roundExecutor.close();
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
