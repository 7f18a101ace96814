package federa.coordinator.simulation;

import federa.common.model.Node;
import federa.coordinator.config.CoordinatorConfig;
import federa.coordinator.queue.FleetQueue;
import federa.node.NodeApp;
import federa.node.NodeWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fleet of nodes inside this process, all serving the same app.
 * Call start() to register and spawn N node workers, stop() to shut them down
 * and unregister their nodes.
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final FleetQueue queue;
    private final CoordinatorConfig config;

    private ExecutorService executor;
    private final List<NodeWorker> workers = new ArrayList<>();
    private volatile boolean running;

    public SimulationService(FleetQueue queue, CoordinatorConfig config) {
        this.queue = queue;
        this.config = config;
    }

    /**
     * Register N nodes and start a worker for each. Nodes are registered before
     * this method returns, so they are immediately visible to the orchestrator.
     *
     * @return the registered nodes
     */
    public synchronized List<Node> start(int nodes, NodeApp app) {
        if (running) {
            throw new IllegalStateException("Simulation already running");
        }
        if (nodes <= 0) {
            throw new IllegalArgumentException("nodes must be positive");
        }

        workers.clear();
        executor = Executors.newFixedThreadPool(nodes, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        List<Node> registered = new ArrayList<>(nodes);
        for (int i = 0; i < nodes; i++) {
            Node node = queue.createNode(false);
            registered.add(node);

            NodeWorker worker = new NodeWorker(queue, app, node, config.nodePollInterval());
            workers.add(worker);
            executor.submit(worker);
        }

        running = true;
        log.info("Simulation started: {} nodes, poll interval {}ms", nodes, config.nodePollInterval().toMillis());
        return registered;
    }

    /**
     * Stop all node workers and unregister their nodes.
     */
    public synchronized void stop() {
        if (!running)
            return;

        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }

        for (NodeWorker worker : workers) {
            try {
                queue.deleteNode(worker.node().nodeId());
            } catch (Exception e) {
                log.debug("Failed to delete sim node {}: {}", worker.node().nodeId(), e.getMessage());
            }
        }

        log.info("Simulation stopped");
    }

    public synchronized List<NodeWorker> workers() {
        return List.copyOf(workers);
    }

    public boolean isRunning() {
        return running;
    }
}
