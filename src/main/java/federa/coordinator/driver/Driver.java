package federa.coordinator.driver;

import federa.common.model.Node;
import federa.coordinator.config.CoordinatorConfig;
import federa.coordinator.queue.DriverQueue;
import federa.coordinator.queue.UnknownNodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Orchestrator entry point: owns the run and hands out one proxy per node.
 * The run is created on first use.
 */
public class Driver {

    private static final Logger log = LoggerFactory.getLogger(Driver.class);

    private final DriverQueue queue;
    private final CoordinatorConfig config;

    private Long runId;

    public Driver(DriverQueue queue, CoordinatorConfig config) {
        this.queue = queue;
        this.config = config;
    }

    /**
     * Id of the run this driver works in, created lazily.
     */
    public synchronized long runId() {
        if (runId == null) {
            runId = queue.createRun();
            log.info("Driver started run {}", runId);
        }
        return runId;
    }

    /**
     * Nodes currently available.
     */
    public List<Node> getNodes() {
        return queue.getNodes(runId());
    }

    /**
     * Build a proxy for every available node.
     */
    public List<ClientProxy> clientProxies() {
        long run = runId();
        List<ClientProxy> proxies = queue.getNodes(run).stream()
                .map(node -> (ClientProxy) newProxy(node, run))
                .toList();
        log.debug("Built {} client proxies for run {}", proxies.size(), run);
        return proxies;
    }

    /**
     * Build a proxy for one known node.
     *
     * @throws UnknownNodeException if the node is not currently available
     */
    public ClientProxy clientProxy(long nodeId) {
        long run = runId();
        return queue.getNodes(run).stream()
                .filter(node -> node.nodeId() == nodeId)
                .findFirst()
                .map(node -> (ClientProxy) newProxy(node, run))
                .orElseThrow(() -> new UnknownNodeException(nodeId));
    }

    private DriverClientProxy newProxy(Node node, long run) {
        return new DriverClientProxy(node.nodeId(), node.anonymous(), run, config.groupId(), queue,
                config.pollInterval());
    }
}
