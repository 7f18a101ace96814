package federa.node;

import federa.common.message.Context;
import federa.common.message.Message;
import federa.common.message.Metadata;
import federa.common.model.Node;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;
import federa.coordinator.queue.FleetQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves one node: loops pull instruction → run the app → push result.
 *
 * <p>
 * Instructions are handled one at a time, which is what keeps the node's
 * {@link Context} free of concurrent mutation. If the app throws, the error is
 * logged and no result is pushed; the orchestrator sees a timeout.
 * Stops cleanly on {@link Thread#interrupt()}.
 */
public final class NodeWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NodeWorker.class);

    private final FleetQueue queue;
    private final NodeApp app;
    private final Node node;
    private final Duration pollInterval;
    private final ContextStore contexts = new ContextStore();
    private final AtomicLong handled = new AtomicLong();

    public NodeWorker(FleetQueue queue, NodeApp app, Node node, Duration pollInterval) {
        this.queue = Objects.requireNonNull(queue, "queue is required");
        this.app = Objects.requireNonNull(app, "app is required");
        this.node = Objects.requireNonNull(node, "node is required");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval is required");
    }

    @Override
    public void run() {
        Thread.currentThread().setName("node-worker-" + node.nodeId());
        log.info("Node worker {} started", node.nodeId());

        while (!Thread.currentThread().isInterrupted()) {
            try {
                List<TaskIns> pulled = queue.pullTaskIns(node.nodeId(), 1);

                if (pulled.isEmpty()) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }

                TaskIns taskIns = pulled.get(0);
                try {
                    handle(taskIns);
                } catch (Exception e) {
                    log.error("Node {} failed on {} task {}, no result pushed",
                            node.nodeId(), taskIns.taskType().tag(), taskIns.taskId(), e);
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.warn("Node worker {} error: {}", node.nodeId(), e.getMessage());
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Node worker {} stopped after {} tasks", node.nodeId(), handled.get());
    }

    /**
     * Run one instruction through the app with the run's context and push the result.
     *
     * @return id of the pushed result
     * @throws Exception whatever the app throws; the context keeps any changes made
     *                   before the failure
     */
    public String handle(TaskIns taskIns) throws Exception {
        Context context = contexts.registerContext(taskIns.runId());
        Metadata metadata = new Metadata(
                taskIns.runId(), taskIns.taskId(), taskIns.groupId(), taskIns.ttl(), taskIns.taskType().tag());

        Message out = app.handle(new Message(metadata, taskIns.content()), context);
        contexts.updateContext(taskIns.runId(), context);

        TaskRes taskRes = TaskRes.builder()
                .groupId(taskIns.groupId())
                .runId(taskIns.runId())
                .nodeId(node.nodeId())
                .taskInsId(taskIns.taskId())
                .taskType(taskIns.taskType())
                .content(out.content())
                .createdAt(Instant.now())
                .build();

        String resId = queue.pushTaskRes(taskRes);
        handled.incrementAndGet();
        return resId;
    }

    public Node node() {
        return node;
    }

    public ContextStore contexts() {
        return contexts;
    }

    /** Number of instructions answered so far. */
    public long handledCount() {
        return handled.get();
    }
}
