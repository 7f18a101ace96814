package federa.coordinator.queue;

import federa.common.model.Node;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;

import java.util.List;

/**
 * Node side of the task queue.
 */
public interface FleetQueue {

    /**
     * Register a new node.
     *
     * @param anonymous whether the node is ephemeral
     * @return the registered node
     */
    Node createNode(boolean anonymous);

    /**
     * Unregister a node. Undelivered instructions for it are dropped.
     *
     * @throws UnknownNodeException if the node is not registered
     */
    void deleteNode(long nodeId);

    /**
     * Take up to {@code limit} undelivered instructions addressed to the node.
     * Each instruction is handed out at most once.
     */
    List<TaskIns> pullTaskIns(long nodeId, int limit);

    /**
     * Enqueue a result.
     *
     * @param taskRes the result; its task id is ignored
     * @return the id assigned to the result
     * @throws IllegalArgumentException if the instruction it answers is unknown or
     *                                  belongs to another run
     */
    String pushTaskRes(TaskRes taskRes);
}
