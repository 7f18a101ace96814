package federa.coordinator.queue;

import federa.common.model.Node;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;

import java.util.List;
import java.util.Set;

/**
 * Orchestrator side of the task queue. Implementations must tolerate concurrent
 * calls from many proxies.
 */
public interface DriverQueue {

    /**
     * Create a new run.
     *
     * @return the run id
     */
    long createRun();

    /**
     * List the nodes currently known to the queue.
     *
     * @param runId the run asking
     * @return available nodes
     */
    List<Node> getNodes(long runId);

    /**
     * Enqueue an instruction for the node named by {@link TaskIns#nodeId()}.
     *
     * @param taskIns the instruction; its task id is ignored
     * @return the id assigned to the instruction
     * @throws UnknownNodeException if the consumer node is not registered
     */
    String pushTaskIns(TaskIns taskIns);

    /**
     * Fetch results answering any of the given instructions. Never blocks; returns
     * an empty list when nothing is ready. Each result is returned at most once.
     *
     * @param taskInsIds ids returned by {@link #pushTaskIns(TaskIns)}
     * @return ready results
     */
    List<TaskRes> pullTaskRes(Set<String> taskInsIds);
}
