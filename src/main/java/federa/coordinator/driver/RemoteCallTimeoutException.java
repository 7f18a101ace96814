package federa.coordinator.driver;

import federa.common.FederaException;

import java.time.Duration;

/**
 * No matching result arrived within the caller's timeout.
 */
public class RemoteCallTimeoutException extends FederaException {

    private final long nodeId;
    private final String taskId;

    public RemoteCallTimeoutException(long nodeId, String taskId, Duration timeout) {
        super("No result from node " + nodeId + " for task " + taskId + " within " + timeout.toMillis() + "ms");
        this.nodeId = nodeId;
        this.taskId = taskId;
    }

    public long nodeId() {
        return nodeId;
    }

    /** Id of the instruction that went unanswered. */
    public String taskId() {
        return taskId;
    }
}
