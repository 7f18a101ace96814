package federa.coordinator.queue;

import federa.common.FederaException;

/**
 * A task was addressed to a node id the queue does not know.
 */
public class UnknownNodeException extends FederaException {

    private final long nodeId;

    public UnknownNodeException(long nodeId) {
        super("Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public long nodeId() {
        return nodeId;
    }
}
