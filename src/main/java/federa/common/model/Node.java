package federa.common.model;

/**
 * A remote participant.
 *
 * @param nodeId    numeric id, unique within the queue
 * @param anonymous true for an ephemeral node with no identity beyond one run
 */
public record Node(long nodeId, boolean anonymous) {
}
