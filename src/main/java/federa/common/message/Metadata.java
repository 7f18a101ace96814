package federa.common.message;

import java.util.Objects;

/**
 * Immutable identifiers of one unit of work.
 *
 * @param runId    run the work belongs to
 * @param taskId   id of the task that carried the work (empty before it is pushed)
 * @param groupId  group id, empty when unused
 * @param ttl      time-to-live as sent by the orchestrator
 * @param taskType call-type tag, see {@link federa.common.model.TaskType}
 */
public record Metadata(long runId, String taskId, String groupId, String ttl, String taskType) {

    public Metadata {
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(groupId, "groupId is required");
        Objects.requireNonNull(ttl, "ttl is required");
        Objects.requireNonNull(taskType, "taskType is required");
    }
}
