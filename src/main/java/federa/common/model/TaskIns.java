package federa.common.model;

import federa.common.message.Content;

import java.time.Instant;
import java.util.Objects;

/**
 * Instruction sent from the orchestrator to one node through the queue.
 * Immutable once built; the content must not be mutated after the push.
 */
public final class TaskIns {
    private final String taskId; // empty until the queue assigns one
    private final String groupId;
    private final long runId;
    private final long nodeId; // consumer
    private final TaskType taskType;
    private final String ttl;
    private final Content content;
    private final Instant createdAt;

    private TaskIns(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.groupId = Objects.requireNonNull(builder.groupId, "groupId is required");
        this.runId = builder.runId;
        this.nodeId = builder.nodeId;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.ttl = Objects.requireNonNull(builder.ttl, "ttl is required");
        this.content = Objects.requireNonNull(builder.content, "content is required");
        this.createdAt = builder.createdAt;
    }

    public String taskId() {
        return taskId;
    }

    public String groupId() {
        return groupId;
    }

    public long runId() {
        return runId;
    }

    public long nodeId() {
        return nodeId;
    }

    public TaskType taskType() {
        return taskType;
    }

    public String ttl() {
        return ttl;
    }

    public Content content() {
        return content;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .groupId(groupId)
                .runId(runId)
                .nodeId(nodeId)
                .taskType(taskType)
                .ttl(ttl)
                .content(content)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId = "";
        private String groupId = "";
        private long runId;
        private long nodeId;
        private TaskType taskType;
        private String ttl = "";
        private Content content;
        private Instant createdAt;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder runId(long runId) {
            this.runId = runId;
            return this;
        }

        public Builder nodeId(long nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder ttl(String ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder content(Content content) {
            this.content = content;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public TaskIns build() {
            return new TaskIns(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskIns other))
            return false;
        return taskId.equals(other.taskId) && runId == other.runId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, runId);
    }

    @Override
    public String toString() {
        return "TaskIns{taskId='" + taskId + "', runId=" + runId + ", nodeId=" + nodeId + ", type=" + taskType + "}";
    }
}
