package federa.common.model;

import federa.common.message.Content;

import java.time.Instant;
import java.util.Objects;

/**
 * Result sent from a node back to the orchestrator. References the instruction
 * it answers through {@link #taskInsId()}.
 */
public final class TaskRes {
    private final String taskId; // empty until the queue assigns one
    private final String groupId;
    private final long runId;
    private final long nodeId; // producer
    private final String taskInsId;
    private final TaskType taskType;
    private final Content content;
    private final Instant createdAt;

    private TaskRes(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.groupId = Objects.requireNonNull(builder.groupId, "groupId is required");
        this.runId = builder.runId;
        this.nodeId = builder.nodeId;
        this.taskInsId = Objects.requireNonNull(builder.taskInsId, "taskInsId is required");
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
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

    public String taskInsId() {
        return taskInsId;
    }

    public TaskType taskType() {
        return taskType;
    }

    public Content content() {
        return content;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** True if this result answers the given instruction of the given run. */
    public boolean answers(String insTaskId, long insRunId) {
        return taskInsId.equals(insTaskId) && runId == insRunId;
    }

    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .groupId(groupId)
                .runId(runId)
                .nodeId(nodeId)
                .taskInsId(taskInsId)
                .taskType(taskType)
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
        private String taskInsId;
        private TaskType taskType;
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

        public Builder taskInsId(String taskInsId) {
            this.taskInsId = taskInsId;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
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

        public TaskRes build() {
            return new TaskRes(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRes other))
            return false;
        return taskId.equals(other.taskId) && runId == other.runId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, runId);
    }

    @Override
    public String toString() {
        return "TaskRes{taskId='" + taskId + "', taskInsId='" + taskInsId + "', runId=" + runId
                + ", nodeId=" + nodeId + ", type=" + taskType + "}";
    }
}
