package federa.common.message;

import java.util.Objects;

/**
 * Unit of work flowing through a mod chain and across the queue.
 * The content is mutable; the metadata is not.
 */
public final class Message {

    private final Metadata metadata;
    private final Content content;

    public Message(Metadata metadata, Content content) {
        this.metadata = Objects.requireNonNull(metadata, "metadata is required");
        this.content = Objects.requireNonNull(content, "content is required");
    }

    public Metadata metadata() {
        return metadata;
    }

    public Content content() {
        return content;
    }

    @Override
    public String toString() {
        return "Message{taskType='" + metadata.taskType() + "', taskId='" + metadata.taskId()
                + "', content=" + content.names() + "}";
    }
}
