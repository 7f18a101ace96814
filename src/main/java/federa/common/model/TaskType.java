package federa.common.model;

import java.util.Optional;

/**
 * Closed set of remote calls. The tag is what travels in metadata and tasks.
 */
public enum TaskType {
    GET_PROPERTIES("get-properties"),
    GET_PARAMETERS("get-parameters"),
    FIT("fit"),
    EVALUATE("evaluate");

    private final String tag;

    TaskType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<TaskType> find(String tag) {
        for (TaskType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static TaskType fromTag(String tag) {
        return find(tag).orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + tag));
    }
}
