package federa.common.model;

import java.util.Map;
import java.util.Objects;

/** Client properties. */
public record GetPropertiesRes(Status status, Map<String, Object> properties) {

    public GetPropertiesRes {
        Objects.requireNonNull(status, "status is required");
        properties = Configs.copy(properties);
    }
}
