package federa.common.model;

import java.util.Map;

/** Request for the client's properties. */
public record GetPropertiesIns(Map<String, Object> config) {

    public GetPropertiesIns {
        config = Configs.copy(config);
    }
}
