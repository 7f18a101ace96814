package federa.common.model;

import java.util.Map;

/** Request for the client's current parameters. */
public record GetParametersIns(Map<String, Object> config) {

    public GetParametersIns {
        config = Configs.copy(config);
    }
}
