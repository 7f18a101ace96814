package federa.common.model;

import java.util.Map;
import java.util.Objects;

/** Instruction to evaluate the given parameters on local data. */
public record EvaluateIns(Parameters parameters, Map<String, Object> config) {

    public EvaluateIns {
        Objects.requireNonNull(parameters, "parameters is required");
        config = Configs.copy(config);
    }
}
