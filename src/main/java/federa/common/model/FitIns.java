package federa.common.model;

import java.util.Map;
import java.util.Objects;

/** Instruction to run one round of local training starting from the given parameters. */
public record FitIns(Parameters parameters, Map<String, Object> config) {

    public FitIns {
        Objects.requireNonNull(parameters, "parameters is required");
        config = Configs.copy(config);
    }
}
