package federa.common.model;

import java.util.Map;
import java.util.Objects;

/**
 * Result of local training.
 *
 * @param numExamples number of examples used for training
 */
public record FitRes(Status status, Parameters parameters, long numExamples, Map<String, Object> metrics) {

    public FitRes {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(parameters, "parameters is required");
        metrics = Configs.copy(metrics);
    }
}
