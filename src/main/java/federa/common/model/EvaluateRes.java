package federa.common.model;

import java.util.Map;
import java.util.Objects;

/** Result of local evaluation. */
public record EvaluateRes(Status status, double loss, long numExamples, Map<String, Object> metrics) {

    public EvaluateRes {
        Objects.requireNonNull(status, "status is required");
        metrics = Configs.copy(metrics);
    }
}
