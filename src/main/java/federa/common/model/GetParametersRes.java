package federa.common.model;

import java.util.Objects;

/** The client's current parameters. */
public record GetParametersRes(Status status, Parameters parameters) {

    public GetParametersRes {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(parameters, "parameters is required");
    }
}
