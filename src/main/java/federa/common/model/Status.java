package federa.common.model;

import java.util.Objects;

/**
 * Result status reported by the remote client.
 */
public record Status(Code code, String message) {

    public static final Status OK = new Status(Code.OK, "Success");

    public Status {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(message, "message is required");
    }

    public boolean isOk() {
        return code == Code.OK;
    }
}
