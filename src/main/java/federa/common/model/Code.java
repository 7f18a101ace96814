package federa.common.model;

/**
 * Outcome code carried by every call result.
 */
public enum Code {
    OK(0),
    GET_PROPERTIES_NOT_IMPLEMENTED(1),
    GET_PARAMETERS_NOT_IMPLEMENTED(2),
    FIT_NOT_IMPLEMENTED(3),
    EVALUATE_NOT_IMPLEMENTED(4);

    private final int value;

    Code(int value) {
        this.value = value;
    }

    /** Stable numeric value used on the wire. */
    public int value() {
        return value;
    }

    public static Code fromValue(long value) {
        for (Code code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + value);
    }
}
