package federa.common.codec;

import federa.common.FederaException;

/**
 * Content could not be decoded for the expected call type. Usually means the
 * orchestrator and the node disagree on the protocol.
 */
public class SchemaMismatchException extends FederaException {

    private final String taskType;

    public SchemaMismatchException(String taskType, String detail) {
        super("Cannot decode " + taskType + ": " + detail);
        this.taskType = taskType;
    }

    public SchemaMismatchException(String taskType, String detail, Throwable cause) {
        super("Cannot decode " + taskType + ": " + detail, cause);
        this.taskType = taskType;
    }

    /** Tag of the call type that failed to decode. */
    public String taskType() {
        return taskType;
    }
}
