package federa.common;

/**
 * Root of the unchecked errors raised by the call pipeline and the queue.
 */
public class FederaException extends RuntimeException {

    public FederaException(String message) {
        super(message);
    }

    public FederaException(String message, Throwable cause) {
        super(message, cause);
    }
}
