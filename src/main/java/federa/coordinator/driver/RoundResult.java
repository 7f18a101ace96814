package federa.coordinator.driver;

import federa.common.model.Status;

import java.util.List;

/**
 * Outcome of one call fanned out to many nodes.
 *
 * @param results  nodes that answered with status OK
 * @param failures nodes that raised or answered with another status
 */
public record RoundResult<R>(List<Success<R>> results, List<Failure> failures) {

    public RoundResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public record Success<R>(long nodeId, R result) {
    }

    /**
     * A node that did not contribute. Exactly one of {@code status} and
     * {@code error} is set.
     */
    public record Failure(long nodeId, Status status, Throwable error) {

        public static Failure of(long nodeId, Status status) {
            return new Failure(nodeId, status, null);
        }

        public static Failure of(long nodeId, Throwable error) {
            return new Failure(nodeId, null, error);
        }
    }
}
