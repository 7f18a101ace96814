package federa.coordinator.driver;

import federa.common.FederaException;
import federa.common.model.EvaluateIns;
import federa.common.model.EvaluateRes;
import federa.common.model.FitIns;
import federa.common.model.FitRes;
import federa.common.model.GetParametersIns;
import federa.common.model.GetParametersRes;
import federa.common.model.GetPropertiesIns;
import federa.common.model.GetPropertiesRes;
import federa.common.model.Status;
import federa.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one call against many proxies in parallel. A node that fails is reported in
 * {@link RoundResult#failures()} and never aborts the round.
 */
public class RoundExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoundExecutor.class);

    private final ExecutorService executor;

    /**
     * One call on one proxy.
     */
    @FunctionalInterface
    public interface RemoteCall<R> {
        R invoke(ClientProxy proxy, Duration timeout);
    }

    public RoundExecutor(CoordinatorConfig config) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.roundParallelism(), r -> {
            Thread t = new Thread(r, "federa-round-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RoundResult<GetPropertiesRes> getProperties(List<ClientProxy> proxies, GetPropertiesIns ins,
            Duration timeout) {
        return execute(proxies, (proxy, t) -> proxy.getProperties(ins, t), GetPropertiesRes::status, timeout);
    }

    public RoundResult<GetParametersRes> getParameters(List<ClientProxy> proxies, GetParametersIns ins,
            Duration timeout) {
        return execute(proxies, (proxy, t) -> proxy.getParameters(ins, t), GetParametersRes::status, timeout);
    }

    public RoundResult<FitRes> fit(List<ClientProxy> proxies, FitIns ins, Duration timeout) {
        return execute(proxies, (proxy, t) -> proxy.fit(ins, t), FitRes::status, timeout);
    }

    public RoundResult<EvaluateRes> evaluate(List<ClientProxy> proxies, EvaluateIns ins, Duration timeout) {
        return execute(proxies, (proxy, t) -> proxy.evaluate(ins, t), EvaluateRes::status, timeout);
    }

    /**
     * Invoke {@code call} on every proxy and wait for all of them.
     *
     * @param statusOf extracts the node-reported status from a result
     */
    public <R> RoundResult<R> execute(List<ClientProxy> proxies, RemoteCall<R> call, Function<R, Status> statusOf,
            Duration timeout) {
        List<Future<R>> futures = new ArrayList<>(proxies.size());
        for (ClientProxy proxy : proxies) {
            futures.add(executor.submit(() -> call.invoke(proxy, timeout)));
        }

        List<RoundResult.Success<R>> results = new ArrayList<>();
        List<RoundResult.Failure> failures = new ArrayList<>();

        for (int i = 0; i < proxies.size(); i++) {
            long nodeId = proxies.get(i).nodeId();
            try {
                R result = futures.get(i).get();
                Status status = statusOf.apply(result);
                if (status.isOk()) {
                    results.add(new RoundResult.Success<>(nodeId, result));
                } else {
                    log.info("Node {} answered with status {}: {}", nodeId, status.code(), status.message());
                    failures.add(RoundResult.Failure.of(nodeId, status));
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof FederaException) {
                    log.warn("Node {} excluded from round: {}", nodeId, cause.getMessage());
                } else {
                    log.error("Node {} call failed unexpectedly", nodeId, cause);
                }
                failures.add(RoundResult.Failure.of(nodeId, cause));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new FederaException("Interrupted while waiting for round results", e);
            }
        }

        log.info("Round finished: {} results, {} failures", results.size(), failures.size());
        return new RoundResult<>(results, failures);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Round executor did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
