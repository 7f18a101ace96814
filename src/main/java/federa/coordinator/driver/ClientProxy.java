package federa.coordinator.driver;

import federa.common.model.EvaluateIns;
import federa.common.model.EvaluateRes;
import federa.common.model.FitIns;
import federa.common.model.FitRes;
import federa.common.model.GetParametersIns;
import federa.common.model.GetParametersRes;
import federa.common.model.GetPropertiesIns;
import federa.common.model.GetPropertiesRes;

import java.time.Duration;

/**
 * Synchronous view of one remote node.
 *
 * <p>
 * Every call blocks until the node answers or the timeout elapses. A {@code null}
 * timeout waits indefinitely. A non-OK status reported by the node is returned
 * inside the result; only transport failures are thrown
 * ({@link RemoteCallTimeoutException},
 * {@link federa.common.codec.SchemaMismatchException},
 * {@link federa.coordinator.queue.UnknownNodeException}).
 */
public interface ClientProxy {

    long nodeId();

    GetPropertiesRes getProperties(GetPropertiesIns ins, Duration timeout);

    GetParametersRes getParameters(GetParametersIns ins, Duration timeout);

    FitRes fit(FitIns ins, Duration timeout);

    EvaluateRes evaluate(EvaluateIns ins, Duration timeout);
}
