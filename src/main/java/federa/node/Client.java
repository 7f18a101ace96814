package federa.node;

import federa.common.model.Code;
import federa.common.model.EvaluateIns;
import federa.common.model.EvaluateRes;
import federa.common.model.FitIns;
import federa.common.model.FitRes;
import federa.common.model.GetParametersIns;
import federa.common.model.GetParametersRes;
import federa.common.model.GetPropertiesIns;
import federa.common.model.GetPropertiesRes;
import federa.common.model.Parameters;
import federa.common.model.Status;

import java.util.Map;

/**
 * Typed client running on a node. Every operation defaults to a "not implemented"
 * status, so implementations only override what they support.
 */
public interface Client {

    default GetPropertiesRes getProperties(GetPropertiesIns ins) {
        return new GetPropertiesRes(
                new Status(Code.GET_PROPERTIES_NOT_IMPLEMENTED, "Client does not implement `getProperties`"),
                Map.of());
    }

    default GetParametersRes getParameters(GetParametersIns ins) {
        return new GetParametersRes(
                new Status(Code.GET_PARAMETERS_NOT_IMPLEMENTED, "Client does not implement `getParameters`"),
                Parameters.empty(""));
    }

    default FitRes fit(FitIns ins) {
        return new FitRes(
                new Status(Code.FIT_NOT_IMPLEMENTED, "Client does not implement `fit`"),
                Parameters.empty(""),
                0,
                Map.of());
    }

    default EvaluateRes evaluate(EvaluateIns ins) {
        return new EvaluateRes(
                new Status(Code.EVALUATE_NOT_IMPLEMENTED, "Client does not implement `evaluate`"),
                0.0,
                0,
                Map.of());
    }
}
