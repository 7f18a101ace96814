package federa.common.codec;

import federa.common.message.ConfigsRecord;
import federa.common.message.Content;
import federa.common.message.MetricsRecord;
import federa.common.message.ParametersRecord;
import federa.common.message.Tensor;
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
import federa.common.model.TaskType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Stateless mapping between typed call values and {@link Content}.
 *
 * <p>
 * Each value is stored as named records prefixed with the lower-case type name,
 * e.g. {@code fitres.parameters}. Decoding throws {@link SchemaMismatchException}
 * when a required record or key is missing or holds the wrong type.
 * Metadata is never consulted.
 */
public final class TaskCodec {

    static final String CONFIG = "config";
    static final String PROPERTIES = "properties";
    static final String PARAMETERS = "parameters";
    static final String TENSOR_TYPE = "tensor_type";
    static final String METRICS = "metrics";
    static final String NUM_EXAMPLES = "num_examples";
    static final String LOSS = "loss";
    static final String STATUS = "status";
    static final String CODE = "code";
    static final String MESSAGE = "message";

    private TaskCodec() {
    }

    // ---------- get-properties ----------

    public static Content encode(GetPropertiesIns ins) {
        Content content = new Content();
        content.setConfigs(name("getpropertiesins", CONFIG), new ConfigsRecord(ins.config()));
        return content;
    }

    public static GetPropertiesIns decodeGetPropertiesIns(Content content) {
        return decoding(TaskType.GET_PROPERTIES, () -> new GetPropertiesIns(
                configs(content, name("getpropertiesins", CONFIG))));
    }

    public static Content encode(GetPropertiesRes res) {
        Content content = new Content();
        content.setConfigs(name("getpropertiesres", PROPERTIES), new ConfigsRecord(res.properties()));
        encodeStatus(content, "getpropertiesres", res.status());
        return content;
    }

    public static GetPropertiesRes decodeGetPropertiesRes(Content content) {
        return decoding(TaskType.GET_PROPERTIES, () -> new GetPropertiesRes(
                decodeStatus(content, "getpropertiesres"),
                configs(content, name("getpropertiesres", PROPERTIES))));
    }

    // ---------- get-parameters ----------

    public static Content encode(GetParametersIns ins) {
        Content content = new Content();
        content.setConfigs(name("getparametersins", CONFIG), new ConfigsRecord(ins.config()));
        return content;
    }

    public static GetParametersIns decodeGetParametersIns(Content content) {
        return decoding(TaskType.GET_PARAMETERS, () -> new GetParametersIns(
                configs(content, name("getparametersins", CONFIG))));
    }

    public static Content encode(GetParametersRes res) {
        Content content = new Content();
        encodeParameters(content, "getparametersres", res.parameters());
        encodeStatus(content, "getparametersres", res.status());
        return content;
    }

    public static GetParametersRes decodeGetParametersRes(Content content) {
        return decoding(TaskType.GET_PARAMETERS, () -> new GetParametersRes(
                decodeStatus(content, "getparametersres"),
                decodeParameters(content, "getparametersres")));
    }

    // ---------- fit ----------

    public static Content encode(FitIns ins) {
        Content content = new Content();
        encodeParameters(content, "fitins", ins.parameters());
        content.setConfigs(name("fitins", CONFIG), new ConfigsRecord(ins.config()));
        return content;
    }

    public static FitIns decodeFitIns(Content content) {
        return decoding(TaskType.FIT, () -> new FitIns(
                decodeParameters(content, "fitins"),
                configs(content, name("fitins", CONFIG))));
    }

    public static Content encode(FitRes res) {
        Content content = new Content();
        encodeParameters(content, "fitres", res.parameters());
        content.setConfigs(name("fitres", METRICS), new ConfigsRecord(res.metrics()));
        content.setMetrics(name("fitres", NUM_EXAMPLES), new MetricsRecord(Map.of(NUM_EXAMPLES, res.numExamples())));
        encodeStatus(content, "fitres", res.status());
        return content;
    }

    public static FitRes decodeFitRes(Content content) {
        return decoding(TaskType.FIT, () -> new FitRes(
                decodeStatus(content, "fitres"),
                decodeParameters(content, "fitres"),
                content.getMetrics(name("fitres", NUM_EXAMPLES)).get(NUM_EXAMPLES, Long.class),
                configs(content, name("fitres", METRICS))));
    }

    // ---------- evaluate ----------

    public static Content encode(EvaluateIns ins) {
        Content content = new Content();
        encodeParameters(content, "evaluateins", ins.parameters());
        content.setConfigs(name("evaluateins", CONFIG), new ConfigsRecord(ins.config()));
        return content;
    }

    public static EvaluateIns decodeEvaluateIns(Content content) {
        return decoding(TaskType.EVALUATE, () -> new EvaluateIns(
                decodeParameters(content, "evaluateins"),
                configs(content, name("evaluateins", CONFIG))));
    }

    public static Content encode(EvaluateRes res) {
        Content content = new Content();
        content.setMetrics(name("evaluateres", LOSS), new MetricsRecord(Map.of(LOSS, res.loss())));
        content.setMetrics(name("evaluateres", NUM_EXAMPLES),
                new MetricsRecord(Map.of(NUM_EXAMPLES, res.numExamples())));
        content.setConfigs(name("evaluateres", METRICS), new ConfigsRecord(res.metrics()));
        encodeStatus(content, "evaluateres", res.status());
        return content;
    }

    public static EvaluateRes decodeEvaluateRes(Content content) {
        return decoding(TaskType.EVALUATE, () -> new EvaluateRes(
                decodeStatus(content, "evaluateres"),
                content.getMetrics(name("evaluateres", LOSS)).get(LOSS, Double.class),
                content.getMetrics(name("evaluateres", NUM_EXAMPLES)).get(NUM_EXAMPLES, Long.class),
                configs(content, name("evaluateres", METRICS))));
    }

    // ---------- shared pieces ----------

    private static String name(String prefix, String field) {
        return prefix + "." + field;
    }

    private static Map<String, Object> configs(Content content, String recordName) {
        return new LinkedHashMap<>(content.getConfigs(recordName).asMap());
    }

    private static void encodeStatus(Content content, String prefix, Status status) {
        ConfigsRecord record = new ConfigsRecord();
        record.put(CODE, (long) status.code().value());
        record.put(MESSAGE, status.message());
        content.setConfigs(name(prefix, STATUS), record);
    }

    private static Status decodeStatus(Content content, String prefix) {
        ConfigsRecord record = content.getConfigs(name(prefix, STATUS));
        return new Status(
                Code.fromValue(record.get(CODE, Long.class)),
                record.get(MESSAGE, String.class));
    }

    private static void encodeParameters(Content content, String prefix, Parameters parameters) {
        ParametersRecord record = new ParametersRecord();
        List<byte[]> tensors = parameters.tensors();
        for (int i = 0; i < tensors.size(); i++) {
            record.put(String.valueOf(i), new Tensor("", List.of(), parameters.tensorType(), tensors.get(i)));
        }
        content.setParameters(name(prefix, PARAMETERS), record);

        ConfigsRecord meta = new ConfigsRecord();
        meta.put(TENSOR_TYPE, parameters.tensorType());
        content.setConfigs(name(prefix, TENSOR_TYPE), meta);
    }

    private static Parameters decodeParameters(Content content, String prefix) {
        ParametersRecord record = content.getParameters(name(prefix, PARAMETERS));
        String tensorType = content.getConfigs(name(prefix, TENSOR_TYPE)).get(TENSOR_TYPE, String.class);
        List<byte[]> tensors = new ArrayList<>(record.size());
        // keys are "0".."n-1"; a gap fails the lookup
        for (int i = 0; i < record.size(); i++) {
            tensors.add(record.get(String.valueOf(i)).data());
        }
        return new Parameters(tensors, tensorType);
    }

    private static <T> T decoding(TaskType type, Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (NoSuchElementException | IllegalArgumentException | ClassCastException e) {
            throw new SchemaMismatchException(type.tag(), e.getMessage(), e);
        }
    }
}
