package federa.common.codec;

import federa.common.message.ConfigsRecord;
import federa.common.message.Content;
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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskCodecTest {

    private static final Parameters WEIGHTS = new Parameters(
            List.of(new byte[] { 1, 2 }, new byte[] { 3 }), "numpy.ndarray");

    @Test
    void fitInsKeepsTensorOrderAndConfig() {
        FitIns ins = new FitIns(WEIGHTS, Map.of("epochs", 2L, "lr", 0.01));

        FitIns decoded = TaskCodec.decodeFitIns(TaskCodec.encode(ins));

        assertEquals(ins, decoded);
        assertArrayEquals(new byte[] { 3 }, decoded.parameters().tensors().get(1));
    }

    @Test
    void fitResCarriesAllFields() {
        FitRes res = new FitRes(Status.OK, WEIGHTS, 120, Map.of("accuracy", 0.9));

        Content content = TaskCodec.encode(res);

        assertTrue(content.contains("fitres.parameters"));
        assertTrue(content.contains("fitres.status"));
        assertEquals(120L, content.getMetrics("fitres.num_examples").get("num_examples", Long.class));
        assertEquals(res, TaskCodec.decodeFitRes(content));
    }

    @Test
    void emptyParametersKeepTensorType() {
        GetParametersRes res = new GetParametersRes(Status.OK, Parameters.empty("pickle"));

        GetParametersRes decoded = TaskCodec.decodeGetParametersRes(TaskCodec.encode(res));

        assertTrue(decoded.parameters().tensors().isEmpty());
        assertEquals("pickle", decoded.parameters().tensorType());
    }

    @Test
    void statusCodeAndMessageSurvive() {
        EvaluateRes res = new EvaluateRes(
                new Status(Code.EVALUATE_NOT_IMPLEMENTED, "no eval"), 0.0, 0, Map.of());

        EvaluateRes decoded = TaskCodec.decodeEvaluateRes(TaskCodec.encode(res));

        assertEquals(Code.EVALUATE_NOT_IMPLEMENTED, decoded.status().code());
        assertEquals("no eval", decoded.status().message());
    }

    @Test
    void evaluateResRoundTrip() {
        EvaluateRes res = new EvaluateRes(Status.OK, 0.25, 64, Map.of("acc", 0.8, "tag", "val"));
        assertEquals(res, TaskCodec.decodeEvaluateRes(TaskCodec.encode(res)));
    }

    @Test
    void configOnlyCallsRoundTrip() {
        GetPropertiesIns props = new GetPropertiesIns(Map.of("detail", true));
        assertEquals(props, TaskCodec.decodeGetPropertiesIns(TaskCodec.encode(props)));

        GetParametersIns params = new GetParametersIns(Map.of());
        assertEquals(params, TaskCodec.decodeGetParametersIns(TaskCodec.encode(params)));

        GetPropertiesRes propsRes = new GetPropertiesRes(Status.OK, Map.of("cores", 4L));
        assertEquals(propsRes, TaskCodec.decodeGetPropertiesRes(TaskCodec.encode(propsRes)));

        EvaluateIns eval = new EvaluateIns(WEIGHTS, Map.of("batch", 32L));
        assertEquals(eval, TaskCodec.decodeEvaluateIns(TaskCodec.encode(eval)));
    }

    @Test
    void missingRecordIsSchemaMismatch() {
        Content content = TaskCodec.encode(new FitRes(Status.OK, WEIGHTS, 1, Map.of()));
        content.remove("fitres.num_examples");

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> TaskCodec.decodeFitRes(content));
        assertEquals("fit", e.taskType());
    }

    @Test
    void wrongValueTypeIsSchemaMismatch() {
        Content content = TaskCodec.encode(new EvaluateRes(Status.OK, 1.0, 1, Map.of()));
        ConfigsRecord status = new ConfigsRecord();
        status.put("code", "zero");
        status.put("message", "bad");
        content.setConfigs("evaluateres.status", status);

        assertThrows(SchemaMismatchException.class, () -> TaskCodec.decodeEvaluateRes(content));
    }

    @Test
    void decodingAnotherCallTypeIsSchemaMismatch() {
        Content content = TaskCodec.encode(new GetPropertiesIns(Map.of()));
        assertThrows(SchemaMismatchException.class, () -> TaskCodec.decodeEvaluateIns(content));
    }

    @Test
    void intAndFloatValuesRoundTripForEveryCall() {
        Map<String, Object> config = Map.of("epochs", 2, "lr", 0.5f, "sizes", List.of(1, 2), "tiny", (short) 3);
        Map<String, Object> metrics = Map.of("acc", 0.25f, "batches", 7, "steps", List.of((byte) 1, (byte) 2));

        GetPropertiesIns propsIns = new GetPropertiesIns(config);
        assertEquals(propsIns, TaskCodec.decodeGetPropertiesIns(TaskCodec.encode(propsIns)));

        GetPropertiesRes propsRes = new GetPropertiesRes(Status.OK, config);
        assertEquals(propsRes, TaskCodec.decodeGetPropertiesRes(TaskCodec.encode(propsRes)));

        GetParametersIns paramsIns = new GetParametersIns(config);
        assertEquals(paramsIns, TaskCodec.decodeGetParametersIns(TaskCodec.encode(paramsIns)));

        GetParametersRes paramsRes = new GetParametersRes(Status.OK, WEIGHTS);
        assertEquals(paramsRes, TaskCodec.decodeGetParametersRes(TaskCodec.encode(paramsRes)));

        FitIns fitIns = new FitIns(WEIGHTS, config);
        assertEquals(fitIns, TaskCodec.decodeFitIns(TaskCodec.encode(fitIns)));

        FitRes fitRes = new FitRes(Status.OK, WEIGHTS, 5, metrics);
        assertEquals(fitRes, TaskCodec.decodeFitRes(TaskCodec.encode(fitRes)));

        EvaluateIns evalIns = new EvaluateIns(WEIGHTS, config);
        assertEquals(evalIns, TaskCodec.decodeEvaluateIns(TaskCodec.encode(evalIns)));

        EvaluateRes evalRes = new EvaluateRes(Status.OK, 0.1, 5, metrics);
        assertEquals(evalRes, TaskCodec.decodeEvaluateRes(TaskCodec.encode(evalRes)));
    }

    @Test
    void typedValuesHoldWidenedTypes() {
        FitIns ins = new FitIns(WEIGHTS, Map.of("epochs", 2, "lr", 0.5f, "sizes", List.of(1, 2)));

        assertEquals(2L, ins.config().get("epochs"));
        assertEquals(0.5, ins.config().get("lr"));
        assertEquals(List.of(1L, 2L), ins.config().get("sizes"));
    }

    @Test
    void byteValuesAreCopiedAndComparedByContent() {
        byte[] blob = { 7 };
        GetPropertiesRes res = new GetPropertiesRes(Status.OK, Map.of("blob", blob));
        blob[0] = 0;

        byte[] read = (byte[]) res.properties().get("blob");
        assertArrayEquals(new byte[] { 7 }, read);
        read[0] = 1;
        assertArrayEquals(new byte[] { 7 }, (byte[]) res.properties().get("blob"));

        GetPropertiesRes same = new GetPropertiesRes(Status.OK, Map.of("blob", new byte[] { 7 }));
        assertEquals(res, same);
        assertEquals(res.hashCode(), same.hashCode());
        assertEquals(res, TaskCodec.decodeGetPropertiesRes(TaskCodec.encode(res)));
    }

    @Test
    void tensorsAreOrderedByIndexKey() {
        Content content = TaskCodec.encode(new FitIns(WEIGHTS, Map.of()));
        ParametersRecord reversed = new ParametersRecord();
        reversed.put("1", new Tensor("", List.of(), "numpy.ndarray", new byte[] { 3 }));
        reversed.put("0", new Tensor("", List.of(), "numpy.ndarray", new byte[] { 1, 2 }));
        content.setParameters("fitins.parameters", reversed);

        FitIns decoded = TaskCodec.decodeFitIns(content);

        assertEquals(WEIGHTS, decoded.parameters());
    }

    @Test
    void gapInTensorIndexIsSchemaMismatch() {
        Content content = TaskCodec.encode(new FitIns(WEIGHTS, Map.of()));
        ParametersRecord gapped = new ParametersRecord();
        gapped.put("0", new Tensor("", List.of(), "numpy.ndarray", new byte[] { 1 }));
        gapped.put("2", new Tensor("", List.of(), "numpy.ndarray", new byte[] { 2 }));
        content.setParameters("fitins.parameters", gapped);

        assertThrows(SchemaMismatchException.class, () -> TaskCodec.decodeFitIns(content));
    }
}
