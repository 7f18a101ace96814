package federa.common.message;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ContentTest {

    @Test
    void nameHoldsOneRecordAcrossKinds() {
        Content content = new Content();
        content.setConfigs("shared", new ConfigsRecord(Map.of("a", "x")));
        content.setMetrics("shared", new MetricsRecord(Map.of("b", 1.5)));

        assertEquals(1, content.names().size());
        assertTrue(content.configs().isEmpty());
        assertEquals(1.5, content.getMetrics("shared").get("b", Double.class));
        assertThrows(NoSuchElementException.class, () -> content.getConfigs("shared"));
    }

    @Test
    void settingReplacesWithoutMerging() {
        Content content = new Content();
        content.setConfigs("c", new ConfigsRecord(Map.of("a", "x")));
        content.setConfigs("c", new ConfigsRecord(Map.of("b", "y")));

        ConfigsRecord record = content.getConfigs("c");
        assertFalse(record.containsKey("a"));
        assertEquals("y", record.get("b", String.class));
    }

    @Test
    void namesKeepInsertionOrder() {
        Content content = new Content();
        content.setMetrics("z", new MetricsRecord());
        content.setParameters("a", new ParametersRecord());
        content.setConfigs("m", new ConfigsRecord());

        assertEquals(List.of("z", "a", "m"), List.copyOf(content.names()));
        assertEquals(List.of("a"), List.copyOf(content.parameters().keySet()));
    }

    @Test
    void missingRecordIsReported() {
        Content content = new Content();
        assertThrows(NoSuchElementException.class, () -> content.getParameters("nope"));
    }

    @Test
    void integralAndFloatValuesAreWidened() {
        ConfigsRecord configs = new ConfigsRecord();
        configs.put("i", 3);
        configs.put("f", 0.5f);
        configs.put("list", List.of(1, 2, 3));

        assertEquals(3L, configs.get("i"));
        assertEquals(0.5, configs.get("f"));
        assertEquals(List.of(1L, 2L, 3L), configs.get("list"));
    }

    @Test
    void unsupportedValuesAreRejected() {
        MetricsRecord metrics = new MetricsRecord();
        assertThrows(IllegalArgumentException.class, () -> metrics.put("s", "not a number"));
        assertThrows(IllegalArgumentException.class, () -> metrics.put("mixed", List.of(1L, 2.0)));
        assertThrows(IllegalArgumentException.class, () -> metrics.put("null", null));

        ConfigsRecord configs = new ConfigsRecord();
        assertThrows(IllegalArgumentException.class, () -> configs.put("obj", new Object()));
    }

    @Test
    void typedLookupChecksType() {
        ConfigsRecord configs = new ConfigsRecord(Map.of("flag", true));

        assertTrue(configs.get("flag", Boolean.class));
        assertThrows(IllegalArgumentException.class, () -> configs.get("flag", String.class));
        assertThrows(NoSuchElementException.class, () -> configs.get("other", Boolean.class));
    }

    @Test
    void recordsWithBytesCompareByContent() {
        ConfigsRecord a = new ConfigsRecord(Map.of("blob", new byte[] { 1, 2 }));
        ConfigsRecord b = new ConfigsRecord(Map.of("blob", new byte[] { 1, 2 }));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void tensorDataIsCopied() {
        byte[] data = { 9, 8 };
        Tensor tensor = new Tensor("float32", List.of(2), "numpy.ndarray", data);
        data[0] = 0;

        assertArrayEquals(new byte[] { 9, 8 }, tensor.data());
    }

    @Test
    void byteValuesAreCopiedInAndOut() {
        byte[] blob = { 1, 2 };
        ConfigsRecord configs = new ConfigsRecord();
        configs.put("blob", blob);
        blob[0] = 9;

        byte[] read = configs.get("blob", byte[].class);
        assertArrayEquals(new byte[] { 1, 2 }, read);
        read[1] = 9;
        assertArrayEquals(new byte[] { 1, 2 }, (byte[]) configs.get("blob"));
        assertArrayEquals(new byte[] { 1, 2 }, (byte[]) configs.asMap().get("blob"));
    }
}
