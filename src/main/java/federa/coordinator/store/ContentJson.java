package federa.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import federa.common.message.ConfigsRecord;
import federa.common.message.Content;
import federa.common.message.ContentRecord;
import federa.common.message.MetricsRecord;
import federa.common.message.ParametersRecord;
import federa.common.message.Tensor;
import federa.common.message.ValueRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link Content} for the task tables.
 *
 * <p>
 * Records and their keys are written as arrays to keep insertion order. Every
 * value carries a type tag so longs, doubles and byte arrays come back as the
 * same Java types.
 */
public final class ContentJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentJson() {
    }

    public static String write(Content content) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode records = root.putArray("records");
        content.records().forEach((name, record) -> {
            ObjectNode node = records.addObject();
            node.put("name", name);
            node.put("kind", record.kind().name());
            if (record instanceof ParametersRecord parameters) {
                writeTensors(node.putArray("tensors"), parameters);
            } else {
                writeValues(node.putArray("values"), (ValueRecord) record);
            }
        });
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize content " + content.names(), e);
        }
    }

    public static Content read(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed content JSON", e);
        }

        Content content = new Content();
        for (JsonNode node : root.path("records")) {
            String name = node.path("name").asText();
            ContentRecord.Kind kind = ContentRecord.Kind.valueOf(node.path("kind").asText());
            switch (kind) {
                case CONFIGS -> content.setConfigs(name, readValues(node.path("values"), new ConfigsRecord()));
                case METRICS -> content.setMetrics(name, readValues(node.path("values"), new MetricsRecord()));
                case PARAMETERS -> content.setParameters(name, readTensors(node.path("tensors")));
            }
        }
        return content;
    }

    private static void writeTensors(ArrayNode out, ParametersRecord record) {
        record.asMap().forEach((key, tensor) -> {
            ObjectNode node = out.addObject();
            node.put("key", key);
            node.put("dtype", tensor.dtype());
            ArrayNode shape = node.putArray("shape");
            tensor.shape().forEach(shape::add);
            node.put("stype", tensor.stype());
            node.put("data", tensor.data());
        });
    }

    private static ParametersRecord readTensors(JsonNode tensors) {
        ParametersRecord record = new ParametersRecord();
        for (JsonNode node : tensors) {
            List<Integer> shape = new ArrayList<>();
            node.path("shape").forEach(dim -> shape.add(dim.asInt()));
            record.put(node.path("key").asText(), new Tensor(
                    node.path("dtype").asText(),
                    shape,
                    node.path("stype").asText(),
                    binary(node.path("data"))));
        }
        return record;
    }

    private static void writeValues(ArrayNode out, ValueRecord record) {
        for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
            ObjectNode node = out.addObject();
            node.put("key", entry.getKey());
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                ArrayNode items = node.putArray("value");
                String elementType = "string";
                for (Object item : list) {
                    elementType = typeOf(item);
                    addScalar(items, item);
                }
                node.put("type", "list:" + elementType);
            } else {
                node.put("type", typeOf(value));
                ArrayNode holder = MAPPER.createArrayNode();
                addScalar(holder, value);
                node.set("value", holder.get(0));
            }
        }
    }

    private static <R extends ValueRecord> R readValues(JsonNode values, R record) {
        for (JsonNode node : values) {
            String type = node.path("type").asText();
            JsonNode value = node.path("value");
            if (type.startsWith("list:")) {
                String elementType = type.substring("list:".length());
                List<Object> items = new ArrayList<>();
                value.forEach(item -> items.add(readScalar(elementType, item)));
                record.put(node.path("key").asText(), items);
            } else {
                record.put(node.path("key").asText(), readScalar(type, value));
            }
        }
        return record;
    }

    private static String typeOf(Object value) {
        if (value instanceof String)
            return "string";
        if (value instanceof Boolean)
            return "bool";
        if (value instanceof Long)
            return "long";
        if (value instanceof Double)
            return "double";
        if (value instanceof byte[])
            return "bytes";
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    private static void addScalar(ArrayNode out, Object value) {
        if (value instanceof String s) {
            out.add(s);
        } else if (value instanceof Boolean b) {
            out.add(b);
        } else if (value instanceof Long l) {
            out.add(l);
        } else if (value instanceof Double d) {
            out.add(d);
        } else if (value instanceof byte[] bytes) {
            out.add(bytes);
        } else {
            throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
        }
    }

    private static Object readScalar(String type, JsonNode node) {
        return switch (type) {
            case "string" -> node.asText();
            case "bool" -> node.asBoolean();
            case "long" -> node.asLong();
            case "double" -> node.asDouble();
            case "bytes" -> binary(node);
            default -> throw new IllegalArgumentException("Unknown value type tag: " + type);
        };
    }

    private static byte[] binary(JsonNode node) {
        try {
            return node.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid base64 payload", e);
        }
    }
}
