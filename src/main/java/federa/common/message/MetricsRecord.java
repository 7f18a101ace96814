package federa.common.message;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Numeric values: longs, doubles, or homogeneous lists of either.
 */
public final class MetricsRecord extends ValueRecord {

    private static final Set<Class<?>> NUMBERS = Set.of(Long.class, Double.class);

    public MetricsRecord() {
    }

    public MetricsRecord(Map<String, ?> values) {
        super(values);
    }

    @Override
    public Kind kind() {
        return Kind.METRICS;
    }

    @Override
    protected Object normalize(String key, Object value) {
        if (value instanceof List<?> list) {
            return normalizeList(key, list, NUMBERS);
        }
        Object widened = widen(value);
        if (!NUMBERS.contains(widened.getClass())) {
            throw new IllegalArgumentException("Unsupported metric value type for '" + key + "': "
                    + value.getClass().getName());
        }
        return widened;
    }
}
