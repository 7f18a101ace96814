package federa.common.message;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration values: strings, booleans, longs, doubles, byte arrays, or
 * homogeneous lists of one of those.
 */
public final class ConfigsRecord extends ValueRecord {

    private static final Set<Class<?>> SCALARS = Set.of(
            String.class, Boolean.class, Long.class, Double.class, byte[].class);

    public ConfigsRecord() {
    }

    public ConfigsRecord(Map<String, ?> values) {
        super(values);
    }

    @Override
    public Kind kind() {
        return Kind.CONFIGS;
    }

    @Override
    protected Object normalize(String key, Object value) {
        if (value instanceof List<?> list) {
            return normalizeList(key, list, SCALARS);
        }
        Object widened = widen(value);
        if (!SCALARS.contains(widened.getClass())) {
            throw new IllegalArgumentException("Unsupported config value type for '" + key + "': "
                    + value.getClass().getName());
        }
        return widened;
    }
}
