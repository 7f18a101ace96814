package federa.common.model;

import federa.common.message.Values;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only, order-preserving config map held by the typed call values.
 *
 * <p>
 * Values are stored in the same canonical form as {@link federa.common.message.ConfigsRecord}
 * (integral boxes as Long, Float as Double, byte arrays copied). Byte arrays are
 * handed out as copies and compared by content.
 */
final class Configs extends AbstractMap<String, Object> {

    private static final Configs EMPTY = new Configs(Map.of());

    private final Map<String, Object> values;

    private Configs(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Values.canonical(value)));
        this.values = Collections.unmodifiableMap(copy);
    }

    /** Canonical copy; null becomes an empty map. */
    static Map<String, Object> copy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        return new Configs(source);
    }

    @Override
    public Object get(Object key) {
        return Values.copyOut(values.get(key));
    }

    @Override
    public boolean containsKey(Object key) {
        return values.containsKey(key);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        Set<Entry<String, Object>> entries = new LinkedHashSet<>();
        values.forEach((key, value) -> entries.add(new SimpleImmutableEntry<>(key, Values.copyOut(value))));
        return Collections.unmodifiableSet(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Map<?, ?> other))
            return false;
        if (size() != other.size())
            return false;
        for (Entry<String, Object> e : values.entrySet()) {
            if (!other.containsKey(e.getKey()) || !Values.valueEquals(e.getValue(), other.get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Entry<String, Object> e : values.entrySet()) {
            h += e.getKey().hashCode() ^ Values.valueHash(e.getValue());
        }
        return h;
    }
}
