package federa.common.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered string-keyed map of primitive values, shared by configs and metrics records.
 * Subclasses decide which value types are accepted.
 */
public abstract class ValueRecord implements ContentRecord {

    private final Map<String, Object> values = new LinkedHashMap<>();

    protected ValueRecord() {
    }

    protected ValueRecord(Map<String, ?> initial) {
        if (initial != null) {
            initial.forEach(this::put);
        }
    }

    /**
     * Set a value, replacing any previous value under the same key.
     *
     * @throws IllegalArgumentException if the value type is not accepted by this record
     */
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key is required");
        if (value == null) {
            throw new IllegalArgumentException("value for '" + key + "' must not be null");
        }
        values.put(key, normalize(key, value));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** Stored value; byte arrays are returned as copies. */
    public Object get(String key) {
        return Values.copyOut(values.get(key));
    }

    /**
     * Typed lookup.
     *
     * @throws NoSuchElementException   if the key is absent
     * @throws IllegalArgumentException if the value has another type
     */
    public <T> T get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new NoSuchElementException("No value for key '" + key + "'");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Value for key '" + key + "' is "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(Values.copyOut(value));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /** Ordered read-only snapshot; byte arrays are copies. */
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key, Values.copyOut(value)));
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Validate and widen a value before it is stored.
     */
    protected abstract Object normalize(String key, Object value);

    /** See {@link Values#widen(Object)}. */
    protected static Object widen(Object value) {
        return Values.widen(value);
    }

    /**
     * Normalize a list value: every element is widened, checked against the allowed
     * element types and must share one type.
     */
    protected static List<Object> normalizeList(String key, List<?> list, Set<Class<?>> allowed) {
        List<Object> out = new ArrayList<>(list.size());
        Class<?> elementType = null;
        for (Object element : list) {
            if (element == null) {
                throw new IllegalArgumentException("List for '" + key + "' contains null");
            }
            Object widened = widen(element);
            if (!allowed.contains(widened.getClass())) {
                throw new IllegalArgumentException("Unsupported list element type for '" + key + "': "
                        + element.getClass().getName());
            }
            if (elementType != null && elementType != widened.getClass()) {
                throw new IllegalArgumentException("List for '" + key + "' mixes element types");
            }
            elementType = widened.getClass();
            out.add(widened);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ValueRecord other = (ValueRecord) o;
        if (!values.keySet().equals(other.values.keySet()))
            return false;
        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (!Values.valueEquals(e.getValue(), other.values.get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = getClass().hashCode();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            h += e.getKey().hashCode() ^ Values.valueHash(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values.keySet();
    }
}
