package federa.common.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Payload of a {@link Message} and the state held by a {@link Context}.
 *
 * <p>
 * Records are addressed by name. A name maps to exactly one record at a time:
 * setting a record replaces whatever was stored under that name, regardless of
 * its kind. Records are never merged. Not thread-safe.
 */
public final class Content {

    private final Map<String, ContentRecord> records = new LinkedHashMap<>();

    public void setConfigs(String name, ConfigsRecord record) {
        set(name, record);
    }

    public void setMetrics(String name, MetricsRecord record) {
        set(name, record);
    }

    public void setParameters(String name, ParametersRecord record) {
        set(name, record);
    }

    /** Store any record kind under a name. */
    public void set(String name, ContentRecord record) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(record, "record is required");
        records.put(name, record);
    }

    public ConfigsRecord getConfigs(String name) {
        return get(name, ConfigsRecord.class);
    }

    public MetricsRecord getMetrics(String name) {
        return get(name, MetricsRecord.class);
    }

    public ParametersRecord getParameters(String name) {
        return get(name, ParametersRecord.class);
    }

    private <T extends ContentRecord> T get(String name, Class<T> type) {
        ContentRecord record = records.get(name);
        if (!type.isInstance(record)) {
            throw new NoSuchElementException("No " + type.getSimpleName() + " named '" + name + "'");
        }
        return type.cast(record);
    }

    public boolean contains(String name) {
        return records.containsKey(name);
    }

    public ContentRecord remove(String name) {
        return records.remove(name);
    }

    /** Record names in insertion order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(records.keySet());
    }

    /** All records in insertion order. */
    public Map<String, ContentRecord> records() {
        return Collections.unmodifiableMap(records);
    }

    public Map<String, ConfigsRecord> configs() {
        return ofKind(ConfigsRecord.class);
    }

    public Map<String, MetricsRecord> metrics() {
        return ofKind(MetricsRecord.class);
    }

    public Map<String, ParametersRecord> parameters() {
        return ofKind(ParametersRecord.class);
    }

    private <T extends ContentRecord> Map<String, T> ofKind(Class<T> type) {
        Map<String, T> out = new LinkedHashMap<>();
        records.forEach((name, record) -> {
            if (type.isInstance(record)) {
                out.put(name, type.cast(record));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Content other))
            return false;
        return records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "Content" + records.keySet();
    }
}
