package federa.common.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered collection of named tensors.
 */
public final class ParametersRecord implements ContentRecord {

    private final Map<String, Tensor> tensors = new LinkedHashMap<>();

    public ParametersRecord() {
    }

    public ParametersRecord(Map<String, Tensor> tensors) {
        if (tensors != null) {
            tensors.forEach(this::put);
        }
    }

    @Override
    public Kind kind() {
        return Kind.PARAMETERS;
    }

    public void put(String key, Tensor tensor) {
        Objects.requireNonNull(key, "key is required");
        tensors.put(key, Objects.requireNonNull(tensor, "tensor is required"));
    }

    /**
     * @throws NoSuchElementException if no tensor is stored under the key
     */
    public Tensor get(String key) {
        Tensor tensor = tensors.get(key);
        if (tensor == null) {
            throw new NoSuchElementException("No tensor for key '" + key + "'");
        }
        return tensor;
    }

    public Map<String, Tensor> asMap() {
        return Collections.unmodifiableMap(tensors);
    }

    public int size() {
        return tensors.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParametersRecord other))
            return false;
        return tensors.equals(other.tensors);
    }

    @Override
    public int hashCode() {
        return tensors.hashCode();
    }

    @Override
    public String toString() {
        return "ParametersRecord" + tensors.keySet();
    }
}
