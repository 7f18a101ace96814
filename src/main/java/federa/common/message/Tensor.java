package federa.common.message;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Serialized numeric array. The data bytes are opaque to the pipeline.
 */
public final class Tensor {

    private final String dtype;
    private final List<Integer> shape;
    private final String stype;
    private final byte[] data;

    public Tensor(String dtype, List<Integer> shape, String stype, byte[] data) {
        this.dtype = Objects.requireNonNull(dtype, "dtype is required");
        this.shape = List.copyOf(Objects.requireNonNull(shape, "shape is required"));
        this.stype = Objects.requireNonNull(stype, "stype is required");
        this.data = Objects.requireNonNull(data, "data is required").clone();
    }

    public String dtype() {
        return dtype;
    }

    public List<Integer> shape() {
        return shape;
    }

    public String stype() {
        return stype;
    }

    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Tensor tensor))
            return false;
        return dtype.equals(tensor.dtype)
                && shape.equals(tensor.shape)
                && stype.equals(tensor.stype)
                && Arrays.equals(data, tensor.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dtype, shape, stype, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "Tensor{dtype='" + dtype + "', shape=" + shape + ", stype='" + stype + "', bytes=" + data.length + "}";
    }
}
