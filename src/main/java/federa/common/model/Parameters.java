package federa.common.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Model parameters as opaque serialized tensors.
 *
 * @param tensors    serialized tensors, in order
 * @param tensorType how the tensors were serialized (e.g. "numpy.ndarray")
 */
public record Parameters(List<byte[]> tensors, String tensorType) {

    public Parameters {
        Objects.requireNonNull(tensors, "tensors is required");
        Objects.requireNonNull(tensorType, "tensorType is required");
        List<byte[]> copy = new ArrayList<>(tensors.size());
        for (byte[] tensor : tensors) {
            copy.add(Objects.requireNonNull(tensor, "tensor must not be null").clone());
        }
        tensors = Collections.unmodifiableList(copy);
    }

    public static Parameters empty(String tensorType) {
        return new Parameters(List.of(), tensorType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Parameters other))
            return false;
        if (!tensorType.equals(other.tensorType) || tensors.size() != other.tensors.size())
            return false;
        for (int i = 0; i < tensors.size(); i++) {
            if (!Arrays.equals(tensors.get(i), other.tensors.get(i)))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = tensorType.hashCode();
        for (byte[] tensor : tensors) {
            h = 31 * h + Arrays.hashCode(tensor);
        }
        return h;
    }

    @Override
    public String toString() {
        return "Parameters{tensors=" + tensors.size() + ", tensorType='" + tensorType + "'}";
    }
}
