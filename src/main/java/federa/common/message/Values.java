package federa.common.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical form, copying and comparison of record values. Shared by the
 * content records and the typed call values so both hold the same Java types.
 */
public final class Values {

    private Values() {
    }

    /**
     * Widen integral boxes to Long and Float to Double; copy byte arrays.
     * Other values are returned as they are.
     */
    public static Object widen(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        return value;
    }

    /**
     * {@link #widen(Object)} applied to a scalar or to every element of a list.
     * Lists come back unmodifiable.
     */
    public static Object canonical(Object value) {
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(widen(element));
            }
            return Collections.unmodifiableList(out);
        }
        return widen(value);
    }

    /** Copy of a stored value safe to hand out: byte arrays are cloned, also inside lists. */
    public static Object copyOut(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof byte[]) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(((byte[]) element).clone());
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    /** Equality that compares byte arrays by content, also inside lists. */
    public static boolean valueEquals(Object a, Object b) {
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size())
                return false;
            for (int i = 0; i < la.size(); i++) {
                if (!Objects.deepEquals(la.get(i), lb.get(i)))
                    return false;
            }
            return true;
        }
        return Objects.deepEquals(a, b);
    }

    /** Hash consistent with {@link #valueEquals(Object, Object)}. */
    public static int valueHash(Object value) {
        if (value instanceof byte[] bytes) {
            return Arrays.hashCode(bytes);
        }
        if (value instanceof List<?> list) {
            int h = 1;
            for (Object element : list) {
                h = 31 * h + valueHash(element);
            }
            return h;
        }
        return Objects.hashCode(value);
    }
}
