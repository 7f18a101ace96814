package federa.common.message;

import java.util.Objects;

/**
 * Long-lived state of one node, shared by reference with every mod and the
 * terminal handler of each call on that node. Never transmitted.
 *
 * <p>
 * Not safe for concurrent mutation: run at most one call per node at a time.
 */
public final class Context {

    private final Content state;

    public Context() {
        this(new Content());
    }

    public Context(Content state) {
        this.state = Objects.requireNonNull(state, "state is required");
    }

    public Content state() {
        return state;
    }

    @Override
    public String toString() {
        return "Context{state=" + state.names() + "}";
    }
}
