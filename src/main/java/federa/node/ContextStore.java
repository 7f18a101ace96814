package federa.node;

import federa.common.message.Context;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Contexts of one node, one per run. A context survives across calls of the same
 * run; callers must not run two calls for the same node concurrently.
 */
public final class ContextStore {

    private final Map<Long, Context> contexts = new ConcurrentHashMap<>();

    /**
     * Create an empty context for the run unless one exists.
     */
    public Context registerContext(long runId) {
        return contexts.computeIfAbsent(runId, id -> new Context());
    }

    /**
     * @throws IllegalStateException if no context was registered for the run
     */
    public Context retrieveContext(long runId) {
        Context context = contexts.get(runId);
        if (context == null) {
            throw new IllegalStateException("No context registered for run " + runId);
        }
        return context;
    }

    public void updateContext(long runId, Context context) {
        contexts.put(runId, Objects.requireNonNull(context, "context is required"));
    }

    public boolean hasContext(long runId) {
        return contexts.containsKey(runId);
    }

    public void removeContext(long runId) {
        contexts.remove(runId);
    }
}
