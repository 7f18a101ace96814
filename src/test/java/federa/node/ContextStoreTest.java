package federa.node;

import federa.common.message.Context;
import federa.common.message.MetricsRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextStoreTest {

    @Test
    void registerIsIdempotent() {
        ContextStore store = new ContextStore();

        Context first = store.registerContext(7);
        first.state().setMetrics("m", new MetricsRecord(Map.of("x", 1L)));
        Context second = store.registerContext(7);

        assertSame(first, second);
        assertTrue(second.state().contains("m"));
    }

    @Test
    void contextsAreSeparatedByRun() {
        ContextStore store = new ContextStore();

        store.registerContext(1).state().setMetrics("m", new MetricsRecord());
        store.registerContext(2);

        assertTrue(store.retrieveContext(1).state().contains("m"));
        assertFalse(store.retrieveContext(2).state().contains("m"));
    }

    @Test
    void retrieveUnknownRunFails() {
        ContextStore store = new ContextStore();
        assertThrows(IllegalStateException.class, () -> store.retrieveContext(42));
    }

    @Test
    void updateReplacesContext() {
        ContextStore store = new ContextStore();
        store.registerContext(3);

        Context replacement = new Context();
        store.updateContext(3, replacement);

        assertSame(replacement, store.retrieveContext(3));
        store.removeContext(3);
        assertFalse(store.hasContext(3));
    }
}
