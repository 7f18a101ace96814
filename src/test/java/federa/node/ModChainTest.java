package federa.node;

import federa.common.message.ConfigsRecord;
import federa.common.message.Content;
import federa.common.message.Context;
import federa.common.message.Message;
import federa.common.message.Metadata;
import federa.common.message.MetricsRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ModChainTest {

    private static final String METRIC = "context";
    private static final String COUNTER = "counter";

    private static void incrementCounter(Context context) {
        long current = context.state().getMetrics(METRIC).get(COUNTER, Long.class);
        context.state().setMetrics(METRIC, new MetricsRecord(Map.of(COUNTER, current + 1)));
    }

    private static Mod tracingMod(String name, List<String> footprint) {
        return (message, context, next) -> {
            footprint.add(name);
            message.content().setConfigs(name, new ConfigsRecord());
            incrementCounter(context);

            Message out = next.handle(message, context);

            footprint.add(name);
            incrementCounter(context);
            out.content().setConfigs(name, new ConfigsRecord());
            return out;
        };
    }

    private static NodeApp tracingApp(String name, List<String> footprint) {
        return (message, context) -> {
            footprint.add(name);
            message.content().setConfigs(name, new ConfigsRecord());
            Message out = new Message(message.metadata(), new Content());
            out.content().setConfigs(name, new ConfigsRecord());
            return out;
        };
    }

    private static Message dummyMessage() {
        return new Message(new Metadata(0, "", "", "", "mock"), new Content());
    }

    private static Context counterContext() {
        Content state = new Content();
        state.setMetrics(METRIC, new MetricsRecord(Map.of(COUNTER, 0L)));
        return new Context(state);
    }

    @Test
    void multipleModsRunInOnionOrder() throws Exception {
        // Prepare
        List<String> footprint = new ArrayList<>();
        List<String> modNames = IntStream.rangeClosed(1, 14).mapToObj(i -> "mod" + i).toList();
        List<Mod> mods = modNames.stream().map(name -> tracingMod(name, footprint)).toList();
        Context context = counterContext();
        Message message = dummyMessage();

        // Execute
        NodeApp wrapped = ModChain.wrap(tracingApp("app", footprint), mods);
        Message out = wrapped.handle(message, context);

        // Assert
        List<String> trace = new ArrayList<>(modNames);
        trace.add("app");
        List<String> reversedMods = new ArrayList<>(modNames);
        Collections.reverse(reversedMods);
        List<String> expectedFootprint = new ArrayList<>(trace);
        expectedFootprint.addAll(reversedMods);
        assertEquals(expectedFootprint, footprint);

        assertEquals(String.join("", trace), String.join("", message.content().configs().keySet()));
        List<String> reversedTrace = new ArrayList<>(trace);
        Collections.reverse(reversedTrace);
        assertEquals(String.join("", reversedTrace), String.join("", out.content().configs().keySet()));

        assertEquals(2L * mods.size(), context.state().getMetrics(METRIC).get(COUNTER, Long.class));
    }

    @Test
    void modCanFilterIncomingMessage() throws Exception {
        // Prepare
        List<String> footprint = new ArrayList<>();
        Message message = dummyMessage();
        Mod filter = (in, context, next) -> {
            footprint.add("filter");
            in.content().setConfigs("filter", new ConfigsRecord());
            Message out = new Message(in.metadata(), new Content());
            out.content().setConfigs("filter", new ConfigsRecord());
            // Skip calling next
            return out;
        };

        // Execute
        Message out = ModChain.wrap(tracingApp("app", footprint), List.of(filter)).handle(message, new Context());

        // Assert
        assertEquals(List.of("filter"), footprint);
        assertEquals("filter", message.content().names().iterator().next());
        assertEquals("filter", out.content().names().iterator().next());
    }

    @Test
    void shortCircuitInTheMiddleSkipsInnerStages() throws Exception {
        // Prepare: mod1, mod2, stop, mod4, app
        List<String> footprint = new ArrayList<>();
        Mod stop = (in, context, next) -> {
            footprint.add("stop");
            footprint.add("stop");
            return new Message(in.metadata(), new Content());
        };
        List<Mod> mods = List.of(
                tracingMod("mod1", footprint),
                tracingMod("mod2", footprint),
                stop,
                tracingMod("mod4", footprint));
        Context context = counterContext();

        // Execute
        ModChain.wrap(tracingApp("app", footprint), mods).handle(dummyMessage(), context);

        // Assert
        assertEquals(List.of("mod1", "mod2", "stop", "stop", "mod2", "mod1"), footprint);
        assertEquals(4L, context.state().getMetrics(METRIC).get(COUNTER, Long.class));
    }

    @Test
    void contextChangesAreVisibleToOuterPostProcessing() throws Exception {
        Mod outer = (in, context, next) -> {
            Message out = next.handle(in, context);
            // written by the app below
            long seen = context.state().getMetrics("app").get("calls", Long.class);
            out.content().setMetrics("seen", new MetricsRecord(Map.of("calls", seen)));
            return out;
        };
        NodeApp app = (in, context) -> {
            context.state().setMetrics("app", new MetricsRecord(Map.of("calls", 1L)));
            return new Message(in.metadata(), new Content());
        };

        Message out = ModChain.wrap(app, List.of(outer)).handle(dummyMessage(), new Context());

        assertEquals(1L, out.content().getMetrics("seen").get("calls", Long.class));
    }

    @Test
    void errorsPropagateUnchangedThroughPostProcessing() {
        List<String> footprint = new ArrayList<>();
        IllegalStateException boom = new IllegalStateException("boom");
        NodeApp failing = (in, context) -> {
            footprint.add("app");
            throw boom;
        };
        Mod observer = (in, context, next) -> {
            footprint.add("observer");
            Message out = next.handle(in, context);
            footprint.add("observer-after");
            return out;
        };

        NodeApp wrapped = ModChain.wrap(failing, List.of(observer, observer));
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> wrapped.handle(dummyMessage(), new Context()));

        assertSame(boom, thrown);
        assertEquals(List.of("observer", "observer", "app"), footprint);
    }

    @Test
    void modCanRecoverFromInnerError() throws Exception {
        NodeApp failing = (in, context) -> {
            throw new IllegalArgumentException("bad input");
        };
        Mod recovering = (in, context, next) -> {
            try {
                return next.handle(in, context);
            } catch (IllegalArgumentException e) {
                Message out = new Message(in.metadata(), new Content());
                out.content().setConfigs("error", new ConfigsRecord(Map.of("message", e.getMessage())));
                return out;
            }
        };

        Message out = ModChain.wrap(failing, List.of(recovering)).handle(dummyMessage(), new Context());

        assertEquals("bad input", out.content().getConfigs("error").get("message", String.class));
    }

    @Test
    void emptyModListCallsAppDirectly() throws Exception {
        List<String> footprint = new ArrayList<>();
        Message out = ModChain.wrap(tracingApp("app", footprint), List.of()).handle(dummyMessage(), new Context());

        assertEquals(List.of("app"), footprint);
        assertEquals(List.of("app"), out.content().names().stream().collect(Collectors.toList()));
    }

    @Test
    void rejectsMissingAppOrMods() {
        NodeApp app = (in, context) -> in;
        assertThrows(NullPointerException.class, () -> ModChain.wrap(null, List.of()));
        assertThrows(NullPointerException.class, () -> ModChain.wrap(app, null));
    }
}
