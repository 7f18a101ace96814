package federa.node;

import federa.common.message.Context;
import federa.common.message.Message;

import java.util.List;
import java.util.Objects;

/**
 * Composes mods {@code [m1..mn]} around a terminal app into a single {@link NodeApp}.
 *
 * <p>
 * Calls nest like an onion: {@code m1} runs first and delegates to a stage that
 * runs {@code m2}, and so on until {@code mn} delegates to the app. Post-processing
 * therefore runs in reverse order. Every stage sees the same {@link Context}
 * instance. The chain adds no retry and no error handling of its own.
 */
public final class ModChain implements NodeApp {

    private final List<Mod> mods;
    private final NodeApp app;

    public ModChain(NodeApp app, List<Mod> mods) {
        this.app = Objects.requireNonNull(app, "app is required");
        this.mods = List.copyOf(Objects.requireNonNull(mods, "mods is required"));
    }

    /**
     * Wrap an app with mods, outermost first.
     */
    public static NodeApp wrap(NodeApp app, List<Mod> mods) {
        return new ModChain(app, mods);
    }

    @Override
    public Message handle(Message message, Context context) throws Exception {
        return stage(0).handle(message, context);
    }

    public int size() {
        return mods.size();
    }

    private NodeApp stage(int index) {
        if (index == mods.size()) {
            return app;
        }
        Mod mod = mods.get(index);
        return (message, context) -> mod.apply(message, context, stage(index + 1));
    }
}
