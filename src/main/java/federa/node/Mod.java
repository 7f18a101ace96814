package federa.node;

import federa.common.message.Context;
import federa.common.message.Message;

/**
 * Middleware around a {@link NodeApp}.
 *
 * <p>
 * A mod may work on the message and the context, then call {@code next} and work
 * on the returned message. Returning without calling {@code next} short-circuits
 * the chain: nothing positioned after this mod runs. Errors thrown by {@code next}
 * reach the mod unchanged; a mod that wants to turn an error into a message must
 * catch it itself.
 */
@FunctionalInterface
public interface Mod {

    Message apply(Message message, Context context, NodeApp next) throws Exception;
}
