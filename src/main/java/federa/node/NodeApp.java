package federa.node;

import federa.common.message.Context;
import federa.common.message.Message;

/**
 * Handles one message for a node. Used both for the terminal handler and for
 * the "rest of the chain" a {@link Mod} delegates to.
 */
@FunctionalInterface
public interface NodeApp {

    Message handle(Message message, Context context) throws Exception;
}
