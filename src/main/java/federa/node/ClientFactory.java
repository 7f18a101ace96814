package federa.node;

import federa.common.message.Context;

/**
 * Builds the client for one call. The client may read and write the node context.
 */
@FunctionalInterface
public interface ClientFactory {

    Client create(Context context);
}
