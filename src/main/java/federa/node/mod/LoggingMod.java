package federa.node.mod;

import federa.common.message.Context;
import federa.common.message.Message;
import federa.common.message.Metadata;
import federa.node.Mod;
import federa.node.NodeApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every call passing through it with its duration. Errors are logged and
 * rethrown unchanged.
 */
public final class LoggingMod implements Mod {

    private static final Logger log = LoggerFactory.getLogger(LoggingMod.class);

    @Override
    public Message apply(Message message, Context context, NodeApp next) throws Exception {
        Metadata metadata = message.metadata();
        long start = System.nanoTime();
        log.debug("-> {} task {} (run {})", metadata.taskType(), metadata.taskId(), metadata.runId());

        try {
            Message out = next.handle(message, context);
            log.debug("<- {} task {} in {}ms", metadata.taskType(), metadata.taskId(), elapsedMs(start));
            return out;
        } catch (Exception e) {
            log.warn("{} task {} failed after {}ms: {}", metadata.taskType(), metadata.taskId(), elapsedMs(start),
                    e.toString());
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
