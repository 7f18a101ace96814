package federa.node;

import federa.common.codec.SchemaMismatchException;
import federa.common.codec.TaskCodec;
import federa.common.message.Content;
import federa.common.message.Context;
import federa.common.message.Message;
import federa.common.model.TaskType;

import java.util.List;
import java.util.Objects;

/**
 * Node app that dispatches each message to a typed {@link Client} by call type,
 * wrapped in a chain of mods.
 */
public final class ClientApp implements NodeApp {

    private final ClientFactory clientFactory;
    private final NodeApp chain;

    public ClientApp(ClientFactory clientFactory) {
        this(clientFactory, List.of());
    }

    public ClientApp(ClientFactory clientFactory, List<Mod> mods) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory is required");
        this.chain = ModChain.wrap(this::dispatch, mods);
    }

    @Override
    public Message handle(Message message, Context context) throws Exception {
        return chain.handle(message, context);
    }

    /**
     * Terminal handler: decode, call the client, encode into a fresh message with
     * the same metadata.
     */
    private Message dispatch(Message message, Context context) {
        String tag = message.metadata().taskType();
        TaskType type = TaskType.find(tag)
                .orElseThrow(() -> new SchemaMismatchException(tag, "unsupported task type"));

        Client client = clientFactory.create(context);
        Content in = message.content();
        Content out = switch (type) {
            case GET_PROPERTIES -> TaskCodec.encode(client.getProperties(TaskCodec.decodeGetPropertiesIns(in)));
            case GET_PARAMETERS -> TaskCodec.encode(client.getParameters(TaskCodec.decodeGetParametersIns(in)));
            case FIT -> TaskCodec.encode(client.fit(TaskCodec.decodeFitIns(in)));
            case EVALUATE -> TaskCodec.encode(client.evaluate(TaskCodec.decodeEvaluateIns(in)));
        };
        return new Message(message.metadata(), out);
    }
}
