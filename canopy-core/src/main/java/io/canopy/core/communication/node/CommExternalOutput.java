package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.node.Status;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Sends a blackboard value out through an external output channel.
///
/// Fails when the data key is not set.
public class CommExternalOutput extends CommunicationLeaf {

    public static final String CHANNEL = "channel";
    public static final String DATA_KEY = "dataKey";

    private final String channel;
    private final String dataKey;

    public CommExternalOutput(String name, CommunicationMiddleware middleware, String channel, String dataKey) {
        super(name, middleware, Set.of(CHANNEL, DATA_KEY));
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.dataKey = Objects.requireNonNull(dataKey, "dataKey must not be null");
    }

    @Override
    protected Status communicate(Blackboard blackboard) {
        Object data = blackboard.get(resolveKey(DATA_KEY, dataKey));
        if (data == null) {
            return Status.FAILURE;
        }
        getMiddleware().externalOutput(String.valueOf(resolve(CHANNEL, channel)), data);
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(CHANNEL, channel, DATA_KEY, dataKey);
    }
}
