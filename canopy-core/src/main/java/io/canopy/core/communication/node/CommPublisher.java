package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.node.Status;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Publishes a blackboard value on a topic.
///
/// Fails when the data key is configured but not set. Without a data key the message
/// carries no payload.
public class CommPublisher extends CommunicationLeaf {

    public static final String TOPIC = "topic";
    public static final String DATA_KEY = "dataKey";

    private final String topic;
    private final String dataKey;

    /// @param name node name, not null
    /// @param middleware middleware to publish through, not null
    /// @param topic target topic, not null
    /// @param dataKey blackboard key holding the payload, may be null
    public CommPublisher(String name, CommunicationMiddleware middleware, String topic, String dataKey) {
        super(name, middleware, Set.of(TOPIC, DATA_KEY));
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.dataKey = dataKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) {
        String key = resolveKey(DATA_KEY, dataKey);
        Object data = null;
        if (key != null) {
            data = blackboard.get(key);
            if (data == null) {
                return Status.FAILURE;
            }
        }
        getMiddleware().publish(String.valueOf(resolve(TOPIC, topic)), data, source());
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TOPIC, topic);
        if (dataKey != null) {
            attributes.put(DATA_KEY, dataKey);
        }
        return attributes;
    }
}
