package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.communication.TopicBus;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.event.EventInfo;
import io.canopy.core.node.Status;
import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Waits for a message on a topic and stores its payload.
///
/// A message published before the tick is picked up immediately, since topic events stay
/// pending on the dispatcher until consumed. Fails when the timeout passes.
public class CommSubscriber extends CommunicationLeaf {

    public static final String TOPIC = "topic";
    public static final String OUTPUT_KEY = "outputKey";
    public static final String TIMEOUT = "timeout";

    private final String topic;
    private final String outputKey;
    private final Duration timeout;

    /// @param name node name, not null
    /// @param middleware middleware to listen on, not null
    /// @param topic topic to wait for, not null
    /// @param outputKey key receiving the payload, may be null
    /// @param timeout maximum wait per tick, not null
    public CommSubscriber(
            String name, CommunicationMiddleware middleware, String topic, String outputKey, Duration timeout) {
        super(name, middleware, Set.of(TOPIC, OUTPUT_KEY, TIMEOUT));
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.outputKey = outputKey;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public CommSubscriber(String name, CommunicationMiddleware middleware, String topic, String outputKey) {
        this(name, middleware, topic, outputKey, DEFAULT_TIMEOUT);
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws InterruptedException {
        EventDispatcher dispatcher = getMiddleware().getEventDispatcher();
        String event = TopicBus.EVENT_PREFIX + resolve(TOPIC, topic);
        if (!dispatcher.waitFor(event, Values.toDuration(resolve(TIMEOUT, timeout)))) {
            return Status.FAILURE;
        }
        store(blackboard, resolveKey(OUTPUT_KEY, outputKey),
                dispatcher.getEventInfo(event).map(EventInfo::data).orElse(null));
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(TOPIC, topic);
        if (outputKey != null) {
            attributes.put(OUTPUT_KEY, outputKey);
        }
        attributes.put(TIMEOUT, timeout.toString());
        return attributes;
    }
}
