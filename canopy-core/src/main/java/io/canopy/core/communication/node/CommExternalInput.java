package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.communication.ExternalChannels;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.event.EventInfo;
import io.canopy.core.node.Status;
import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Waits for data on an external input channel and stores it.
public class CommExternalInput extends CommunicationLeaf {

    public static final String CHANNEL = "channel";
    public static final String OUTPUT_KEY = "outputKey";
    public static final String TIMEOUT = "timeout";

    private final String channel;
    private final String outputKey;
    private final Duration timeout;

    public CommExternalInput(
            String name, CommunicationMiddleware middleware, String channel, String outputKey, Duration timeout) {
        super(name, middleware, Set.of(CHANNEL, OUTPUT_KEY, TIMEOUT));
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.outputKey = outputKey;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public CommExternalInput(String name, CommunicationMiddleware middleware, String channel, String outputKey) {
        this(name, middleware, channel, outputKey, DEFAULT_TIMEOUT);
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws InterruptedException {
        EventDispatcher dispatcher = getMiddleware().getEventDispatcher();
        String event = ExternalChannels.INPUT_EVENT_PREFIX + resolve(CHANNEL, channel);
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
        attributes.put(CHANNEL, channel);
        if (outputKey != null) {
            attributes.put(OUTPUT_KEY, outputKey);
        }
        attributes.put(TIMEOUT, timeout.toString());
        return attributes;
    }
}
