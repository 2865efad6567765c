package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.event.EventInfo;
import io.canopy.core.node.Status;
import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Blocks the tick until an event is emitted or a timeout passes.
///
/// Succeeds when the event fires and fails on timeout. When an output key is configured
/// the event payload is stored there.
public class WaitForEvent extends Action {

    public static final String EVENT = "event";
    public static final String TIMEOUT = "timeout";
    public static final String OUTPUT = "output";

    private final EventDispatcher dispatcher;
    private final String event;
    private final Duration timeout;
    private final String outputKey;

    /// Creates the node.
    ///
    /// @param name node name, not null
    /// @param dispatcher dispatcher to wait on, not null
    /// @param event event to wait for, not null
    /// @param timeout maximum wait per tick, not null
    /// @param outputKey key receiving the payload, null to discard it
    public WaitForEvent(
            String name,
            EventDispatcher dispatcher,
            String event,
            Duration timeout,
            String outputKey) {
        super(name, Set.of(EVENT, TIMEOUT, OUTPUT));
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.outputKey = outputKey;
    }

    @Override
    protected Status execute(Blackboard blackboard) throws InterruptedException {
        String target = String.valueOf(resolve(EVENT, event));
        if (!dispatcher.waitFor(target, Values.toDuration(resolve(TIMEOUT, timeout)))) {
            return Status.FAILURE;
        }
        String key = resolveKey(OUTPUT, outputKey);
        Optional<Object> payload = dispatcher.getEventInfo(target).map(EventInfo::data);
        if (key != null && payload.isPresent()) {
            blackboard.set(key, payload.get());
        }
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(EVENT, event);
        attributes.put(TIMEOUT, timeout.toString());
        if (outputKey != null) {
            attributes.put(OUTPUT, outputKey);
        }
        return attributes;
    }
}
