package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.node.Status;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Copies a blackboard value into watched middleware state.
///
/// Succeeds whether or not the value changed. Fails when the value key is not set.
public class CommStateUpdate extends CommunicationLeaf {

    public static final String STATE_KEY = "stateKey";
    public static final String VALUE_KEY = "valueKey";

    private final String stateKey;
    private final String valueKey;

    public CommStateUpdate(String name, CommunicationMiddleware middleware, String stateKey, String valueKey) {
        super(name, middleware, Set.of(STATE_KEY, VALUE_KEY));
        this.stateKey = Objects.requireNonNull(stateKey, "stateKey must not be null");
        this.valueKey = Objects.requireNonNull(valueKey, "valueKey must not be null");
    }

    @Override
    protected Status communicate(Blackboard blackboard) {
        Object value = blackboard.get(resolveKey(VALUE_KEY, valueKey));
        if (value == null) {
            return Status.FAILURE;
        }
        getMiddleware().updateState(String.valueOf(resolve(STATE_KEY, stateKey)), value, source());
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(STATE_KEY, stateKey, VALUE_KEY, valueKey);
    }
}
