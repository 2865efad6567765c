package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Stores a value on the blackboard and succeeds. An empty key fails.
public class SetBlackboard extends Action {

    public static final String KEY = "key";
    public static final String VALUE = "value";

    private final String key;
    private final Object value;

    public SetBlackboard(String name, String key, Object value) {
        super(name, Set.of(KEY, VALUE));
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    protected Status execute(Blackboard blackboard) {
        String target = String.valueOf(resolve(KEY, key));
        if (target.isEmpty()) {
            return Status.FAILURE;
        }
        blackboard.set(target, resolve(VALUE, value));
        return Status.SUCCESS;
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(KEY, key, VALUE, value);
    }
}
