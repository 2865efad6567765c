package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Succeeds when the key holds `Boolean.TRUE`, or the text `true`.
public class IsTrue extends Condition {

    public static final String KEY = "key";

    private final String key;

    public IsTrue(String name, String key) {
        super(name, Set.of(KEY));
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    @Override
    protected boolean evaluate(Blackboard blackboard) {
        Object value = blackboard.get(String.valueOf(resolve(KEY, key)));
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public String getKey() {
        return key;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(KEY, key);
    }
}
