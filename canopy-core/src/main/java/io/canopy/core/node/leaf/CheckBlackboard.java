package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.util.Values;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Checks a blackboard entry, either for presence or for an expected value.
///
/// Numbers are compared by value, so an expected `1` matches a stored `1.0`.
public class CheckBlackboard extends Condition {

    public static final String KEY = "key";
    public static final String EXPECTED_VALUE = "expectedValue";

    private final String key;
    private final Object expectedValue;
    private final boolean existsOnly;

    private CheckBlackboard(String name, String key, Object expectedValue, boolean existsOnly) {
        super(name, Set.of(KEY, EXPECTED_VALUE));
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.expectedValue = expectedValue;
        this.existsOnly = existsOnly;
    }

    /// Creates a check that succeeds when the key holds the expected value.
    public CheckBlackboard(String name, String key, Object expectedValue) {
        this(name, key, Objects.requireNonNull(expectedValue, "expectedValue must not be null"), false);
    }

    /// Creates a check that succeeds when the key is present, whatever its value.
    public static CheckBlackboard exists(String name, String key) {
        return new CheckBlackboard(name, key, null, true);
    }

    @Override
    protected boolean evaluate(Blackboard blackboard) {
        String target = String.valueOf(resolve(KEY, key));
        if (existsOnly) {
            return blackboard.has(target);
        }
        return Values.looselyEquals(blackboard.get(target), resolve(EXPECTED_VALUE, expectedValue));
    }

    public String getKey() {
        return key;
    }

    public boolean isExistsOnly() {
        return existsOnly;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(KEY, key);
        if (existsOnly) {
            attributes.put("existsOnly", true);
        } else {
            attributes.put(EXPECTED_VALUE, expectedValue);
        }
        return attributes;
    }
}
