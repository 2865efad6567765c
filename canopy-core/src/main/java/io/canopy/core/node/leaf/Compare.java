package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Compares a blackboard entry with a reference value.
///
/// A missing entry or operands without a common ordering make the comparison false.
public class Compare extends Condition {

    public static final String KEY = "key";
    public static final String VALUE = "value";

    private final String key;
    private final ComparisonOperator operator;
    private final Object value;

    public Compare(String name, String key, ComparisonOperator operator, Object value) {
        super(name, Set.of(KEY, VALUE));
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    protected boolean evaluate(Blackboard blackboard) {
        Object stored = blackboard.get(String.valueOf(resolve(KEY, key)));
        return operator.test(stored, resolve(VALUE, value));
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(KEY, key, "operator", operator.getSymbol(), VALUE, value);
    }
}
