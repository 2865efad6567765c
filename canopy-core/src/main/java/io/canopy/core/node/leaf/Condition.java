package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;
import java.util.Objects;
import java.util.Set;

/// Leaf that tests a predicate: SUCCESS when it holds, FAILURE otherwise.
///
/// Exceptions thrown while evaluating also produce FAILURE.
public abstract class Condition extends LeafNode {

    protected Condition(String name) {
        this(name, Set.of());
    }

    protected Condition(String name, Set<String> parameters) {
        super(name, parameters);
    }

    @Override
    protected final Status doTick() throws Exception {
        return evaluate(requireBlackboard()) ? Status.SUCCESS : Status.FAILURE;
    }

    /// @param blackboard the tree's blackboard, not null
    /// @return whether the condition holds
    /// @throws Exception on failure
    protected abstract boolean evaluate(Blackboard blackboard) throws Exception;

    /// Creates a condition from a predicate.
    ///
    /// @param name node name, not null
    /// @param check predicate, not null
    /// @return a new condition, never null
    public static Condition of(String name, ConditionCheck check) {
        Objects.requireNonNull(check, "check must not be null");
        return new Condition(name) {
            @Override
            protected boolean evaluate(Blackboard blackboard) throws Exception {
                return check.evaluate(blackboard);
            }

            @Override
            public String getTypeName() {
                return "Condition";
            }
        };
    }
}
