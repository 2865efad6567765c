package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;

/// User supplied predicate of a {@link Condition} created with {@link Condition#of}.
@FunctionalInterface
public interface ConditionCheck {

    /// @param blackboard the tree's blackboard, not null
    /// @return whether the condition holds
    /// @throws Exception on failure, reported as failure of the condition
    boolean evaluate(Blackboard blackboard) throws Exception;
}
