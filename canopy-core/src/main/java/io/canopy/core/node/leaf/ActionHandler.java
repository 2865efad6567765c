package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;

/// User supplied behavior of an {@link Action} created with {@link Action#of}.
@FunctionalInterface
public interface ActionHandler {

    /// Performs one step of the action.
    ///
    /// @param blackboard the tree's blackboard, not null
    /// @return the step's status, not null
    /// @throws Exception on failure, reported as {@link Status#FAILURE}
    Status execute(Blackboard blackboard) throws Exception;
}
