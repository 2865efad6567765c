package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;
import java.util.Objects;
import java.util.Set;

/// Leaf that performs work and reports its own status.
///
/// Subclass and implement {@link #execute(Blackboard)}, or wrap a lambda with
/// {@link #of(String, ActionHandler)}. Exceptions thrown by the action turn into
/// {@link Status#FAILURE}.
///
/// {@snippet :
/// Action move = Action.of("move", bb -> {
///     bb.set("position", next());
///     return Status.SUCCESS;
/// });
/// }
public abstract class Action extends LeafNode {

    protected Action(String name) {
        this(name, Set.of());
    }

    protected Action(String name, Set<String> parameters) {
        super(name, parameters);
    }

    @Override
    protected final Status doTick() throws Exception {
        return execute(requireBlackboard());
    }

    /// Performs one step of the action.
    ///
    /// @param blackboard the tree's blackboard, not null
    /// @return the step's status, not null
    /// @throws Exception on failure
    protected abstract Status execute(Blackboard blackboard) throws Exception;

    /// Creates an action from a handler.
    ///
    /// @param name node name, not null
    /// @param handler behavior, not null
    /// @return a new action, never null
    public static Action of(String name, ActionHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        return new Action(name) {
            @Override
            protected Status execute(Blackboard blackboard) throws Exception {
                return handler.execute(blackboard);
            }

            @Override
            public String getTypeName() {
                return "Action";
            }
        };
    }
}
