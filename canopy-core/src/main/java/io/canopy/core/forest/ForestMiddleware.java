package io.canopy.core.forest;

import io.canopy.core.node.Status;
import java.util.Map;

/// Extension hooked into a {@link BehaviorForest}'s tick cycle.
///
/// The forest calls {@link #initialize(BehaviorForest)} once when the middleware is
/// added, {@link #preTick()} before ticking its nodes and {@link #postTick(Map)} with the
/// results afterwards. Hook failures are logged by the forest and do not stop the tick.
public interface ForestMiddleware {

    /// Returns the name the middleware is registered under.
    String getName();

    /// Called once when the middleware is added to a forest.
    ///
    /// @param forest the owning forest, not null
    default void initialize(BehaviorForest forest) {}

    /// Called before the forest ticks its nodes.
    default void preTick() {}

    /// Called after the forest ticked its nodes.
    ///
    /// @param results status per node name in registration order, not null
    default void postTick(Map<String, Status> results) {}
}
