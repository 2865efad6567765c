package io.canopy.core.engine;

import io.canopy.core.node.Status;

/// Callbacks fired by a {@link TickManager} after each tick.
///
/// All methods have empty defaults so implementations override only what they need.
/// Callbacks run on the ticking thread; exceptions they throw are logged and ignored.
public interface TickListener {

    /// Called after every tick.
    ///
    /// @param status status of the root for this tick, not null
    default void onTick(Status status) {}

    /// Called when the root's status differs from the previous tick's.
    ///
    /// @param previous status before this tick, not null
    /// @param current status produced by this tick, not null
    default void onStatusChange(Status previous, Status current) {}
}
