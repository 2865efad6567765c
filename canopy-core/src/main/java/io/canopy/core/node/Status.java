package io.canopy.core.node;

/// Outcome of a single node tick.
///
/// Every tick of every node resolves to exactly one of these values. Nodes that
/// have never been ticked, or that were just reset, report {@link #FAILURE}.
public enum Status {
    /// The node reached its goal.
    SUCCESS,

    /// The node could not reach its goal, or faulted while trying.
    FAILURE,

    /// The node needs more ticks before it can decide.
    RUNNING
}
