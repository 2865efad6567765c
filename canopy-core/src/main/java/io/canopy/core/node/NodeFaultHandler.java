package io.canopy.core.node;

/// Receives exceptions raised while a node was ticking.
///
/// A fault never escapes {@link Node#tick()}: the node reports {@link Status#FAILURE} and
/// the handler is told what happened. Handlers must not throw.
///
/// @see LoggingFaultHandler
@FunctionalInterface
public interface NodeFaultHandler {

    /// Called once per faulting tick.
    ///
    /// @param node the node whose tick failed, not null
    /// @param error the exception raised by the node, not null
    void onFault(Node node, Throwable error);
}
