package io.canopy.core.registry;

import io.canopy.core.node.Node;

/// Creates a node from its declarative description.
///
/// Factories build the node itself only. Children and parameter bindings are applied
/// by the {@link TreeBuilder}.
@FunctionalInterface
public interface NodeFactory {

    /// @param spec description of the node, not null
    /// @return a new, unattached node, never null
    /// @throws IllegalArgumentException if the spec's attributes are invalid
    Node create(NodeSpec spec);
}
