package io.canopy.core.node.composite;

import io.canopy.core.node.Node;
import io.canopy.core.node.NodeKind;

/// Base class for nodes that own any number of ordered children.
///
/// Composites keep no memory of a running child between ticks: every tick starts
/// again from the first child.
///
/// @see Sequence
/// @see Selector
/// @see Parallel
public abstract class CompositeNode extends Node {

    /// Creates a composite with the given initial children.
    ///
    /// @param name node name, not null
    /// @param children initial children in tick order, not null
    protected CompositeNode(String name, Node... children) {
        super(name, NodeKind.COMPOSITE);
        for (Node child : children) {
            addChild(child);
        }
    }
}
