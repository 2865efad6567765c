package io.canopy.core.node.decorator;

import io.canopy.core.node.Node;
import io.canopy.core.node.NodeKind;
import io.canopy.core.node.Status;

/// Base class for nodes wrapping a single child.
///
/// Adding a child to a decorator replaces the previous one. A decorator without a child
/// fails every tick.
///
/// @see Inverter
/// @see Repeater
/// @see UntilSuccess
/// @see UntilFailure
public abstract class DecoratorNode extends Node {

    /// Creates a decorator.
    ///
    /// @param name node name, not null
    /// @param child wrapped node, may be null to attach later
    protected DecoratorNode(String name, Node child) {
        super(name, NodeKind.DECORATOR);
        if (child != null) {
            addChild(child);
        }
    }

    /// Returns the wrapped node.
    ///
    /// @return the child, or null if none is attached
    public Node getDecorated() {
        return getChildCount() == 0 ? null : getChild(0);
    }

    @Override
    protected final Status doTick() {
        Node child = getDecorated();
        if (child == null) {
            return Status.FAILURE;
        }
        return decorate(child, child.tick());
    }

    /// Maps the child's status to this decorator's status.
    ///
    /// @param child the wrapped node, not null
    /// @param childStatus status the child just returned, not null
    /// @return this decorator's status, not null
    protected abstract Status decorate(Node child, Status childStatus);
}
