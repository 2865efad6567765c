package io.canopy.core.node.decorator;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;

/// Repeats its child while it succeeds.
///
/// A succeeding child is reset and the decorator keeps RUNNING. Once the child fails the
/// loop has ended as intended and the decorator reports SUCCESS.
public class UntilFailure extends DecoratorNode {

    public UntilFailure(String name, Node child) {
        super(name, child);
    }

    public UntilFailure(String name) {
        this(name, null);
    }

    @Override
    protected Status decorate(Node child, Status childStatus) {
        return switch (childStatus) {
            case FAILURE -> Status.SUCCESS;
            case RUNNING -> Status.RUNNING;
            case SUCCESS -> {
                child.reset();
                yield Status.RUNNING;
            }
        };
    }
}
