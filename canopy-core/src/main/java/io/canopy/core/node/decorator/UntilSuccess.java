package io.canopy.core.node.decorator;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;

/// Retries its child until it succeeds.
///
/// A failing child is reset and the decorator keeps RUNNING.
public class UntilSuccess extends DecoratorNode {

    public UntilSuccess(String name, Node child) {
        super(name, child);
    }

    public UntilSuccess(String name) {
        this(name, null);
    }

    @Override
    protected Status decorate(Node child, Status childStatus) {
        return switch (childStatus) {
            case SUCCESS -> Status.SUCCESS;
            case RUNNING -> Status.RUNNING;
            case FAILURE -> {
                child.reset();
                yield Status.RUNNING;
            }
        };
    }
}
