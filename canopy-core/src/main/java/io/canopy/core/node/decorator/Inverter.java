package io.canopy.core.node.decorator;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;

/// Swaps SUCCESS and FAILURE of its child. RUNNING passes through.
public class Inverter extends DecoratorNode {

    public Inverter(String name, Node child) {
        super(name, child);
    }

    public Inverter(String name) {
        this(name, null);
    }

    @Override
    protected Status decorate(Node child, Status childStatus) {
        return switch (childStatus) {
            case SUCCESS -> Status.FAILURE;
            case FAILURE -> Status.SUCCESS;
            case RUNNING -> Status.RUNNING;
        };
    }
}
