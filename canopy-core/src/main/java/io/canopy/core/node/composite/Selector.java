package io.canopy.core.node.composite;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;

/// Ticks children left to right until one does not fail.
///
/// The first child that succeeds or is still running decides the result and later
/// children are not ticked. An empty selector fails.
public class Selector extends CompositeNode {

    public Selector(String name, Node... children) {
        super(name, children);
    }

    @Override
    protected Status doTick() {
        for (Node child : getChildren()) {
            Status result = child.tick();
            if (result != Status.FAILURE) {
                return result;
            }
        }
        return Status.FAILURE;
    }
}
