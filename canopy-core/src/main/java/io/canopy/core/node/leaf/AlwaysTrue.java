package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;

public class AlwaysTrue extends Condition {

    public AlwaysTrue(String name) {
        super(name);
    }

    @Override
    protected boolean evaluate(Blackboard blackboard) {
        return true;
    }
}
