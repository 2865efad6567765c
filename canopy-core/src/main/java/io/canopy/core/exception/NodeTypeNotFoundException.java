package io.canopy.core.exception;

import java.io.Serial;

public class NodeTypeNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -3918244752083317261L;

    public NodeTypeNotFoundException(String message) {
        super(message);
    }
}
