package io.canopy.core.exception;

import java.io.Serial;

public class BehaviorNotFoundException extends CommunicationException {
    @Serial private static final long serialVersionUID = -7092816463271503985L;

    public BehaviorNotFoundException(String message) {
        super(message);
    }
}
