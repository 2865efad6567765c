package io.canopy.core.exception;

import java.io.Serial;

public class TaskNotFoundException extends CommunicationException {
    @Serial private static final long serialVersionUID = 1846630571092203347L;

    public TaskNotFoundException(String message) {
        super(message);
    }
}
