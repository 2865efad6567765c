package io.canopy.core.exception;

import java.io.Serial;

public class ServiceNotFoundException extends CommunicationException {
    @Serial private static final long serialVersionUID = 5512093170274631208L;

    public ServiceNotFoundException(String message) {
        super(message);
    }
}
