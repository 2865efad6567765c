package io.canopy.core.exception;

import java.io.Serial;

/// Base type for recoverable failures raised by the communication middleware.
///
/// @see ServiceNotFoundException
/// @see BehaviorNotFoundException
/// @see TaskNotFoundException
/// @see InvocationFailedException
public class CommunicationException extends Exception {
    @Serial private static final long serialVersionUID = 2880155073904417722L;

    public CommunicationException(String message) {
        super(message);
    }

    public CommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
