package io.canopy.core.exception;

import java.io.Serial;

/// Raised when a registered service or behavior handler fails while serving a call.
///
/// The handler's own exception is kept as the cause.
public class InvocationFailedException extends CommunicationException {
    @Serial private static final long serialVersionUID = -6458019931827703415L;

    public InvocationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
