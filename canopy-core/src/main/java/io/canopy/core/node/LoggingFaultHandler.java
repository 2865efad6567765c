package io.canopy.core.node;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Default {@link NodeFaultHandler} that writes each fault to the log at `WARNING`.
public final class LoggingFaultHandler implements NodeFaultHandler {

    public static final LoggingFaultHandler INSTANCE = new LoggingFaultHandler();

    private static final Logger logger = Logger.getLogger(LoggingFaultHandler.class.getName());

    private LoggingFaultHandler() {}

    @Override
    public void onFault(Node node, Throwable error) {
        logger.log(
                Level.WARNING,
                "Node '" + node.getPath() + "' failed: " + error.getMessage(),
                error);
    }
}
