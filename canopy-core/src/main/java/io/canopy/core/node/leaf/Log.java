package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.node.Status;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Writes a message to the log and succeeds.
///
/// Levels may be given as {@link Level} names or as `DEBUG`, `WARN` and `ERROR`.
public class Log extends Action {

    public static final String MESSAGE = "message";
    public static final String LEVEL = "level";

    private static final Logger logger = Logger.getLogger(Log.class.getName());

    private final String message;
    private final Level level;

    public Log(String name, String message, Level level) {
        super(name, Set.of(MESSAGE, LEVEL));
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
    }

    public Log(String name, String message) {
        this(name, message, Level.INFO);
    }

    @Override
    protected Status execute(Blackboard blackboard) {
        Object resolvedLevel = resolve(LEVEL, level);
        Level effective =
                resolvedLevel instanceof Level l ? l : parseLevel(resolvedLevel.toString());
        logger.log(effective, "[" + getName() + "] " + resolve(MESSAGE, message));
        return Status.SUCCESS;
    }

    /// Parses a level name.
    ///
    /// @param name level name, not null
    /// @return the level, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static Level parseLevel(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DEBUG" -> Level.FINE;
            case "WARN" -> Level.WARNING;
            case "ERROR", "CRITICAL" -> Level.SEVERE;
            default -> Level.parse(normalized);
        };
    }

    public String getMessage() {
        return message;
    }

    public Level getLevel() {
        return level;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        return Map.of(MESSAGE, message, LEVEL, level.getName());
    }
}
