package io.canopy.core;

import io.canopy.core.registry.DefaultNodeRegistry;
import io.canopy.core.registry.NodeRegistry;
import io.canopy.core.util.NamedThreadFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring Canopy environments.
///
/// ### Usage Patterns
///
/// **Explicit configuration**:
/// {@snippet :
/// try (CanopyEnvironment env = CanopyFactory.createEnvironment(
///         CanopyConfig.builder().tickRate(30).threadPoolSize(4).build())) {
///     BehaviorForest forest = env.newForest("patrol");
/// }
/// }
///
/// **Classpath and system properties**:
/// {@snippet :
/// var env = CanopyFactory.createEnvironment();
/// }
///
/// @see CanopyEnvironment
/// @see CanopyConfig
public final class CanopyFactory {

    private static final Logger logger = Logger.getLogger(CanopyFactory.class.getName());

    /// Classpath resource read by {@link #createEnvironment()}.
    public static final String PROPERTIES_RESOURCE = "canopy.properties";

    private CanopyFactory() {}

    /// Creates an environment configured from `canopy.properties` on the classpath,
    /// overridden by `canopy.*` system properties.
    ///
    /// @return a fully-configured environment, never null
    /// @throws UncheckedIOException if the resource exists but cannot be read
    public static CanopyEnvironment createEnvironment() {
        return createEnvironment(loadConfig());
    }

    /// Creates an environment with the built-in node types and a fixed forest pool.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured environment, never null
    public static CanopyEnvironment createEnvironment(CanopyConfig config) {
        if (config.getThreadPoolSize() <= 0) {
            throw new IllegalArgumentException("threadPoolSize must be positive, got " + config.getThreadPoolSize());
        }
        ExecutorService executorService =
                Executors.newFixedThreadPool(config.getThreadPoolSize(), new NamedThreadFactory("canopy-forest"));
        return createEnvironment(config, new DefaultNodeRegistry(), executorService);
    }

    /// Creates an environment with pre-configured collaborators.
    ///
    /// Useful for testing with custom registries or executors.
    ///
    /// @param config configuration, not null
    /// @param nodeRegistry registry used to build trees, not null
    /// @param executorService pool ticking forest nodes, owned by the environment, not null
    /// @return a fully-configured environment, never null
    public static CanopyEnvironment createEnvironment(
            CanopyConfig config, NodeRegistry nodeRegistry, ExecutorService executorService) {
        logger.fine("Creating environment with " + config);
        return new CanopyEnvironment(config, nodeRegistry, executorService);
    }

    /// Loads the configuration from the classpath resource and system properties.
    ///
    /// @return the merged configuration, never null
    public static CanopyConfig loadConfig() {
        Properties properties = new Properties();
        try (InputStream in = CanopyFactory.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.fine("Loaded " + PROPERTIES_RESOURCE + " from classpath");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        System.getProperties().forEach((key, value) -> {
            String name = key.toString();
            if (name.startsWith(CanopyConfig.PREFIX)) {
                properties.setProperty(name, value.toString());
            }
        });
        return CanopyConfig.fromProperties(properties);
    }
}
