package io.canopy.core.registry;

import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.node.Policy;
import io.canopy.core.node.composite.Parallel;
import io.canopy.core.node.composite.Selector;
import io.canopy.core.node.composite.Sequence;
import io.canopy.core.node.decorator.Inverter;
import io.canopy.core.node.decorator.Repeater;
import io.canopy.core.node.decorator.UntilFailure;
import io.canopy.core.node.decorator.UntilSuccess;
import io.canopy.core.node.leaf.AlwaysFalse;
import io.canopy.core.node.leaf.AlwaysTrue;
import io.canopy.core.node.leaf.CheckBlackboard;
import io.canopy.core.node.leaf.Compare;
import io.canopy.core.node.leaf.ComparisonOperator;
import io.canopy.core.node.leaf.IsFalse;
import io.canopy.core.node.leaf.IsTrue;
import io.canopy.core.node.leaf.Log;
import io.canopy.core.node.leaf.SetBlackboard;
import io.canopy.core.node.leaf.Wait;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/// Default implementation of {@link NodeRegistry}.
///
/// Registers every built-in composite, decorator and leaf under its simple class name.
/// Communication nodes depend on a middleware instance and are added separately through
/// {@link io.canopy.core.communication.node.CommunicationNodes#register}.
///
/// ### Built-in attributes
/// - `Parallel`: `policy` (default `SUCCEED_ON_ALL`)
/// - `Repeater`: `repeatCount` (default `-1`, unbounded)
/// - `Wait`: `duration` in seconds or ISO-8601
/// - `Log`: `message`, `level` (default `INFO`)
/// - `SetBlackboard`: `key`, `value`
/// - `CheckBlackboard`: `key`, then `expectedValue` or `existsOnly`
/// - `IsTrue`, `IsFalse`: `key`
/// - `Compare`: `key`, `operator` (`==`, `!=`, `>`, `<`, `>=`, `<=`), `value`
public class DefaultNodeRegistry implements NodeRegistry {

    private final Map<String, NodeFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, NodeTypeInfo> infos = new ConcurrentHashMap<>();
    private final ExecutorService parallelExecutor;

    /// Creates a registry with all built-in types; parallel nodes use their shared pool.
    public DefaultNodeRegistry() {
        this((ExecutorService) null);
    }

    /// Creates a registry with all built-in types.
    ///
    /// @param parallelExecutor pool for parallel nodes, null for their shared pool
    public DefaultNodeRegistry(ExecutorService parallelExecutor) {
        this.parallelExecutor = parallelExecutor;
        registerBuiltins();
    }

    private DefaultNodeRegistry(NodeRegistry source) {
        this.parallelExecutor = null;
        for (String type : source.getRegisteredTypes()) {
            source.getFactory(type).ifPresent(factory -> factories.put(type, factory));
            infos.put(type, source.getTypeInfo(type).orElse(new NodeTypeInfo(type, "", false)));
        }
    }

    /// Creates an independent registry holding the same registrations as another one.
    ///
    /// Changes to the copy do not affect the source, which lets callers add types bound
    /// to one forest without touching a shared registry.
    ///
    /// @param source registry to copy, not null
    /// @return a new registry, never null
    public static DefaultNodeRegistry copyOf(NodeRegistry source) {
        return new DefaultNodeRegistry(Objects.requireNonNull(source, "source must not be null"));
    }

    private void registerBuiltins() {
        builtin("Sequence", "Ticks children in order until one does not succeed",
                spec -> new Sequence(spec.name()));
        builtin("Selector", "Ticks children in order until one does not fail",
                spec -> new Selector(spec.name()));
        builtin("Parallel", "Ticks all children concurrently and applies a policy",
                spec -> {
                    Policy policy = Policy.valueOf(
                            spec.stringAttribute("policy", Policy.SUCCEED_ON_ALL.name()).toUpperCase(Locale.ROOT));
                    return parallelExecutor == null
                            ? new Parallel(spec.name(), policy)
                            : new Parallel(spec.name(), policy, parallelExecutor);
                });

        builtin("Inverter", "Swaps success and failure", spec -> new Inverter(spec.name()));
        builtin("Repeater", "Repeats its child a number of times",
                spec -> new Repeater(spec.name(), spec.intAttribute("repeatCount", Repeater.UNBOUNDED)));
        builtin("UntilSuccess", "Retries its child until it succeeds", spec -> new UntilSuccess(spec.name()));
        builtin("UntilFailure", "Repeats its child until it fails", spec -> new UntilFailure(spec.name()));

        builtin("Wait", "Runs until a duration has passed",
                spec -> new Wait(spec.name(), spec.durationAttribute(Wait.DURATION, Duration.ofSeconds(1))));
        builtin("Log", "Writes a message to the log",
                spec -> new Log(spec.name(), spec.requireString(Log.MESSAGE),
                        Log.parseLevel(spec.stringAttribute(Log.LEVEL, "INFO"))));
        builtin("SetBlackboard", "Stores a value on the blackboard",
                spec -> new SetBlackboard(spec.name(), spec.requireString(SetBlackboard.KEY),
                        spec.requireAttribute(SetBlackboard.VALUE)));
        builtin("CheckBlackboard", "Checks a blackboard entry",
                spec -> spec.booleanAttribute("existsOnly", false)
                        ? CheckBlackboard.exists(spec.name(), spec.requireString(CheckBlackboard.KEY))
                        : new CheckBlackboard(spec.name(), spec.requireString(CheckBlackboard.KEY),
                                spec.requireAttribute(CheckBlackboard.EXPECTED_VALUE)));
        builtin("IsTrue", "Succeeds when a key holds true",
                spec -> new IsTrue(spec.name(), spec.requireString(IsTrue.KEY)));
        builtin("IsFalse", "Succeeds when a key holds false",
                spec -> new IsFalse(spec.name(), spec.requireString(IsFalse.KEY)));
        builtin("Compare", "Compares a blackboard entry with a value",
                spec -> new Compare(spec.name(), spec.requireString(Compare.KEY),
                        ComparisonOperator.fromSymbol(spec.stringAttribute("operator", "==")),
                        spec.requireAttribute(Compare.VALUE)));
        builtin("AlwaysTrue", "Always succeeds", spec -> new AlwaysTrue(spec.name()));
        builtin("AlwaysFalse", "Always fails", spec -> new AlwaysFalse(spec.name()));
    }

    private void builtin(String type, String description, NodeFactory factory) {
        factories.put(type, factory);
        infos.put(type, new NodeTypeInfo(type, description, true));
    }

    @Override
    public void register(String type, String description, NodeFactory factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        factories.put(type, factory);
        infos.put(type, new NodeTypeInfo(type, description == null ? "" : description, false));
    }

    @Override
    public boolean unregister(String type) {
        infos.remove(type);
        return factories.remove(type) != null;
    }

    @Override
    public boolean isRegistered(String type) {
        return factories.containsKey(type);
    }

    @Override
    public Set<String> getRegisteredTypes() {
        return Set.copyOf(factories.keySet());
    }

    @Override
    public Optional<NodeTypeInfo> getTypeInfo(String type) {
        return Optional.ofNullable(infos.get(type));
    }

    @Override
    public Optional<NodeFactory> getFactory(String type) {
        return Optional.ofNullable(factories.get(type));
    }

    @Override
    public NodeFactory getFactoryOrThrow(String type) throws NodeTypeNotFoundException {
        return getFactory(type)
                .orElseThrow(() -> new NodeTypeNotFoundException("No node type registered as: " + type));
    }

    @Override
    public void clear() {
        factories.clear();
        infos.clear();
    }
}
