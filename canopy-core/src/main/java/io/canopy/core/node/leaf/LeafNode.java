package io.canopy.core.node.leaf;

import io.canopy.core.node.Node;
import io.canopy.core.node.NodeKind;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Base class for nodes without children.
///
/// ### Parameter bindings
/// A leaf declares the names of its bindable parameters once, per class. Each instance
/// may then map some of those parameters to blackboard keys. At tick time
/// {@link #resolve(String, Object)} reads a bound parameter from the blackboard and falls
/// back to the configured value when the key is not set. Leaves that write results use
/// {@link #resolveKey(String, String)} to pick the target key.
///
/// {@snippet :
/// Log log = new Log("announce", "idle", Level.INFO);
/// log.bindParameter(Log.MESSAGE, "log_message");
/// }
public abstract class LeafNode extends Node {

    private final Set<String> parameters;
    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    /// Creates a leaf.
    ///
    /// @param name node name, not null
    /// @param parameters names of the parameters this leaf class accepts bindings for, not null
    protected LeafNode(String name, Set<String> parameters) {
        super(name, NodeKind.LEAF);
        this.parameters = Set.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
    }

    /// Maps a parameter to a blackboard key.
    ///
    /// @param parameter declared parameter name, not null
    /// @param key blackboard key to read the parameter from, not null
    /// @return this leaf for chaining
    /// @throws IllegalArgumentException if the parameter is not declared by this leaf
    public LeafNode bindParameter(String parameter, String key) {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (!parameters.contains(parameter)) {
            throw new IllegalArgumentException(
                    getTypeName()
                            + " '"
                            + getName()
                            + "' has no parameter '"
                            + parameter
                            + "', expected one of "
                            + parameters);
        }
        bindings.put(parameter, key);
        return this;
    }

    /// Returns the parameter names this leaf accepts bindings for.
    public Set<String> getParameters() {
        return parameters;
    }

    /// Returns the current parameter to key bindings.
    ///
    /// @return unmodifiable copy, never null
    public Map<String, String> getParameterBindings() {
        return Map.copyOf(bindings);
    }

    /// Resolves a parameter value for this tick.
    ///
    /// @param parameter declared parameter name, not null
    /// @param fallback value used when the parameter is unbound or its key is not set
    /// @return the blackboard value or `fallback`
    protected Object resolve(String parameter, Object fallback) {
        String key = bindings.get(parameter);
        if (key == null || getBlackboard() == null) {
            return fallback;
        }
        return getBlackboard().get(key, fallback);
    }

    /// Resolves the blackboard key a parameter writes to.
    ///
    /// @param parameter declared parameter name, not null
    /// @param defaultKey key used when the parameter is unbound, may be null
    /// @return the bound key or `defaultKey`
    protected String resolveKey(String parameter, String defaultKey) {
        return bindings.getOrDefault(parameter, defaultKey);
    }
}
