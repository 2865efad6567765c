package io.canopy.core.registry;

import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Declarative description of a node and its subtree.
///
/// Attributes configure the node through its registry factory; bindings map leaf
/// parameters to blackboard keys. Specs are immutable and may be shared between builds.
///
/// @param type registered node type name, not null
/// @param name node name, not null
/// @param attributes factory attributes, not null, no null values
/// @param bindings leaf parameter to blackboard key, not null
/// @param children child specs in order, not null
public record NodeSpec(
        String type,
        String name,
        Map<String, Object> attributes,
        Map<String, String> bindings,
        List<NodeSpec> children) {

    public NodeSpec {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        attributes = Map.copyOf(attributes);
        bindings = Map.copyOf(bindings);
        children = List.copyOf(children);
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /// Returns a mandatory attribute.
    ///
    /// @throws IllegalArgumentException if the attribute is missing
    public Object requireAttribute(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            throw new IllegalArgumentException(
                    type + " '" + name + "' requires attribute '" + key + "'");
        }
        return value;
    }

    public String stringAttribute(String key, String defaultValue) {
        return attribute(key).map(Object::toString).orElse(defaultValue);
    }

    public String requireString(String key) {
        return requireAttribute(key).toString();
    }

    public int intAttribute(String key, int defaultValue) {
        return attribute(key).map(Values::toInt).orElse(defaultValue);
    }

    public boolean booleanAttribute(String key, boolean defaultValue) {
        return attribute(key).map(v -> Boolean.parseBoolean(v.toString())).orElse(defaultValue);
    }

    public Duration durationAttribute(String key, Duration defaultValue) {
        return attribute(key).map(Values::toDuration).orElse(defaultValue);
    }

    /// Reads a set of strings given as a collection or as comma separated text.
    ///
    /// @return the trimmed, non-empty items, empty when the attribute is missing
    public Set<String> stringSetAttribute(String key) {
        Object value = attributes.get(key);
        Set<String> items = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(item -> items.add(String.valueOf(item).trim()));
        } else if (value != null) {
            for (String item : value.toString().split(",")) {
                items.add(item.trim());
            }
        }
        items.remove("");
        return items;
    }

    public static Builder builder(String type, String name) {
        return new Builder(type, name);
    }

    /// Fluent builder for {@link NodeSpec}.
    public static final class Builder {
        private final String type;
        private final String name;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, String> bindings = new LinkedHashMap<>();
        private final List<NodeSpec> children = new ArrayList<>();

        private Builder(String type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder binding(String parameter, String blackboardKey) {
            bindings.put(parameter, blackboardKey);
            return this;
        }

        public Builder child(NodeSpec child) {
            children.add(child);
            return this;
        }

        public Builder children(List<NodeSpec> specs) {
            children.addAll(specs);
            return this;
        }

        public NodeSpec build() {
            return new NodeSpec(type, name, attributes, bindings, children);
        }
    }
}
