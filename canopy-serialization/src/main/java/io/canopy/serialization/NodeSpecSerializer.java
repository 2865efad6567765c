package io.canopy.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.canopy.core.registry.NodeSpec;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;
import java.util.TreeMap;

/// Serializes a {@link NodeSpec} and its children.
///
/// ```
/// {
///   "type": "Sequence",
///   "name": "patrol",
///   "attributes": { ... },   omitted when empty
///   "bindings": { ... },     omitted when empty
///   "children": [ ... ]      omitted when empty
/// }
/// ```
///
/// Attribute and binding keys are written in sorted order so that exports are stable.
///
/// @implNote Package-private. Registered by {@link CanopyJacksonModule}.
/// @see NodeSpecDeserializer for the inverse operation
class NodeSpecSerializer extends StdSerializer<NodeSpec> {

    @Serial private static final long serialVersionUID = 4127718830262431905L;

    NodeSpecSerializer() {
        super(NodeSpec.class);
    }

    @Override
    public void serialize(NodeSpec spec, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", spec.type());
        gen.writeStringField("name", spec.name());
        if (!spec.attributes().isEmpty()) {
            provider.defaultSerializeField("attributes", sorted(spec.attributes()), gen);
        }
        if (!spec.bindings().isEmpty()) {
            provider.defaultSerializeField("bindings", sorted(spec.bindings()), gen);
        }
        if (!spec.children().isEmpty()) {
            gen.writeArrayFieldStart("children");
            for (NodeSpec child : spec.children()) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private static <V> Map<String, V> sorted(Map<String, V> map) {
        return new TreeMap<>(map);
    }
}
