package io.canopy.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.canopy.core.registry.NodeSpec;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes a {@link NodeSpec} tree.
///
/// `type` is required. `name` defaults to the type. Attribute values keep their JSON
/// types: numbers become `Integer`, `Long` or `Double`, arrays become lists.
///
/// @implNote Package-private. Registered by {@link CanopyJacksonModule}.
/// @see NodeSpecSerializer for the inverse operation
class NodeSpecDeserializer extends StdDeserializer<NodeSpec> {

    @Serial private static final long serialVersionUID = -6210344196027315318L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    NodeSpecDeserializer() {
        super(NodeSpec.class);
    }

    @Override
    public NodeSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p), p);
    }

    private NodeSpec read(ObjectMapper mapper, JsonNode node, JsonParser p) throws IOException {
        if (node == null || !node.isObject()) {
            throw JsonMappingException.from(p, "Node definition must be a JSON object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw JsonMappingException.from(p, "Node definition is missing 'type'");
        }
        String name = node.hasNonNull("name") ? node.get("name").asText() : type.asText();

        NodeSpec.Builder builder = NodeSpec.builder(type.asText(), name);
        if (node.hasNonNull("attributes")) {
            Map<String, Object> attributes = mapper.convertValue(node.get("attributes"), OBJECT_MAP);
            attributes.forEach((key, value) -> {
                if (value != null) {
                    builder.attribute(key, value);
                }
            });
        }
        if (node.hasNonNull("bindings")) {
            mapper.convertValue(node.get("bindings"), STRING_MAP).forEach(builder::binding);
        }
        if (node.hasNonNull("children")) {
            for (JsonNode child : node.get("children")) {
                builder.child(read(mapper, child, p));
            }
        }
        return builder.build();
    }
}
