package io.canopy.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.canopy.core.registry.NodeSpec;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the Canopy serialization configuration.
///
/// {@link NodeSpec} uses a custom serializer/deserializer pair so that empty attribute,
/// binding and child collections are omitted and node names default to their type.
/// Definition records bind through Jackson's record support.
///
/// @see TreeDefinitionSerializer for the convenience factory API
public class CanopyJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2093187717049523162L;

    public CanopyJacksonModule() {
        super("CanopyJacksonModule");
        addSerializer(NodeSpec.class, new NodeSpecSerializer());
        addDeserializer(NodeSpec.class, new NodeSpecDeserializer());
    }
}
