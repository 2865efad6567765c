package io.canopy.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Utility class for reading and writing tree and forest definitions as JSON.
///
/// ### Usage
/// {@snippet :
/// String json = TreeDefinitionSerializer.toJson(TreeExporter.export(tree));
/// TreeDefinition definition = TreeDefinitionSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see CanopyJacksonModule for the registered type handlers
public final class TreeDefinitionSerializer {

    private TreeDefinitionSerializer() {}

    /// Serializes a tree definition to pretty-printed JSON.
    ///
    /// @param definition the definition, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(TreeDefinition definition) {
        try {
            return createMapper().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize tree definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a tree definition.
    ///
    /// @param json JSON text, not null
    /// @return the definition, never null
    /// @throws IllegalArgumentException if the text is not a valid tree definition
    public static TreeDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, TreeDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize tree definition: " + e.getMessage(), e);
        }
    }

    public static String forestToJson(ForestDefinition definition) {
        try {
            return createMapper().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize forest definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a forest definition.
    ///
    /// @param json JSON text, not null
    /// @return the definition, never null
    /// @throws IllegalArgumentException if the text is not a valid forest definition
    public static ForestDefinition forestFromJson(String json) {
        try {
            return createMapper().readValue(json, ForestDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize forest definition: " + e.getMessage(), e);
        }
    }

    /// Reads a tree definition from a UTF-8 file.
    ///
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid tree definition
    public static TreeDefinition read(Path path) {
        return fromJson(readString(path));
    }

    /// Reads a forest definition from a UTF-8 file.
    ///
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid forest definition
    public static ForestDefinition readForest(Path path) {
        return forestFromJson(readString(path));
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /// Creates an ObjectMapper configured for Canopy definitions.
    ///
    /// Registers:
    /// - `CanopyJacksonModule` for node specs
    /// - `JavaTimeModule` for `Duration` and `Instant` values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Durations and instants written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new CanopyJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
