package io.canopy.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.canopy.core.forest.ForestNodeType;
import io.canopy.core.registry.NodeSpec;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TreeDefinitionSerializerTest {

    private static NodeSpec patrolRoot() {
        return NodeSpec.builder("Sequence", "patrol")
                .child(NodeSpec.builder("IsTrue", "has_power").attribute("key", "powered").build())
                .child(NodeSpec.builder("Repeater", "loop")
                        .attribute("repeatCount", 3)
                        .child(NodeSpec.builder("SetBlackboard", "mark")
                                .attribute("key", "visited")
                                .attribute("value", true)
                                .binding("value", "flag")
                                .build())
                        .build())
                .build();
    }

    @Nested
    class TreeJson {

        @Test
        void shouldWriteNodeShapeWithoutEmptySections() throws Exception {
            // Given
            TreeDefinition definition = TreeDefinition.of("guard", patrolRoot());

            // When
            String json = TreeDefinitionSerializer.toJson(definition);

            // Then
            JsonNode root = new ObjectMapper().readTree(json).get("root");
            assertThat(root.get("type").asText()).isEqualTo("Sequence");
            assertThat(root.get("name").asText()).isEqualTo("patrol");
            assertThat(root.has("attributes")).isFalse();
            assertThat(root.has("bindings")).isFalse();
            assertThat(root.get("children")).hasSize(2);

            JsonNode mark = root.get("children").get(1).get("children").get(0);
            assertThat(mark.get("attributes").get("key").asText()).isEqualTo("visited");
            assertThat(mark.get("bindings").get("value").asText()).isEqualTo("flag");
            assertThat(mark.has("children")).isFalse();
        }

        @Test
        void shouldReadBackEqualDefinition() {
            // Given
            TreeDefinition definition =
                    new TreeDefinition("guard", "night shift", Map.of("powered", true, "laps", 2), patrolRoot());

            // When
            TreeDefinition read = TreeDefinitionSerializer.fromJson(TreeDefinitionSerializer.toJson(definition));

            // Then
            assertThat(read).isEqualTo(definition);
        }

        @Test
        void shouldDefaultNameToType() {
            // Given
            String json = """
                    {"name": "t", "root": {"type": "AlwaysTrue"}}
                    """;

            // When
            TreeDefinition definition = TreeDefinitionSerializer.fromJson(json);

            // Then
            assertThat(definition.root().name()).isEqualTo("AlwaysTrue");
            assertThat(definition.description()).isEmpty();
            assertThat(definition.blackboard()).isEmpty();
        }

        @Test
        void shouldIgnoreUnknownProperties() {
            // Given
            String json = """
                    {"name": "t", "version": 7, "root": {"type": "Log", "attributes": {"message": "hi"}}}
                    """;

            // When
            TreeDefinition definition = TreeDefinitionSerializer.fromJson(json);

            // Then
            assertThat(definition.root().stringAttribute("message", null)).isEqualTo("hi");
        }

        @Test
        void shouldRejectNodeWithoutType() {
            // Given
            String json = """
                    {"name": "t", "root": {"name": "orphan"}}
                    """;

            // When / Then
            assertThatThrownBy(() -> TreeDefinitionSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize tree definition")
                    .hasMessageContaining("missing 'type'");
        }

        @Test
        void shouldRejectNonObjectChild() {
            // Given
            String json = """
                    {"name": "t", "root": {"type": "Sequence", "children": ["AlwaysTrue"]}}
                    """;

            // When / Then
            assertThatThrownBy(() -> TreeDefinitionSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be a JSON object");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> TreeDefinitionSerializer.fromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class ForestJson {

        @Test
        void shouldReadForestWithDefaults() {
            // Given
            String json = """
                    {
                      "name": "fleet",
                      "blackboard": {"zone": "north"},
                      "nodes": [
                        {"name": "scout", "capabilities": ["move"],
                         "tree": {"name": "scout", "root": {"type": "AlwaysTrue"}}},
                        {"name": "boss", "type": "MASTER", "dependencies": ["scout"],
                         "tree": {"name": "boss", "root": {"type": "AlwaysFalse"}}}
                      ]
                    }
                    """;

            // When
            ForestDefinition definition = TreeDefinitionSerializer.forestFromJson(json);

            // Then
            assertThat(definition.name()).isEqualTo("fleet");
            assertThat(definition.blackboard()).containsEntry("zone", "north");
            assertThat(definition.nodes()).extracting(ForestNodeDefinition::type)
                    .containsExactly(ForestNodeType.WORKER, ForestNodeType.MASTER);
            assertThat(definition.nodes().get(0).capabilities()).containsExactly("move");
            assertThat(definition.nodes().get(1).dependencies()).containsExactly("scout");
        }

        @Test
        void shouldRoundTripForest() {
            // Given
            ForestDefinition definition = new ForestDefinition(
                    "fleet",
                    "",
                    Map.of(),
                    List.of(new ForestNodeDefinition("scout", ForestNodeType.MONITOR, List.of("look"), List.of(),
                            TreeDefinition.of("scout", patrolRoot()))));

            // When
            ForestDefinition read =
                    TreeDefinitionSerializer.forestFromJson(TreeDefinitionSerializer.forestToJson(definition));

            // Then
            assertThat(read).isEqualTo(definition);
        }
    }

    @Nested
    class FileInput {

        @TempDir Path directory;

        @Test
        void shouldReadTreeFile() throws Exception {
            // Given
            Path file = directory.resolve("guard.json");
            Files.writeString(file, TreeDefinitionSerializer.toJson(TreeDefinition.of("guard", patrolRoot())));

            // When
            TreeDefinition definition = TreeDefinitionSerializer.read(file);

            // Then
            assertThat(definition.name()).isEqualTo("guard");
            assertThat(definition.root()).isEqualTo(patrolRoot());
        }

        @Test
        void shouldFailOnMissingFile() {
            Path missing = directory.resolve("missing.json");

            assertThatThrownBy(() -> TreeDefinitionSerializer.readForest(missing))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasMessageContaining("missing.json");
        }
    }
}
