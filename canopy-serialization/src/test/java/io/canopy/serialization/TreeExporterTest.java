package io.canopy.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.forest.ForestNodeType;
import io.canopy.core.node.Policy;
import io.canopy.core.node.Status;
import io.canopy.core.node.composite.Parallel;
import io.canopy.core.node.composite.Sequence;
import io.canopy.core.node.decorator.Repeater;
import io.canopy.core.node.leaf.AlwaysTrue;
import io.canopy.core.node.leaf.SetBlackboard;
import io.canopy.core.node.leaf.Wait;
import io.canopy.core.registry.DefaultNodeRegistry;
import io.canopy.core.registry.NodeSpec;
import io.canopy.core.registry.TreeBuilder;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TreeExporterTest {

    @Test
    void shouldDescribeTypesAttributesAndBindings() {
        // Given
        SetBlackboard mark = new SetBlackboard("mark", "visited", true);
        mark.bindParameter(SetBlackboard.VALUE, "flag");
        Sequence root = new Sequence("patrol");
        root.addChild(new Repeater("loop", 3));
        root.getChild(0).addChild(mark);
        root.addChild(new Wait("rest", Duration.ofSeconds(2)));

        // When
        NodeSpec spec = TreeExporter.export(root);

        // Then
        assertThat(spec.type()).isEqualTo("Sequence");
        assertThat(spec.attributes()).isEmpty();
        assertThat(spec.children()).extracting(NodeSpec::type).containsExactly("Repeater", "Wait");
        assertThat(spec.children().get(0).attributes()).containsEntry("repeatCount", 3);
        assertThat(spec.children().get(1).attributes()).containsEntry("duration", "PT2S");

        NodeSpec exportedMark = spec.children().get(0).children().get(0);
        assertThat(exportedMark.attributes()).containsEntry("key", "visited").containsEntry("value", true);
        assertThat(exportedMark.bindings()).containsEntry("value", "flag");
    }

    @Test
    void shouldRebuildEquivalentTreeFromExport() throws Exception {
        // Given
        BehaviorTree original = new BehaviorTree("guard");
        Parallel both = new Parallel("both", Policy.SUCCEED_ON_ONE);
        both.addChild(new AlwaysTrue("ok"));
        both.addChild(new SetBlackboard("mark", "visited", "yes"));
        original.loadFromRoot(both);
        String json = TreeDefinitionSerializer.toJson(TreeExporter.export(original));

        // When
        TreeDefinition definition = TreeDefinitionSerializer.fromJson(json);
        BehaviorTree rebuilt = new TreeBuilder(new DefaultNodeRegistry()).buildTree("copy", definition.root());

        // Then
        assertThat(TreeExporter.export(rebuilt.getRoot())).isEqualTo(TreeExporter.export(both));
        assertThat(rebuilt.tick()).isEqualTo(Status.SUCCESS);
        assertThat(rebuilt.getBlackboardData("visited")).isEqualTo("yes");
    }

    @Test
    void shouldIncludeBlackboardOnlyWhenAsked() {
        // Given
        BehaviorTree tree = new BehaviorTree("guard");
        tree.loadFromRoot(new AlwaysTrue("ok"));
        tree.setBlackboardData("laps", 4);

        // When / Then
        assertThat(TreeExporter.export(tree).blackboard()).isEmpty();
        assertThat(TreeExporter.export(tree, true).blackboard()).containsEntry("laps", 4);
    }

    @Test
    void shouldRejectTreeWithoutRoot() {
        BehaviorTree empty = new BehaviorTree("empty");

        assertThatThrownBy(() -> TreeExporter.export(empty))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'empty' has no root");
    }

    @Test
    void shouldExportForestMembersWithSortedCapabilities() {
        // Given
        try (BehaviorForest forest = new BehaviorForest("fleet")) {
            BehaviorTree tree = forest.newTree("scout");
            tree.loadFromRoot(new AlwaysTrue("ok"));
            forest.addNode("scout", tree, ForestNodeType.WORKER, Set.of("zoom", "look", "move"))
                    .addDependency("base");
            forest.getBlackboard().set("zone", "north");

            // When
            ForestDefinition definition = TreeExporter.export(forest, true);

            // Then
            assertThat(definition.name()).isEqualTo("fleet");
            assertThat(definition.blackboard()).containsEntry("zone", "north");
            assertThat(definition.nodes()).singleElement().satisfies(node -> {
                assertThat(node.type()).isEqualTo(ForestNodeType.WORKER);
                assertThat(node.capabilities()).containsExactly("look", "move", "zoom");
                assertThat(node.dependencies()).containsExactly("base");
                assertThat(node.tree().root().type()).isEqualTo("AlwaysTrue");
            });
        }
    }
}
