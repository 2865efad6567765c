package io.canopy.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.exception.TreeStructureException;
import io.canopy.core.node.composite.Selector;
import io.canopy.core.node.composite.Sequence;
import io.canopy.core.node.decorator.Inverter;
import io.canopy.core.node.leaf.AlwaysFalse;
import io.canopy.core.node.leaf.AlwaysTrue;
import org.junit.jupiter.api.Test;

class TreeValidatorTest {

    @Test
    void shouldAcceptWellFormedTree() {
        Sequence root = new Sequence("root", new Inverter("not", new AlwaysFalse("no")), new AlwaysTrue("yes"));

        ValidationResult result = TreeValidator.validate(root);

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void shouldWarnAboutEmptyNodesAndDuplicateNames() {
        // Given
        Sequence root = new Sequence("root", new Inverter("empty"), new Selector("none"), new AlwaysTrue("root"));

        // When
        ValidationResult result = TreeValidator.validate(root);

        // Then
        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings())
                .anyMatch(w -> w.contains("Decorator 'empty'"))
                .anyMatch(w -> w.contains("Composite 'none'"))
                .anyMatch(w -> w.contains("Duplicate node names"));
    }

    @Test
    void shouldRejectBlankNames() {
        Sequence root = new Sequence("root", new AlwaysTrue(""));

        ValidationResult result = TreeValidator.validate(root);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("blank name");
        assertThatThrownBy(() -> TreeValidator.requireValid(root)).isInstanceOf(TreeStructureException.class);
    }
}
