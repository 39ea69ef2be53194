package io.github.cyfko.zapformat.core.ast;

import io.github.cyfko.zapformat.core.ast.TypeNode.EnumType;
import io.github.cyfko.zapformat.core.ast.TypeNode.EnumVariant;
import io.github.cyfko.zapformat.core.ast.TypeNode.PrimitiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST Node Tests")
class AstNodeTest {

    @Test
    @DisplayName("Should accept boolean, number and string option values")
    void shouldAcceptOptionValues() {
        assertDoesNotThrow(() -> new OptionNode("a", true));
        assertDoesNotThrow(() -> new OptionNode("b", 1.0));
        assertDoesNotThrow(() -> new OptionNode("c", "PascalCase"));
    }

    @Test
    @DisplayName("Should reject other option values")
    void shouldRejectOtherOptionValues() {
        assertThrows(IllegalArgumentException.class, () -> new OptionNode("a", 1));
        assertThrows(IllegalArgumentException.class, () -> new OptionNode("a", null));
    }

    @Test
    @DisplayName("Should copy configuration lists")
    void shouldCopyConfigurationLists() {
        // Given
        List<ConfigItem> items = new ArrayList<>();
        items.add(new TypeDefinitionNode("A", new PrimitiveType("u8")));

        // When
        ZapConfiguration config = new ZapConfiguration(List.of(), items);
        items.clear();

        // Then
        assertEquals(1, config.items().size());
        assertThrows(UnsupportedOperationException.class, () -> config.items().add(new CommentNode("-- x")));
    }

    @Test
    @DisplayName("Should expose item kinds")
    void shouldExposeItemKinds() {
        assertEquals(ItemKind.COMMENT, new CommentNode("-- x").kind());
        assertEquals(ItemKind.EVENT, new EventNode("E", EventProperties.empty()).kind());
        assertEquals(ItemKind.FUNCTION, new FunctionNode("F", FunctionProperties.empty()).kind());
        assertEquals(ItemKind.NAMESPACE, new NamespaceNode("N", List.of()).kind());
        assertEquals(ItemKind.TYPE_DEFINITION, new TypeDefinitionNode("T", new PrimitiveType("u8")).kind());
    }

    @Test
    @DisplayName("Should treat a missing or empty tag as untagged")
    void shouldTreatEmptyTagAsUntagged() {
        List<EnumVariant> variants = List.of(new EnumVariant("A"));

        assertFalse(new EnumType(null, variants).isTagged());
        assertFalse(new EnumType("", variants).isTagged());
        assertTrue(new EnumType("kind", variants).isTagged());
    }

    @Test
    @DisplayName("Should build range constraints")
    void shouldBuildRangeConstraints() {
        assertEquals(new RangeConstraint(5.0, 5.0), RangeConstraint.exactly(5));
        assertEquals(new RangeConstraint(1.0, null), RangeConstraint.atLeast(1));
        assertEquals(new RangeConstraint(null, 10.0), RangeConstraint.atMost(10));
        assertEquals(new RangeConstraint(null, null), RangeConstraint.open());
    }
}
