package io.github.cyfko.zapformat.core.ast;

import java.util.Objects;

/**
 * {@code type <name> = <type>}
 *
 * @param name       the defined type name
 * @param definition the type expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TypeDefinitionNode(String name, TypeNode definition) implements ConfigItem {

    public TypeDefinitionNode {
        Objects.requireNonNull(name, "Type name cannot be null");
        Objects.requireNonNull(definition, "Type definition cannot be null");
    }

    @Override
    public ItemKind kind() {
        return ItemKind.TYPE_DEFINITION;
    }
}
