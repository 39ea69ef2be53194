package io.github.cyfko.zapformat.core.ast;

import java.util.Objects;

/**
 * {@code funct <name> = { ... }}
 *
 * @param name       the function name
 * @param properties the function properties
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionNode(String name, FunctionProperties properties) implements NamespaceMember {

    public FunctionNode {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(properties, "Function properties cannot be null");
    }

    @Override
    public ItemKind kind() {
        return ItemKind.FUNCTION;
    }
}
