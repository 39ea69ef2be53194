package io.github.cyfko.zapformat.core.ast;

import java.util.Objects;

/**
 * {@code event <name> = { ... }}
 *
 * @param name       the event name
 * @param properties the event properties
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EventNode(String name, EventProperties properties) implements NamespaceMember {

    public EventNode {
        Objects.requireNonNull(name, "Event name cannot be null");
        Objects.requireNonNull(properties, "Event properties cannot be null");
    }

    @Override
    public ItemKind kind() {
        return ItemKind.EVENT;
    }
}
