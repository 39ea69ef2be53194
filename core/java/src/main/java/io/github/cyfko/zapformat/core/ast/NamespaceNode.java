package io.github.cyfko.zapformat.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code namespace <name> = { ... }}, a flat container of comments, events and functions.
 *
 * @param name    the namespace name
 * @param members the members in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NamespaceNode(String name, List<NamespaceMember> members) implements ConfigItem {

    public NamespaceNode {
        Objects.requireNonNull(name, "Namespace name cannot be null");
        members = List.copyOf(members);
    }

    @Override
    public ItemKind kind() {
        return ItemKind.NAMESPACE;
    }
}
