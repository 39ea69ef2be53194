package io.github.cyfko.zapformat.core.ast;

import java.util.Objects;

/**
 * A line comment. {@code text} includes the leading {@code --}.
 *
 * @param text the comment text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CommentNode(String text) implements NamespaceMember {

    public CommentNode {
        Objects.requireNonNull(text, "Comment text cannot be null");
    }

    @Override
    public ItemKind kind() {
        return ItemKind.COMMENT;
    }
}
