package io.github.cyfko.zapformat.core.ast;

/**
 * Items allowed inside a namespace body. Namespaces hold no nested namespaces and no type
 * definitions.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface NamespaceMember extends ConfigItem permits CommentNode, EventNode, FunctionNode {
}
