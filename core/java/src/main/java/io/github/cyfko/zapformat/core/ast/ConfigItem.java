package io.github.cyfko.zapformat.core.ast;

/**
 * A top-level item of a Zap configuration (everything except options).
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ConfigItem permits NamespaceMember, NamespaceNode, TypeDefinitionNode {

    /**
     * @return the discriminant identifying the concrete item shape
     */
    ItemKind kind();
}
