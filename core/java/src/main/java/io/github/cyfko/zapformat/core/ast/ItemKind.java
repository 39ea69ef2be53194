package io.github.cyfko.zapformat.core.ast;

/**
 * Discriminant of the configuration items that may appear at top level or inside a namespace.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ItemKind {
    COMMENT,
    EVENT,
    FUNCTION,
    NAMESPACE,
    TYPE_DEFINITION
}
