package io.github.cyfko.zapformat.core.ast;

/**
 * Discriminant of {@link TypeNode} variants.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TypeKind {
    PRIMITIVE,
    ARRAY,
    MAP,
    SET,
    OPTIONAL,
    UNION,
    INSTANCE,
    TUPLE,
    STRUCT,
    ENUM,
    VECTOR
}
