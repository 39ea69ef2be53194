package io.github.cyfko.zapformat.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A Zap type expression.
 * <p>
 * The set of variants is closed. Each variant reports its {@link TypeKind} so that consumers
 * can dispatch with an exhaustive {@code switch} over {@link #kind()}.
 * </p>
 *
 * <h2>Grammar to node mapping</h2>
 * <pre>
 * u8, string(3..20), string.utf8  -> PrimitiveType
 * T[], T[10], T[1..5]             -> ArrayType
 * map {[K]: V}                    -> MapType
 * set {T}                         -> SetType
 * T?                              -> OptionalType
 * A | B | C                       -> UnionType
 * Instance, Instance.Part         -> InstanceType
 * (a: T, U)                       -> TupleType
 * struct {a: T}                   -> StructType
 * enum {A, B}, enum "k" {A {..}}  -> EnumType
 * vector(f32, f32), Vector3       -> VectorType
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface TypeNode {

    /**
     * @return the discriminant identifying the concrete type shape
     */
    TypeKind kind();

    /**
     * A named primitive such as {@code u8}, {@code string}, {@code CFrame} or {@code string.utf8}.
     *
     * @param name       the primitive name as written
     * @param constraint optional range, {@code null} when absent
     */
    record PrimitiveType(String name, RangeConstraint constraint) implements TypeNode {
        public PrimitiveType {
            Objects.requireNonNull(name, "Primitive name cannot be null");
        }

        public PrimitiveType(String name) {
            this(name, null);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.PRIMITIVE;
        }
    }

    /**
     * @param elementType the element type
     * @param constraint  optional length range, {@code null} when absent
     */
    record ArrayType(TypeNode elementType, RangeConstraint constraint) implements TypeNode {
        public ArrayType {
            Objects.requireNonNull(elementType, "Array element type cannot be null");
        }

        public ArrayType(TypeNode elementType) {
            this(elementType, null);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.ARRAY;
        }
    }

    record MapType(TypeNode keyType, TypeNode valueType) implements TypeNode {
        public MapType {
            Objects.requireNonNull(keyType, "Map key type cannot be null");
            Objects.requireNonNull(valueType, "Map value type cannot be null");
        }

        @Override
        public TypeKind kind() {
            return TypeKind.MAP;
        }
    }

    record SetType(TypeNode elementType) implements TypeNode {
        public SetType {
            Objects.requireNonNull(elementType, "Set element type cannot be null");
        }

        @Override
        public TypeKind kind() {
            return TypeKind.SET;
        }
    }

    record OptionalType(TypeNode innerType) implements TypeNode {
        public OptionalType {
            Objects.requireNonNull(innerType, "Optional inner type cannot be null");
        }

        @Override
        public TypeKind kind() {
            return TypeKind.OPTIONAL;
        }
    }

    /**
     * A union of two or more types. Singletons never produce a union node.
     *
     * @param types the members in source order
     */
    record UnionType(List<TypeNode> types) implements TypeNode {
        public UnionType {
            types = List.copyOf(types);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.UNION;
        }
    }

    /**
     * @param className the Roblox class name, {@code null} for a bare {@code Instance}
     */
    record InstanceType(String className) implements TypeNode {
        @Override
        public TypeKind kind() {
            return TypeKind.INSTANCE;
        }
    }

    /**
     * @param name optional element name, {@code null} when unnamed
     * @param type the element type
     */
    record TupleElement(String name, TypeNode type) {
        public TupleElement {
            Objects.requireNonNull(type, "Tuple element type cannot be null");
        }
    }

    record TupleType(List<TupleElement> elements) implements TypeNode {
        public TupleType {
            elements = List.copyOf(elements);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.TUPLE;
        }
    }

    record StructField(String name, TypeNode type) {
        public StructField {
            Objects.requireNonNull(name, "Struct field name cannot be null");
            Objects.requireNonNull(type, "Struct field type cannot be null");
        }
    }

    /**
     * @param fields fields in source order; names are not checked for uniqueness
     */
    record StructType(List<StructField> fields) implements TypeNode {
        public StructType {
            fields = List.copyOf(fields);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.STRUCT;
        }
    }

    /**
     * @param name   the variant name
     * @param fields payload of a tagged-enum variant, {@code null} when absent
     */
    record EnumVariant(String name, StructType fields) {
        public EnumVariant {
            Objects.requireNonNull(name, "Enum variant name cannot be null");
        }

        public EnumVariant(String name) {
            this(name, null);
        }
    }

    /**
     * @param tagField discriminant field name of a tagged enum, {@code null} for a unit enum
     * @param variants variants in source order
     */
    record EnumType(String tagField, List<EnumVariant> variants) implements TypeNode {
        public EnumType {
            variants = List.copyOf(variants);
        }

        /**
         * An empty tag string counts as no tag.
         *
         * @return {@code true} if this enum declares a non-empty tag field
         */
        public boolean isTagged() {
            return tagField != null && !tagField.isEmpty();
        }

        @Override
        public TypeKind kind() {
            return TypeKind.ENUM;
        }
    }

    /**
     * @param components explicit component types, {@code null} when no list was written
     */
    record VectorType(List<TypeNode> components) implements TypeNode {
        public VectorType {
            components = components == null ? null : List.copyOf(components);
        }

        @Override
        public TypeKind kind() {
            return TypeKind.VECTOR;
        }
    }
}
