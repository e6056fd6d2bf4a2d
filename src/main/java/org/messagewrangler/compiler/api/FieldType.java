package org.messagewrangler.compiler.api;

import java.util.List;
import java.util.Optional;

/**
 * The resolved type of a field.
 */
public sealed interface FieldType
        permits FieldType.PrimitiveType, FieldType.EnumRef, FieldType.OptionsRef, FieldType.MessageRef,
                FieldType.CompoundType, FieldType.ArrayType, FieldType.MapType {

    /**
     * Returns the type tag: {@code string}, {@code int}, {@code float}, {@code bool}, {@code byte},
     * {@code enum}, {@code options}, {@code message}, {@code compound}, {@code array} or {@code map}.
     */
    String tag();

    /**
     * Returns the referenced entity, looking through arrays and map values.
     * Empty for primitives, compounds and containers of them.
     */
    default Optional<TypeRef> typeRef() {
        return Optional.empty();
    }

    enum Primitive {
        STRING("string"),
        INT("int"),
        FLOAT("float"),
        BOOL("bool"),
        BYTE("byte");

        private final String keyword;

        Primitive(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static Optional<Primitive> fromKeyword(String keyword) {
            for (Primitive p : values()) {
                if (p.keyword.equals(keyword)) {
                    return Optional.of(p);
                }
            }
            return Optional.empty();
        }
    }

    record PrimitiveType(Primitive primitive) implements FieldType {
        @Override
        public String tag() {
            return primitive.keyword();
        }
    }

    record EnumRef(TypeRef ref) implements FieldType {
        @Override
        public String tag() {
            return "enum";
        }

        @Override
        public Optional<TypeRef> typeRef() {
            return Optional.of(ref);
        }
    }

    record OptionsRef(TypeRef ref) implements FieldType {
        @Override
        public String tag() {
            return "options";
        }

        @Override
        public Optional<TypeRef> typeRef() {
            return Optional.of(ref);
        }
    }

    record MessageRef(TypeRef ref) implements FieldType {
        @Override
        public String tag() {
            return "message";
        }

        @Override
        public Optional<TypeRef> typeRef() {
            return Optional.of(ref);
        }
    }

    record CompoundType(String baseType, List<String> components) implements FieldType {
        public CompoundType {
            components = List.copyOf(components);
        }

        @Override
        public String tag() {
            return "compound";
        }
    }

    record ArrayType(FieldType element) implements FieldType {
        @Override
        public String tag() {
            return "array";
        }

        @Override
        public Optional<TypeRef> typeRef() {
            return element.typeRef();
        }
    }

    record MapType(FieldType key, FieldType value) implements FieldType {
        @Override
        public String tag() {
            return "map";
        }

        @Override
        public Optional<TypeRef> typeRef() {
            Optional<TypeRef> valueRef = value.typeRef();
            return valueRef.isPresent() ? valueRef : key.typeRef();
        }
    }
}
