package org.messagewrangler.compiler.frontend.early;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An unresolved field type, one record per syntactic kind. Named references are plain strings
 * until the Model Builder binds them.
 */
public sealed interface RawType
        permits RawType.Primitive, RawType.Reference, RawType.InlineEnum, RawType.InlineOptions,
                RawType.Compound, RawType.Array, RawType.MapOf {

    /**
     * Returns a copy with every named reference rewritten by {@code names}.
     * Compound base types are rewritten only when {@code includeCompoundBase} is set.
     */
    RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase);

    /**
     * Returns whether an inline enum or options body occurs anywhere in this type.
     */
    default boolean containsInline() {
        return false;
    }

    /** One of the built-in types. */
    record Primitive(String name) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            return this;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A named type.
     *
     * @param name The name as written, or its QFN once resolved.
     * @param kind The entity kind demanded by the syntax.
     */
    record Reference(String name, RefKind kind) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            String mapped = names.apply(name);
            return mapped.equals(name) ? this : new Reference(mapped, kind);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** An enum body written in field position. */
    record InlineEnum(boolean open, List<EarlyEnumValue> values) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            return this;
        }

        @Override
        public boolean containsInline() {
            return true;
        }

        @Override
        public String toString() {
            return (open ? "open_enum" : "enum") + values.stream().map(EarlyEnumValue::name).toList();
        }
    }

    /** An options body written in field position. */
    record InlineOptions(List<EarlyEnumValue> values) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            return this;
        }

        @Override
        public boolean containsInline() {
            return true;
        }

        @Override
        public String toString() {
            return "options" + values.stream().map(EarlyEnumValue::name).toList();
        }
    }

    /** A fixed-component aggregate written in field position. */
    record Compound(String baseType, List<String> components) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            if (!includeCompoundBase) {
                return this;
            }
            String mapped = names.apply(baseType);
            return mapped.equals(baseType) ? this : new Compound(mapped, components);
        }

        @Override
        public String toString() {
            return baseType + components;
        }
    }

    /** {@code element[]}. */
    record Array(RawType element) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            RawType mapped = element.mapNames(names, includeCompoundBase);
            return mapped == element ? this : new Array(mapped);
        }

        @Override
        public boolean containsInline() {
            return element.containsInline();
        }

        @Override
        public String toString() {
            return element + "[]";
        }
    }

    /** {@code Map<key, value>}. */
    record MapOf(RawType key, RawType value) implements RawType {
        @Override
        public RawType mapNames(UnaryOperator<String> names, boolean includeCompoundBase) {
            RawType k = key.mapNames(names, includeCompoundBase);
            RawType v = value.mapNames(names, includeCompoundBase);
            return k == key && v == value ? this : new MapOf(k, v);
        }

        @Override
        public boolean containsInline() {
            return key.containsInline() || value.containsInline();
        }

        @Override
        public String toString() {
            return "Map<" + key + ", " + value + ">";
        }
    }

    /** The entity kind a reference must resolve to. */
    enum RefKind {
        ANY,
        ENUM,
        OPTIONS
    }
}
