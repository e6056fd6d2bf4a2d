package org.messagewrangler.compiler.api;

import java.util.List;

/**
 * A field default reduced to its final representation.
 */
public sealed interface DefaultValue
        permits DefaultValue.StringValue, DefaultValue.IntValue, DefaultValue.FloatValue, DefaultValue.BoolValue,
                DefaultValue.EnumValue, DefaultValue.FlagsValue, DefaultValue.RawValue {

    /**
     * Returns the value as it would be written in the schema language.
     */
    String text();

    record StringValue(String value) implements DefaultValue {
        @Override
        public String text() {
            return "\"" + value + "\"";
        }
    }

    record IntValue(long value) implements DefaultValue {
        @Override
        public String text() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements DefaultValue {
        @Override
        public String text() {
            return Double.toString(value);
        }
    }

    record BoolValue(boolean value) implements DefaultValue {
        @Override
        public String text() {
            return Boolean.toString(value);
        }
    }

    /** A value of the field's enum. */
    record EnumValue(String name, long value) implements DefaultValue {
        @Override
        public String text() {
            return name;
        }
    }

    /** Options flags OR-combined into one number. */
    record FlagsValue(List<String> names, long value) implements DefaultValue {
        public FlagsValue {
            names = List.copyOf(names);
        }

        @Override
        public String text() {
            return String.join(" | ", names);
        }
    }

    /** A default for a message, array, map or compound field, kept as written. */
    record RawValue(String text) implements DefaultValue {
    }
}
