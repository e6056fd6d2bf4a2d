package org.messagewrangler.compiler.semantics;

import org.messagewrangler.compiler.api.DefaultValue;
import org.messagewrangler.compiler.api.FieldType;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelEnumValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reduces a raw default expression to its final value for the field's type.
 * <p>
 * Enum defaults name one value ({@code Red}, {@code Color::Red} or {@code Color.Red}) or give its number.
 * Options defaults are {@code A | B | ...} and are OR-combined. Defaults of message, array, map and
 * compound fields are kept as written.
 */
public final class DefaultValueReducer {

    private final Function<String, Optional<ModelEnum>> enums;

    /**
     * @param enums Looks up a resolved enum by QFN.
     */
    public DefaultValueReducer(Function<String, Optional<ModelEnum>> enums) {
        this.enums = enums;
    }

    /**
     * @param raw  The default expression as written.
     * @param type The resolved field type.
     * @return The reduced default.
     * @throws IllegalArgumentException If the expression is not a valid value of the type.
     */
    public DefaultValue reduce(String raw, FieldType type) {
        String text = raw.trim();
        if (type instanceof FieldType.PrimitiveType primitive) {
            return reducePrimitive(text, primitive.primitive());
        }
        if (type instanceof FieldType.EnumRef enumRef) {
            return reduceEnum(text, enumFor(enumRef.ref().qfn()));
        }
        if (type instanceof FieldType.OptionsRef optionsRef) {
            return reduceFlags(text, enumFor(optionsRef.ref().qfn()));
        }
        return new DefaultValue.RawValue(text);
    }

    private DefaultValue reducePrimitive(String text, FieldType.Primitive primitive) {
        switch (primitive) {
            case STRING -> {
                if (text.length() < 2 || !text.startsWith("\"") || !text.endsWith("\"")) {
                    throw new IllegalArgumentException("'" + text + "' is not a quoted string");
                }
                return new DefaultValue.StringValue(text.substring(1, text.length() - 1).replace("\\\"", "\""));
            }
            case INT, BYTE -> {
                long value;
                try {
                    value = Long.decode(text);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("'" + text + "' is not an integer", e);
                }
                if (primitive == FieldType.Primitive.BYTE && (value < 0 || value > 255)) {
                    throw new IllegalArgumentException(value + " is out of range for byte");
                }
                return new DefaultValue.IntValue(value);
            }
            case FLOAT -> {
                try {
                    return new DefaultValue.FloatValue(Double.parseDouble(text));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("'" + text + "' is not a number", e);
                }
            }
            case BOOL -> {
                if (!text.equals("true") && !text.equals("false")) {
                    throw new IllegalArgumentException("'" + text + "' is not true or false");
                }
                return new DefaultValue.BoolValue(Boolean.parseBoolean(text));
            }
            default -> throw new IllegalStateException("Unknown primitive " + primitive);
        }
    }

    private DefaultValue reduceEnum(String text, ModelEnum target) {
        Optional<Long> number = parseNumber(text);
        if (number.isPresent()) {
            for (ModelEnumValue v : target.values()) {
                if (v.value() == number.get()) {
                    return new DefaultValue.EnumValue(v.name(), v.value());
                }
            }
            if (target.open()) {
                return new DefaultValue.IntValue(number.get());
            }
            throw new IllegalArgumentException(text + " is not a value of enum '" + target.qfn() + "'");
        }
        ModelEnumValue value = valueOf(target, text);
        return new DefaultValue.EnumValue(value.name(), value.value());
    }

    private DefaultValue reduceFlags(String text, ModelEnum target) {
        List<String> names = new ArrayList<>();
        long combined = 0;
        for (String part : text.split("\\|")) {
            String flag = part.trim();
            if (flag.isEmpty()) {
                throw new IllegalArgumentException("empty flag in '" + text + "'");
            }
            Optional<Long> number = parseNumber(flag);
            if (number.isPresent()) {
                combined |= number.get();
                names.add(flag);
            } else {
                ModelEnumValue value = valueOf(target, flag);
                combined |= value.value();
                names.add(value.name());
            }
        }
        return new DefaultValue.FlagsValue(names, combined);
    }

    private ModelEnumValue valueOf(ModelEnum target, String text) {
        String name = lastSegment(text);
        return target.value(name).orElseThrow(() ->
                new IllegalArgumentException("'" + name + "' is not a value of '" + target.qfn() + "'"));
    }

    private ModelEnum enumFor(String qfn) {
        return enums.apply(qfn).orElseThrow(() ->
                new IllegalArgumentException("enum '" + qfn + "' is not resolved"));
    }

    private static String lastSegment(String name) {
        int colons = name.lastIndexOf("::");
        if (colons >= 0) {
            return name.substring(colons + 2);
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private static Optional<Long> parseNumber(String text) {
        if (text.isEmpty() || !(Character.isDigit(text.charAt(0)) || text.charAt(0) == '-')) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.decode(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
