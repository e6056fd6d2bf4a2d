package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;
import java.util.Optional;

/**
 * A resolved enum or options set.
 *
 * @param name         The simple name.
 * @param qfn          The fully qualified name.
 * @param options      Whether this is a bit-flag options set.
 * @param open         Whether values outside the declared set are permitted.
 * @param bitWidth     The encoding width: 8, 16, 32 or 64.
 * @param values       Inherited values followed by the enum's own values.
 * @param parent       The parent enum, or {@code null}.
 * @param doc          The doc comment, or an empty string.
 * @param comment      All attached comments, or an empty string.
 * @param source       The declaring position.
 * @param promotedFrom {@code Message.field} for enums promoted from an inline body, else {@code null}.
 */
public record ModelEnum(String name, String qfn, boolean options, boolean open, int bitWidth,
                        List<ModelEnumValue> values, TypeRef parent, String doc, String comment,
                        SourceRef source, String promotedFrom) implements ModelEntity {

    public ModelEnum {
        values = List.copyOf(values);
    }

    public Optional<ModelEnumValue> value(String valueName) {
        return values.stream().filter(v -> v.name().equals(valueName)).findFirst();
    }

    public Optional<TypeRef> parentRef() {
        return Optional.ofNullable(parent);
    }

    public TypeRef ref() {
        return new TypeRef(qfn, options ? TypeRef.Kind.OPTIONS : TypeRef.Kind.ENUM);
    }
}
