package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;
import java.util.Optional;

/**
 * A resolved message field.
 *
 * @param name         The field name.
 * @param type         The resolved type.
 * @param modifiers    The modifiers in source order.
 * @param defaultValue The reduced default, or {@code null}.
 * @param doc          The doc comment, or an empty string.
 * @param comment      All attached comments, or an empty string.
 * @param source       The declaring position.
 */
public record ModelField(String name, FieldType type, List<String> modifiers, DefaultValue defaultValue,
                         String doc, String comment, SourceRef source) {

    public ModelField {
        modifiers = List.copyOf(modifiers);
    }

    public boolean optional() {
        return modifiers.contains("optional");
    }

    public Optional<TypeRef> typeRef() {
        return type.typeRef();
    }

    public Optional<DefaultValue> defaultValueOpt() {
        return Optional.ofNullable(defaultValue);
    }
}
