package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;
import java.util.Optional;

/**
 * A resolved message.
 */
public record ModelMessage(String name, String qfn, TypeRef parent, List<ModelField> fields,
                           String doc, String comment, SourceRef source) implements ModelEntity {

    public ModelMessage {
        fields = List.copyOf(fields);
    }

    public Optional<ModelField> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public Optional<TypeRef> parentRef() {
        return Optional.ofNullable(parent);
    }
}
