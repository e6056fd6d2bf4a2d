package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

import java.util.List;

/**
 * A named compound declaration. Fields that reference it carry a {@link FieldType.CompoundType}.
 */
public record ModelCompound(String name, String qfn, String baseType, List<String> components,
                            String doc, String comment, SourceRef source) implements ModelEntity {

    public ModelCompound {
        components = List.copyOf(components);
    }
}
