package org.messagewrangler.compiler.api;

import org.messagewrangler.compiler.model.SourceRef;

/**
 * A resolved enum or options value.
 *
 * @param name          The value name.
 * @param value         The final numeric value.
 * @param doc           The doc comment, or an empty string.
 * @param comment       All attached comments, or an empty string.
 * @param source        The declaring position.
 * @param inheritedFrom The QFN of the enum that declared the value, if it was inherited; else {@code null}.
 */
public record ModelEnumValue(String name, long value, String doc, String comment, SourceRef source,
                             String inheritedFrom) {

    public boolean isInherited() {
        return inheritedFrom != null;
    }
}
