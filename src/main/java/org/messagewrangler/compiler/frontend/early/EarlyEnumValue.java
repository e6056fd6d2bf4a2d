package org.messagewrangler.compiler.frontend.early;

import org.messagewrangler.compiler.model.SourceRef;

/**
 * A raw enum or options value.
 *
 * @param name     The value name.
 * @param value    The numeric value, explicit or assigned from the previous one.
 * @param explicit Whether the value was written in the source.
 * @param doc      The doc comment, or an empty string.
 * @param comment  All attached comments, or an empty string.
 * @param source   The declaring position.
 */
public record EarlyEnumValue(String name, long value, boolean explicit, String doc, String comment, SourceRef source) {
}
