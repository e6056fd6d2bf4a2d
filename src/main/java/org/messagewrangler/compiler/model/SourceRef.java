package org.messagewrangler.compiler.model;

/**
 * Provenance of a declaration.
 *
 * @param file The source file name.
 * @param line The 1-based line, or 0 for synthesized entities without a position.
 */
public record SourceRef(String file, int line) {

    @Override
    public String toString() {
        return line > 0 ? file + ":" + line : file;
    }
}
