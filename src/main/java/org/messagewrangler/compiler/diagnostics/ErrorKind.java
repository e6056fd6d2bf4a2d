package org.messagewrangler.compiler.diagnostics;

/**
 * Classifies the errors a compilation can produce.
 */
public enum ErrorKind {
    /** The grammar rejected the input. */
    SYNTAX("syntax error"),
    /** A type or parent name could not be bound to an entity. */
    UNRESOLVED_REFERENCE("unresolved reference"),
    /** Two entities (or two namespaces) share one qualified name. */
    DUPLICATE_DEFINITION("duplicate definition"),
    /** An extending enum redeclares an inherited value name. */
    DUPLICATE_ENUM_VALUE("duplicate enum value"),
    /** The import graph contains a cycle. */
    CIRCULAR_IMPORT("circular import"),
    /** A message or enum parent chain revisits itself. */
    CIRCULAR_INHERITANCE("circular inheritance"),
    /** An imported file does not exist. */
    MISSING_IMPORT("missing import"),
    /** A default value cannot be reduced for the type of its field. */
    INVALID_DEFAULT_VALUE("invalid default value"),
    /** A file exists but could not be read. */
    IO("i/o error"),
    /** Non-fatal findings. */
    WARNING("warning");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
