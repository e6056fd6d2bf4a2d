package org.messagewrangler.compiler.diagnostics;

/**
 * A single error or warning reported during compilation.
 *
 * @param severity Whether this diagnostic fails the compilation.
 * @param kind     The error category.
 * @param message  The human-readable description, naming the entity involved.
 * @param fileName The source file the diagnostic refers to (may be empty for global problems).
 * @param line     The 1-based line, or 0 if unknown.
 */
public record Diagnostic(Severity severity, ErrorKind kind, String message, String fileName, int line) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats this diagnostic as {@code file:line: error: [kind] message}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        if (fileName != null && !fileName.isEmpty()) {
            sb.append(fileName);
            if (line > 0) {
                sb.append(':').append(line);
            }
            sb.append(": ");
        }
        sb.append(severity == Severity.ERROR ? "error" : "warning").append(": ");
        if (kind != ErrorKind.WARNING) {
            sb.append('[').append(kind.label()).append("] ");
        }
        sb.append(message);
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
