package org.messagewrangler.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings for one compilation unit.
 * <p>
 * Every phase reports into the same engine so that a user sees all problems of a run at once.
 * The engine never throws; callers decide when to stop by checking {@link #hasErrors()}.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param kind     The error category.
     * @param message  The error message.
     * @param fileName The file the error occurred in.
     * @param line     The 1-based line number, or 0 if unknown.
     */
    public void reportError(ErrorKind kind, String message, String fileName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, kind, message, nullToEmpty(fileName), line));
    }

    /**
     * Reports a syntax error.
     * @param message  The error message.
     * @param fileName The file the error occurred in.
     * @param line     The 1-based line number.
     */
    public void reportError(String message, String fileName, int line) {
        reportError(ErrorKind.SYNTAX, message, fileName, line);
    }

    /**
     * Reports a warning.
     * @param message  The warning message.
     * @param fileName The file the warning refers to.
     * @param line     The 1-based line number, or 0 if unknown.
     */
    public void reportWarning(String message, String fileName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, ErrorKind.WARNING, message, nullToEmpty(fileName), line));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> !d.isError());
    }

    /**
     * Returns all diagnostics in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public List<Diagnostic> errorsOfKind(ErrorKind kind) {
        return diagnostics.stream()
                .filter(Diagnostic::isError)
                .filter(d -> d.kind() == kind)
                .collect(Collectors.toList());
    }

    public int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    /**
     * Renders all diagnostics, one per line.
     * @return The formatted diagnostics, or an empty string if there are none.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("\n"));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
