package org.messagewrangler.compiler;

import org.messagewrangler.compiler.diagnostics.Diagnostic;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;

import java.util.List;

/**
 * Thrown by the {@link Compiler} when a compilation produced errors.
 * Carries every diagnostic reported up to the failing phase.
 */
public class CompilationException extends RuntimeException {

    private final transient DiagnosticsEngine diagnostics;

    public CompilationException(String message, DiagnosticsEngine diagnostics) {
        super(message);
        this.diagnostics = diagnostics;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        return diagnostics.errors();
    }
}
