package org.minimips.compiler.api;

import org.minimips.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when assembly source cannot be turned into a {@link Program}.
 * The message is meant to be shown to the user verbatim.
 */
public class ProgramLoadException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new load exception carrying the diagnostics that caused it.
     * @param message The detail message.
     * @param diagnostics The diagnostics collected during loading.
     */
    public ProgramLoadException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics collected up to the failure.
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
