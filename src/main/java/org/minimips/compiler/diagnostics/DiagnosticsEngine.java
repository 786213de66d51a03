package org.minimips.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors and warnings reported by the loader phases, so that the
 * phases themselves never have to decide how problems are surfaced.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String sourceName;

    /**
     * Creates an engine whose diagnostics name the given source.
     * @param sourceName The logical source name.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return The diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One diagnostic per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
