package org.minimips.compiler.diagnostics;

/**
 * A single diagnostic message produced while loading a program.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param sourceName The logical name of the source, e.g. a file name.
 * @param lineNumber The 1-based source line the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** A problem that prevents loading. */
        ERROR,
        /** A problem the loader tolerates. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, sourceName, lineNumber, message);
    }
}
