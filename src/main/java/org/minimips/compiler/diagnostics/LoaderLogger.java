package org.minimips.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loader-internal logger with integer verbosity levels on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 */
public final class LoaderLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(LoaderLogger.class);

    private LoaderLogger() {}

    /**
     * Sets the logging verbosity level.
     * @param newLevel The new level, clamped to the range ERROR..TRACE.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * Returns the current verbosity level.
     * @return The level.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a warning message.
     * @param msg The message to log.
     */
    public static void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    /**
     * Logs a debug message.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs the warnings collected by the engine. Errors are not logged here, they
     * travel with the exception that aborts the load.
     * @param diagnostics The diagnostics to log.
     */
    public static void reportWarnings(DiagnosticsEngine diagnostics) {
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.type() == Diagnostic.Type.WARNING) {
                warn(diagnostic.toString());
            }
        }
    }
}
