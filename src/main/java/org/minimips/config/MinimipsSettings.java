package org.minimips.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.minimips.compiler.ProgramLoader;
import org.minimips.runtime.VirtualMachine;
import org.minimips.runtime.session.DebugSession;

/**
 * The tunable settings of the loader, the virtual machine and debug sessions, read
 * from the {@code minimips} block of the configuration.
 *
 * <pre>
 * minimips {
 *   loader.eager-validation = false
 *   runtime.max-steps = 10000
 *   session.history-limit = 1000
 * }
 * </pre>
 *
 * @param eagerValidation Whether undecodable instructions fail the load.
 * @param maxSteps The step bound of the virtual machine.
 * @param historyLimit The number of snapshots a debug session keeps.
 */
public record MinimipsSettings(boolean eagerValidation, int maxSteps, int historyLimit) {

    private static final String ROOT = "minimips";

    public MinimipsSettings {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("minimips.runtime.max-steps must be positive, was " + maxSteps);
        }
        if (historyLimit < 0) {
            throw new IllegalArgumentException("minimips.session.history-limit must not be negative, was " + historyLimit);
        }
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The configuration; must contain the {@code minimips} block, which
     *               {@code reference.conf} provides.
     * @return The settings.
     * @throws ConfigException if a value is missing or has the wrong type.
     */
    public static MinimipsSettings from(Config config) {
        Config root = config.getConfig(ROOT);
        return new MinimipsSettings(
                root.getBoolean("loader.eager-validation"),
                root.getInt("runtime.max-steps"),
                root.getInt("session.history-limit"));
    }

    /**
     * Returns the settings of {@code reference.conf} alone.
     * @return The default settings.
     */
    public static MinimipsSettings defaults() {
        return from(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Creates a loader configured by these settings.
     * @return A new loader.
     */
    public ProgramLoader newLoader() {
        return new ProgramLoader(eagerValidation);
    }

    /**
     * Creates a virtual machine configured by these settings.
     * @return A new virtual machine.
     */
    public VirtualMachine newVirtualMachine() {
        return new VirtualMachine(maxSteps);
    }

    /**
     * Creates a debug session configured by these settings.
     * @return A new session.
     */
    public DebugSession newSession() {
        return new DebugSession(newLoader(), newVirtualMachine(), historyLimit);
    }
}
