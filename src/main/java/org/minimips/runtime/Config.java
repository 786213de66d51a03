package org.minimips.runtime;

import org.minimips.runtime.model.Register;

/**
 * Provides the fixed machine constants. Values that deployments may tune, like the
 * step bound, have their defaults here and can be overridden through
 * {@link org.minimips.config.MinimipsSettings}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The default number of instructions a machine may execute before it is stopped
     * with a timeout error.
     */
    public static final int MAX_STEPS = 10000;

    /**
     * The address of the first data segment allocation.
     */
    public static final int DATA_SEGMENT_BASE = 0x10010000;

    /**
     * The size of a {@code .word} element in bytes.
     */
    public static final int WORD_SIZE = 4;

    /**
     * The register whose value selects the system service of {@code syscall}.
     */
    public static final Register SYSCALL_SELECTOR = Register.V0;

    /**
     * The register holding the argument of a system service.
     */
    public static final Register SYSCALL_ARGUMENT = Register.A0;

    /**
     * The default number of snapshots a debug session keeps for stepping back.
     */
    public static final int DEFAULT_HISTORY_LIMIT = 1000;
}
