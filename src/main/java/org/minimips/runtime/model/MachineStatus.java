package org.minimips.runtime.model;

/**
 * Lifecycle status of a machine. {@link #HALTED} and {@link #ERROR} are terminal.
 */
public enum MachineStatus {
    /** The machine can execute its next instruction. */
    READY,
    /** The program ran off its end or requested exit. */
    HALTED,
    /** Execution stopped on a failure, see {@link MachineState#getError()}. */
    ERROR;

    /**
     * Checks whether no further step can change the machine.
     * @return true for HALTED and ERROR.
     */
    public boolean isTerminal() {
        return this != READY;
    }
}
