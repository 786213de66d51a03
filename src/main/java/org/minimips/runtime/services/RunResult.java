package org.minimips.runtime.services;

import org.minimips.runtime.model.MachineState;

/**
 * The outcome of a one-shot run, as shown in the editor's terminal.
 *
 * @param status Whether the program halted normally.
 * @param output The text to display.
 * @param machine The final machine state.
 */
public record RunResult(Status status, String output, MachineState machine) {

    /**
     * The coarse outcome of a run.
     */
    public enum Status {
        /** The program halted. */
        SUCCESS,
        /** Loading or execution failed. */
        ERROR
    }

    /**
     * Checks for a normal halt.
     * @return true if the status is SUCCESS.
     */
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
