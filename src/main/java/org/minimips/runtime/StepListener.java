package org.minimips.runtime;

import org.minimips.runtime.model.MachineState;

/**
 * Observes state transitions of a {@link VirtualMachine}.
 */
@FunctionalInterface
public interface StepListener {

    /**
     * Called after every call to {@link VirtualMachine#step(MachineState)} that changed
     * the machine.
     *
     * @param before The state the step started from.
     * @param after The resulting state.
     */
    void onStep(MachineState before, MachineState after);
}
