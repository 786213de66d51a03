package org.minimips.runtime;

import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.MachineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The execution driver. A VirtualMachine holds no machine state of its own: every call
 * takes a snapshot and returns the next one, so one instance can drive any number of
 * independent executions, also from different threads.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final int maxSteps;
    private final List<StepListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a VM with the default step bound of {@link Config#MAX_STEPS}.
     */
    public VirtualMachine() {
        this(Config.MAX_STEPS);
    }

    /**
     * Creates a VM with a custom step bound.
     *
     * @param maxSteps The number of instructions a machine may execute before it times out.
     */
    public VirtualMachine(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive, was " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /**
     * Executes one instruction.
     * <p>
     * A machine that is not READY is returned unchanged. A program counter outside the
     * program halts the machine, and a machine that already executed {@code maxSteps}
     * instructions fails with a timeout; neither transition counts as a step. Otherwise
     * the step counter is incremented and the instruction at the program counter runs,
     * whether it succeeds or fails.
     *
     * @param state The current state.
     * @return The next state.
     */
    public MachineState step(MachineState state) {
        if (state.getStatus() != MachineStatus.READY) {
            return state;
        }

        MachineState next;
        int pc = state.getPc();
        if (pc < 0 || pc >= state.getProgram().size()) {
            next = state.withStatus(MachineStatus.HALTED, "");
        } else if (state.getSteps() >= maxSteps) {
            next = state.withStatus(MachineStatus.ERROR, "Execution timed out after " + maxSteps + " steps.");
        } else {
            Instruction instruction = state.getProgram().getInstruction(pc);
            ExecutionContext context = new ExecutionContext(state);
            instruction.execute(context);
            next = context.toState();
        }

        if (next.getStatus() == MachineStatus.ERROR) {
            LOG.debug("Machine failed at pc={} after {} steps: {}", next.getPc(), next.getSteps(), next.getError());
        } else if (next.getStatus() == MachineStatus.HALTED) {
            LOG.debug("Machine halted at pc={} after {} steps", next.getPc(), next.getSteps());
        }
        for (StepListener listener : listeners) {
            listener.onStep(state, next);
        }
        return next;
    }

    /**
     * Steps until the machine leaves the READY status. Termination is guaranteed by the
     * step bound.
     *
     * @param state The starting state.
     * @return A HALTED or ERROR state.
     */
    public MachineState runToEnd(MachineState state) {
        MachineState current = state;
        while (current.getStatus() == MachineStatus.READY) {
            current = step(current);
        }
        return current;
    }

    /**
     * Registers a listener that is notified after every transition.
     * @param listener The listener.
     */
    public void addListener(StepListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     * @param listener The listener.
     */
    public void removeListener(StepListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the step bound.
     * @return The maximum number of executed instructions.
     */
    public int getMaxSteps() {
        return maxSteps;
    }
}
