package org.minimips.runtime.internal.services;

import org.minimips.compiler.api.Program;
import org.minimips.runtime.isa.RegisterOperand;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.MachineStatus;
import org.minimips.runtime.model.Register;

/**
 * The working copy of a machine while one instruction executes. It is created by the
 * VirtualMachine from the previous snapshot, handed to the instruction, and frozen
 * into the next snapshot afterwards; the previous snapshot is never touched.
 */
public class ExecutionContext {

    private final MachineState.Builder next;
    private final StringBuilder output;

    /**
     * Constructs a context for the step that follows the given state.
     * The step counter of the working copy is already incremented.
     *
     * @param current The state before the step.
     */
    public ExecutionContext(MachineState current) {
        this.next = current.toBuilder().steps(current.getSteps() + 1);
        this.output = new StringBuilder(current.getOutput());
    }

    /**
     * Returns the program being executed.
     * @return The program.
     */
    public Program getProgram() {
        return next.getProgram();
    }

    /**
     * Reads a register of the working copy.
     * @param register The register.
     * @return The value; always 0 for {@code $zero}.
     */
    public int readRegister(Register register) {
        if (register == Register.ZERO) {
            return 0;
        }
        return next.getRegister(register);
    }

    /**
     * Reads a register operand.
     * @param operand The operand.
     * @return The value; 0 for {@code $zero} and for unbound operands.
     */
    public int readRegister(RegisterOperand operand) {
        return operand.isBound() ? readRegister(operand.register()) : 0;
    }

    /**
     * Writes a register and marks it as touched. Writes to {@code $zero} and to unbound
     * operands are discarded.
     * @param operand The destination operand.
     * @param value The new value.
     */
    public void writeRegister(RegisterOperand operand, int value) {
        Register register = operand.register();
        if (register == null || register == Register.ZERO) {
            return;
        }
        next.register(register, value);
        if (!next.getTouchedRegisters().contains(register)) {
            next.getTouchedRegisters().add(register);
        }
    }

    /**
     * Reads a memory word and marks the address as touched.
     * @param address The address.
     * @return The stored word, 0 if never written.
     */
    public int loadWord(int address) {
        touchMemory(address);
        return next.getMemory().getOrDefault(address, 0);
    }

    /**
     * Stores a memory word and marks the address as touched.
     * @param address The address.
     * @param value The word.
     */
    public void storeWord(int address, int value) {
        next.memory(address, value);
        touchMemory(address);
    }

    private void touchMemory(int address) {
        if (!next.getTouchedMemory().contains(address)) {
            next.getTouchedMemory().add(address);
        }
    }

    /**
     * Appends text to the program output.
     * @param text The text.
     */
    public void print(String text) {
        output.append(text);
    }

    /**
     * Advances the program counter to the next instruction.
     */
    public void advance() {
        next.pc(next.getPc() + 1);
    }

    /**
     * Transfers control to an instruction index.
     * @param target The target index.
     */
    public void jumpTo(int target) {
        next.pc(target);
    }

    /**
     * Stops the machine normally. The program counter is left on the halting instruction.
     */
    public void halt() {
        next.status(MachineStatus.HALTED);
    }

    /**
     * Stops the machine with an error.
     * @param message The user-facing error message.
     */
    public void fail(String message) {
        next.status(MachineStatus.ERROR).error(message);
    }

    /**
     * Freezes the working copy into the next snapshot.
     * @return The state after the step.
     */
    public MachineState toState() {
        return next.output(output.toString()).build();
    }
}
