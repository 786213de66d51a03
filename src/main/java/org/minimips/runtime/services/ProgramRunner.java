package org.minimips.runtime.services;

import org.minimips.compiler.ProgramLoader;
import org.minimips.runtime.VirtualMachine;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.MachineStatus;

import java.util.Map;

/**
 * Loads and runs a program to completion in one call, the way the editor's run action
 * does, and formats the outcome for display.
 */
public class ProgramRunner {

    /**
     * The text shown when a run produced neither output nor an error.
     */
    public static final String NO_OUTPUT = "(no output)";

    private final ProgramLoader loader;
    private final VirtualMachine vm;

    /**
     * Creates a runner with default loader and step bound.
     */
    public ProgramRunner() {
        this(new ProgramLoader(), new VirtualMachine());
    }

    /**
     * Creates a runner.
     * @param loader The loader.
     * @param vm The virtual machine.
     */
    public ProgramRunner(ProgramLoader loader, VirtualMachine vm) {
        this.loader = loader;
        this.vm = vm;
    }

    /**
     * Runs a program with all registers and memory zeroed.
     * @param source The assembly source.
     * @return The formatted result.
     */
    public RunResult run(String source) {
        return run(source, Map.of(), Map.of());
    }

    /**
     * Runs a program with initial values.
     *
     * @param source The assembly source.
     * @param initialRegisters Initial register values by name.
     * @param initialMemory Initial memory words by textual address.
     * @return The formatted result. On error the message follows the program output on
     *         its own line.
     */
    public RunResult run(String source, Map<String, Integer> initialRegisters, Map<String, Integer> initialMemory) {
        MachineState initial = MachineState.fromSource(source, loader, initialRegisters, initialMemory);
        MachineState result = vm.runToEnd(initial);

        StringBuilder text = new StringBuilder(result.getOutput());
        if (result.getStatus() == MachineStatus.ERROR) {
            if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                text.append('\n');
            }
            text.append(result.getError());
        }
        String output = text.length() == 0 ? NO_OUTPUT : text.toString();
        RunResult.Status status = result.getStatus() == MachineStatus.HALTED
                ? RunResult.Status.SUCCESS
                : RunResult.Status.ERROR;
        return new RunResult(status, output, result);
    }
}
