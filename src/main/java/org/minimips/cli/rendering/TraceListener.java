package org.minimips.cli.rendering;

import org.minimips.runtime.StepListener;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.Register;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Prints one line per executed instruction, with the registers it changed.
 */
public class TraceListener implements StepListener {

    private final PrintWriter out;

    /**
     * Creates a trace printer.
     * @param out The writer receiving the trace.
     */
    public TraceListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void onStep(MachineState before, MachineState after) {
        String instruction = before.currentInstructionText().orElse("<end of program>");
        String changes = Arrays.stream(Register.values())
                .filter(register -> before.getRegister(register) != after.getRegister(register))
                .map(register -> register.symbol() + "=" + after.getRegister(register))
                .collect(Collectors.joining(" "));
        out.printf("[%5d] pc=%-4d %-28s %s%s%n", after.getSteps(), before.getPc(), instruction, changes,
                after.getStatus().isTerminal() ? " -> " + after.getStatus() : "");
        out.flush();
    }
}
