package org.minimips.cli.rendering;

import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.Register;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The JSON shape of a machine state, as printed by {@code run --json}. Memory
 * addresses are rendered as decimal strings.
 */
public record StateReport(
        String status,
        String error,
        int pc,
        int steps,
        String output,
        Map<String, Integer> registers,
        Map<String, Integer> memory,
        List<String> touchedRegisters,
        List<String> touchedMemory
) {

    /**
     * Builds the report of a state.
     * @param state The machine state.
     * @return The report.
     */
    public static StateReport of(MachineState state) {
        Map<String, Integer> memory = new LinkedHashMap<>();
        state.getMemory().forEach((address, value) -> memory.put(String.valueOf(address), value));
        return new StateReport(
                state.getStatus().name().toLowerCase(Locale.ROOT),
                state.getError(),
                state.getPc(),
                state.getSteps(),
                state.getOutput(),
                state.getRegisters(),
                memory,
                state.getTouchedRegisters().stream().map(Register::symbol).toList(),
                state.getTouchedMemory().stream().map(String::valueOf).toList());
    }
}
