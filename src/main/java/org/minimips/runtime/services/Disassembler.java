package org.minimips.runtime.services;

import org.minimips.compiler.api.Program;
import org.minimips.runtime.isa.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a loaded program as a listing: one line per decoded instruction with its
 * index, labels and source line, followed by the data symbols.
 */
public class Disassembler {

    /**
     * Produces the listing of a program.
     *
     * @param program The program.
     * @return The listing lines.
     */
    public List<String> listing(Program program) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < program.size(); i++) {
            Instruction instruction = program.getInstruction(i);
            String labels = labelsAt(program, i);
            lines.add(String.format("%04d  %-16s %-28s ; line %d",
                    i, labels.isEmpty() ? "" : labels + ":", instruction.render(),
                    instruction.getSourceInfo().lineNumber()));
        }
        // Labels bound past the last instruction
        String trailing = labelsAt(program, program.size());
        if (!trailing.isEmpty()) {
            lines.add(String.format("%04d  %s:", program.size(), trailing));
        }
        for (Map.Entry<String, Integer> data : program.dataAddresses().entrySet()) {
            String payload = program.findStringAt(data.getValue())
                    .map(text -> " \"" + text.replace("\n", "\\n").replace("\"", "\\\"") + "\"")
                    .orElse("");
            lines.add(String.format("data  0x%08x  %s%s", data.getValue(), data.getKey(), payload));
        }
        return lines;
    }

    private static String labelsAt(Program program, int index) {
        return program.labels().entrySet().stream()
                .filter(entry -> entry.getValue() == index)
                .map(Map.Entry::getKey)
                .collect(Collectors.joining(", "));
    }
}
