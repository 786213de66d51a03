package org.minimips.compiler.api;

import org.minimips.runtime.isa.Instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The immutable, loaded form of an assembly program. Instructions are already decoded;
 * a single {@code Program} may be shared by any number of concurrent executions.
 *
 * @param instructions The decoded {@code .text} instructions in source order.
 * @param labels Text labels mapped to the index of the instruction that follows them.
 * @param dataAddresses Data labels mapped to their allocated address.
 * @param dataContents String payloads of {@code .asciiz} declarations by address.
 */
public record Program(
        List<Instruction> instructions,
        Map<String, Integer> labels,
        Map<String, Integer> dataAddresses,
        Map<Integer, String> dataContents
) {
    public Program {
        instructions = List.copyOf(instructions);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        dataAddresses = Collections.unmodifiableMap(new LinkedHashMap<>(dataAddresses));
        dataContents = Collections.unmodifiableMap(new LinkedHashMap<>(dataContents));
    }

    /**
     * Returns a program without instructions, used by machines whose source failed to load.
     * @return An empty program.
     */
    public static Program empty() {
        return new Program(List.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Returns the number of instructions.
     * @return The instruction count.
     */
    public int size() {
        return instructions.size();
    }

    /**
     * Gets the instruction at an index.
     * @param index A valid instruction index.
     * @return The decoded instruction.
     */
    public Instruction getInstruction(int index) {
        return instructions.get(index);
    }

    /**
     * Looks up the string stored at a data address.
     * @param address The start address of an {@code .asciiz} declaration.
     * @return The string, or empty if no string starts at that address.
     */
    public Optional<String> findStringAt(int address) {
        return Optional.ofNullable(dataContents.get(address));
    }

    /**
     * Returns the source text of all instructions in order.
     * @return The instruction lines.
     */
    public List<String> getInstructionTexts() {
        return instructions.stream().map(Instruction::getText).toList();
    }
}
