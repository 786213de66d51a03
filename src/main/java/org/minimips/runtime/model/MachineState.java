package org.minimips.runtime.model;

import org.minimips.compiler.ProgramLoader;
import org.minimips.compiler.api.Program;
import org.minimips.compiler.api.ProgramLoadException;
import org.minimips.compiler.util.NumericParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable snapshot of a machine: register file, sparse memory, program counter,
 * step counter, status and accumulated output. Every step of the
 * {@link org.minimips.runtime.VirtualMachine} produces a new snapshot, so holders of an
 * older snapshot never observe later changes.
 * <p>
 * The touched sets record, in first-write order, which registers and memory cells the
 * execution has changed or accessed. They carry no execution semantics and exist for
 * highlighting in inspectors.
 */
public final class MachineState {

    private final String source;
    private final Program program;
    private final int[] registers;
    private final Map<Integer, Integer> memory;
    private final String output;
    private final MachineStatus status;
    private final String error;
    private final int pc;
    private final int steps;
    private final List<Register> touchedRegisters;
    private final List<Integer> touchedMemory;

    private MachineState(Builder builder) {
        this.source = builder.source;
        this.program = builder.program;
        this.registers = builder.registers.clone();
        this.registers[Register.ZERO.number()] = 0;
        this.memory = Collections.unmodifiableMap(new LinkedHashMap<>(builder.memory));
        this.output = builder.output;
        this.status = builder.status;
        this.error = builder.error;
        this.pc = builder.pc;
        this.steps = builder.steps;
        this.touchedRegisters = List.copyOf(builder.touchedRegisters);
        this.touchedMemory = List.copyOf(builder.touchedMemory);
    }

    /**
     * Creates a ready machine for a loaded program.
     * <p>
     * Register overrides are keyed by register name; {@code $zero} and unknown names are
     * ignored. Memory overrides are keyed by a decimal or hexadecimal address; keys that
     * do not parse are ignored. Entries with a {@code null} value are skipped.
     *
     * @param source The source text the program was loaded from.
     * @param program The loaded program.
     * @param initialRegisters Initial register values, may be empty.
     * @param initialMemory Initial memory words, may be empty.
     * @return The initial machine state.
     */
    public static MachineState initialize(String source, Program program,
                                          Map<String, Integer> initialRegisters,
                                          Map<String, Integer> initialMemory) {
        Builder builder = new Builder(source, program);
        initialRegisters.forEach((name, value) -> {
            if (value != null) {
                Register.fromName(name)
                        .filter(register -> register != Register.ZERO)
                        .ifPresent(register -> builder.registers[register.number()] = value);
            }
        });
        initialMemory.forEach((key, value) -> {
            if (value != null) {
                NumericParser.parseInt(key).ifPresent(address -> builder.memory.put(address, value));
            }
        });
        return builder.build();
    }

    /**
     * Loads the source and creates a ready machine for it. If loading fails the returned
     * machine is already in {@link MachineStatus#ERROR} with the load error as message
     * and an empty program.
     *
     * @param source The assembly source.
     * @param loader The loader to use.
     * @param initialRegisters Initial register values, may be empty.
     * @param initialMemory Initial memory words, may be empty.
     * @return The initial machine state.
     */
    public static MachineState fromSource(String source, ProgramLoader loader,
                                          Map<String, Integer> initialRegisters,
                                          Map<String, Integer> initialMemory) {
        try {
            return initialize(source, loader.load(source), initialRegisters, initialMemory);
        } catch (ProgramLoadException e) {
            return new Builder(source, Program.empty())
                    .status(MachineStatus.ERROR)
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * Returns a copy of this state with a different status. Used for transitions that
     * do not execute an instruction.
     *
     * @param newStatus The new status.
     * @param message The error message, empty unless the status is ERROR.
     * @return The new state.
     */
    public MachineState withStatus(MachineStatus newStatus, String message) {
        return toBuilder().status(newStatus).error(message).build();
    }

    /**
     * Creates a builder initialized with this state's values.
     * @return A new builder; changes to it do not affect this state.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(source, program);
        System.arraycopy(registers, 0, builder.registers, 0, Register.COUNT);
        builder.memory.putAll(memory);
        builder.output = output;
        builder.status = status;
        builder.error = error;
        builder.pc = pc;
        builder.steps = steps;
        builder.touchedRegisters.addAll(touchedRegisters);
        builder.touchedMemory.addAll(touchedMemory);
        return builder;
    }

    public String getSource() { return source; }

    public Program getProgram() { return program; }

    /**
     * Reads a register.
     * @param register The register.
     * @return Its current value; always 0 for {@code $zero}.
     */
    public int getRegister(Register register) {
        return registers[register.number()];
    }

    /**
     * Reads a register by name.
     * @param name A symbolic or numeric register name.
     * @return Its current value.
     * @throws IllegalArgumentException if the name is not a register.
     */
    public int getRegister(String name) {
        return getRegister(Register.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown register: " + name)));
    }

    /**
     * Returns all registers by name, in display order.
     * @return An ordered, unmodifiable map.
     */
    public Map<String, Integer> getRegisters() {
        Map<String, Integer> view = new LinkedHashMap<>();
        for (Register register : Register.values()) {
            view.put(register.symbol(), registers[register.number()]);
        }
        return Collections.unmodifiableMap(view);
    }

    /**
     * Reads a memory word. Addresses never written read as 0.
     * @param address The address.
     * @return The stored word.
     */
    public int readMemory(int address) {
        return memory.getOrDefault(address, 0);
    }

    /**
     * Returns all explicitly stored memory words.
     * @return An unmodifiable map from address to word.
     */
    public Map<Integer, Integer> getMemory() { return memory; }

    public String getOutput() { return output; }

    public MachineStatus getStatus() { return status; }

    /**
     * Returns the error message.
     * @return The message, empty unless the status is ERROR.
     */
    public String getError() { return error; }

    public int getPc() { return pc; }

    public int getSteps() { return steps; }

    public List<Register> getTouchedRegisters() { return touchedRegisters; }

    public List<Integer> getTouchedMemory() { return touchedMemory; }

    /**
     * Returns the source text of the instruction at the program counter.
     * @return The instruction text, or empty if the pc is outside the program.
     */
    public Optional<String> currentInstructionText() {
        if (pc < 0 || pc >= program.size()) {
            return Optional.empty();
        }
        return Optional.of(program.getInstruction(pc).getText());
    }

    @Override
    public String toString() {
        return "MachineState{status=" + status + ", pc=" + pc + ", steps=" + steps
                + (error.isEmpty() ? "" : ", error='" + error + "'") + "}";
    }

    /**
     * Mutable assembly area for a {@link MachineState}. The executor works on a builder
     * derived from the previous state and freezes it into the next snapshot.
     */
    public static final class Builder {
        private final String source;
        private final Program program;
        private final int[] registers = new int[Register.COUNT];
        private final Map<Integer, Integer> memory = new LinkedHashMap<>();
        private final List<Register> touchedRegisters = new ArrayList<>();
        private final List<Integer> touchedMemory = new ArrayList<>();
        private String output = "";
        private MachineStatus status = MachineStatus.READY;
        private String error = "";
        private int pc;
        private int steps;

        /**
         * Creates a builder for a fresh machine with all registers and memory zeroed.
         * @param source The source text.
         * @param program The program.
         */
        public Builder(String source, Program program) {
            this.source = source;
            this.program = program;
        }

        public Builder register(Register register, int value) {
            registers[register.number()] = value;
            return this;
        }

        public Builder memory(int address, int value) {
            memory.put(address, value);
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder status(MachineStatus status) {
            this.status = status;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder pc(int pc) {
            this.pc = pc;
            return this;
        }

        public Builder steps(int steps) {
            this.steps = steps;
            return this;
        }

        public int getRegister(Register register) {
            return registers[register.number()];
        }

        public Map<Integer, Integer> getMemory() {
            return memory;
        }

        public List<Register> getTouchedRegisters() {
            return touchedRegisters;
        }

        public List<Integer> getTouchedMemory() {
            return touchedMemory;
        }

        public Program getProgram() {
            return program;
        }

        public int getPc() {
            return pc;
        }

        public int getSteps() {
            return steps;
        }

        public MachineStatus getStatus() {
            return status;
        }

        /**
         * Freezes the builder into an immutable state; {@code $zero} is forced to 0.
         * @return The new state.
         */
        public MachineState build() {
            return new MachineState(this);
        }

        @Override
        public String toString() {
            return "MachineState.Builder{pc=" + pc + ", steps=" + steps + ", registers=" + Arrays.toString(registers) + "}";
        }
    }
}
