package org.minimips.runtime.session;

import org.minimips.compiler.ProgramLoader;
import org.minimips.compiler.util.NumericParser;
import org.minimips.runtime.Config;
import org.minimips.runtime.VirtualMachine;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.Register;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The inspector state of one open document: its source, the initial register and
 * memory values the user entered, the current machine and the snapshots needed to
 * step backwards. Because machine states are immutable, stepping back simply restores
 * the previous snapshot.
 * <p>
 * A session is not thread-safe; each document owns its own.
 */
public class DebugSession {

    private static final Logger LOG = LoggerFactory.getLogger(DebugSession.class);

    private final ProgramLoader loader;
    private final VirtualMachine vm;
    private final int historyLimit;

    private final Map<String, Integer> initialRegisters = new LinkedHashMap<>();
    private final Map<String, Integer> initialMemory = new LinkedHashMap<>();
    private final Deque<MachineState> history = new ArrayDeque<>();
    private String source = "";
    private MachineState machine;

    /**
     * Creates a session with default loader, step bound and history limit.
     */
    public DebugSession() {
        this(new ProgramLoader(), new VirtualMachine(), Config.DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Creates a session.
     *
     * @param loader The loader used by {@link #load(String)}.
     * @param vm The virtual machine that executes the steps.
     * @param historyLimit The maximum number of snapshots kept for {@link #stepBack()}.
     */
    public DebugSession(ProgramLoader loader, VirtualMachine vm, int historyLimit) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must not be negative, was " + historyLimit);
        }
        this.loader = loader;
        this.vm = vm;
        this.historyLimit = historyLimit;
    }

    /**
     * Loads a source and creates a fresh machine from it and the current initial values.
     * A source that fails to load yields a machine in ERROR status.
     *
     * @param newSource The assembly source.
     * @return The new machine.
     */
    public MachineState load(String newSource) {
        this.source = newSource;
        this.machine = MachineState.fromSource(newSource, loader, initialRegisters, initialMemory);
        history.clear();
        LOG.debug("Session loaded, status={}, instructions={}", machine.getStatus(), machine.getProgram().size());
        return machine;
    }

    /**
     * Reloads the current source, discarding the execution so far.
     * @return The new machine.
     * @throws IllegalStateException if nothing was loaded yet.
     */
    public MachineState reset() {
        requireLoaded();
        return load(source);
    }

    /**
     * Executes one instruction.
     * @return The machine after the step.
     * @throws IllegalStateException if nothing was loaded yet.
     */
    public MachineState step() {
        requireLoaded();
        return advanceTo(vm.step(machine));
    }

    /**
     * Runs until the machine halts or fails. The whole run is undone by one
     * {@link #stepBack()}.
     *
     * @return The terminal machine.
     * @throws IllegalStateException if nothing was loaded yet.
     */
    public MachineState run() {
        requireLoaded();
        return advanceTo(vm.runToEnd(machine));
    }

    /**
     * Restores the snapshot before the most recent step or run.
     * @return true if a snapshot was restored, false if the history is empty.
     */
    public boolean stepBack() {
        MachineState previous = history.pollLast();
        if (previous == null) {
            return false;
        }
        machine = previous;
        return true;
    }

    /**
     * Checks whether {@link #stepBack()} would restore a snapshot.
     * @return true if the history is not empty.
     */
    public boolean canStepBack() {
        return !history.isEmpty();
    }

    private MachineState advanceTo(MachineState next) {
        if (next != machine && historyLimit > 0) {
            history.addLast(machine);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        machine = next;
        return machine;
    }

    /**
     * Sets an initial register value, applied on the next load or reset.
     *
     * @param name A register name.
     * @param value The value.
     * @throws IllegalArgumentException if the name is not a register.
     */
    public void setInitialRegister(String name, int value) {
        Register register = Register.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown register: " + name));
        initialRegisters.put(register.symbol(), value);
    }

    /**
     * Sets an initial memory word, applied on the next load or reset.
     *
     * @param address A decimal or hexadecimal address.
     * @param value The word.
     * @throws IllegalArgumentException if the address is not a number.
     */
    public void setInitialMemory(String address, int value) {
        int parsed = NumericParser.parseInt(address)
                .orElseThrow(() -> new IllegalArgumentException("Invalid memory address: " + address));
        initialMemory.put(String.valueOf(parsed), value);
    }

    /**
     * Removes all initial register and memory values.
     */
    public void clearInitialValues() {
        initialRegisters.clear();
        initialMemory.clear();
    }

    public Map<String, Integer> getInitialRegisters() {
        return Collections.unmodifiableMap(initialRegisters);
    }

    public Map<String, Integer> getInitialMemory() {
        return Collections.unmodifiableMap(initialMemory);
    }

    /**
     * Returns the current machine.
     * @return The machine, or empty if nothing was loaded yet.
     */
    public Optional<MachineState> getMachine() {
        return Optional.ofNullable(machine);
    }

    public String getSource() {
        return source;
    }

    private void requireLoaded() {
        if (machine == null) {
            throw new IllegalStateException("No program loaded");
        }
    }
}
