package org.minimips.runtime.instructions;

import org.minimips.compiler.ProgramLoader;
import org.minimips.runtime.VirtualMachine;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.MachineStatus;
import org.minimips.runtime.model.Register;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class VMArithmeticInstructionTest {

    private final VirtualMachine vm = new VirtualMachine();

    @BeforeAll
    static void init() {
        Instruction.init();
    }

    private MachineState run(String source, Map<String, Integer> registers) {
        return vm.runToEnd(MachineState.fromSource(source, new ProgramLoader(), registers, Map.of()));
    }

    // --- ADD ---
    @Test
    @Tag("unit")
    void testAddi() {
        MachineState state = run("addi $t0, $t0, 5\n", Map.of("$t0", 10));
        assertThat(state.getRegister(Register.T0)).isEqualTo(15);
    }

    @Test
    @Tag("unit")
    void testAddiNegativeHexImmediate() {
        MachineState state = run("addi $t1, $t0, -0x1\n", Map.of("$t0", 10));
        assertThat(state.getRegister(Register.T1)).isEqualTo(9);
    }

    @Test
    @Tag("unit")
    void testAdd() {
        MachineState state = run("li $t0, 5\nli $t1, 7\nadd $t2, $t0, $t1\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T2)).isEqualTo(12);
    }

    @Test
    @Tag("unit")
    void testAddWrapsOnOverflow() {
        MachineState state = run("addi $t1, $t0, 1\n", Map.of("$t0", 0x7FFFFFFF));
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T1)).isEqualTo(-2147483648);
    }

    // --- SUB ---
    @Test
    @Tag("unit")
    void testSub() {
        MachineState state = run("sub $t2, $t0, $t1\n", Map.of("$t0", 3, "$t1", 10));
        assertThat(state.getRegister(Register.T2)).isEqualTo(-7);
    }

    @Test
    @Tag("unit")
    void testSubWrapsOnUnderflow() {
        MachineState state = run("sub $t2, $t0, $t1\n", Map.of("$t0", Integer.MIN_VALUE, "$t1", 1));
        assertThat(state.getRegister(Register.T2)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @Tag("unit")
    void testSameRegisterAsSourceAndDestination() {
        MachineState state = run("add $t0, $t0, $t0\n", Map.of("$t0", 21));
        assertThat(state.getRegister(Register.T0)).isEqualTo(42);
    }

    @Test
    @Tag("unit")
    void testUnknownSourceRegisterReadsZero() {
        MachineState state = run("add $t2, $t0, $nope\nsub $t3, $nope, $t0\n", Map.of("$t0", 4));
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T2)).isEqualTo(4);
        assertThat(state.getRegister(Register.T3)).isEqualTo(-4);
    }

    @Test
    @Tag("unit")
    void testMalformedOperandsFailWhenReached() {
        MachineState state = run("add $t0, $t1\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.ERROR);
        assertThat(state.getError()).isEqualTo("Unsupported instruction: add $t0, $t1");
        assertThat(state.getSteps()).isEqualTo(1);
    }
}
