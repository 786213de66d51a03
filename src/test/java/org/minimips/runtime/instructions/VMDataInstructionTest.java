package org.minimips.runtime.instructions;

import org.minimips.compiler.ProgramLoader;
import org.minimips.runtime.Config;
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

public class VMDataInstructionTest {

    private final VirtualMachine vm = new VirtualMachine();

    @BeforeAll
    static void init() {
        Instruction.init();
    }

    private MachineState run(String source, Map<String, Integer> registers) {
        return vm.runToEnd(MachineState.fromSource(source, new ProgramLoader(), registers, Map.of()));
    }

    @Test
    @Tag("unit")
    void testLi() {
        MachineState state = run("li $t0, 42\nli $t1, -0x10\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T0)).isEqualTo(42);
        assertThat(state.getRegister(Register.T1)).isEqualTo(-16);
        assertThat(state.getTouchedRegisters()).containsExactly(Register.T0, Register.T1);
    }

    @Test
    @Tag("unit")
    void testLiAcceptsNumericRegisterAndUppercaseMnemonic() {
        MachineState state = run("LI $9, 7\n", Map.of());
        assertThat(state.getRegister(Register.T1)).isEqualTo(7);
    }

    @Test
    @Tag("unit")
    void testLiWithInvalidImmediateFailsWhenReached() {
        MachineState state = run("li $t0, 1\nli $t1, ten\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.ERROR);
        assertThat(state.getError()).isEqualTo("Invalid immediate value: ten");
        assertThat(state.getRegister(Register.T0)).isEqualTo(1);
        assertThat(state.getPc()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testWriteToUnknownRegisterIsDiscarded() {
        MachineState state = run("li $foo, 1\nli $t0, 7\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T0)).isEqualTo(7);
        assertThat(state.getTouchedRegisters()).containsExactly(Register.T0);
    }

    @Test
    @Tag("unit")
    void testReadFromUnknownRegisterIsZero() {
        MachineState state = run("move $t0, $bar\nli $t1, 3\n", Map.of("$t0", 5));
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.T0)).isZero();
        assertThat(state.getRegister(Register.T1)).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testLa() {
        MachineState state = run(".data\npad: .word 0\nmsg: .asciiz \"x\"\n.text\nla $a0, msg\n", Map.of());
        assertThat(state.getRegister(Register.A0)).isEqualTo(Config.DATA_SEGMENT_BASE + 4);
    }

    @Test
    @Tag("unit")
    void testLaUnknownLabel() {
        MachineState state = run("la $a0, missing\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.ERROR);
        assertThat(state.getError()).contains("missing");
    }

    @Test
    @Tag("unit")
    void testMove() {
        MachineState state = run("move $s0, $t3\n", Map.of("$t3", 77));
        assertThat(state.getRegister(Register.S0)).isEqualTo(77);
        assertThat(state.getRegister(Register.T3)).isEqualTo(77);
    }

    @Test
    @Tag("unit")
    void testWriteToZeroIsDiscarded() {
        MachineState state = run("li $zero, 5\nmove $t0, $zero\n", Map.of());
        assertThat(state.getStatus()).isEqualTo(MachineStatus.HALTED);
        assertThat(state.getRegister(Register.ZERO)).isZero();
        assertThat(state.getRegister(Register.T0)).isZero();
        assertThat(state.getTouchedRegisters()).containsExactly(Register.T0);
    }
}
