package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.DecodeContext;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.isa.RegisterOperand;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Handles the conditional branches BEQ and BNE and the unconditional jump J.
 * Targets are resolved while decoding; an undefined label is only an error once the
 * transfer is actually taken.
 */
public class ControlFlowInstruction extends Instruction {

    private final RegisterOperand lhs;
    private final RegisterOperand rhs;
    private final String label;
    private final Integer target;

    private ControlFlowInstruction(SourceInfo sourceInfo, String mnemonic, RegisterOperand lhs, RegisterOperand rhs,
                                   String label, Integer target) {
        super(sourceInfo, mnemonic);
        this.lhs = lhs;
        this.rhs = rhs;
        this.label = label;
        this.target = target;
    }

    /**
     * Decodes {@code beq rs, rt, label} and {@code bne rs, rt, label}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeBranch(Matcher match, DecodeContext context) {
        String name = match.group(4);
        return new ControlFlowInstruction(context.sourceInfo(), match.group(1).toLowerCase(Locale.ROOT),
                context.register(match.group(2)), context.register(match.group(3)),
                name, context.symbols().findLabel(name).orElse(null));
    }

    /**
     * Decodes {@code j label}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeJump(Matcher match, DecodeContext context) {
        String name = match.group(1);
        return new ControlFlowInstruction(context.sourceInfo(), "j", null, null,
                name, context.symbols().findLabel(name).orElse(null));
    }

    @Override
    public void execute(ExecutionContext context) {
        boolean taken = switch (mnemonic) {
            case "beq" -> context.readRegister(lhs) == context.readRegister(rhs);
            case "bne" -> context.readRegister(lhs) != context.readRegister(rhs);
            default -> true;
        };
        if (!taken) {
            context.advance();
            return;
        }
        if (target == null) {
            context.fail("Unknown label: " + label);
            return;
        }
        context.jumpTo(target);
    }

    @Override
    public String render() {
        if ("j".equals(mnemonic)) {
            return "j " + label;
        }
        return mnemonic + " " + lhs + ", " + rhs + ", " + label;
    }
}
