package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.DecodeContext;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.isa.RegisterOperand;

import java.util.regex.Matcher;

/**
 * Handles the register loading instructions LI, LA and MOVE.
 */
public class DataInstruction extends Instruction {

    private final RegisterOperand target;
    private final RegisterOperand source;
    private final Integer value;
    private final String label;

    private DataInstruction(SourceInfo sourceInfo, String mnemonic, RegisterOperand target,
                            RegisterOperand source, Integer value, String label) {
        super(sourceInfo, mnemonic);
        this.target = target;
        this.source = source;
        this.value = value;
        this.label = label;
    }

    /**
     * Decodes {@code li rd, imm}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeLoadImmediate(Matcher match, DecodeContext context) {
        int immediate = context.immediate(match.group(2));
        return new DataInstruction(context.sourceInfo(), "li", context.register(match.group(1)), null, immediate, null);
    }

    /**
     * Decodes {@code la rd, label}. An undefined label is only reported when executed.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeLoadAddress(Matcher match, DecodeContext context) {
        String name = match.group(2);
        Integer address = context.symbols().findDataAddress(name).orElse(null);
        return new DataInstruction(context.sourceInfo(), "la", context.register(match.group(1)), null, address, name);
    }

    /**
     * Decodes {@code move rd, rs}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeMove(Matcher match, DecodeContext context) {
        return new DataInstruction(context.sourceInfo(), "move",
                context.register(match.group(1)), context.register(match.group(2)), null, null);
    }

    @Override
    public void execute(ExecutionContext context) {
        switch (mnemonic) {
            case "li" -> context.writeRegister(target, value);
            case "la" -> {
                if (value == null) {
                    context.fail("Unknown data label: " + label);
                    return;
                }
                context.writeRegister(target, value);
            }
            case "move" -> context.writeRegister(target, context.readRegister(source));
            default -> {
                context.fail("Unsupported instruction: " + getText());
                return;
            }
        }
        context.advance();
    }

    @Override
    public String render() {
        return switch (mnemonic) {
            case "li" -> "li " + target + ", " + value;
            case "la" -> "la " + target + ", " + label;
            default -> mnemonic + " " + target + ", " + source;
        };
    }
}
