package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.compiler.util.NumericParser;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.DecodeContext;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.isa.RegisterOperand;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Handles ADD, SUB and ADDI. Results wrap around on overflow; no trap is raised.
 */
public class ArithmeticInstruction extends Instruction {

    private final RegisterOperand destination;
    private final RegisterOperand lhs;
    private final RegisterOperand rhs;
    private final int immediate;

    private ArithmeticInstruction(SourceInfo sourceInfo, String mnemonic, RegisterOperand destination,
                                  RegisterOperand lhs, RegisterOperand rhs, int immediate) {
        super(sourceInfo, mnemonic);
        this.destination = destination;
        this.lhs = lhs;
        this.rhs = rhs;
        this.immediate = immediate;
    }

    /**
     * Decodes {@code addi rd, rs, imm}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeImmediate(Matcher match, DecodeContext context) {
        int value = context.immediate(match.group(3));
        return new ArithmeticInstruction(context.sourceInfo(), "addi",
                context.register(match.group(1)), context.register(match.group(2)), null, value);
    }

    /**
     * Decodes {@code add rd, rs, rt} and {@code sub rd, rs, rt}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decodeRegister(Matcher match, DecodeContext context) {
        return new ArithmeticInstruction(context.sourceInfo(), match.group(1).toLowerCase(Locale.ROOT),
                context.register(match.group(2)), context.register(match.group(3)),
                context.register(match.group(4)), 0);
    }

    @Override
    public void execute(ExecutionContext context) {
        long a = context.readRegister(lhs);
        long result;
        switch (mnemonic) {
            case "addi" -> result = a + immediate;
            case "add" -> result = a + context.readRegister(rhs);
            case "sub" -> result = a - context.readRegister(rhs);
            default -> {
                context.fail("Unsupported instruction: " + getText());
                return;
            }
        }
        context.writeRegister(destination, NumericParser.normalize(result));
        context.advance();
    }

    @Override
    public String render() {
        if ("addi".equals(mnemonic)) {
            return "addi " + destination + ", " + lhs + ", " + immediate;
        }
        return mnemonic + " " + destination + ", " + lhs + ", " + rhs;
    }
}
