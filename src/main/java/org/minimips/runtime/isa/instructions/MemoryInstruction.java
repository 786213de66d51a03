package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.compiler.util.AddressOperand;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.DecodeContext;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.isa.RegisterOperand;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Handles the word transfers LW and SW. Memory is sparse and unbounded, so every
 * effective address is valid.
 */
public class MemoryInstruction extends Instruction {

    private final RegisterOperand register;
    private final AddressOperand address;

    private MemoryInstruction(SourceInfo sourceInfo, String mnemonic, RegisterOperand register, AddressOperand address) {
        super(sourceInfo, mnemonic);
        this.register = register;
        this.address = address;
    }

    /**
     * Decodes {@code lw rt, addr} and {@code sw rt, addr}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decode(Matcher match, DecodeContext context) {
        AddressOperand operand = context.address(match.group(3));
        return new MemoryInstruction(context.sourceInfo(), match.group(1).toLowerCase(Locale.ROOT),
                context.register(match.group(2)), operand);
    }

    @Override
    public void execute(ExecutionContext context) {
        int baseValue = address.isRegisterRelative() ? context.readRegister(address.base()) : 0;
        int effective = address.effectiveAddress(baseValue);
        if ("lw".equals(mnemonic)) {
            context.writeRegister(register, context.loadWord(effective));
        } else {
            context.storeWord(effective, context.readRegister(register));
        }
        context.advance();
    }

    @Override
    public String render() {
        return mnemonic + " " + register + ", " + address;
    }
}
