package org.minimips.runtime.isa;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.instructions.ArithmeticInstruction;
import org.minimips.runtime.isa.instructions.ControlFlowInstruction;
import org.minimips.runtime.isa.instructions.DataInstruction;
import org.minimips.runtime.isa.instructions.InvalidInstruction;
import org.minimips.runtime.isa.instructions.MemoryInstruction;
import org.minimips.runtime.isa.instructions.SystemInstruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * The abstract base class for all decoded instructions.
 * <p>
 * Instructions are decoded once, when a program is loaded, by matching the line text
 * against the registered {@link InstructionSignature}s in registration order; the first
 * match decides. Lines that match no signature, or whose operands are invalid, decode to
 * an {@link InvalidInstruction} that reports its error only when it is executed.
 */
public abstract class Instruction {

    /**
     * The label syntax accepted by branch, jump and address-load instructions.
     */
    public static final String LABEL_PATTERN = "[A-Za-z_.$][\\w.$]*";

    private static final String REG = "(\\$\\w+)";
    private static final String SEP = "\\s*,\\s*";

    private static final List<InstructionSignature> SIGNATURES = new ArrayList<>();
    private static boolean initialized = false;

    protected final SourceInfo sourceInfo;
    protected final String mnemonic;

    /**
     * Constructs a new instruction.
     * @param sourceInfo The source line this instruction was decoded from.
     * @param mnemonic The lower-case mnemonic.
     */
    protected Instruction(SourceInfo sourceInfo, String mnemonic) {
        this.sourceInfo = sourceInfo;
        this.mnemonic = mnemonic.toLowerCase(Locale.ROOT);
    }

    /**
     * Executes the instruction against the working copy of the machine. Implementations
     * move the program counter themselves and report failures through
     * {@link ExecutionContext#fail(String)}.
     *
     * @param context The execution context of the current step.
     */
    public abstract void execute(ExecutionContext context);

    /**
     * Renders the decoded form in canonical syntax, used by listings.
     * @return The canonical instruction text.
     */
    public abstract String render();

    /**
     * Initializes the instruction set by registering all instruction families.
     * Calling this more than once has no effect.
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }
        // Data-Family
        register("^li\\s+" + REG + SEP + "([^,\\s]+)$", DataInstruction::decodeLoadImmediate);
        register("^la\\s+" + REG + SEP + "(" + LABEL_PATTERN + ")$", DataInstruction::decodeLoadAddress);
        register("^move\\s+" + REG + SEP + REG + "$", DataInstruction::decodeMove);

        // Arithmetic-Family
        register("^addi\\s+" + REG + SEP + REG + SEP + "([^,\\s]+)$", ArithmeticInstruction::decodeImmediate);
        register("^(add|sub)\\s+" + REG + SEP + REG + SEP + REG + "$", ArithmeticInstruction::decodeRegister);

        // Memory-Family
        register("^(lw|sw)\\s+" + REG + SEP + "(.+)$", MemoryInstruction::decode);

        // ControlFlow-Family
        register("^(beq|bne)\\s+" + REG + SEP + REG + SEP + "(" + LABEL_PATTERN + ")$", ControlFlowInstruction::decodeBranch);
        register("^j\\s+(" + LABEL_PATTERN + ")$", ControlFlowInstruction::decodeJump);

        // System-Family
        register("^syscall$", SystemInstruction::decode);

        initialized = true;
    }

    private static void register(String regex, InstructionDecoder decoder) {
        SIGNATURES.add(InstructionSignature.of(regex, decoder));
    }

    /**
     * Decodes one instruction line.
     *
     * @param sourceInfo The line to decode.
     * @param symbols The program's label tables.
     * @return The decoded instruction; never null.
     */
    public static Instruction decode(SourceInfo sourceInfo, SymbolTable symbols) {
        init();
        String text = sourceInfo.lineContent();
        DecodeContext context = new DecodeContext(sourceInfo, symbols);
        for (InstructionSignature signature : SIGNATURES) {
            Matcher match = signature.pattern().matcher(text);
            if (match.matches()) {
                try {
                    return signature.decoder().decode(match, context);
                } catch (InstructionDecodeException e) {
                    return new InvalidInstruction(sourceInfo, e.getMessage());
                }
            }
        }
        return new InvalidInstruction(sourceInfo, "Unsupported instruction: " + text);
    }

    /**
     * Checks whether this instruction decoded successfully.
     * @return false only for {@link InvalidInstruction}.
     */
    public boolean isValid() {
        return true;
    }

    /**
     * Gets the source line of this instruction.
     * @return The source info.
     */
    public final SourceInfo getSourceInfo() { return sourceInfo; }

    /**
     * Gets the verbatim source text of this instruction.
     * @return The instruction text.
     */
    public final String getText() { return sourceInfo.lineContent(); }

    /**
     * Gets the lower-case mnemonic.
     * @return The mnemonic.
     */
    public final String getMnemonic() { return mnemonic; }

    @Override
    public String toString() {
        return render();
    }
}
