package org.minimips.runtime.isa;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.compiler.util.AddressOperand;
import org.minimips.compiler.util.NumericParser;

/**
 * Everything a decoder needs to know about the line it decodes, plus helpers that
 * convert operand text and fail with the user-facing message.
 *
 * @param sourceInfo The line being decoded.
 * @param symbols The program's label tables.
 */
public record DecodeContext(SourceInfo sourceInfo, SymbolTable symbols) {

    /**
     * Resolves a register operand. Unknown names are not an error; they decode to an
     * unbound operand.
     * @param name The operand text.
     * @return The operand.
     */
    public RegisterOperand register(String name) {
        return RegisterOperand.of(name);
    }

    /**
     * Parses an immediate operand.
     * @param text The operand text.
     * @return The 32-bit value.
     * @throws InstructionDecodeException if the text is not a number.
     */
    public int immediate(String text) {
        return NumericParser.parseInt(text)
                .orElseThrow(() -> new InstructionDecodeException("Invalid immediate value: " + text));
    }

    /**
     * Parses a memory address operand.
     * @param text The operand text.
     * @return The decoded operand.
     * @throws InstructionDecodeException if the operand syntax is invalid.
     */
    public AddressOperand address(String text) {
        return AddressOperand.parse(text, symbols.dataAddresses())
                .orElseThrow(() -> new InstructionDecodeException("Invalid memory operand: " + text));
    }
}
