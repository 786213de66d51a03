package org.minimips.runtime.isa;

import java.util.regex.Matcher;

/**
 * Builds an instruction from a line that matched its {@link InstructionSignature}.
 * Implementations report operand problems by throwing {@link InstructionDecodeException},
 * usually through the helpers of {@link DecodeContext}.
 */
@FunctionalInterface
public interface InstructionDecoder {

    /**
     * Decodes a matched instruction line.
     *
     * @param match The successful match of the signature pattern.
     * @param context The source position and symbol tables.
     * @return The decoded instruction.
     */
    Instruction decode(Matcher match, DecodeContext context);
}
