package org.minimips.runtime.isa;

import java.util.regex.Pattern;

/**
 * Associates the textual shape of an instruction with the decoder that turns matching
 * lines into {@link Instruction} objects.
 *
 * @param pattern The case-insensitive pattern a whole instruction line must match.
 * @param decoder The decoder applied to the match.
 */
public record InstructionSignature(Pattern pattern, InstructionDecoder decoder) {

    /**
     * Creates a signature from a regular expression, compiled case-insensitively.
     * @param regex The expression.
     * @param decoder The decoder.
     * @return The signature.
     */
    public static InstructionSignature of(String regex, InstructionDecoder decoder) {
        return new InstructionSignature(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), decoder);
    }
}
