package org.minimips.runtime.isa;

/**
 * Signals that a line matched an instruction shape but one of its operands is invalid.
 * The message is the run-time error reported when the line is reached.
 */
public class InstructionDecodeException extends RuntimeException {

    /**
     * Constructs a new decode exception.
     * @param message The user-facing error message.
     */
    public InstructionDecodeException(String message) {
        super(message);
    }
}
