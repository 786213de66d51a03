package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.Instruction;

import java.util.Locale;

/**
 * Stands in for a line that could not be decoded. Loading succeeds; the stored error
 * is raised only if execution reaches this line.
 */
public class InvalidInstruction extends Instruction {

    private final String message;

    /**
     * Constructs a new InvalidInstruction.
     * @param sourceInfo The offending line.
     * @param message The error to raise when executed.
     */
    public InvalidInstruction(SourceInfo sourceInfo, String message) {
        super(sourceInfo, firstWord(sourceInfo.lineContent()));
        this.message = message;
    }

    private static String firstWord(String text) {
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        return (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
    }

    @Override
    public void execute(ExecutionContext context) {
        context.fail(message);
    }

    /**
     * Returns the error raised when this line executes.
     * @return The message.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean isValid() {
        return false;
    }

    @Override
    public String render() {
        return "<invalid> " + getText();
    }
}
