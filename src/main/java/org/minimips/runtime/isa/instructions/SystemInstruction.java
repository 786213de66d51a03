package org.minimips.runtime.isa.instructions;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.runtime.Config;
import org.minimips.runtime.internal.services.ExecutionContext;
import org.minimips.runtime.isa.DecodeContext;
import org.minimips.runtime.isa.Instruction;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Handles SYSCALL. The service is selected by the value in {@code $v0}; its argument,
 * if any, is taken from {@code $a0}.
 */
public class SystemInstruction extends Instruction {

    /**
     * The system services the machine models.
     */
    public enum Syscall {
        /** Prints {@code $a0} as a signed decimal. */
        PRINT_INT(1),
        /** Prints the string declared at the address in {@code $a0}. */
        PRINT_STRING(4),
        /** Halts the machine. */
        EXIT(10),
        /** Prints the low byte of {@code $a0} as a character. */
        PRINT_CHAR(11);

        private final int code;

        Syscall(int code) {
            this.code = code;
        }

        /**
         * Resolves a service by its selector value.
         * @param code The selector.
         * @return The service, or empty if unsupported.
         */
        public static Optional<Syscall> fromCode(int code) {
            for (Syscall syscall : values()) {
                if (syscall.code == code) {
                    return Optional.of(syscall);
                }
            }
            return Optional.empty();
        }
    }

    private SystemInstruction(SourceInfo sourceInfo) {
        super(sourceInfo, "syscall");
    }

    /**
     * Decodes {@code syscall}.
     * @param match The signature match.
     * @param context The decode context.
     * @return The instruction.
     */
    public static Instruction decode(Matcher match, DecodeContext context) {
        return new SystemInstruction(context.sourceInfo());
    }

    @Override
    public void execute(ExecutionContext context) {
        int selector = context.readRegister(Config.SYSCALL_SELECTOR);
        Optional<Syscall> syscall = Syscall.fromCode(selector);
        if (syscall.isEmpty()) {
            context.fail("Unsupported syscall: " + selector);
            return;
        }
        int argument = context.readRegister(Config.SYSCALL_ARGUMENT);
        switch (syscall.get()) {
            case PRINT_INT -> context.print(String.valueOf(argument));
            case PRINT_STRING -> context.print(context.getProgram().findStringAt(argument).orElse(""));
            case PRINT_CHAR -> context.print(String.valueOf((char) (argument & 0xFF)));
            case EXIT -> {
                context.halt();
                return;
            }
        }
        context.advance();
    }

    @Override
    public String render() {
        return "syscall";
    }
}
