package org.minimips.runtime.isa;

import org.minimips.runtime.model.Register;

/**
 * A register operand as written in the source. Names outside the register file decode
 * to an unbound operand: it reads as 0 and writes to it are discarded.
 *
 * @param name The operand text.
 * @param register The register, or {@code null} if the name is not a register.
 */
public record RegisterOperand(String name, Register register) {

    /**
     * Resolves an operand name.
     * @param name The operand text.
     * @return The operand; unbound if the name is unknown.
     */
    public static RegisterOperand of(String name) {
        return new RegisterOperand(name, Register.fromName(name).orElse(null));
    }

    /**
     * Checks whether the operand names a register of the register file.
     * @return true if bound.
     */
    public boolean isBound() {
        return register != null;
    }

    @Override
    public String toString() {
        return register != null ? register.symbol() : name;
    }
}
