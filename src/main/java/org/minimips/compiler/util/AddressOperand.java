package org.minimips.compiler.util;

import org.minimips.runtime.model.Register;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The decoded form of a {@code lw}/{@code sw} address operand. Three source forms exist:
 * {@code offset($base)}, a data label, or a literal address. Labels and literals are
 * resolved to an absolute address while decoding; only the register-relative form needs
 * the register file at execution time.
 *
 * @param base The base register, or {@code null} for an absolute address.
 * @param offset The offset added to the base register, or the absolute address.
 */
public record AddressOperand(Register base, int offset) {

    private static final Pattern OFFSET_BASE = Pattern.compile("^(.+)\\((\\$\\w+)\\)$");

    /**
     * Parses an address operand.
     *
     * @param operand The operand text.
     * @param dataAddresses The data label table used to resolve bare labels.
     * @return The decoded operand, or empty if the syntax is invalid, the offset is not a
     *         number or the base is not a register.
     */
    public static Optional<AddressOperand> parse(String operand, Map<String, Integer> dataAddresses) {
        String text = operand.trim();
        Matcher offsetBase = OFFSET_BASE.matcher(text);
        if (offsetBase.matches()) {
            Optional<Integer> offset = NumericParser.parseInt(offsetBase.group(1));
            Optional<Register> base = Register.fromName(offsetBase.group(2));
            if (offset.isEmpty() || base.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new AddressOperand(base.get(), offset.get()));
        }
        Integer labelAddress = dataAddresses.get(text);
        if (labelAddress != null) {
            return Optional.of(absolute(labelAddress));
        }
        return NumericParser.parseInt(text).map(AddressOperand::absolute);
    }

    /**
     * Creates an operand for a fixed address.
     * @param address The absolute address.
     * @return The operand.
     */
    public static AddressOperand absolute(int address) {
        return new AddressOperand(null, address);
    }

    /**
     * Checks whether the effective address depends on a register.
     * @return true for the {@code offset($base)} form.
     */
    public boolean isRegisterRelative() {
        return base != null;
    }

    /**
     * Computes the effective 32-bit address.
     *
     * @param baseValue The current value of the base register, ignored for absolute operands.
     * @return The effective address.
     */
    public int effectiveAddress(int baseValue) {
        if (base == null) {
            return offset;
        }
        return NumericParser.normalize((long) baseValue + offset);
    }

    @Override
    public String toString() {
        if (base == null) {
            return String.format("0x%08x", offset);
        }
        return offset + "(" + base.symbol() + ")";
    }
}
