package org.minimips.compiler.util;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses integer literals as they appear in assembly source and in caller supplied
 * initial values. Decimal and {@code 0x} hexadecimal forms are accepted, both optionally
 * negative. Values outside the 32-bit range wrap to their low-order 32 bits.
 */
public final class NumericParser {

    private static final Pattern HEX_LITERAL = Pattern.compile("^-?0[xX][0-9a-fA-F]+$");
    private static final Pattern DECIMAL_LITERAL = Pattern.compile("^[+-]?\\d+$");

    private NumericParser() {}

    /**
     * Parses a numeric literal.
     *
     * @param raw The literal text, surrounding whitespace is ignored.
     * @return The 32-bit value, or empty if the text is not a valid literal.
     */
    public static Optional<Integer> parseInt(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        if (HEX_LITERAL.matcher(value).matches()) {
            boolean negative = value.startsWith("-");
            BigInteger magnitude = new BigInteger(value.substring(negative ? 3 : 2), 16);
            return Optional.of((negative ? magnitude.negate() : magnitude).intValue());
        }
        if (DECIMAL_LITERAL.matcher(value).matches()) {
            return Optional.of(new BigInteger(value).intValue());
        }
        return Optional.empty();
    }

    /**
     * Truncates a wide intermediate result to a 32-bit two's-complement value.
     *
     * @param value The value to normalize.
     * @return The low-order 32 bits interpreted as a signed int.
     */
    public static int normalize(long value) {
        return (int) value;
    }
}
