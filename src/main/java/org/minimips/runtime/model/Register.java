package org.minimips.runtime.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The 32 general purpose registers of the machine, declared in display order.
 * Each register also carries its architectural number, which is what the
 * numeric {@code $0..$31} source syntax refers to.
 */
public enum Register {
    ZERO("$zero", 0),
    AT("$at", 1),
    V0("$v0", 2),
    V1("$v1", 3),
    A0("$a0", 4),
    A1("$a1", 5),
    A2("$a2", 6),
    A3("$a3", 7),
    T0("$t0", 8),
    T1("$t1", 9),
    T2("$t2", 10),
    T3("$t3", 11),
    T4("$t4", 12),
    T5("$t5", 13),
    T6("$t6", 14),
    T7("$t7", 15),
    T8("$t8", 24),
    T9("$t9", 25),
    S0("$s0", 16),
    S1("$s1", 17),
    S2("$s2", 18),
    S3("$s3", 19),
    S4("$s4", 20),
    S5("$s5", 21),
    S6("$s6", 22),
    S7("$s7", 23),
    K0("$k0", 26),
    K1("$k1", 27),
    GP("$gp", 28),
    SP("$sp", 29),
    FP("$fp", 30),
    RA("$ra", 31);

    /**
     * The number of registers in the register file.
     */
    public static final int COUNT = 32;

    private static final Map<String, Register> BY_NAME = new HashMap<>();

    static {
        for (Register register : values()) {
            BY_NAME.put(register.symbol, register);
            BY_NAME.put("$" + register.number, register);
        }
    }

    private final String symbol;
    private final int number;

    Register(String symbol, int number) {
        this.symbol = symbol;
        this.number = number;
    }

    /**
     * Returns the symbolic name, e.g. {@code $t0}.
     * @return The register name including the dollar sign.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the architectural register number, used as index into the register file.
     * @return A number between 0 and 31.
     */
    public int number() {
        return number;
    }

    /**
     * Resolves a register by its symbolic ({@code $sp}) or numeric ({@code $29}) name.
     * Matching is case-insensitive.
     *
     * @param name The register name.
     * @return The register, or empty if the name is unknown.
     */
    public static Optional<Register> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
