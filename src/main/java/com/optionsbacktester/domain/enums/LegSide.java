package com.optionsbacktester.domain.enums;

/**
 * Direction of a position leg. LONG legs are bought (debit), SHORT legs are sold (credit).
 */
public enum LegSide {
    LONG(1),
    SHORT(-1);

    private final int sign;

    LegSide(int sign) {
        this.sign = sign;
    }

    /** +1 for LONG, -1 for SHORT. */
    public int sign() {
        return sign;
    }
}
