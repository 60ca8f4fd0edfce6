package com.optionsbacktester.domain.enums;

/**
 * Volatility-index level buckets used to segment trade performance.
 *
 * <p>Boundaries (VIX points): below 12, below 15, up to 20, up to 25, up to 30,
 * up to 40, above 40. Upper bounds of the OPTIMAL and HIGH buckets are inclusive.
 */
public enum VolatilityRegime {
    EXTREMELY_LOW,
    LOW,
    OPTIMAL_LOW,
    OPTIMAL_MEDIUM,
    OPTIMAL_HIGH,
    HIGH,
    EXTREMELY_HIGH,
    UNKNOWN;

    public static VolatilityRegime fromVix(Double vixLevel) {
        if (vixLevel == null || !Double.isFinite(vixLevel) || vixLevel < 0) {
            return UNKNOWN;
        }
        double vix = vixLevel;
        if (vix < 12) return EXTREMELY_LOW;
        if (vix < 15) return LOW;
        if (vix <= 20) return OPTIMAL_LOW;
        if (vix <= 25) return OPTIMAL_MEDIUM;
        if (vix <= 30) return OPTIMAL_HIGH;
        if (vix <= 40) return HIGH;
        return EXTREMELY_HIGH;
    }
}
