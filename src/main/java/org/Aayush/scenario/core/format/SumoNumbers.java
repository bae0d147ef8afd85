package org.Aayush.scenario.core.format;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;

/**
 * Canonical text form for numbers written into SUMO documents.
 *
 * <p>Shortest exact decimal, no exponent, no trailing zeros: {@code 50.0 -> "50"},
 * {@code 13.89 -> "13.89"}, {@code -0.0 -> "0"}. The same double always yields the
 * same text, which keeps rendered documents byte-stable.</p>
 */
@UtilityClass
public class SumoNumbers {

    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value: " + value);
        }
        if (value == 0.0d) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String format(int value) {
        return Integer.toString(value);
    }
}
