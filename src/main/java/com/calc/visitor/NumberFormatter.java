package com.calc.visitor;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Formats doubles as their shortest plain decimal text.
 * <p>
 * Whole numbers lose the trailing ".0" ({@code 6.0 -> "6"}) and exponent
 * notation is never used ({@code 1e21 -> "1000000000000000000000"}).
 * The digits are the fewest that still read back as the same double.
 */
public final class NumberFormatter {

    // 17 significant digits always identify a double
    private static final int MAX_DIGITS = 17;

    private NumberFormatter() {
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            // BigDecimal has no negative zero
            return Double.doubleToRawLongBits(value) == 0L ? "0" : "-0";
        }
        return shortest(value).stripTrailingZeros().toPlainString();
    }

    private static BigDecimal shortest(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < MAX_DIGITS; digits++) {
            BigDecimal rounded = exact.round(new MathContext(digits));
            if (rounded.doubleValue() == value) {
                return rounded;
            }
        }
        return exact.round(new MathContext(MAX_DIGITS));
    }
}
