package com.optmodeler.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatting of numeric and string literals in OPTMODEL syntax.
 *
 * <p>Numbers are written without locale influence: integral values have no fraction,
 * other values are plain decimals with trailing zeros stripped, and very large or very
 * small magnitudes use {@code E} notation. Infinities are written as
 * {@code constant('BIG')}.
 */
public final class OptmodelLiterals {

    /** OPTMODEL spelling of an infinite bound. */
    public static final String INFINITY = "constant('BIG')";

    private static final double SCIENTIFIC_UPPER = 1e16;
    private static final double SCIENTIFIC_LOWER = 1e-6;

    private OptmodelLiterals() {
    }

    /**
     * Formats a number.
     *
     * @param value value to format, must not be NaN
     * @param maxDigits maximum fraction digits, 0 or less for no rounding
     * @return literal text
     */
    public static String formatNumber(double value, int maxDigits) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN cannot be written as a literal");
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        double magnitude = Math.abs(value);
        if (magnitude == 0.0) {
            return "0";
        }
        if (magnitude >= SCIENTIFIC_UPPER || magnitude < SCIENTIFIC_LOWER) {
            return Double.toString(value);
        }
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value));
        if (maxDigits > 0 && decimal.scale() > maxDigits) {
            decimal = decimal.setScale(maxDigits, RoundingMode.HALF_UP);
        }
        decimal = decimal.stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    public static String formatNumber(double value) {
        return formatNumber(value, 0);
    }

    /**
     * Quotes a string literal, doubling embedded single quotes.
     *
     * @param text raw text
     * @return quoted literal
     */
    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    /**
     * Formats a literal index element: strings are quoted, numbers formatted.
     *
     * @param element string or number
     * @param maxDigits maximum fraction digits
     * @return literal text
     */
    public static String formatElement(Object element, int maxDigits) {
        if (element instanceof String text) {
            return quote(text);
        }
        if (element instanceof Long number) {
            return Long.toString(number);
        }
        if (element instanceof Number number) {
            return formatNumber(number.doubleValue(), maxDigits);
        }
        throw new IllegalArgumentException("Not a literal element: " + element);
    }
}
