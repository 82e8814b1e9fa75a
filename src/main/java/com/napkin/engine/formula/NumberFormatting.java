package com.napkin.engine.formula;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Number parsing and display rules shared by the evaluator and the grid.
 */
public final class NumberFormatting {

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);

    private NumberFormatting() {
    }

    /**
     * Parses plain decimal text ("12", "-0.5", "1e3").
     * Returns null for anything else, including empty text and values that overflow.
     */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || !NUMBER_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        double value = Double.parseDouble(trimmed);
        return Double.isFinite(value) ? value : null;
    }

    public static boolean isWhole(double value) {
        return Double.isFinite(value) && value == Math.rint(value);
    }

    /**
     * Formats an evaluation result: whole numbers without a decimal point,
     * everything else like C's {@code %g} (6 significant digits, no trailing zeros).
     */
    public static String formatResult(double value) {
        if (isWhole(value)) {
            return formatWhole(value);
        }
        BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 6) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            int magnitude = Math.abs(exponent);
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + (magnitude < 10 ? "0" : "") + magnitude;
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /**
     * Normalizes a plain (non-formula) literal: "007" becomes "7", "1.50" becomes "1.5",
     * text that is not a number is returned unchanged.
     */
    public static String normalizeLiteral(String input) {
        Double number = parseNumber(input);
        if (number == null) {
            return input;
        }
        if (isWhole(number) && !input.contains(".")) {
            return formatWhole(number);
        }
        return Double.toString(number);
    }

    private static String formatWhole(double value) {
        if (value == 0) {
            // also folds -0
            return "0";
        }
        return new BigDecimal(value).setScale(0, RoundingMode.UNNECESSARY).toPlainString();
    }
}
