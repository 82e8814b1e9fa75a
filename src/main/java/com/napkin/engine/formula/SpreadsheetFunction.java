package com.napkin.engine.formula;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Built-in functions. Every aggregate over an empty argument set yields 0,
 * PRODUCT included.
 */
public enum SpreadsheetFunction {
    SUM {
        @Override
        double apply(FunctionArguments args) {
            double total = 0;
            for (double v : args.getValues()) {
                total += v;
            }
            return total;
        }
    },
    PRODUCT {
        @Override
        double apply(FunctionArguments args) {
            if (args.isEmpty()) {
                return 0;
            }
            double product = 1;
            for (double v : args.getValues()) {
                product *= v;
            }
            return product;
        }
    },
    AVERAGE {
        @Override
        double apply(FunctionArguments args) {
            if (args.isEmpty()) {
                return 0;
            }
            return SUM.apply(args) / args.getValues().size();
        }
    },
    MIN {
        @Override
        double apply(FunctionArguments args) {
            List<Double> values = args.getValues();
            if (values.isEmpty()) {
                return 0;
            }
            double min = values.get(0);
            for (double v : values) {
                min = Math.min(min, v);
            }
            return min;
        }
    },
    MAX {
        @Override
        double apply(FunctionArguments args) {
            List<Double> values = args.getValues();
            if (values.isEmpty()) {
                return 0;
            }
            double max = values.get(0);
            for (double v : values) {
                max = Math.max(max, v);
            }
            return max;
        }
    },
    COUNT {
        @Override
        double apply(FunctionArguments args) {
            return args.getNumericCount();
        }
    },
    ABS {
        @Override
        double apply(FunctionArguments args) {
            return args.isEmpty() ? 0 : Math.abs(args.getValues().get(0));
        }
    },
    ROUND {
        @Override
        double apply(FunctionArguments args) {
            if (args.isEmpty()) {
                return 0;
            }
            double value = args.getValues().get(0);
            if (!Double.isFinite(value)) {
                return value;
            }
            Double secondary = args.getSecondary();
            int places = 0;
            if (secondary != null && NumberFormatting.isWhole(secondary)) {
                places = (int) Math.max(-MAX_ROUND_PLACES, Math.min(MAX_ROUND_PLACES, secondary.doubleValue()));
            }
            return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
        }
    };

    // beyond this a double has no digits left to round
    private static final int MAX_ROUND_PLACES = 20;

    abstract double apply(FunctionArguments args);

    /**
     * Case-insensitive lookup, e.g. "sum" -> SUM.
     */
    public static SpreadsheetFunction fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (SpreadsheetFunction function : values()) {
            if (function.name().equals(upper)) {
                return function;
            }
        }
        throw new FormulaException(FormulaErrorType.INVALID_FUNCTION, "Unknown function: " + name);
    }
}
