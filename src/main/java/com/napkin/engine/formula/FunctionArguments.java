package com.napkin.engine.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Values resolved from a function's argument list.
 * Every value takes part in SUM/PRODUCT/AVERAGE/MIN/MAX; only the ones
 * that came from an actual number are counted by COUNT.
 */
public final class FunctionArguments {
    private final List<Double> values = new ArrayList<>();
    private int numericCount;
    private Double secondary;

    public void add(double value, boolean numeric) {
        values.add(value);
        if (numeric) {
            numericCount++;
        }
    }

    public List<Double> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int getNumericCount() {
        return numericCount;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Scalar from the segment after ';' (ROUND's decimal places), or null when absent.
     */
    public Double getSecondary() {
        return secondary;
    }

    public void setSecondary(Double secondary) {
        this.secondary = secondary;
    }
}
