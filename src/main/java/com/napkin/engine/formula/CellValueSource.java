package com.napkin.engine.formula;

/**
 * Supplies the current text of a cell to the evaluator.
 * {@code null} and the empty string both mean "empty cell".
 */
@FunctionalInterface
public interface CellValueSource {

    String valueAt(int row, int column);
}
