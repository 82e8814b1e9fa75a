package com.napkin.engine.formula;

import com.napkin.engine.models.CellCoordinate;

/**
 * One comma-separated entry of a function call.
 */
abstract class FunctionArgument {

    // guards against "A1:ZZZ999999"-sized scans
    static final long MAX_RANGE_CELLS = 1_000_000L;

    abstract void collect(CellValueSource source, FunctionArguments into);

    /**
     * Value when used as the secondary (after ';') argument, null when it is not a plain value.
     */
    Double scalar(CellValueSource source) {
        return null;
    }

    /**
     * A numeric literal or a nested call; always counted.
     */
    static final class Value extends FunctionArgument {
        private final Expression expression;

        Value(Expression expression) {
            this.expression = expression;
        }

        @Override
        void collect(CellValueSource source, FunctionArguments into) {
            into.add(expression.evaluate(source), true);
        }

        @Override
        Double scalar(CellValueSource source) {
            return expression.evaluate(source);
        }
    }

    /**
     * A single cell. Empty or non-numeric text contributes an uncounted 0.
     */
    static final class Reference extends FunctionArgument {
        private final CellCoordinate coordinate;

        Reference(CellCoordinate coordinate) {
            this.coordinate = coordinate;
        }

        @Override
        void collect(CellValueSource source, FunctionArguments into) {
            Double number = NumberFormatting.parseNumber(source.valueAt(coordinate.getRow(), coordinate.getColumn()));
            if (number == null) {
                into.add(0, false);
            } else {
                into.add(number, true);
            }
        }
    }

    /**
     * Inclusive rectangle between two corners, in either direction.
     * Empty cells are skipped, text counts as an uncounted 0.
     */
    static final class Range extends FunctionArgument {
        private final int minRow;
        private final int maxRow;
        private final int minColumn;
        private final int maxColumn;

        Range(CellCoordinate start, CellCoordinate end) {
            this.minRow = Math.min(start.getRow(), end.getRow());
            this.maxRow = Math.max(start.getRow(), end.getRow());
            this.minColumn = Math.min(start.getColumn(), end.getColumn());
            this.maxColumn = Math.max(start.getColumn(), end.getColumn());
            long cells = ((long) maxRow - minRow + 1) * ((long) maxColumn - minColumn + 1);
            if (cells > MAX_RANGE_CELLS) {
                throw new FormulaException(FormulaErrorType.INVALID_RANGE,
                        "Range " + CellReferences.rangeLabel(start, end) + " spans too many cells");
            }
        }

        @Override
        void collect(CellValueSource source, FunctionArguments into) {
            for (int row = minRow; row <= maxRow; row++) {
                for (int column = minColumn; column <= maxColumn; column++) {
                    String text = source.valueAt(row, column);
                    if (text == null || text.isEmpty()) {
                        continue;
                    }
                    Double number = NumberFormatting.parseNumber(text);
                    if (number == null) {
                        into.add(0, false);
                    } else {
                        into.add(number, true);
                    }
                }
            }
        }
    }
}
