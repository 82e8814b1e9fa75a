package com.napkin.engine.formula;

import com.napkin.engine.models.CellCoordinate;

import java.util.List;

/**
 * Parsed formula tree. Nodes are immutable and evaluate against a {@link CellValueSource}.
 */
abstract class Expression {

    abstract double evaluate(CellValueSource source);

    static final class Number extends Expression {
        private final double value;

        Number(double value) {
            this.value = value;
        }

        @Override
        double evaluate(CellValueSource source) {
            return value;
        }
    }

    /**
     * A bare reference inside arithmetic. Empty cells read as 0,
     * text that is not a number fails the whole formula.
     */
    static final class Reference extends Expression {
        private final CellCoordinate coordinate;

        Reference(CellCoordinate coordinate) {
            this.coordinate = coordinate;
        }

        @Override
        double evaluate(CellValueSource source) {
            String text = source.valueAt(coordinate.getRow(), coordinate.getColumn());
            if (text == null || text.isEmpty()) {
                return 0;
            }
            Double number = NumberFormatting.parseNumber(text);
            if (number == null) {
                throw new FormulaException(FormulaErrorType.INVALID_FORMULA,
                        "Cell " + CellReferences.encode(coordinate) + " does not hold a number: " + text);
            }
            return number;
        }
    }

    static final class Negate extends Expression {
        private final Expression operand;

        Negate(Expression operand) {
            this.operand = operand;
        }

        @Override
        double evaluate(CellValueSource source) {
            return -operand.evaluate(source);
        }
    }

    static final class Binary extends Expression {
        private final Token.Type operator;
        private final Expression left;
        private final Expression right;

        Binary(Token.Type operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        double evaluate(CellValueSource source) {
            double l = left.evaluate(source);
            double r = right.evaluate(source);
            switch (operator) {
                case PLUS:
                    return l + r;
                case MINUS:
                    return l - r;
                case STAR:
                    return l * r;
                case SLASH:
                    if (r == 0) {
                        throw new FormulaException(FormulaErrorType.DIVISION_BY_ZERO, "Division by zero");
                    }
                    return l / r;
                default:
                    throw new IllegalStateException("Not a binary operator: " + operator);
            }
        }
    }

    static final class Call extends Expression {
        private final SpreadsheetFunction function;
        private final List<FunctionArgument> arguments;
        private final FunctionArgument secondary;

        Call(SpreadsheetFunction function, List<FunctionArgument> arguments, FunctionArgument secondary) {
            this.function = function;
            this.arguments = arguments;
            this.secondary = secondary;
        }

        @Override
        double evaluate(CellValueSource source) {
            FunctionArguments resolved = new FunctionArguments();
            for (FunctionArgument argument : arguments) {
                argument.collect(source, resolved);
            }
            if (secondary != null) {
                resolved.setSecondary(secondary.scalar(source));
            }
            return function.apply(resolved);
        }
    }
}
