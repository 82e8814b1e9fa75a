package com.napkin.engine.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates one formula body (the text after the leading '=') against
 * whatever the {@link CellValueSource} currently returns.
 * Stateless and safe to share.
 */
public class FormulaEngine {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEngine.class);

    /**
     * Evaluates the formula and formats the result for display.
     *
     * @throws FormulaException when any stage fails; the type names the stage
     */
    public String evaluate(String formula, CellValueSource source) {
        String balanced = balanceParentheses(formula == null ? "" : formula);
        Expression expression = FormulaParser.parse(balanced);
        double result = expression.evaluate(source);
        if (!Double.isFinite(result)) {
            throw new FormulaException(FormulaErrorType.DIVISION_BY_ZERO, "Result is not finite: " + balanced);
        }
        String formatted = NumberFormatting.formatResult(result);
        logger.debug("Evaluated '{}' -> {}", balanced, formatted);
        return formatted;
    }

    /**
     * Appends the ')' a caller forgot, e.g. "SUM(A1:A3" -> "SUM(A1:A3)".
     * Nothing else about the text is corrected.
     */
    public static String balanceParentheses(String formula) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < formula.length(); i++) {
            char ch = formula.charAt(i);
            if (ch == '(') {
                open++;
            } else if (ch == ')') {
                close++;
            }
        }
        if (open <= close) {
            return formula;
        }
        StringBuilder sb = new StringBuilder(formula);
        for (int i = close; i < open; i++) {
            sb.append(')');
        }
        return sb.toString();
    }
}
