package com.napkin.engine.formula;

import com.napkin.engine.models.CellCoordinate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the formula evaluator against a map-backed set of cells.
 */
class FormulaEngineTest {

    private FormulaEngine engine;
    private Map<CellCoordinate, String> cells;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        cells = new HashMap<>();
    }

    private void set(String label, String value) {
        cells.put(CellReferences.decode(label), value);
    }

    private String eval(String formula) {
        return engine.evaluate(formula, (row, column) -> cells.get(new CellCoordinate(row, column)));
    }

    private void assertFails(FormulaErrorType expected, String formula) {
        FormulaException ex = assertThrows(FormulaException.class, () -> eval(formula));
        assertEquals(expected, ex.getType(), "for " + formula);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "5+3 | 8",
            "10-3 | 7",
            "10*2 | 20",
            "10/2 | 5",
            "(5+3)*2 | 16",
            "((2+3)*4)/2 | 10",
            "7/2 | 3.5",
            "1+2*3 | 7",
            "2+3*4 | 14",
            "10-2-3 | 5",
            "16/4/2 | 2",
            "-5+3 | -2",
            "--5 | 5",
            "+4 | 4",
            "2*-3 | -6",
            "1e3+1 | 1001",
            "2E-1*10 | 2",
            ".5+.25 | 0.75",
            " 1 +  2 | 3"
    })
    void testArithmetic(String formula, String expected) {
        assertEquals(expected, eval(formula));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "4/2 | 2",
            "1/3 | 0.333333",
            "2/3 | 0.666667",
            "100/3 | 33.3333",
            "1/8 | 0.125",
            "1000*1000 | 1000000",
            "0.1+0.2 | 0.3",
            "1/100000 | 1e-05",
            "2469135/2 | 1.23457e+06",
            "0-0 | 0"
    })
    void testResultFormatting(String formula, String expected) {
        assertEquals(expected, eval(formula));
    }

    @Test
    void testCellReferences() {
        set("A1", "10");
        set("B1", "20");
        set("C1", "30");
        set("A2", "0.08");
        set("J1", "77");
        set("Z1", "55");
        set("AA1", "3");
        assertEquals("10", eval("A1"));
        assertEquals("30", eval("A1+B1"));
        assertEquals("900", eval("(A1+B1)*C1"));
        assertEquals("0.8", eval("A1*A2"));
        assertEquals("77", eval("J1"));
        assertEquals("55", eval("Z1"));
        assertEquals("6", eval("AA1*2"));
    }

    @Test
    void testLowerCaseReferences() {
        set("A1", "4");
        assertEquals("8", eval("a1*2"));
    }

    @Test
    void testEmptyCellReadsAsZero() {
        set("A1", "5");
        assertEquals("5", eval("A1+B1"));
    }

    @Test
    void testNegativeAndScientificCellText() {
        set("A1", "-5");
        set("A2", "1.0E-5");
        assertEquals("-15", eval("A1*3"));
        assertEquals("1", eval("A2*100000"));
    }

    @Test
    void testSum() {
        for (int i = 1; i <= 5; i++) {
            set("A" + i, String.valueOf(i * 10));
        }
        assertEquals("150", eval("SUM(A1:A5)"));
        assertEquals("300", eval("SUM(A1:A5)*2"));
        assertEquals("30", eval("sum(A1:A2)"));
        assertEquals("40", eval("SUM(A1,A3)"));
        assertEquals("20", eval("SUM(A1,A1)"));
        assertEquals("6", eval("SUM(1,2,3)"));
        assertEquals("-1", eval("SUM(-3,2)"));
        assertEquals("0", eval("SUM()"));
    }

    @Test
    void testRangeDirectionIsIrrelevant() {
        set("A1", "10");
        set("A2", "20");
        set("A3", "30");
        assertEquals("60", eval("SUM(A1:A3)"));
        assertEquals("60", eval("SUM(A3:A1)"));
    }

    @Test
    void testRectangularRange() {
        set("A1", "1");
        set("A2", "2");
        set("B1", "3");
        set("B2", "4");
        assertEquals("10", eval("SUM(A1:B2)"));
        assertEquals("10", eval("SUM(B2:A1)"));
        assertEquals("10", eval("SUM(A2:B1)"));
    }

    @Test
    void testEmptyCellsAreSkippedByCount() {
        set("A1", "10");
        set("A3", "30");
        assertEquals("40", eval("SUM(A1:A3)"));
        assertEquals("2", eval("COUNT(A1:A3)"));
        assertEquals("20", eval("AVERAGE(A1:A3)"));
    }

    @Test
    void testNonNumericTextInAggregates() {
        set("A1", "hello");
        set("A2", "10");
        assertEquals("10", eval("SUM(A1:A2)"));
        assertEquals("1", eval("COUNT(A1:A2)"));
        assertEquals("5", eval("AVERAGE(A1:A2)"));
        assertEquals("0", eval("MIN(A1:A2)"));
        assertEquals("0", eval("PRODUCT(A1:A2)"));
        assertEquals("10", eval("SUM(A1,A2)"));
    }

    /**
     * The same text that an aggregate folds to 0 breaks a plain arithmetic reference.
     */
    @Test
    void testNonNumericTextInBareReferenceFails() {
        set("A1", "hello");
        assertFails(FormulaErrorType.INVALID_FORMULA, "A1+1");
        set("B1", "#ERROR");
        assertFails(FormulaErrorType.INVALID_FORMULA, "B1");
    }

    @Test
    void testProduct() {
        set("A1", "2");
        set("A2", "3");
        set("A3", "4");
        set("B1", "5");
        set("C1", "6");
        assertEquals("24", eval("PRODUCT(A1:A3)"));
        assertEquals("30", eval("PRODUCT(B1,C1)"));
        assertEquals("0", eval("PRODUCT(D1:D3)"));
        assertEquals("0", eval("PRODUCT()"));
    }

    @Test
    void testAverage() {
        set("A1", "10");
        set("A2", "20");
        set("A3", "30");
        set("A4", "40");
        assertEquals("20", eval("AVERAGE(A1:A3)"));
        assertEquals("25", eval("AVERAGE(A1:A4)"));
        assertEquals("10", eval("AVERAGE(A1,A1)"));
        assertEquals("0", eval("AVERAGE(B1:B3)"));
    }

    @Test
    void testMinMax() {
        set("A1", "3");
        set("A2", "-1");
        set("A3", "2");
        assertEquals("-1", eval("MIN(A1:A3)"));
        assertEquals("3", eval("MAX(A1:A3)"));
        assertEquals("7", eval("MAX(A1:A3,7)"));
        assertEquals("0", eval("MIN(B1:B3)"));
        assertEquals("0", eval("MAX()"));
    }

    @Test
    void testCount() {
        set("A1", "1");
        set("A2", "text");
        set("A3", "3");
        assertEquals("2", eval("COUNT(A1:A4)"));
        assertEquals("3", eval("COUNT(A1:A4,5)"));
        assertEquals("0", eval("COUNT(B1:B9)"));
        // a single empty reference contributes no counted value
        assertEquals("1", eval("COUNT(A1,B1)"));
    }

    @Test
    void testAbs() {
        set("A1", "-7");
        assertEquals("7", eval("ABS(A1)"));
        assertEquals("5", eval("ABS(-5)"));
        assertEquals("2.5", eval("ABS(-2.5)"));
        assertEquals("0", eval("ABS()"));
    }

    @Test
    void testRound() {
        set("A1", "3.7");
        set("A2", "2.345");
        assertEquals("4", eval("ROUND(A1)"));
        assertEquals("2.35", eval("ROUND(A2;2)"));
        assertEquals("2.3", eval("ROUND(A2;1)"));
        assertEquals("-3", eval("ROUND(-2.5)"));
        assertEquals("120", eval("ROUND(123;-1)"));
        // secondary that is not a number falls back to 0 places
        assertEquals("2", eval("ROUND(A2;B7)"));
        assertEquals("2", eval("ROUND(A2;)"));
        // only a single whole number is read as places
        assertEquals("2", eval("ROUND(2.345;2.7)"));
        assertEquals("2", eval("ROUND(2.345;2,5)"));
        assertEquals("2.35", eval("ROUND(2.345;ABS(-2))"));
    }

    @Test
    void testNestedFunctions() {
        set("A1", "2");
        set("A2", "3");
        set("B1", "4");
        set("B2", "5");
        assertEquals("5", eval("MIN(SUM(A1:A2);PRODUCT(B1:B2))"));
        assertEquals("20", eval("MAX(SUM(A1:A2),PRODUCT(B1:B2))"));
        assertEquals("25", eval("SUM(SUM(A1:A2),PRODUCT(B1:B2))"));
        assertEquals("1.5", eval("ROUND(AVERAGE(A1:A2);1)-1"));
    }

    @Test
    void testFunctionsInsideArithmetic() {
        set("A1", "10");
        set("B1", "5");
        set("B2", "15");
        for (int i = 1; i <= 4; i++) {
            set("C" + i, String.valueOf(i * 10));
        }
        assertEquals("30", eval("A1+SUM(B1:B2)"));
        assertEquals("25", eval("SUM(C1:C4)/4"));
        assertEquals("60", eval("SUM(B1:B2)+SUM(C1:C2)+A1"));
    }

    @Test
    void testMissingClosingParenthesesAreAppended() {
        set("A1", "1");
        set("A2", "2");
        assertEquals("3", eval("SUM(A1:A2"));
        assertEquals("9", eval("(1+2)*(1+2"));
        assertEquals("SUM(A1)", FormulaEngine.balanceParentheses("SUM(A1"));
        assertEquals("((1))", FormulaEngine.balanceParentheses("((1"));
        assertEquals("1)", FormulaEngine.balanceParentheses("1)"));
    }

    @Test
    void testDivisionByZero() {
        set("A1", "10");
        assertFails(FormulaErrorType.DIVISION_BY_ZERO, "1/0");
        assertFails(FormulaErrorType.DIVISION_BY_ZERO, "A1/B1");
        assertFails(FormulaErrorType.DIVISION_BY_ZERO, "0/0");
        assertFails(FormulaErrorType.DIVISION_BY_ZERO, "1e308*10");
    }

    @Test
    void testInvalidFormulas() {
        assertFails(FormulaErrorType.INVALID_FORMULA, "+++");
        assertFails(FormulaErrorType.INVALID_FORMULA, "");
        assertFails(FormulaErrorType.INVALID_FORMULA, "2 $ 3");
        assertFails(FormulaErrorType.INVALID_FORMULA, "hello");
        assertFails(FormulaErrorType.INVALID_FORMULA, "1 2");
        assertFails(FormulaErrorType.INVALID_FORMULA, "A1:A3");
        assertFails(FormulaErrorType.INVALID_FORMULA, "(1+2))");
        assertFails(FormulaErrorType.INVALID_FORMULA, ".");
    }

    @Test
    void testInvalidFunction() {
        assertFails(FormulaErrorType.INVALID_FUNCTION, "FOO(1)");
        assertFails(FormulaErrorType.INVALID_FUNCTION, "1+median(A1:A2)");
    }

    @Test
    void testInvalidReferencesAndRanges() {
        assertFails(FormulaErrorType.INVALID_REFERENCE, "A0+1");
        assertFails(FormulaErrorType.INVALID_REFERENCE, "SUM(A0:A2)");
        assertFails(FormulaErrorType.INVALID_REFERENCE, "SUM(A1+1)");
        assertFails(FormulaErrorType.INVALID_REFERENCE, "SUM(A1,)");
        assertFails(FormulaErrorType.INVALID_RANGE, "SUM(A1:)");
        assertFails(FormulaErrorType.INVALID_RANGE, "SUM(A1:5)");
        assertFails(FormulaErrorType.INVALID_RANGE, "SUM(A1:ZZZ99999)");
    }
}
