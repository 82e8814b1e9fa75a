package com.napkin.engine.grid;

import com.napkin.engine.models.CellCoordinate;

import java.util.Collections;
import java.util.List;

/**
 * Summary of one full recompute pass.
 */
public class RecalculationResult {
    private final int formulaCount;
    private final List<CellCoordinate> evaluationOrder;
    private final List<CellCoordinate> cyclicCells;

    public RecalculationResult(int formulaCount, List<CellCoordinate> evaluationOrder, List<CellCoordinate> cyclicCells) {
        this.formulaCount = formulaCount;
        this.evaluationOrder = Collections.unmodifiableList(evaluationOrder);
        this.cyclicCells = Collections.unmodifiableList(cyclicCells);
    }

    public int getFormulaCount() {
        return formulaCount;
    }

    /** Formula cells in the order they were evaluated. */
    public List<CellCoordinate> getEvaluationOrder() {
        return evaluationOrder;
    }

    /** Formula cells on a cycle or depending on one; all were marked as errors. */
    public List<CellCoordinate> getCyclicCells() {
        return cyclicCells;
    }

    public boolean hasCycles() {
        return !cyclicCells.isEmpty();
    }
}
