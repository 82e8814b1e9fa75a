package com.napkin.engine.grid;

import com.napkin.engine.exceptions.CellOutOfBoundsException;
import com.napkin.engine.exceptions.InvalidGridDimensionsException;
import com.napkin.engine.formula.CellReferences;
import com.napkin.engine.formula.CellValueSource;
import com.napkin.engine.formula.FormulaEngine;
import com.napkin.engine.formula.NumberFormatting;
import com.napkin.engine.models.Cell;
import com.napkin.engine.models.CellCoordinate;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire grid:
 * - Has a unique ID
 * - A fixed rows x columns array of Cells, created once
 * - A recalculator that keeps display values consistent after every edit
 * - A read/write lock; "apply edit + recompute" runs under the write lock
 */
public class Grid implements CellValueSource {

    // Generates unique IDs for newly created grids
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final int rows;
    private final int columns;
    private final Cell[][] cells;
    private final GridRecalculator recalculator;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Grid(int rows, int columns) {
        this(rows, columns, new FormulaEngine());
    }

    public Grid(int rows, int columns, FormulaEngine formulaEngine) {
        if (rows <= 0 || columns <= 0) {
            throw new InvalidGridDimensionsException("Grid dimensions must be positive: " + rows + "x" + columns);
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.rows = rows;
        this.columns = columns;
        this.cells = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                cells[r][c] = new Cell(r, c);
            }
        }
        this.recalculator = new GridRecalculator(formulaEngine);
    }

    public long getId() {
        return id;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public boolean contains(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /**
     * Returns the cell at (row, column); throws if it lies outside the grid.
     */
    public Cell getCell(int row, int column) {
        if (!contains(row, column)) {
            throw new CellOutOfBoundsException("Cell (" + row + ", " + column + ") is outside the "
                    + rows + "x" + columns + " grid");
        }
        return cells[row][column];
    }

    public Cell getCell(String label) {
        CellCoordinate coordinate = CellReferences.decode(label);
        if (!contains(coordinate.getRow(), coordinate.getColumn())) {
            throw new CellOutOfBoundsException("Cell " + label + " is outside the " + rows + "x" + columns + " grid");
        }
        return cells[coordinate.getRow()][coordinate.getColumn()];
    }

    /**
     * Display value lookup used by formulas. Cells outside the grid read as empty.
     */
    @Override
    public String valueAt(int row, int column) {
        if (!contains(row, column)) {
            return "";
        }
        return cells[row][column].getDisplayValue();
    }

    /**
     * Stores new input for one cell, evaluates it right away and then
     * recomputes the whole grid, which has the final word.
     */
    public RecalculationResult applyEdit(int row, int column, String input) {
        lock.writeLock().lock();
        try {
            Cell cell = getCell(row, column);
            cell.setInput(normalizeInput(input));
            recalculator.evaluateCell(this, cell);
            return recalculator.recompute(this);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies several edits (a paste, for instance) followed by a single recompute.
     * Nothing is changed if any edit lies outside the grid.
     */
    public RecalculationResult applyEdits(List<CellEdit> edits) {
        lock.writeLock().lock();
        try {
            for (CellEdit edit : edits) {
                getCell(edit.getRow(), edit.getColumn());
            }
            for (CellEdit edit : edits) {
                cells[edit.getRow()][edit.getColumn()].setInput(normalizeInput(edit.getInput()));
            }
            return recalculator.recompute(this);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RecalculationResult recompute() {
        lock.writeLock().lock();
        try {
            return recalculator.recompute(this);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            for (Cell[] row : cells) {
                for (Cell cell : row) {
                    cell.clear();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<CellCoordinate, Set<CellCoordinate>> dependencyGraph() {
        lock.readLock().lock();
        try {
            return recalculator.dependencyGraph(this);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    /**
     * Formulas get their missing ')' appended; numeric literals are tidied
     * ("007" -> "7"); anything else is kept as typed.
     */
    static String normalizeInput(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        if (input.charAt(0) == Cell.FORMULA_MARKER) {
            return Cell.FORMULA_MARKER + FormulaEngine.balanceParentheses(input.substring(1));
        }
        return NumberFormatting.normalizeLiteral(input);
    }
}
