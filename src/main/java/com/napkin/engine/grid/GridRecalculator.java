package com.napkin.engine.grid;

import com.napkin.engine.formula.CellReferences;
import com.napkin.engine.formula.DependencyExtractor;
import com.napkin.engine.formula.FormulaEngine;
import com.napkin.engine.formula.FormulaException;
import com.napkin.engine.models.Cell;
import com.napkin.engine.models.CellCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Full-grid recompute: rebuilds the dependency graph of all formula cells,
 * orders them with Kahn's algorithm and evaluates them dependencies-first.
 * Formula cells the ordering never reaches are on a cycle, or depend on one,
 * and are marked as errors without being evaluated.
 */
public class GridRecalculator {

    private static final Logger logger = LoggerFactory.getLogger(GridRecalculator.class);

    private final FormulaEngine formulaEngine;

    public GridRecalculator(FormulaEngine formulaEngine) {
        this.formulaEngine = formulaEngine;
    }

    /**
     * Forward adjacency: formula cell -> in-bounds cells its text mentions.
     * Keys are in row-major order.
     */
    public Map<CellCoordinate, Set<CellCoordinate>> dependencyGraph(Grid grid) {
        Map<CellCoordinate, Set<CellCoordinate>> graph = new LinkedHashMap<>();
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getColumns(); c++) {
                Cell cell = grid.getCell(r, c);
                if (!cell.isFormula()) {
                    continue;
                }
                Set<CellCoordinate> references = new LinkedHashSet<>();
                for (CellCoordinate ref : DependencyExtractor.dependencies(cell.getFormulaBody())) {
                    if (grid.contains(ref.getRow(), ref.getColumn())) {
                        references.add(ref);
                    }
                }
                graph.put(cell.getCoordinate(), references);
            }
        }
        return graph;
    }

    /**
     * The dependency graph plus, for every range a formula names, every formula cell
     * inside it (clipped to the grid). A range that encloses its own cell
     * makes that cell depend on itself.
     */
    Map<CellCoordinate, Set<CellCoordinate>> orderingGraph(Grid grid) {
        Map<CellCoordinate, Set<CellCoordinate>> graph = dependencyGraph(grid);
        for (Map.Entry<CellCoordinate, Set<CellCoordinate>> entry : graph.entrySet()) {
            CellCoordinate owner = entry.getKey();
            String body = grid.getCell(owner.getRow(), owner.getColumn()).getFormulaBody();
            for (CellCoordinate[] range : DependencyExtractor.ranges(body)) {
                int firstRow = Math.min(range[0].getRow(), range[1].getRow());
                int lastRow = Math.min(Math.max(range[0].getRow(), range[1].getRow()), grid.getRows() - 1);
                int firstColumn = Math.min(range[0].getColumn(), range[1].getColumn());
                int lastColumn = Math.min(Math.max(range[0].getColumn(), range[1].getColumn()), grid.getColumns() - 1);
                for (int r = firstRow; r <= lastRow; r++) {
                    for (int c = firstColumn; c <= lastColumn; c++) {
                        if (grid.getCell(r, c).isFormula()) {
                            entry.getValue().add(new CellCoordinate(r, c));
                        }
                    }
                }
            }
        }
        return graph;
    }

    public RecalculationResult recompute(Grid grid) {
        Map<CellCoordinate, Set<CellCoordinate>> graph = orderingGraph(grid);

        // Only edges between formula cells take part; plain cells are constants
        Map<CellCoordinate, Integer> inDegree = new HashMap<>();
        Map<CellCoordinate, List<CellCoordinate>> dependents = new HashMap<>();
        for (Map.Entry<CellCoordinate, Set<CellCoordinate>> entry : graph.entrySet()) {
            int degree = 0;
            for (CellCoordinate dependency : entry.getValue()) {
                if (graph.containsKey(dependency)) {
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
                    degree++;
                }
            }
            inDegree.put(entry.getKey(), degree);
        }

        Queue<CellCoordinate> queue = new ArrayDeque<>();
        for (CellCoordinate cell : graph.keySet()) {
            if (inDegree.get(cell) == 0) {
                queue.add(cell);
            }
        }

        List<CellCoordinate> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            CellCoordinate current = queue.poll();
            order.add(current);
            for (CellCoordinate dependent : dependents.getOrDefault(current, Collections.emptyList())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        // Plain cells first so formulas read their current text
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getColumns(); c++) {
                Cell cell = grid.getCell(r, c);
                if (!cell.isFormula()) {
                    cell.setValue(cell.getInput());
                }
            }
        }

        Set<CellCoordinate> reached = new HashSet<>(order);
        List<CellCoordinate> cyclic = new ArrayList<>();
        for (CellCoordinate cell : graph.keySet()) {
            if (!reached.contains(cell)) {
                cyclic.add(cell);
                grid.getCell(cell.getRow(), cell.getColumn()).markError();
            }
        }
        if (!cyclic.isEmpty()) {
            logger.warn("Grid {}: {} cell(s) on or behind a circular reference", grid.getId(), cyclic.size());
        }

        for (CellCoordinate coordinate : order) {
            evaluateCell(grid, grid.getCell(coordinate.getRow(), coordinate.getColumn()));
        }

        logger.debug("Grid {} recomputed: {} formula cell(s), {} cyclic", grid.getId(), graph.size(), cyclic.size());
        return new RecalculationResult(graph.size(), order, cyclic);
    }

    /**
     * Evaluates a single cell against the grid's current display values.
     * Used for the fast path right after an edit; neighbours may still be stale.
     */
    public void evaluateCell(Grid grid, Cell cell) {
        if (cell.isEmpty()) {
            cell.setValue("");
            return;
        }
        if (!cell.isFormula()) {
            cell.setValue(cell.getInput());
            return;
        }
        try {
            cell.setValue(formulaEngine.evaluate(cell.getFormulaBody(), grid));
        } catch (FormulaException e) {
            logger.debug("Cell {} failed with {}: {}", CellReferences.encode(cell.getCoordinate()), e.getType(), e.getMessage());
            cell.markError();
        }
    }
}
