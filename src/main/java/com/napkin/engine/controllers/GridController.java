package com.napkin.engine.controllers;

import com.napkin.engine.models.CellView;
import com.napkin.engine.models.GridDimensions;
import com.napkin.engine.services.GridService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing grids.
 * "/grid" is the base path; cells are addressed by label ("B12").
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private GridService gridService;

    /**
     * POST /grid
     * Optional JSON body { "rows": 20, "columns": 10 }.
     * Creates a new grid, returns its id.
     */
    @PostMapping
    public ResponseEntity<Long> createGrid(@RequestBody(required = false) GridDimensions dimensions) {
        GridDimensions requested = dimensions == null ? new GridDimensions() : dimensions;
        long gridId = gridService.createGrid(requested.getRows(), requested.getColumns());
        return ResponseEntity.ok(gridId);
    }

    /**
     * PUT /grid/{gridId}/cell/{label}
     * Body: raw input (literal, or a formula such as "=SUM(A1:A3)").
     * An empty body clears the cell. Returns the cell after recompute.
     */
    @PutMapping("/{gridId}/cell/{label}")
    public ResponseEntity<CellView> setCell(
            @PathVariable long gridId,
            @PathVariable String label,
            @RequestBody(required = false) String input
    ) {
        return ResponseEntity.ok(gridService.setCell(gridId, label, input == null ? "" : input));
    }

    /**
     * PUT /grid/{gridId}/cells
     * Body: { "A1": "10", "B1": "=A1*2" }, applied together with one recompute.
     */
    @PutMapping("/{gridId}/cells")
    public ResponseEntity<Map<String, CellView>> setCells(
            @PathVariable long gridId,
            @RequestBody Map<String, String> inputs
    ) {
        return ResponseEntity.ok(gridService.setCells(gridId, inputs));
    }

    /**
     * GET /grid/{gridId}
     * Returns every non-empty cell: { "A1": { "label", "input", "value", "error" }, ... }.
     */
    @GetMapping("/{gridId}")
    public ResponseEntity<Map<String, CellView>> getGrid(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getGridData(gridId));
    }

    @GetMapping("/{gridId}/cell/{label}")
    public ResponseEntity<CellView> getCell(@PathVariable long gridId, @PathVariable String label) {
        return ResponseEntity.ok(gridService.getCell(gridId, label));
    }

    /**
     * GET /grid/{gridId}/dependencies
     * For each formula cell, the cells its text references.
     */
    @GetMapping("/{gridId}/dependencies")
    public ResponseEntity<Map<String, List<String>>> getDependencies(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getDependencies(gridId));
    }

    /**
     * GET /grid/{gridId}/csv
     * Display values as CSV.
     */
    @GetMapping(value = "/{gridId}/csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@PathVariable long gridId) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(gridService.exportCsv(gridId));
    }

    @DeleteMapping("/{gridId}/cells")
    public ResponseEntity<Void> clearGrid(@PathVariable long gridId) {
        gridService.clearGrid(gridId);
        return ResponseEntity.noContent().build();
    }
}
