package com.napkin.engine.services;

import com.napkin.engine.formula.CellReferences;
import com.napkin.engine.formula.FormulaEngine;
import com.napkin.engine.models.CellCoordinate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Stateless formula evaluation against an ad-hoc set of cells.
 */
@Service
public class FormulaService {

    private final FormulaEngine formulaEngine = new FormulaEngine();

    /**
     * Evaluates a formula; one leading '=' is tolerated and stripped. Labels in {@code cells} are decoded first,
     * so a malformed label fails the request with INVALID_REFERENCE.
     */
    public String evaluate(String formula, Map<String, String> cells) {
        Map<CellCoordinate, String> values = new HashMap<>();
        if (cells != null) {
            for (Map.Entry<String, String> entry : cells.entrySet()) {
                values.put(CellReferences.decode(entry.getKey()), entry.getValue());
            }
        }
        String body = formula != null && formula.startsWith("=") ? formula.substring(1) : formula;
        return formulaEngine.evaluate(body, (row, column) -> values.get(new CellCoordinate(row, column)));
    }
}
