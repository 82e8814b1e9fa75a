package com.napkin.engine.controllers;

import com.napkin.engine.models.EvaluationRequest;
import com.napkin.engine.services.FormulaService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * Evaluates a single formula without touching any grid.
 */
@RestController
@RequestMapping("/formula")
public class FormulaController {

    @Autowired
    private FormulaService formulaService;

    /**
     * POST /formula/evaluate
     * Returns { "value": "..." }; a failing formula is turned into a 400 by the GlobalExceptionHandler.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<Map<String, String>> evaluate(@RequestBody EvaluationRequest request) {
        String value = formulaService.evaluate(request.getFormula(), request.getCells());
        return ResponseEntity.ok(Collections.singletonMap("value", value));
    }
}
