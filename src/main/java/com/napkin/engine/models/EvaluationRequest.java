package com.napkin.engine.models;

import java.util.HashMap;
import java.util.Map;

/**
 * Body of POST /formula/evaluate: a formula body plus the cell texts it may read,
 * keyed by label, e.g. { "formula": "SUM(A1:A2)", "cells": { "A1": "1", "A2": "2" } }.
 */
public class EvaluationRequest {
    private String formula;
    private Map<String, String> cells = new HashMap<>();

    public EvaluationRequest() {
    }

    public EvaluationRequest(String formula, Map<String, String> cells) {
        this.formula = formula;
        this.cells = cells;
    }

    public String getFormula() {
        return formula;
    }
    public Map<String, String> getCells() {
        return cells;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setCells(Map<String, String> cells) {
        this.cells = cells;
    }
}
