package com.napkin.engine.exceptions;

/**
 * Thrown when an edit or lookup addresses a cell outside the grid's
 * fixed dimensions, e.g. "K1" on a grid with 10 columns.
 */
public class CellOutOfBoundsException extends RuntimeException {
    public CellOutOfBoundsException(String message) {
        super(message);
    }
}
