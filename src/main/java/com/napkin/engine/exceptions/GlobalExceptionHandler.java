package com.napkin.engine.exceptions;

import com.napkin.engine.formula.FormulaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches exceptions from the controllers or services and returns
 * error JSON with an HTTP 4xx code instead of 500 where the client is at fault.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FormulaException.class)
    public ResponseEntity<ErrorResponse> handleFormula(FormulaException ex) {
        return new ResponseEntity<>(ErrorResponse.of(ex), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CellOutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleOutOfBounds(CellOutOfBoundsException ex) {
        ErrorResponse error = new ErrorResponse("CELL_OUT_OF_BOUNDS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidGridDimensionsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDimensions(InvalidGridDimensionsException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_DIMENSIONS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(GridNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleGridNotFound(GridNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("GRID_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        ErrorResponse error = new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read");
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
