package com.napkin.engine.exceptions;

import com.napkin.engine.formula.FormulaException;

/**
 * JSON body of every failed request. {@code code} is stable and machine-readable
 * (a {@link com.napkin.engine.formula.FormulaErrorType} name for formula failures,
 * otherwise one of the handler's own codes); {@code message} is for people.
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorResponse of(FormulaException ex) {
        return new ErrorResponse(ex.getType().name(), ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
