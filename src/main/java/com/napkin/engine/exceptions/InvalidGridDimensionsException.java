package com.napkin.engine.exceptions;

/**
 * Thrown when a grid is requested with non-positive or too large dimensions.
 */
public class InvalidGridDimensionsException extends RuntimeException {
    public InvalidGridDimensionsException(String message) {
        super(message);
    }
}
