package com.sqlshaper.exception;

/**
 * Thrown when a CTE name is null, empty or whitespace-only.
 */
public class InvalidCTENameException extends CTEException {

    public InvalidCTENameException(String cteName) {
        super("CTE name cannot be empty or whitespace-only", cteName);
    }
}
