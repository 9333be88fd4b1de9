package com.sqlshaper.exception;

/**
 * Thrown when adding a CTE whose name is already defined in the WITH clause.
 */
public class DuplicateCTEException extends CTEException {

    public DuplicateCTEException(String cteName) {
        super("CTE '" + cteName + "' already exists", cteName);
    }
}
