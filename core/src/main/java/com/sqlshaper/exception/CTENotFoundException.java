package com.sqlshaper.exception;

/**
 * Thrown when removing or replacing a CTE that is not defined.
 */
public class CTENotFoundException extends CTEException {

    public CTENotFoundException(String cteName) {
        super("CTE '" + cteName + "' not found", cteName);
    }
}
