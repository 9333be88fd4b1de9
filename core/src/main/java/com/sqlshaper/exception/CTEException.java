package com.sqlshaper.exception;

/**
 * Base class for failures of the common table expression mutation API.
 *
 * <p>Every subclass carries the exact CTE name that caused the failure.
 */
public abstract class CTEException extends RuntimeException {

    private final String cteName;

    protected CTEException(String message, String cteName) {
        super(message);
        this.cteName = cteName;
    }

    /**
     * Returns the CTE name the failing operation was called with.
     *
     * @return the offending name, as passed by the caller
     */
    public String getCteName() {
        return cteName;
    }
}
