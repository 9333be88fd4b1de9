package com.sqlshaper.exception;

/**
 * Exception thrown when SQL text cannot be split into lexemes.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Unterminated string literal or quoted identifier</li>
 *   <li>Unterminated block comment</li>
 *   <li>A character that starts no known lexeme</li>
 * </ul>
 *
 * @see com.sqlshaper.lexer.SQLLexer
 */
public class SQLLexException extends RuntimeException {

    private final int position;

    /**
     * Creates a lex exception.
     *
     * @param message the error message
     * @param position zero-based character offset of the offending input
     */
    public SQLLexException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * Returns the zero-based character offset where lexing failed.
     *
     * @return the position
     */
    public int getPosition() {
        return position;
    }
}
