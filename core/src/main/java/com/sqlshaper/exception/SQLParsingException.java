package com.sqlshaper.exception;

/**
 * Exception thrown when SQL text does not match the supported grammar.
 *
 * <p>The parser aborts on the first error; no partial tree is ever returned.
 * The exception keeps the complete input and the offending offset so callers can
 * render their own diagnostics.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       SelectQuery query = SQLParser.parse(sql);
 *   } catch (SQLParsingException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 *
 * @see com.sqlshaper.parser.SQLParser
 */
public class SQLParsingException extends RuntimeException {

    private static final int EXCERPT_RADIUS = 20;

    private final String sql;
    private final int position;

    /**
     * Creates a parsing exception.
     *
     * @param message the error message
     * @param sql the SQL being parsed
     * @param position zero-based character offset of the offending lexeme
     */
    public SQLParsingException(String message, String sql, int position) {
        this(message, sql, position, null);
    }

    /**
     * Creates a parsing exception with a cause.
     *
     * @param message the error message
     * @param sql the SQL being parsed
     * @param position zero-based character offset of the offending lexeme
     * @param cause the underlying cause, may be null
     */
    public SQLParsingException(String message, String sql, int position, Throwable cause) {
        super(message, cause);
        this.sql = sql;
        this.position = position;
    }

    /**
     * Returns the SQL that failed to parse.
     *
     * @return the input SQL, or null if not available
     */
    public String getSql() {
        return sql;
    }

    /**
     * Returns the zero-based character offset of the failure.
     *
     * @return the position
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns a user-friendly message with an excerpt of the input around the failure.
     *
     * @return message plus a caret line pointing at the offending position
     */
    public String getUserMessage() {
        if (sql == null || sql.isEmpty()) {
            return getMessage();
        }
        int at = Math.max(0, Math.min(position, sql.length()));
        int from = Math.max(0, at - EXCERPT_RADIUS);
        int to = Math.min(sql.length(), at + EXCERPT_RADIUS);
        String excerpt = sql.substring(from, to).replace('\n', ' ').replace('\r', ' ');
        return getMessage() + " (position " + position + ")\n"
            + "  " + excerpt + "\n"
            + "  " + " ".repeat(at - from) + "^";
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Parsing Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Position: ").append(position).append("\n");
        if (sql != null) {
            sb.append("SQL: ").append(sql).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
