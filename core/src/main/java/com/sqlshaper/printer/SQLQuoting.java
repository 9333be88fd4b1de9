package com.sqlshaper.printer;

import java.util.Objects;

/**
 * Quoting rules for identifiers, string literals and comments in formatted SQL.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("users", IdentifierEscape.BACKTICK);
 *   // Result: `users`
 *
 *   SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLRenderer
 */
public final class SQLQuoting {

    private SQLQuoting() {
        // Utility class
    }

    /**
     * Quotes an identifier with double quotes.
     *
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        return quoteIdentifier(identifier, IdentifierEscape.DOUBLE_QUOTE);
    }

    /**
     * Quotes an identifier with the given delimiters.
     *
     * <p>Occurrences of the closing delimiter inside the name are doubled. With
     * {@link IdentifierEscape#NONE} the name is returned unchanged.
     *
     * @param identifier the identifier to quote
     * @param escape the delimiters to use
     * @return the quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, IdentifierEscape escape) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        Objects.requireNonNull(escape, "escape must not be null");
        if (escape.isNone()) {
            return identifier;
        }
        String escaped = identifier.replace(escape.end(), escape.end() + escape.end());
        return escape.start() + escaped + escape.end();
    }

    /**
     * Quotes a string literal value, doubling single quotes.
     *
     * @return the quoted literal, or {@code null} (unquoted) for a null value
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "null";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Renders a comment body as a block comment.
     *
     * <p>A {@code *}{@code /} inside the body would end the comment early, so it is
     * broken up as {@code * /}.
     */
    public static String blockComment(String body) {
        String text = body == null ? "" : body.trim();
        return "/* " + text.replace("*/", "* /") + " */";
    }
}
