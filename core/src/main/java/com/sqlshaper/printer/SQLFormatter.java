package com.sqlshaper.printer;

import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.query.SelectQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Formats query trees as SQL text.
 *
 * <p>Formatting runs in two stages: {@link PrintTokenBuilder} turns the tree into a
 * style-free token tree, then {@link SQLRenderer} lays the tokens out under a
 * {@link FormatStyle}. Formatting never modifies the query, and the same query and
 * style always produce the same text.
 *
 * <p>Example usage:
 * <pre>
 *   SelectQuery query = SQLParser.parse("SELECT id FROM users WHERE id = :id");
 *   FormatResult result = new SQLFormatter(FormatStyle.preset("postgres")).format(query);
 *   // result.sql(): select "id" from "users" where "id" = $1
 * </pre>
 */
public final class SQLFormatter {

    private static final Logger logger = LoggerFactory.getLogger(SQLFormatter.class);

    private final SQLRenderer renderer;

    /**
     * Creates a formatter with {@link FormatStyle#defaults()}.
     */
    public SQLFormatter() {
        this(FormatStyle.defaults());
    }

    public SQLFormatter(FormatStyle style) {
        this.renderer = new SQLRenderer(Objects.requireNonNull(style, "style must not be null"));
    }

    public FormatStyle style() {
        return renderer.style();
    }

    /**
     * Formats a query.
     *
     * @param query the query to format
     * @return the SQL text with the values of its parameters
     */
    public FormatResult format(SelectQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        FormatResult result = renderer.render(PrintTokenBuilder.build(query));
        logger.debug("Formatted {} into {} characters with {} parameter(s)",
            query.getClass().getSimpleName(), result.sql().length(), result.params().size());
        return result;
    }

    /**
     * Formats a standalone expression, such as a WHERE condition.
     */
    public FormatResult format(ValueExpression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return renderer.render(PrintTokenBuilder.build(expression));
    }

    /**
     * Formats a query with a given style.
     */
    public static FormatResult format(SelectQuery query, FormatStyle style) {
        return new SQLFormatter(style).format(query);
    }

    /**
     * Formats a query with the default style and returns the text only.
     */
    public static String toSql(SelectQuery query) {
        return new SQLFormatter().format(query).sql();
    }
}
