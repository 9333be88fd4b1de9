package com.sqlshaper.parser;

import com.sqlshaper.exception.SQLParsingException;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.query.SelectQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for parsing SQL text into a query tree.
 *
 * <p>Parsing is stateless: every call tokenizes and parses its own input, so the
 * methods are safe to call from any number of threads.
 *
 * <p>Usage:
 * <pre>
 *   SelectQuery query = SQLParser.parse("SELECT id FROM users WHERE active");
 *   ValueExpression condition = SQLParser.parseExpression("status = 'active'");
 * </pre>
 */
public final class SQLParser {

    private static final Logger logger = LoggerFactory.getLogger(SQLParser.class);

    private SQLParser() {
        // Utility class
    }

    /**
     * Parses one SELECT, VALUES or set-operation statement with the default limits.
     *
     * @param sql the SQL text; a single trailing semicolon is allowed
     * @return the query tree, owned by the caller
     * @throws SQLParsingException if the text is empty, not lexically valid, or not a supported query
     */
    public static SelectQuery parse(String sql) {
        return parse(sql, ParserConfig.defaults());
    }

    /**
     * Parses one statement with the given limits.
     *
     * <p>Comments in front of the statement become header comments of the returned query.
     * Comments that cannot be tied to a node are appended to the header comments, so none
     * are lost.
     *
     * @param sql the SQL text
     * @param config parser limits
     * @return the query tree
     * @throws SQLParsingException if parsing fails
     */
    public static SelectQuery parse(String sql, ParserConfig config) {
        requireText(sql);
        logger.debug("Parsing SQL: {}", sql);

        LexemeCursor cursor = LexemeCursor.open(sql, config);
        List<String> header = cursor.takeComments();
        SelectQuery query = new SelectQueryParser(cursor).parseQuery();
        cursor.matchPunctuation(";");
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected input after end of statement: '" + cursor.peek().raw() + "'");
        }
        header.forEach(query::addComment);
        cursor.drainComments().forEach(query::addComment);

        logger.debug("Parsed {} ({} header comments)", query.getClass().getSimpleName(), query.getComments().size());
        return query;
    }

    /**
     * Parses a standalone value expression, such as a WHERE predicate fragment.
     *
     * @param sql the expression text
     * @return the expression tree
     * @throws SQLParsingException if parsing fails or input remains after the expression
     */
    public static ValueExpression parseExpression(String sql) {
        return parseExpression(sql, ParserConfig.defaults());
    }

    public static ValueExpression parseExpression(String sql, ParserConfig config) {
        requireText(sql);
        logger.debug("Parsing expression: {}", sql);

        LexemeCursor cursor = LexemeCursor.open(sql, config);
        ValueExpression expression = new SelectQueryParser(cursor).valueParser().parseExpression();
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected input after end of expression: '" + cursor.peek().raw() + "'");
        }
        List<String> orphans = cursor.drainComments();
        orphans.forEach(expression::addComment);
        return expression;
    }

    /**
     * Checks whether SQL text parses, without surfacing the error.
     *
     * @param sql the SQL text
     * @return true if {@link #parse(String)} would succeed
     */
    public static boolean canParse(String sql) {
        try {
            parse(sql);
            return true;
        } catch (SQLParsingException e) {
            logger.debug("SQL does not parse: {}", e.getMessage());
            return false;
        }
    }

    private static void requireText(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SQLParsingException("SQL text must not be null or empty", sql, 0);
        }
    }
}
