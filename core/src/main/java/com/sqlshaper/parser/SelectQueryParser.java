package com.sqlshaper.parser;

import com.sqlshaper.exception.CTEException;
import com.sqlshaper.exception.SQLParsingException;
import com.sqlshaper.expression.FunctionCall;
import com.sqlshaper.expression.TupleExpression;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.lexer.LexemeKind;
import com.sqlshaper.model.CommentPosition;
import com.sqlshaper.query.BinarySelectQuery;
import com.sqlshaper.query.CommonTable;
import com.sqlshaper.query.FromClause;
import com.sqlshaper.query.FunctionSource;
import com.sqlshaper.query.JoinClause;
import com.sqlshaper.query.JoinClause.JoinType;
import com.sqlshaper.query.SelectItem;
import com.sqlshaper.query.SelectQuery;
import com.sqlshaper.query.SetOperator;
import com.sqlshaper.query.SimpleSelectQuery;
import com.sqlshaper.query.Source;
import com.sqlshaper.query.SourceExpression;
import com.sqlshaper.query.SubQuerySource;
import com.sqlshaper.query.TableSource;
import com.sqlshaper.query.ValuesQuery;
import com.sqlshaper.query.WithClause;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for SELECT, VALUES, WITH and set-operation queries.
 *
 * <p>Every value position is delegated to {@link ValueParser}; CTE bodies, derived tables
 * and subqueries re-enter {@link #parseQuery()}.
 */
final class SelectQueryParser {

    private final LexemeCursor cursor;
    private final ValueParser values;

    SelectQueryParser(LexemeCursor cursor) {
        this.cursor = cursor;
        this.values = new ValueParser(cursor, this);
    }

    ValueParser valueParser() {
        return values;
    }

    /**
     * True when the current lexeme starts a query.
     */
    boolean startsQuery() {
        return cursor.isKeyword("select") || cursor.isKeyword("with") || cursor.isKeyword("values");
    }

    /**
     * Parses a query with its optional WITH clause and any chain of set operations.
     *
     * <p>INTERSECT binds tighter than UNION and EXCEPT; operators of the same strength
     * associate to the left. A WITH clause in front of a set operation is attached to the
     * leftmost SELECT, which prints it back in the same place.
     */
    SelectQuery parseQuery() {
        cursor.enter();
        try {
            List<String> leading = cursor.takeComments();
            int withPosition = cursor.currentPosition();
            WithClause with = cursor.isKeyword("with") ? parseWithClause() : null;

            SelectQuery query = parseIntersectChain();
            while (cursor.isKeyword("union") || cursor.isKeyword("except")) {
                SetOperator operator = parseSetOperator();
                List<String> comments = cursor.takeComments();
                SelectQuery right = parseIntersectChain();
                right.addPositionedComments(CommentPosition.BEFORE, comments);
                query = new BinarySelectQuery(query, operator, right);
            }

            if (with != null) {
                SelectQuery leftmost = query;
                while (leftmost instanceof BinarySelectQuery binary) {
                    leftmost = binary.getLeft();
                }
                if (!(leftmost instanceof SimpleSelectQuery simple) || simple.getWithClause() != null) {
                    throw new SQLParsingException(
                        "WITH clause must be followed by a SELECT", cursor.sql(), withPosition);
                }
                simple.setWithClause(with);
            }
            query.addPositionedComments(CommentPosition.BEFORE, leading);
            return query;
        } finally {
            cursor.exit();
        }
    }

    private SelectQuery parseSetOperand() {
        if (cursor.isKeyword("select")) {
            return parseSimpleSelect();
        }
        if (cursor.isKeyword("values")) {
            return parseValues();
        }
        if (cursor.matchPunctuation("(")) {
            SelectQuery inner = parseQuery();
            cursor.expectPunctuation(")");
            return inner;
        }
        throw cursor.unexpected("SELECT, VALUES or '('");
    }

    /**
     * Parses operands joined by INTERSECT, which binds tighter than UNION and EXCEPT.
     */
    private SelectQuery parseIntersectChain() {
        SelectQuery query = parseSetOperand();
        while (cursor.isKeyword("intersect")) {
            SetOperator operator = parseSetOperator();
            List<String> comments = cursor.takeComments();
            SelectQuery right = parseSetOperand();
            right.addPositionedComments(CommentPosition.BEFORE, comments);
            query = new BinarySelectQuery(query, operator, right);
        }
        return query;
    }

    private SetOperator parseSetOperator() {
        String base = cursor.next().text();
        boolean all = cursor.matchKeyword("all");
        if (!all) {
            cursor.matchKeyword("distinct");
        }
        return SetOperator.of(base, all);
    }

    // ---------------------------------------------------------------------
    // WITH
    // ---------------------------------------------------------------------

    private WithClause parseWithClause() {
        cursor.expectKeyword("with");
        WithClause with = new WithClause(cursor.matchWord("recursive"));
        do {
            int position = cursor.currentPosition();
            CommonTable table = parseCommonTable();
            try {
                with.add(table);
            } catch (CTEException e) {
                throw new SQLParsingException(
                    e.getMessage(), cursor.sql(), position, e);
            }
        } while (cursor.matchPunctuation(","));
        return with;
    }

    private CommonTable parseCommonTable() {
        List<String> comments = cursor.takeComments();
        int position = cursor.currentPosition();
        String name = cursor.expectIdentifier("a CTE name");
        List<String> columns = cursor.isPunctuation("(") ? parseNameList() : null;
        cursor.expectKeyword("as");

        Boolean materialized = null;
        if (cursor.matchKeyword("not")) {
            cursor.expectWord("materialized");
            materialized = Boolean.FALSE;
        } else if (cursor.matchWord("materialized")) {
            materialized = Boolean.TRUE;
        }

        cursor.expectPunctuation("(");
        SelectQuery body = parseQuery();
        cursor.expectPunctuation(")");

        CommonTable table;
        try {
            table = new CommonTable(name, columns, body, materialized);
        } catch (CTEException e) {
            throw new SQLParsingException(e.getMessage(), cursor.sql(), position, e);
        }
        table.addPositionedComments(CommentPosition.BEFORE, comments);
        return table;
    }

    // ---------------------------------------------------------------------
    // SELECT
    // ---------------------------------------------------------------------

    private SimpleSelectQuery parseSimpleSelect() {
        List<String> comments = cursor.takeComments();
        cursor.expectKeyword("select");
        SimpleSelectQuery query = new SimpleSelectQuery();
        query.addPositionedComments(CommentPosition.BEFORE, comments);

        if (cursor.matchKeyword("distinct")) {
            if (cursor.matchKeyword("on")) {
                cursor.expectPunctuation("(");
                query.setDistinctOn(values.parseExpressionList());
                cursor.expectPunctuation(")");
            } else {
                query.setDistinct(true);
            }
        } else {
            cursor.matchKeyword("all");
        }

        List<SelectItem> items = new ArrayList<>();
        do {
            items.add(parseSelectItem());
        } while (cursor.matchPunctuation(","));
        query.setSelectItems(items);

        if (cursor.matchKeyword("from")) {
            query.setFrom(parseFromClause());
        }
        if (cursor.matchKeyword("where")) {
            query.setWhere(values.parseExpression());
        }
        if (cursor.matchKeyword("group")) {
            cursor.expectKeyword("by");
            query.setGroupBy(values.parseExpressionList());
        }
        if (cursor.matchKeyword("having")) {
            query.setHaving(values.parseExpression());
        }
        if (cursor.matchKeyword("order")) {
            cursor.expectKeyword("by");
            query.setOrderBy(values.parseOrderByList());
        }
        parseLimitOffset(query);
        return query;
    }

    private void parseLimitOffset(SimpleSelectQuery query) {
        while (true) {
            if (query.getLimit() == null && cursor.matchKeyword("limit")) {
                query.setLimit(values.parseExpression());
            } else if (query.getOffset() == null && cursor.matchKeyword("offset")) {
                query.setOffset(values.parseExpression());
                if (!cursor.matchWord("rows")) {
                    cursor.matchWord("row");
                }
            } else {
                return;
            }
        }
    }

    private SelectItem parseSelectItem() {
        ValueExpression value = values.parseExpression();
        String alias = parseOptionalAlias();
        return new SelectItem(value, alias);
    }

    /**
     * Reads {@code AS name} or a bare identifier alias; returns null if neither follows.
     */
    private String parseOptionalAlias() {
        if (cursor.matchKeyword("as")) {
            return cursor.expectIdentifier("an alias");
        }
        if (cursor.isKind(LexemeKind.IDENTIFIER)) {
            return cursor.next().text();
        }
        return null;
    }

    private List<String> parseNameList() {
        cursor.expectPunctuation("(");
        List<String> names = new ArrayList<>();
        do {
            names.add(cursor.expectIdentifier("a column name"));
        } while (cursor.matchPunctuation(","));
        cursor.expectPunctuation(")");
        return names;
    }

    // ---------------------------------------------------------------------
    // FROM
    // ---------------------------------------------------------------------

    private FromClause parseFromClause() {
        FromClause from = new FromClause(parseSourceExpression());
        while (true) {
            if (cursor.matchPunctuation(",")) {
                boolean lateral = cursor.matchKeyword("lateral");
                from.addJoin(new JoinClause(JoinType.COMMA, false, lateral, parseSourceExpression(), null, null));
                continue;
            }
            boolean natural = cursor.matchKeyword("natural");
            JoinType type = parseJoinType();
            if (type == null) {
                if (natural) {
                    throw cursor.unexpected("'JOIN'");
                }
                return from;
            }
            from.addJoin(parseJoin(type, natural));
        }
    }

    /**
     * Consumes a join keyword sequence, or returns null without consuming if none follows.
     */
    private JoinType parseJoinType() {
        if (cursor.matchKeyword("join")) {
            return JoinType.JOIN;
        }
        if (cursor.matchKeyword("inner")) {
            cursor.expectKeyword("join");
            return JoinType.INNER_JOIN;
        }
        if (cursor.matchKeyword("cross")) {
            cursor.expectKeyword("join");
            return JoinType.CROSS_JOIN;
        }
        JoinType plain;
        JoinType outer;
        if (cursor.matchKeyword("left")) {
            plain = JoinType.LEFT_JOIN;
            outer = JoinType.LEFT_OUTER_JOIN;
        } else if (cursor.matchKeyword("right")) {
            plain = JoinType.RIGHT_JOIN;
            outer = JoinType.RIGHT_OUTER_JOIN;
        } else if (cursor.matchKeyword("full")) {
            plain = JoinType.FULL_JOIN;
            outer = JoinType.FULL_OUTER_JOIN;
        } else {
            return null;
        }
        boolean isOuter = cursor.matchKeyword("outer");
        cursor.expectKeyword("join");
        return isOuter ? outer : plain;
    }

    private JoinClause parseJoin(JoinType type, boolean natural) {
        boolean lateral = cursor.matchKeyword("lateral");
        SourceExpression source = parseSourceExpression();
        ValueExpression condition = null;
        List<String> using = null;
        if (type.acceptsCondition() && !natural) {
            if (cursor.matchKeyword("on")) {
                condition = values.parseExpression();
            } else if (cursor.matchKeyword("using")) {
                using = parseNameList();
            } else {
                throw cursor.unexpected("'ON' or 'USING'");
            }
        }
        return new JoinClause(type, natural, lateral, source, condition, using);
    }

    private SourceExpression parseSourceExpression() {
        List<String> comments = cursor.takeComments();
        Source source;
        if (cursor.matchPunctuation("(")) {
            if (!startsQuery()) {
                throw cursor.unexpected("a subquery");
            }
            source = new SubQuerySource(parseQuery());
            cursor.expectPunctuation(")");
        } else {
            List<String> parts = new ArrayList<>();
            parts.add(cursor.expectIdentifier("a table name, subquery or table function"));
            while (cursor.matchPunctuation(".")) {
                parts.add(cursor.expectIdentifier("a table name"));
            }
            if (cursor.isPunctuation("(")) {
                FunctionCall call = values.parseFunctionCall(String.join(".", parts));
                source = new FunctionSource(call);
            } else {
                String table = parts.remove(parts.size() - 1);
                source = new TableSource(parts, table);
            }
        }

        String alias = parseOptionalAlias();
        List<String> columnAliases = null;
        if (alias != null && cursor.isPunctuation("(")) {
            columnAliases = parseNameList();
        }
        SourceExpression expression = new SourceExpression(source, alias, columnAliases);
        expression.addPositionedComments(CommentPosition.BEFORE, comments);
        return expression;
    }

    // ---------------------------------------------------------------------
    // VALUES
    // ---------------------------------------------------------------------

    private ValuesQuery parseValues() {
        List<String> comments = cursor.takeComments();
        cursor.expectKeyword("values");
        List<TupleExpression> rows = new ArrayList<>();
        do {
            cursor.expectPunctuation("(");
            rows.add(new TupleExpression(values.parseExpressionList()));
            cursor.expectPunctuation(")");
        } while (cursor.matchPunctuation(","));
        ValuesQuery query = new ValuesQuery(rows);
        query.addPositionedComments(CommentPosition.BEFORE, comments);
        return query;
    }
}
