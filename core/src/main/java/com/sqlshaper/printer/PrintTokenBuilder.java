package com.sqlshaper.printer;

import com.sqlshaper.expression.BetweenExpression;
import com.sqlshaper.expression.BinaryExpression;
import com.sqlshaper.expression.CaseExpression;
import com.sqlshaper.expression.CastExpression;
import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.FunctionCall;
import com.sqlshaper.expression.LiteralValue;
import com.sqlshaper.expression.ParameterExpression;
import com.sqlshaper.expression.ParenExpression;
import com.sqlshaper.expression.SubqueryExpression;
import com.sqlshaper.expression.TupleExpression;
import com.sqlshaper.expression.UnaryExpression;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.expression.WindowFrame;
import com.sqlshaper.expression.WindowSpec;
import com.sqlshaper.model.CommentPosition;
import com.sqlshaper.model.SqlNode;
import com.sqlshaper.query.BinarySelectQuery;
import com.sqlshaper.query.CommonTable;
import com.sqlshaper.query.FromClause;
import com.sqlshaper.query.FunctionSource;
import com.sqlshaper.query.JoinClause;
import com.sqlshaper.query.OrderByItem;
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
import java.util.Locale;

/**
 * Converts a query tree into a {@link SqlPrintToken} tree.
 *
 * <p>The conversion knows nothing about output style. Keywords are emitted in lower
 * case, spaces are emitted as if the output were a single line, and containers are
 * tagged so that {@link SQLRenderer} can lay them out.
 *
 * <p>Parentheses the tree does not carry are added only where printing without them
 * would re-parse differently: an operand binding weaker than its operator, a set
 * operation's left branch ending in ORDER BY or LIMIT or binding weaker than INTERSECT,
 * and a right branch that is itself a set operation.
 */
public final class PrintTokenBuilder {

    /** Binding strength of operands that never need parentheses. */
    private static final int ATOMIC = 100;

    private PrintTokenBuilder() {
        // Utility class
    }

    /**
     * Builds the token tree of a query, header comments included.
     */
    public static SqlPrintToken build(SelectQuery query) {
        return new PrintTokenBuilder().query(query);
    }

    /**
     * Builds the token tree of a standalone expression.
     */
    public static SqlPrintToken build(ValueExpression expression) {
        return new PrintTokenBuilder().value(expression);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    private SqlPrintToken query(SelectQuery query) {
        SqlPrintToken body;
        if (query instanceof SimpleSelectQuery simple) {
            body = simpleQuery(simple);
        } else if (query instanceof BinarySelectQuery binary) {
            body = binaryQuery(binary);
        } else if (query instanceof ValuesQuery values) {
            body = valuesQuery(values);
        } else {
            throw new UnsupportedOperationException(
                "Printing not implemented for query: " + query.getClass().getSimpleName());
        }
        return withComments(query, body);
    }

    private SqlPrintToken simpleQuery(SimpleSelectQuery query) {
        SqlPrintToken root = SqlPrintToken.container(ContainerTag.SELECT_QUERY);
        if (query.getWithClause() != null) {
            root.add(withClause(query.getWithClause()));
        }

        root.add(SqlPrintToken.keyword("select"));
        if (!query.getDistinctOn().isEmpty()) {
            root.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("distinct on")).add(SqlPrintToken.space());
            root.add(parenthesizedList(query.getDistinctOn()));
        } else if (query.isDistinct()) {
            root.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("distinct"));
        }
        SqlPrintToken items = SqlPrintToken.container(ContainerTag.SELECT_CLAUSE);
        List<SelectItem> selectItems = query.getSelectItems();
        for (int i = 0; i < selectItems.size(); i++) {
            if (i > 0) {
                items.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
            }
            items.add(selectItem(selectItems.get(i)));
        }
        root.add(SqlPrintToken.space()).add(items);

        if (query.getFrom() != null) {
            clause(root, "from", ContainerTag.FROM_CLAUSE).add(fromClause(query.getFrom()));
        }
        if (query.getWhere() != null) {
            clause(root, "where", ContainerTag.WHERE_CLAUSE).add(value(query.getWhere()));
        }
        if (!query.getGroupBy().isEmpty()) {
            SqlPrintToken groupBy = clause(root, "group by", ContainerTag.GROUP_BY_CLAUSE);
            addCommaSeparated(groupBy, query.getGroupBy());
        }
        if (query.getHaving() != null) {
            clause(root, "having", ContainerTag.HAVING_CLAUSE).add(value(query.getHaving()));
        }
        if (query.hasOrderBy()) {
            SqlPrintToken orderBy = clause(root, "order by", ContainerTag.ORDER_BY_CLAUSE);
            List<OrderByItem> orderItems = query.getOrderBy();
            for (int i = 0; i < orderItems.size(); i++) {
                if (i > 0) {
                    orderBy.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
                }
                orderBy.add(orderByItem(orderItems.get(i)));
            }
        }
        if (query.getLimit() != null) {
            root.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("limit"))
                .add(SqlPrintToken.space()).add(value(query.getLimit()));
        }
        if (query.getOffset() != null) {
            root.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("offset"))
                .add(SqlPrintToken.space()).add(value(query.getOffset()));
        }
        return root;
    }

    /**
     * Appends {@code keyword body} to {@code root} and returns the empty body container.
     */
    private static SqlPrintToken clause(SqlPrintToken root, String keyword, ContainerTag tag) {
        SqlPrintToken body = SqlPrintToken.container(tag);
        root.add(SqlPrintToken.space()).add(SqlPrintToken.keyword(keyword)).add(SqlPrintToken.space()).add(body);
        return body;
    }

    private SqlPrintToken binaryQuery(BinarySelectQuery query) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.SET_OPERATION);
        SelectQuery left = query.getLeft();
        SelectQuery right = query.getRight();
        boolean parenthesizeLeft = endsWithOrderOrLimit(left)
            || (left instanceof BinarySelectQuery inner && bindsWeaker(inner.getOperator(), query.getOperator()));
        token.add(parenthesizeLeft ? parenthesizedQuery(left, ContainerTag.SUBQUERY) : query(left));
        token.add(SqlPrintToken.lineBreak());
        token.add(SqlPrintToken.keyword(query.getOperator().keyword()));
        token.add(SqlPrintToken.lineBreak());
        token.add(right instanceof BinarySelectQuery ? parenthesizedQuery(right, ContainerTag.SUBQUERY) : query(right));
        return token;
    }

    private static boolean bindsWeaker(SetOperator inner, SetOperator outer) {
        return !isIntersect(inner) && isIntersect(outer);
    }

    private static boolean isIntersect(SetOperator operator) {
        return operator == SetOperator.INTERSECT || operator == SetOperator.INTERSECT_ALL;
    }

    private static boolean endsWithOrderOrLimit(SelectQuery query) {
        if (query instanceof SimpleSelectQuery simple) {
            return simple.hasOrderBy() || simple.getLimit() != null || simple.getOffset() != null;
        }
        if (query instanceof BinarySelectQuery binary) {
            return endsWithOrderOrLimit(binary.getRight());
        }
        return false;
    }

    private SqlPrintToken valuesQuery(ValuesQuery query) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(SqlPrintToken.keyword("values")).add(SqlPrintToken.space());
        SqlPrintToken rows = SqlPrintToken.container(ContainerTag.VALUES_LIST);
        List<TupleExpression> tuples = query.getTuples();
        for (int i = 0; i < tuples.size(); i++) {
            if (i > 0) {
                rows.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
            }
            rows.add(value(tuples.get(i)));
        }
        return token.add(rows);
    }

    private SqlPrintToken parenthesizedQuery(SelectQuery query, ContainerTag tag) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(SqlPrintToken.parenthesis("("));
        token.add(SqlPrintToken.container(tag).add(query(query)));
        token.add(SqlPrintToken.parenthesis(")"));
        return token;
    }

    private SqlPrintToken withClause(WithClause with) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.WITH_CLAUSE);
        token.add(SqlPrintToken.keyword(with.isRecursive() ? "with recursive" : "with")).add(SqlPrintToken.space());
        SqlPrintToken body = SqlPrintToken.container(ContainerTag.WITH_CLAUSE_BODY);
        List<CommonTable> tables = with.tables();
        for (int i = 0; i < tables.size(); i++) {
            if (i > 0) {
                body.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
            }
            body.add(commonTable(tables.get(i)));
        }
        token.add(body);
        token.add(SqlPrintToken.lineBreak());
        return withComments(with, token);
    }

    private SqlPrintToken commonTable(CommonTable table) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.COMMON_TABLE);
        token.add(SqlPrintToken.identifier(table.name()));
        if (!table.columnAliases().isEmpty()) {
            token.add(nameList(table.columnAliases()));
        }
        token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("as")).add(SqlPrintToken.space());
        if (table.materialized() != null) {
            token.add(SqlPrintToken.keyword(table.materialized() ? "materialized" : "not materialized"))
                .add(SqlPrintToken.space());
        }
        token.add(parenthesizedQuery(table.query(), ContainerTag.SUBQUERY));
        return withComments(table, token);
    }

    private SqlPrintToken selectItem(SelectItem item) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(value(item.value()));
        if (item.alias() != null) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("as"))
                .add(SqlPrintToken.space()).add(SqlPrintToken.identifier(item.alias()));
        }
        return withComments(item, token);
    }

    private SqlPrintToken orderByItem(OrderByItem item) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(value(item.value()));
        if (item.direction() != null) {
            token.add(SqlPrintToken.space())
                .add(SqlPrintToken.keyword(item.direction().name().toLowerCase(Locale.ROOT)));
        }
        if (item.nulls() != null) {
            token.add(SqlPrintToken.space())
                .add(SqlPrintToken.keyword("nulls " + item.nulls().name().toLowerCase(Locale.ROOT)));
        }
        return token;
    }

    // ---------------------------------------------------------------------
    // FROM
    // ---------------------------------------------------------------------

    private SqlPrintToken fromClause(FromClause from) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(sourceExpression(from.source()));
        for (JoinClause join : from.joins()) {
            if (join.type() == JoinClause.JoinType.COMMA) {
                token.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
                if (join.isLateral()) {
                    token.add(SqlPrintToken.keyword("lateral")).add(SqlPrintToken.space());
                }
                token.add(sourceExpression(join.source()));
            } else {
                token.add(SqlPrintToken.lineBreak()).add(joinClause(join));
            }
        }
        return withComments(from, token);
    }

    private SqlPrintToken joinClause(JoinClause join) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.JOIN_CLAUSE);
        if (join.isNatural()) {
            token.add(SqlPrintToken.keyword("natural")).add(SqlPrintToken.space());
        }
        token.add(SqlPrintToken.keyword(join.type().keyword())).add(SqlPrintToken.space());
        if (join.isLateral()) {
            token.add(SqlPrintToken.keyword("lateral")).add(SqlPrintToken.space());
        }
        token.add(sourceExpression(join.source()));
        if (join.condition() != null) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("on")).add(SqlPrintToken.space());
            token.add(SqlPrintToken.container(ContainerTag.JOIN_CONDITION).add(value(join.condition())));
        } else if (!join.usingColumns().isEmpty()) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("using")).add(SqlPrintToken.space());
            token.add(nameList(join.usingColumns()));
        }
        return withComments(join, token);
    }

    private SqlPrintToken sourceExpression(SourceExpression expression) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(source(expression.source()));
        if (expression.alias() != null) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("as"))
                .add(SqlPrintToken.space()).add(SqlPrintToken.identifier(expression.alias()));
            if (!expression.columnAliases().isEmpty()) {
                token.add(nameList(expression.columnAliases()));
            }
        }
        return withComments(expression, token);
    }

    private SqlPrintToken source(Source source) {
        if (source instanceof TableSource table) {
            return qualifiedName(table.namespaces(), SqlPrintToken.identifier(table.table()));
        }
        if (source instanceof SubQuerySource subquery) {
            return parenthesizedQuery(subquery.query(), ContainerTag.SUBQUERY);
        }
        if (source instanceof FunctionSource function) {
            return value(function.call());
        }
        throw new UnsupportedOperationException(
            "Printing not implemented for source: " + source.getClass().getSimpleName());
    }

    // ---------------------------------------------------------------------
    // Values
    // ---------------------------------------------------------------------

    private SqlPrintToken value(ValueExpression expression) {
        return withComments(expression, valueBody(expression));
    }

    private SqlPrintToken valueBody(ValueExpression expression) {
        if (expression instanceof ColumnReference column) {
            SqlPrintToken last = column.isWildcard()
                ? SqlPrintToken.raw(ColumnReference.WILDCARD)
                : SqlPrintToken.identifier(column.column());
            return qualifiedName(column.namespaces(), last);
        }
        if (expression instanceof LiteralValue literal) {
            return literal(literal);
        }
        if (expression instanceof ParameterExpression parameter) {
            return SqlPrintToken.parameter(parameter);
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary);
        }
        if (expression instanceof UnaryExpression unary) {
            return unary(unary);
        }
        if (expression instanceof FunctionCall call) {
            return functionCall(call);
        }
        if (expression instanceof CaseExpression caseExpression) {
            return caseExpression(caseExpression);
        }
        if (expression instanceof TupleExpression tuple) {
            return parenthesizedList(tuple.items());
        }
        if (expression instanceof SubqueryExpression subquery) {
            return parenthesizedQuery(subquery.query(), ContainerTag.INLINE_QUERY);
        }
        if (expression instanceof BetweenExpression between) {
            return between(between);
        }
        if (expression instanceof CastExpression cast) {
            return cast(cast);
        }
        if (expression instanceof ParenExpression paren) {
            return SqlPrintToken.container(ContainerTag.PAREN_EXPRESSION)
                .add(SqlPrintToken.parenthesis("("))
                .add(value(paren.inner()))
                .add(SqlPrintToken.parenthesis(")"));
        }
        throw new UnsupportedOperationException(
            "Printing not implemented for expression: " + expression.getClass().getSimpleName());
    }

    private static SqlPrintToken literal(LiteralValue literal) {
        return switch (literal.kind()) {
            case STRING -> SqlPrintToken.value(SQLQuoting.quoteLiteral(literal.text()));
            case NUMBER -> SqlPrintToken.value(literal.text());
            case BOOLEAN, NULL -> SqlPrintToken.keyword(literal.text());
        };
    }

    private SqlPrintToken binary(BinaryExpression binary) {
        int precedence = binary.operator().precedence();
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(operand(binary.left(), precedence(binary.left()) < precedence));
        token.add(SqlPrintToken.space());
        token.add(SqlPrintToken.operator(binary.operator().symbol()));
        token.add(SqlPrintToken.space());
        token.add(operand(binary.right(), precedence(binary.right()) <= precedence));
        return token;
    }

    private SqlPrintToken unary(UnaryExpression unary) {
        SqlPrintToken token = SqlPrintToken.container(null);
        UnaryExpression.Operator operator = unary.operator();
        token.add(SqlPrintToken.operator(operator.symbol()));
        ValueExpression operand = unary.operand();
        boolean nestedSign = operand instanceof UnaryExpression inner && !inner.operator().isWord();
        if (operator.isWord() || nestedSign) {
            token.add(SqlPrintToken.space());
        }
        token.add(operand(operand, precedence(operand) < operator.precedence()));
        return token;
    }

    private SqlPrintToken functionCall(FunctionCall call) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.FUNCTION_CALL);
        token.add(SqlPrintToken.value(call.name()));
        token.add(SqlPrintToken.parenthesis("("));
        if (call.isDistinct()) {
            token.add(SqlPrintToken.keyword("distinct")).add(SqlPrintToken.space());
        }
        addCommaSeparated(token, call.arguments());
        token.add(SqlPrintToken.parenthesis(")"));
        if (call.windowName() != null) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("over"))
                .add(SqlPrintToken.space()).add(SqlPrintToken.identifier(call.windowName()));
        } else if (call.window() != null) {
            token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("over"))
                .add(SqlPrintToken.space()).add(window(call.window()));
        }
        return token;
    }

    private SqlPrintToken window(WindowSpec window) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.WINDOW_SPEC);
        token.add(SqlPrintToken.parenthesis("("));
        boolean first = true;
        if (!window.partitionBy().isEmpty()) {
            token.add(SqlPrintToken.keyword("partition by")).add(SqlPrintToken.space());
            addCommaSeparated(token, window.partitionBy());
            first = false;
        }
        if (!window.orderBy().isEmpty()) {
            if (!first) {
                token.add(SqlPrintToken.space());
            }
            token.add(SqlPrintToken.keyword("order by")).add(SqlPrintToken.space());
            for (int i = 0; i < window.orderBy().size(); i++) {
                if (i > 0) {
                    token.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
                }
                token.add(orderByItem(window.orderBy().get(i)));
            }
            first = false;
        }
        WindowFrame frame = window.frame();
        if (frame != null) {
            if (!first) {
                token.add(SqlPrintToken.space());
            }
            token.add(SqlPrintToken.keyword(frame.unit().keyword())).add(SqlPrintToken.space());
            if (frame.end() != null) {
                token.add(SqlPrintToken.keyword("between")).add(SqlPrintToken.space());
                token.add(frameBound(frame.start()));
                token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("and")).add(SqlPrintToken.space());
                token.add(frameBound(frame.end()));
            } else {
                token.add(frameBound(frame.start()));
            }
        }
        token.add(SqlPrintToken.parenthesis(")"));
        return token;
    }

    private SqlPrintToken frameBound(WindowFrame.Bound bound) {
        SqlPrintToken token = SqlPrintToken.container(null);
        if (bound.offset() != null) {
            token.add(operand(bound.offset(), precedence(bound.offset()) <= BetweenExpression.PRECEDENCE));
            token.add(SqlPrintToken.space());
        }
        return token.add(SqlPrintToken.keyword(bound.kind().keyword()));
    }

    private SqlPrintToken caseExpression(CaseExpression expression) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(SqlPrintToken.keyword("case"));
        if (expression.operand() != null) {
            token.add(SqlPrintToken.space()).add(value(expression.operand()));
        }
        token.add(SqlPrintToken.space());

        SqlPrintToken body = SqlPrintToken.container(ContainerTag.CASE_EXPRESSION);
        List<CaseExpression.WhenThen> branches = expression.branches();
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) {
                body.add(SqlPrintToken.lineBreak());
            }
            CaseExpression.WhenThen branch = branches.get(i);
            SqlPrintToken pair = SqlPrintToken.container(ContainerTag.CASE_WHEN_PAIR);
            pair.add(SqlPrintToken.keyword("when")).add(SqlPrintToken.space()).add(value(branch.when()));
            pair.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("then")).add(SqlPrintToken.space());
            pair.add(SqlPrintToken.container(ContainerTag.CASE_THEN_VALUE).add(value(branch.then())));
            body.add(pair);
        }
        if (expression.elseValue() != null) {
            body.add(SqlPrintToken.lineBreak());
            body.add(SqlPrintToken.keyword("else")).add(SqlPrintToken.space());
            body.add(SqlPrintToken.container(ContainerTag.CASE_ELSE_VALUE).add(value(expression.elseValue())));
        }
        token.add(body);
        token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("end"));
        return token;
    }

    private SqlPrintToken between(BetweenExpression between) {
        SqlPrintToken token = SqlPrintToken.container(ContainerTag.BETWEEN_EXPRESSION);
        int precedence = BetweenExpression.PRECEDENCE;
        token.add(operand(between.value(), precedence(between.value()) < precedence));
        token.add(SqlPrintToken.space());
        token.add(SqlPrintToken.keyword(between.isNegated() ? "not between" : "between"));
        token.add(SqlPrintToken.space());
        token.add(operand(between.lower(), precedence(between.lower()) <= precedence));
        token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("and")).add(SqlPrintToken.space());
        token.add(operand(between.upper(), precedence(between.upper()) <= precedence));
        return token;
    }

    private SqlPrintToken cast(CastExpression cast) {
        SqlPrintToken token = SqlPrintToken.container(null);
        switch (cast.syntax()) {
            case DOUBLE_COLON -> {
                token.add(operand(cast.value(), precedence(cast.value()) < ATOMIC));
                token.add(SqlPrintToken.operator("::"));
                token.add(SqlPrintToken.value(cast.typeName()));
            }
            case CAST_FUNCTION -> {
                token.add(SqlPrintToken.keyword("cast")).add(SqlPrintToken.parenthesis("("));
                token.add(value(cast.value()));
                token.add(SqlPrintToken.space()).add(SqlPrintToken.keyword("as")).add(SqlPrintToken.space());
                token.add(SqlPrintToken.value(cast.typeName())).add(SqlPrintToken.parenthesis(")"));
            }
            case TYPED_LITERAL -> {
                token.add(SqlPrintToken.value(cast.typeName())).add(SqlPrintToken.space());
                token.add(value(cast.value()));
            }
        }
        return token;
    }

    /**
     * Prints an operand, wrapped in parentheses when it binds weaker than its context.
     */
    private SqlPrintToken operand(ValueExpression expression, boolean parenthesize) {
        if (!parenthesize) {
            return value(expression);
        }
        return SqlPrintToken.container(ContainerTag.PAREN_EXPRESSION)
            .add(SqlPrintToken.parenthesis("("))
            .add(value(expression))
            .add(SqlPrintToken.parenthesis(")"));
    }

    private static int precedence(ValueExpression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.operator().precedence();
        }
        if (expression instanceof UnaryExpression unary) {
            return unary.operator().precedence();
        }
        if (expression instanceof BetweenExpression) {
            return BetweenExpression.PRECEDENCE;
        }
        return ATOMIC;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private SqlPrintToken parenthesizedList(List<ValueExpression> items) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(SqlPrintToken.parenthesis("("));
        addCommaSeparated(token, items);
        return token.add(SqlPrintToken.parenthesis(")"));
    }

    private void addCommaSeparated(SqlPrintToken target, List<ValueExpression> items) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                target.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
            }
            target.add(value(items.get(i)));
        }
    }

    private static SqlPrintToken nameList(List<String> names) {
        SqlPrintToken token = SqlPrintToken.container(null);
        token.add(SqlPrintToken.parenthesis("("));
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                token.add(SqlPrintToken.comma()).add(SqlPrintToken.space());
            }
            token.add(SqlPrintToken.identifier(names.get(i)));
        }
        return token.add(SqlPrintToken.parenthesis(")"));
    }

    private static SqlPrintToken qualifiedName(List<String> namespaces, SqlPrintToken last) {
        SqlPrintToken token = SqlPrintToken.container(null);
        for (String namespace : namespaces) {
            token.add(SqlPrintToken.identifier(namespace)).add(SqlPrintToken.raw("."));
        }
        return token.add(last);
    }

    /**
     * Surrounds a node's tokens with its comments: header and BEFORE comments in front,
     * AFTER comments behind.
     */
    private static SqlPrintToken withComments(SqlNode node, SqlPrintToken body) {
        List<String> before = new ArrayList<>(node.getComments());
        before.addAll(node.getPositionedComments(CommentPosition.BEFORE));
        List<String> after = node.getPositionedComments(CommentPosition.AFTER);
        if (before.isEmpty() && after.isEmpty()) {
            return body;
        }
        SqlPrintToken token = SqlPrintToken.container(null);
        before.forEach(comment -> token.add(SqlPrintToken.comment(comment)));
        token.add(body);
        after.forEach(comment -> token.add(SqlPrintToken.comment(comment)));
        return token;
    }
}
