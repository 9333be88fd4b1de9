package com.sqlshaper.parser;

import com.sqlshaper.expression.BetweenExpression;
import com.sqlshaper.expression.BinaryExpression;
import com.sqlshaper.expression.BinaryExpression.Operator;
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
import com.sqlshaper.lexer.Lexeme;
import com.sqlshaper.lexer.LexemeKind;
import com.sqlshaper.model.CommentPosition;
import com.sqlshaper.query.OrderByItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Precedence-climbing parser for value expressions.
 *
 * <p>Binding strength, weakest first:
 * <pre>
 *   1  OR
 *   2  AND
 *   3  NOT (prefix)
 *   4  IS [NOT]
 *   5  = &lt;&gt; != &lt; &lt;= &gt; &gt;=
 *   6  [NOT] LIKE, [NOT] ILIKE, [NOT] IN, [NOT] BETWEEN
 *   7  || -&gt; -&gt;&gt;
 *   8  + -
 *   9  * / %
 *   10 ^
 *   11 unary - +
 *   then postfix ::type
 * </pre>
 * Every binary operator associates to the left.
 */
final class ValueParser {

    private static final int NOT_PRECEDENCE = UnaryExpression.Operator.NOT.precedence();
    private static final int RANGE_PRECEDENCE = BetweenExpression.PRECEDENCE;

    private static final Set<String> TYPED_LITERAL_TYPES =
        Set.of("date", "time", "timestamp", "timestamptz", "interval");

    private static final Set<String> TYPE_NAME_CONTINUATIONS = Set.of("precision", "varying");

    private final LexemeCursor cursor;
    private final SelectQueryParser queryParser;

    ValueParser(LexemeCursor cursor, SelectQueryParser queryParser) {
        this.cursor = cursor;
        this.queryParser = queryParser;
    }

    /**
     * Parses a complete expression and attaches the comments around it.
     */
    ValueExpression parseExpression() {
        List<String> before = cursor.takeComments();
        ValueExpression expression = parseBinary(0);
        expression.addPositionedComments(CommentPosition.BEFORE, before);
        expression.addPositionedComments(CommentPosition.AFTER, cursor.takeComments());
        return expression;
    }

    List<ValueExpression> parseExpressionList() {
        List<ValueExpression> expressions = new ArrayList<>();
        do {
            expressions.add(parseExpression());
        } while (cursor.matchPunctuation(","));
        return expressions;
    }

    private ValueExpression parseBinary(int minPrecedence) {
        cursor.enter();
        try {
            ValueExpression left = parseUnary();
            while (true) {
                Lexeme lookahead = cursor.peek();
                if (lookahead == null) {
                    return left;
                }
                boolean negated = lookahead.isKeyword("not") && isNegatableInfix(cursor.peek(1));
                Lexeme operator = negated ? cursor.peek(1) : lookahead;
                int precedence = infixPrecedence(operator);
                if (precedence < 0 || precedence < minPrecedence) {
                    return left;
                }
                cursor.next();
                if (negated) {
                    cursor.next();
                }
                left = parseInfix(left, operator, negated, precedence);
            }
        } finally {
            cursor.exit();
        }
    }

    private ValueExpression parseInfix(ValueExpression left, Lexeme operator, boolean negated, int precedence) {
        if (operator.isKeyword("between")) {
            ValueExpression lower = parseBinary(RANGE_PRECEDENCE + 1);
            cursor.expectKeyword("and");
            ValueExpression upper = parseBinary(RANGE_PRECEDENCE + 1);
            return new BetweenExpression(left, lower, upper, negated);
        }
        if (operator.isKeyword("in")) {
            return new BinaryExpression(left, negated ? Operator.NOT_IN : Operator.IN, parseInList());
        }
        if (operator.isKeyword("is")) {
            boolean not = cursor.matchKeyword("not");
            return new BinaryExpression(left, not ? Operator.IS_NOT : Operator.IS, parseBinary(precedence + 1));
        }
        Operator op;
        if (operator.isKeyword("like")) {
            op = negated ? Operator.NOT_LIKE : Operator.LIKE;
        } else if (operator.isKeyword("ilike")) {
            op = negated ? Operator.NOT_ILIKE : Operator.ILIKE;
        } else if (operator.isKeyword("and")) {
            op = Operator.AND;
        } else if (operator.isKeyword("or")) {
            op = Operator.OR;
        } else {
            op = Operator.fromSymbol(operator.text());
        }
        return new BinaryExpression(left, op, parseBinary(precedence + 1));
    }

    private static boolean isNegatableInfix(Lexeme lexeme) {
        return lexeme != null && (lexeme.isKeyword("in") || lexeme.isKeyword("like")
            || lexeme.isKeyword("ilike") || lexeme.isKeyword("between"));
    }

    /**
     * Returns the binding strength of an infix operator lexeme, or -1 if it is not one.
     */
    private static int infixPrecedence(Lexeme lexeme) {
        if (lexeme.kind() == LexemeKind.KEYWORD) {
            return switch (lexeme.text()) {
                case "or" -> Operator.OR.precedence();
                case "and" -> Operator.AND.precedence();
                case "is" -> Operator.IS.precedence();
                case "like", "ilike", "in", "between" -> RANGE_PRECEDENCE;
                default -> -1;
            };
        }
        if (lexeme.kind() == LexemeKind.OPERATOR) {
            Operator op = Operator.fromSymbol(lexeme.text());
            return op == null ? -1 : op.precedence();
        }
        return -1;
    }

    private ValueExpression parseInList() {
        cursor.expectPunctuation("(");
        ValueExpression list;
        if (queryParser.startsQuery()) {
            list = new SubqueryExpression(queryParser.parseQuery());
        } else {
            list = new TupleExpression(parseExpressionList());
        }
        cursor.expectPunctuation(")");
        return list;
    }

    private ValueExpression parseUnary() {
        if (cursor.matchKeyword("not")) {
            return new UnaryExpression(UnaryExpression.Operator.NOT, parseBinary(NOT_PRECEDENCE + 1));
        }
        if (cursor.isOperator("-") || cursor.isOperator("+")) {
            boolean minus = cursor.next().text().equals("-");
            cursor.enter();
            try {
                ValueExpression operand = parseUnary();
                return new UnaryExpression(minus ? UnaryExpression.Operator.NEGATE : UnaryExpression.Operator.PLUS, operand);
            } finally {
                cursor.exit();
            }
        }
        if (cursor.matchKeyword("exists")) {
            cursor.expectPunctuation("(");
            SubqueryExpression subquery = new SubqueryExpression(queryParser.parseQuery());
            cursor.expectPunctuation(")");
            return UnaryExpression.exists(subquery);
        }
        ValueExpression value = parsePrimary();
        while (cursor.isOperator("::")) {
            cursor.next();
            value = new CastExpression(value, parseTypeName(), CastExpression.Syntax.DOUBLE_COLON);
        }
        return value;
    }

    private ValueExpression parsePrimary() {
        List<String> before = cursor.takeComments();
        ValueExpression value = parsePrimaryValue();
        value.addPositionedComments(CommentPosition.BEFORE, before);
        return value;
    }

    private ValueExpression parsePrimaryValue() {
        Lexeme current = cursor.peek();
        if (current == null) {
            throw cursor.unexpected("an expression");
        }
        switch (current.kind()) {
            case NUMERIC_LITERAL:
                cursor.next();
                return LiteralValue.ofNumber(current.text());
            case STRING_LITERAL:
                cursor.next();
                return LiteralValue.ofString(current.text());
            case PARAMETER:
                return parseParameter();
            case IDENTIFIER:
                return parseIdentifierExpression();
            case PUNCTUATION:
                if (current.isPunctuation("(")) {
                    return parseParenthesized();
                }
                break;
            case OPERATOR:
                if (current.isOperator("*")) {
                    cursor.next();
                    return ColumnReference.wildcard();
                }
                break;
            case KEYWORD:
                return parseKeywordExpression(current);
            default:
                break;
        }
        throw cursor.unexpected("an expression");
    }

    private ValueExpression parseKeywordExpression(Lexeme keyword) {
        switch (keyword.text()) {
            case "null":
                cursor.next();
                return LiteralValue.nullValue();
            case "true":
            case "false":
                cursor.next();
                return LiteralValue.ofBoolean(keyword.text().equals("true"));
            case "case":
                return parseCase();
            case "cast":
                return parseCast();
            case "left":
            case "right":
                Lexeme after = cursor.peek(1);
                if (after != null && after.isPunctuation("(")) {
                    cursor.next();
                    return parseFunctionCall(keyword.text());
                }
                break;
            default:
                break;
        }
        throw cursor.unexpected("an expression");
    }

    private ValueExpression parseParameter() {
        Lexeme marker = cursor.peek();
        try {
            ParameterExpression parameter = ParameterExpression.fromMarker(marker.text());
            cursor.next();
            return parameter;
        } catch (IllegalArgumentException e) {
            throw cursor.error("Invalid parameter '" + marker.raw() + "': " + e.getMessage(), e);
        }
    }

    private ValueExpression parseParenthesized() {
        cursor.expectPunctuation("(");
        if (queryParser.startsQuery()) {
            SubqueryExpression subquery = new SubqueryExpression(queryParser.parseQuery());
            cursor.expectPunctuation(")");
            return subquery;
        }
        List<ValueExpression> items = parseExpressionList();
        cursor.expectPunctuation(")");
        return items.size() == 1 ? new ParenExpression(items.get(0)) : new TupleExpression(items);
    }

    private ValueExpression parseIdentifierExpression() {
        Lexeme first = cursor.next();
        if (!first.isQuotedIdentifier()
                && TYPED_LITERAL_TYPES.contains(first.text().toLowerCase(Locale.ROOT))
                && cursor.isKind(LexemeKind.STRING_LITERAL)) {
            return new CastExpression(LiteralValue.ofString(cursor.next().text()),
                first.text(), CastExpression.Syntax.TYPED_LITERAL);
        }
        List<String> parts = new ArrayList<>();
        parts.add(first.text());
        while (cursor.matchPunctuation(".")) {
            if (cursor.isOperator("*")) {
                cursor.next();
                return new ColumnReference(parts, ColumnReference.WILDCARD);
            }
            parts.add(expectNamePart());
        }
        if (cursor.isPunctuation("(")) {
            return parseFunctionCall(String.join(".", parts));
        }
        String column = parts.remove(parts.size() - 1);
        return new ColumnReference(parts, column);
    }

    /**
     * Reads a name after a dot; reserved words are allowed there ({@code t.order}).
     */
    private String expectNamePart() {
        Lexeme current = cursor.peek();
        if (current == null
                || (current.kind() != LexemeKind.IDENTIFIER && current.kind() != LexemeKind.KEYWORD)) {
            throw cursor.unexpected("a name after '.'");
        }
        cursor.next();
        return current.kind() == LexemeKind.KEYWORD ? current.raw() : current.text();
    }

    /**
     * Parses {@code (args) [OVER ...]} after a function name; the cursor is on the '('.
     */
    FunctionCall parseFunctionCall(String name) {
        cursor.expectPunctuation("(");
        boolean distinct = cursor.matchKeyword("distinct");
        List<ValueExpression> arguments = new ArrayList<>();
        if (!cursor.isPunctuation(")")) {
            arguments = parseExpressionList();
        }
        cursor.expectPunctuation(")");

        WindowSpec window = null;
        String windowName = null;
        if (cursor.matchKeyword("over")) {
            if (cursor.isPunctuation("(")) {
                window = parseWindowSpec();
            } else {
                windowName = cursor.expectIdentifier("a window name or '('");
            }
        }
        return new FunctionCall(name, arguments, distinct, window, windowName);
    }

    private WindowSpec parseWindowSpec() {
        cursor.expectPunctuation("(");
        List<ValueExpression> partitionBy = null;
        if (cursor.matchWord("partition")) {
            cursor.expectKeyword("by");
            partitionBy = parseExpressionList();
        }
        List<OrderByItem> orderBy = null;
        if (cursor.matchKeyword("order")) {
            cursor.expectKeyword("by");
            orderBy = parseOrderByList();
        }
        WindowFrame frame = null;
        if (cursor.isWord("rows") || cursor.isWord("range") || cursor.isWord("groups")) {
            frame = parseWindowFrame();
        }
        cursor.expectPunctuation(")");
        return new WindowSpec(partitionBy, orderBy, frame);
    }

    private WindowFrame parseWindowFrame() {
        WindowFrame.Unit unit = WindowFrame.Unit.valueOf(cursor.next().raw().toUpperCase(Locale.ROOT));
        if (cursor.matchKeyword("between")) {
            WindowFrame.Bound start = parseFrameBound();
            cursor.expectKeyword("and");
            return new WindowFrame(unit, start, parseFrameBound());
        }
        return new WindowFrame(unit, parseFrameBound(), null);
    }

    private WindowFrame.Bound parseFrameBound() {
        if (cursor.matchWord("unbounded")) {
            if (cursor.matchWord("preceding")) {
                return WindowFrame.Bound.of(WindowFrame.BoundKind.UNBOUNDED_PRECEDING);
            }
            cursor.expectWord("following");
            return WindowFrame.Bound.of(WindowFrame.BoundKind.UNBOUNDED_FOLLOWING);
        }
        if (cursor.matchWord("current")) {
            cursor.expectWord("row");
            return WindowFrame.Bound.of(WindowFrame.BoundKind.CURRENT_ROW);
        }
        ValueExpression offset = parseBinary(RANGE_PRECEDENCE + 1);
        if (cursor.matchWord("preceding")) {
            return new WindowFrame.Bound(WindowFrame.BoundKind.PRECEDING, offset);
        }
        cursor.expectWord("following");
        return new WindowFrame.Bound(WindowFrame.BoundKind.FOLLOWING, offset);
    }

    List<OrderByItem> parseOrderByList() {
        List<OrderByItem> items = new ArrayList<>();
        do {
            ValueExpression value = parseExpression();
            OrderByItem.Direction direction = null;
            if (cursor.matchKeyword("asc")) {
                direction = OrderByItem.Direction.ASC;
            } else if (cursor.matchKeyword("desc")) {
                direction = OrderByItem.Direction.DESC;
            }
            OrderByItem.NullsOrder nulls = null;
            if (cursor.matchWord("nulls")) {
                if (cursor.matchWord("first")) {
                    nulls = OrderByItem.NullsOrder.FIRST;
                } else {
                    cursor.expectWord("last");
                    nulls = OrderByItem.NullsOrder.LAST;
                }
            }
            items.add(new OrderByItem(value, direction, nulls));
        } while (cursor.matchPunctuation(","));
        return items;
    }

    private ValueExpression parseCase() {
        cursor.expectKeyword("case");
        ValueExpression operand = cursor.isKeyword("when") ? null : parseExpression();
        List<CaseExpression.WhenThen> branches = new ArrayList<>();
        while (cursor.matchKeyword("when")) {
            ValueExpression when = parseExpression();
            cursor.expectKeyword("then");
            branches.add(new CaseExpression.WhenThen(when, parseExpression()));
        }
        if (branches.isEmpty()) {
            throw cursor.unexpected("'WHEN'");
        }
        ValueExpression elseValue = cursor.matchKeyword("else") ? parseExpression() : null;
        cursor.expectKeyword("end");
        return new CaseExpression(operand, branches, elseValue);
    }

    private ValueExpression parseCast() {
        cursor.expectKeyword("cast");
        cursor.expectPunctuation("(");
        ValueExpression value = parseExpression();
        cursor.expectKeyword("as");
        String type = parseTypeName();
        cursor.expectPunctuation(")");
        return new CastExpression(value, type, CastExpression.Syntax.CAST_FUNCTION);
    }

    /**
     * Reads a type name such as {@code int}, {@code double precision}, {@code numeric(10, 2)}
     * or {@code text[]}, returned as written with normalized spacing.
     */
    private String parseTypeName() {
        StringBuilder type = new StringBuilder(cursor.expectIdentifier("a type name"));
        while (cursor.peek() != null && cursor.peek().kind() == LexemeKind.IDENTIFIER
                && TYPE_NAME_CONTINUATIONS.contains(cursor.peek().raw().toLowerCase(Locale.ROOT))) {
            type.append(' ').append(cursor.next().raw());
        }
        if (cursor.matchPunctuation("(")) {
            List<String> arguments = new ArrayList<>();
            do {
                if (!cursor.isKind(LexemeKind.NUMERIC_LITERAL)) {
                    throw cursor.unexpected("a type modifier");
                }
                arguments.add(cursor.next().text());
            } while (cursor.matchPunctuation(","));
            cursor.expectPunctuation(")");
            type.append('(').append(String.join(", ", arguments)).append(')');
        }
        while (cursor.peek() != null && cursor.peek().raw().equals("[]")) {
            cursor.next();
            type.append("[]");
        }
        return type.toString();
    }
}
