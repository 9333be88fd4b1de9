package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * A binary operation: arithmetic, comparison, pattern matching, membership or logical.
 *
 * <p>{@code IN} and {@code NOT IN} take a {@link TupleExpression} or a
 * {@link SubqueryExpression} on the right side.
 */
public final class BinaryExpression extends SqlComponent implements ValueExpression {

    /**
     * Binary operators with their SQL spelling and binding strength.
     *
     * <p>Higher precedence binds tighter. All operators associate to the left.
     */
    public enum Operator {
        OR("or", 1),
        AND("and", 2),
        IS("is", 4),
        IS_NOT("is not", 4),
        EQUAL("=", 5),
        NOT_EQUAL("<>", 5),
        LESS_THAN("<", 5),
        LESS_THAN_OR_EQUAL("<=", 5),
        GREATER_THAN(">", 5),
        GREATER_THAN_OR_EQUAL(">=", 5),
        LIKE("like", 6),
        NOT_LIKE("not like", 6),
        ILIKE("ilike", 6),
        NOT_ILIKE("not ilike", 6),
        IN("in", 6),
        NOT_IN("not in", 6),
        CONCAT("||", 7),
        JSON_GET("->", 7),
        JSON_GET_TEXT("->>", 7),
        ADD("+", 8),
        SUBTRACT("-", 8),
        MULTIPLY("*", 9),
        DIVIDE("/", 9),
        MODULO("%", 9),
        POWER("^", 10);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO || this == POWER;
        }

        public boolean isComparison() {
            return precedence == 5;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        /**
         * True when the operator is spelled with words rather than symbols.
         */
        public boolean isWord() {
            return Character.isLetter(symbol.charAt(0));
        }

        /**
         * Maps a symbolic operator lexeme to its operator, or null if it is not binary.
         */
        public static Operator fromSymbol(String symbol) {
            return switch (symbol) {
                case "=" -> EQUAL;
                case "<>", "!=" -> NOT_EQUAL;
                case "<" -> LESS_THAN;
                case "<=" -> LESS_THAN_OR_EQUAL;
                case ">" -> GREATER_THAN;
                case ">=" -> GREATER_THAN_OR_EQUAL;
                case "||" -> CONCAT;
                case "->" -> JSON_GET;
                case "->>" -> JSON_GET_TEXT;
                case "+" -> ADD;
                case "-" -> SUBTRACT;
                case "*" -> MULTIPLY;
                case "/" -> DIVIDE;
                case "%" -> MODULO;
                case "^" -> POWER;
                default -> null;
            };
        }
    }

    private final ValueExpression left;
    private final Operator operator;
    private final ValueExpression right;

    public BinaryExpression(ValueExpression left, Operator operator, ValueExpression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        if ((operator == Operator.IN || operator == Operator.NOT_IN)
                && !(right instanceof TupleExpression) && !(right instanceof SubqueryExpression)) {
            throw new IllegalArgumentException("IN requires a value list or a subquery on the right side");
        }
    }

    public ValueExpression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public ValueExpression right() {
        return right;
    }

    public static BinaryExpression and(ValueExpression left, ValueExpression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(ValueExpression left, ValueExpression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }

    public static BinaryExpression equal(ValueExpression left, ValueExpression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression greaterThan(ValueExpression left, ValueExpression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression lessThan(ValueExpression left, ValueExpression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return left.equals(that.left) && operator == that.operator && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
