package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * A prefix operation: {@code NOT x}, {@code -x}, {@code +x} or {@code EXISTS (subquery)}.
 */
public final class UnaryExpression extends SqlComponent implements ValueExpression {

    public enum Operator {
        NOT("not", 3),
        NEGATE("-", 11),
        PLUS("+", 11),
        EXISTS("exists", 12);

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

        public boolean isWord() {
            return Character.isLetter(symbol.charAt(0));
        }
    }

    private final Operator operator;
    private final ValueExpression operand;

    public UnaryExpression(Operator operator, ValueExpression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        if (operator == Operator.EXISTS && !(operand instanceof SubqueryExpression)) {
            throw new IllegalArgumentException("EXISTS requires a subquery operand");
        }
    }

    public static UnaryExpression not(ValueExpression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression exists(SubqueryExpression subquery) {
        return new UnaryExpression(Operator.EXISTS, subquery);
    }

    public Operator operator() {
        return operator;
    }

    public ValueExpression operand() {
        return operand;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator.symbol() + (operator.isWord() ? " " : "") + operand;
    }
}
