package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * {@code value [NOT] BETWEEN lower AND upper}.
 */
public final class BetweenExpression extends SqlComponent implements ValueExpression {

    public static final int PRECEDENCE = 6;

    private final ValueExpression value;
    private final ValueExpression lower;
    private final ValueExpression upper;
    private final boolean negated;

    public BetweenExpression(ValueExpression value, ValueExpression lower, ValueExpression upper, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.lower = Objects.requireNonNull(lower, "lower must not be null");
        this.upper = Objects.requireNonNull(upper, "upper must not be null");
        this.negated = negated;
    }

    public ValueExpression value() {
        return value;
    }

    public ValueExpression lower() {
        return lower;
    }

    public ValueExpression upper() {
        return upper;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BetweenExpression)) return false;
        BetweenExpression that = (BetweenExpression) obj;
        return negated == that.negated && value.equals(that.value)
            && lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, lower, upper, negated);
    }

    @Override
    public String toString() {
        return value + (negated ? " NOT" : "") + " BETWEEN " + lower + " AND " + upper;
    }
}
