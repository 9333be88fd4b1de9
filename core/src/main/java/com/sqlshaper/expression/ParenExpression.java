package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * Explicit grouping parentheses written in the source, {@code (a or b)}.
 */
public final class ParenExpression extends SqlComponent implements ValueExpression {

    private final ValueExpression inner;

    public ParenExpression(ValueExpression inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    public ValueExpression inner() {
        return inner;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ParenExpression)) return false;
        return inner.equals(((ParenExpression) obj).inner);
    }

    @Override
    public int hashCode() {
        return inner.hashCode() * 31;
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
