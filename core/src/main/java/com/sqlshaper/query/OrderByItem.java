package com.sqlshaper.query;

import com.sqlshaper.expression.ValueExpression;

import java.util.Objects;

/**
 * A sort key of {@code ORDER BY} or a window's ordering.
 */
public final class OrderByItem {

    public enum Direction { ASC, DESC }

    public enum NullsOrder { FIRST, LAST }

    private final ValueExpression value;
    private final Direction direction;
    private final NullsOrder nulls;

    /**
     * @param value the sort expression
     * @param direction the explicit direction, or null when none was written
     * @param nulls the explicit NULLS ordering, or null
     */
    public OrderByItem(ValueExpression value, Direction direction, NullsOrder nulls) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.direction = direction;
        this.nulls = nulls;
    }

    public static OrderByItem of(ValueExpression value) {
        return new OrderByItem(value, null, null);
    }

    public static OrderByItem of(ValueExpression value, Direction direction) {
        return new OrderByItem(value, direction, null);
    }

    public ValueExpression value() {
        return value;
    }

    public Direction direction() {
        return direction;
    }

    public NullsOrder nulls() {
        return nulls;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderByItem)) return false;
        OrderByItem that = (OrderByItem) obj;
        return value.equals(that.value) && direction == that.direction && nulls == that.nulls;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, direction, nulls);
    }

    @Override
    public String toString() {
        return value + (direction != null ? " " + direction : "") + (nulls != null ? " NULLS " + nulls : "");
    }
}
