package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parenthesized value list: {@code (a, b, c)}, used for IN lists and VALUES rows.
 */
public final class TupleExpression extends SqlComponent implements ValueExpression {

    private final List<ValueExpression> items;

    public TupleExpression(List<ValueExpression> items) {
        Objects.requireNonNull(items, "items must not be null");
        if (items.isEmpty()) {
            throw new IllegalArgumentException("A tuple requires at least one value");
        }
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static TupleExpression of(ValueExpression... items) {
        return new TupleExpression(List.of(items));
    }

    public List<ValueExpression> items() {
        return items;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TupleExpression)) return false;
        return items.equals(((TupleExpression) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Tuple" + items;
    }
}
