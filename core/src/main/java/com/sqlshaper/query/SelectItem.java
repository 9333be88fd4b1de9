package com.sqlshaper.query;

import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * One entry of the select list, with an optional alias.
 */
public final class SelectItem extends SqlComponent {

    private final ValueExpression value;
    private final String alias;

    public SelectItem(ValueExpression value, String alias) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.alias = alias;
    }

    public static SelectItem of(ValueExpression value) {
        return new SelectItem(value, null);
    }

    public static SelectItem of(ValueExpression value, String alias) {
        return new SelectItem(value, alias);
    }

    public ValueExpression value() {
        return value;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toString() {
        return alias == null ? value.toString() : value + " AS " + alias;
    }
}
