package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;
import com.sqlshaper.query.SelectQuery;

import java.util.Objects;

/**
 * A query used as a value: scalar subquery, {@code IN (subquery)} or {@code EXISTS (subquery)}.
 */
public final class SubqueryExpression extends SqlComponent implements ValueExpression {

    private final SelectQuery query;

    public SubqueryExpression(SelectQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    public SelectQuery query() {
        return query;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubqueryExpression)) return false;
        return query == ((SubqueryExpression) obj).query;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(query);
    }

    @Override
    public String toString() {
        return "Subquery(" + query.getClass().getSimpleName() + ")";
    }
}
