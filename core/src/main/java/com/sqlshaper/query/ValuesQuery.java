package com.sqlshaper.query;

import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.TupleExpression;
import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code VALUES (...), (...)} row list, with optional column names used when it is
 * normalized to a SELECT.
 */
public final class ValuesQuery extends SqlComponent implements SelectQuery {

    /** Alias of the derived table produced by {@link #toSimpleQuery()}. */
    public static final String DERIVED_ALIAS = "vq";

    private final List<TupleExpression> tuples;
    private List<String> columnAliases;

    public ValuesQuery(List<TupleExpression> tuples) {
        this(tuples, null);
    }

    public ValuesQuery(List<TupleExpression> tuples, List<String> columnAliases) {
        this.tuples = new ArrayList<>(Objects.requireNonNull(tuples, "tuples must not be null"));
        setColumnAliases(columnAliases);
    }

    public List<TupleExpression> getTuples() {
        return Collections.unmodifiableList(tuples);
    }

    public ValuesQuery addTuple(TupleExpression tuple) {
        tuples.add(Objects.requireNonNull(tuple, "tuple must not be null"));
        return this;
    }

    /**
     * Returns the column names, empty when none were assigned.
     */
    public List<String> getColumnAliases() {
        return Collections.unmodifiableList(columnAliases);
    }

    public void setColumnAliases(List<String> columnAliases) {
        this.columnAliases = columnAliases == null ? new ArrayList<>() : new ArrayList<>(columnAliases);
    }

    /**
     * Wraps the rows as a derived table.
     *
     * <p>With column names the result is {@code select "vq"."a", "vq"."b" from (values ...) as "vq"("a", "b")};
     * without, it selects {@code *}.
     *
     * @return a new query; this query becomes its derived table
     * @throws IllegalStateException if there are no rows, or the column names do not match the row width
     */
    @Override
    public SimpleSelectQuery toSimpleQuery() {
        if (tuples.isEmpty()) {
            throw new IllegalStateException("Cannot convert an empty VALUES list to a SELECT query");
        }
        int width = tuples.get(0).items().size();
        if (!columnAliases.isEmpty() && columnAliases.size() != width) {
            throw new IllegalStateException("VALUES rows have " + width + " columns but "
                + columnAliases.size() + " column names were given");
        }
        SourceExpression derived = new SourceExpression(new SubQuerySource(this), DERIVED_ALIAS, columnAliases);
        List<SelectItem> items = new ArrayList<>();
        if (columnAliases.isEmpty()) {
            items.add(SelectItem.of(ColumnReference.wildcard()));
        } else {
            for (String column : columnAliases) {
                items.add(SelectItem.of(ColumnReference.of(DERIVED_ALIAS, column)));
            }
        }
        return new SimpleSelectQuery(items, new FromClause(derived));
    }

    @Override
    public String toString() {
        return "ValuesQuery(rows=" + tuples.size() + ", columns=" + columnAliases + ")";
    }
}
