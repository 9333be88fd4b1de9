package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A possibly qualified column name, such as {@code id}, {@code u.id} or {@code s.u.id}.
 *
 * <p>The column {@code *} denotes a wildcard ({@code *} or {@code u.*}).
 */
public final class ColumnReference extends SqlComponent implements ValueExpression {

    public static final String WILDCARD = "*";

    private final List<String> namespaces;
    private final String column;

    public ColumnReference(List<String> namespaces, String column) {
        this.namespaces = namespaces == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(namespaces));
        this.column = Objects.requireNonNull(column, "column must not be null");
    }

    public static ColumnReference of(String column) {
        return new ColumnReference(null, column);
    }

    public static ColumnReference of(String table, String column) {
        return new ColumnReference(table == null ? null : List.of(table), column);
    }

    public static ColumnReference wildcard() {
        return new ColumnReference(null, WILDCARD);
    }

    /**
     * Returns the qualifiers in source order, empty for an unqualified column.
     */
    public List<String> namespaces() {
        return namespaces;
    }

    /**
     * Returns the innermost qualifier (the table or alias), or null.
     */
    public String table() {
        return namespaces.isEmpty() ? null : namespaces.get(namespaces.size() - 1);
    }

    public String column() {
        return column;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(column);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return namespaces.equals(that.namespaces) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespaces, column);
    }

    @Override
    public String toString() {
        return namespaces.isEmpty() ? column : String.join(".", namespaces) + "." + column;
    }
}
