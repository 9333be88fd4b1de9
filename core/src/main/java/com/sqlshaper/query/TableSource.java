package com.sqlshaper.query;

import java.util.List;
import java.util.Objects;

/**
 * A named table or CTE reference, optionally schema-qualified.
 *
 * @param namespaces qualifiers in source order, empty when unqualified
 * @param table the table name
 */
public record TableSource(List<String> namespaces, String table) implements Source {

    public TableSource {
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        Objects.requireNonNull(table, "table must not be null");
    }

    public static TableSource of(String table) {
        return new TableSource(List.of(), table);
    }
}
