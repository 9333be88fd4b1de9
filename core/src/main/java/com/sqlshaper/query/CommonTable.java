package com.sqlshaper.query;

import com.sqlshaper.exception.InvalidCTENameException;
import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One named entry of a WITH clause: {@code name [(cols)] AS [[NOT] MATERIALIZED] (query)}.
 */
public final class CommonTable extends SqlComponent {

    private final String name;
    private final List<String> columnAliases;
    private SelectQuery query;
    private Boolean materialized;

    /**
     * @param name the CTE name, non-blank
     * @param columnAliases optional column list, may be null
     * @param query the body
     * @param materialized {@code TRUE} for MATERIALIZED, {@code FALSE} for NOT MATERIALIZED, null for no hint
     * @throws InvalidCTENameException if the name is null, empty or whitespace-only
     */
    public CommonTable(String name, List<String> columnAliases, SelectQuery query, Boolean materialized) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidCTENameException(name);
        }
        this.name = name;
        this.columnAliases = columnAliases == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(columnAliases));
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.materialized = materialized;
    }

    public String name() {
        return name;
    }

    public List<String> columnAliases() {
        return columnAliases;
    }

    public SelectQuery query() {
        return query;
    }

    void setQuery(SelectQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    /**
     * Returns the materialization hint: true, false, or null when none was given.
     */
    public Boolean materialized() {
        return materialized;
    }

    void setMaterialized(Boolean materialized) {
        this.materialized = materialized;
    }
}
