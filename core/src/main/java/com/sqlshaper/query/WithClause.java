package com.sqlshaper.query;

import com.sqlshaper.exception.DuplicateCTEException;
import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A WITH clause: the optional RECURSIVE flag and uniquely named common tables in order.
 */
public final class WithClause extends SqlComponent {

    private boolean recursive;
    private final List<CommonTable> tables = new ArrayList<>();

    public WithClause(boolean recursive) {
        this.recursive = recursive;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public List<CommonTable> tables() {
        return Collections.unmodifiableList(tables);
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    /**
     * Appends a common table.
     *
     * @throws DuplicateCTEException if a table with the same name exists
     */
    public void add(CommonTable table) {
        Objects.requireNonNull(table, "table must not be null");
        if (find(table.name()) != null) {
            throw new DuplicateCTEException(table.name());
        }
        tables.add(table);
    }

    /**
     * Returns the table with the given name, or null.
     */
    public CommonTable find(String name) {
        for (CommonTable table : tables) {
            if (table.name().equals(name)) {
                return table;
            }
        }
        return null;
    }

    boolean remove(String name) {
        return tables.removeIf(t -> t.name().equals(name));
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(tables.size());
        for (CommonTable table : tables) {
            names.add(table.name());
        }
        return Collections.unmodifiableList(names);
    }
}
