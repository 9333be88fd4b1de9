package com.sqlshaper.query;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A source with its optional alias and column aliases: {@code users as u},
 * {@code (values ...) as vq(id, name)}.
 */
public final class SourceExpression extends SqlComponent {

    private final Source source;
    private final String alias;
    private final List<String> columnAliases;

    public SourceExpression(Source source, String alias, List<String> columnAliases) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.alias = alias;
        if (columnAliases != null && !columnAliases.isEmpty() && alias == null) {
            throw new IllegalArgumentException("Column aliases require a source alias");
        }
        this.columnAliases = columnAliases == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(columnAliases));
    }

    public static SourceExpression table(String table) {
        return new SourceExpression(TableSource.of(table), null, null);
    }

    public static SourceExpression table(String table, String alias) {
        return new SourceExpression(TableSource.of(table), alias, null);
    }

    public Source source() {
        return source;
    }

    public String alias() {
        return alias;
    }

    public List<String> columnAliases() {
        return columnAliases;
    }
}
