package com.sqlshaper.query;

import java.util.Objects;

/**
 * A derived table: {@code (select ...)} or {@code (values ...)} in FROM.
 *
 * @param query the inner query
 */
public record SubQuerySource(SelectQuery query) implements Source {

    public SubQuerySource {
        Objects.requireNonNull(query, "query must not be null");
    }
}
