package com.sqlshaper.query;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The FROM clause: a first source followed by joins in order.
 */
public final class FromClause extends SqlComponent {

    private final SourceExpression source;
    private final List<JoinClause> joins = new ArrayList<>();

    public FromClause(SourceExpression source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public FromClause(SourceExpression source, List<JoinClause> joins) {
        this(source);
        if (joins != null) {
            joins.forEach(this::addJoin);
        }
    }

    public SourceExpression source() {
        return source;
    }

    public List<JoinClause> joins() {
        return Collections.unmodifiableList(joins);
    }

    public FromClause addJoin(JoinClause join) {
        joins.add(Objects.requireNonNull(join, "join must not be null"));
        return this;
    }
}
