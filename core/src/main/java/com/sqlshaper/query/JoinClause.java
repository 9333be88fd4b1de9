package com.sqlshaper.query;

import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One join of a FROM clause.
 *
 * <p>A join has at most one of an {@code ON} condition and a {@code USING} column list.
 * Comma-separated sources are represented as joins of type {@link JoinType#COMMA}.
 */
public final class JoinClause extends SqlComponent {

    /**
     * Join types, keeping the spelling they were written with.
     */
    public enum JoinType {
        JOIN("join"),
        INNER_JOIN("inner join"),
        LEFT_JOIN("left join"),
        LEFT_OUTER_JOIN("left outer join"),
        RIGHT_JOIN("right join"),
        RIGHT_OUTER_JOIN("right outer join"),
        FULL_JOIN("full join"),
        FULL_OUTER_JOIN("full outer join"),
        CROSS_JOIN("cross join"),
        COMMA(",");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * True when the join type admits an ON or USING condition.
         */
        public boolean acceptsCondition() {
            return this != CROSS_JOIN && this != COMMA;
        }
    }

    private final JoinType type;
    private final boolean natural;
    private final boolean lateral;
    private final SourceExpression source;
    private final ValueExpression condition;
    private final List<String> usingColumns;

    public JoinClause(JoinType type, boolean natural, boolean lateral, SourceExpression source,
                      ValueExpression condition, List<String> usingColumns) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.natural = natural;
        this.lateral = lateral;
        this.condition = condition;
        this.usingColumns = usingColumns == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(usingColumns));
        if (condition != null && !this.usingColumns.isEmpty()) {
            throw new IllegalArgumentException("A join takes either ON or USING, not both");
        }
        if ((condition != null || !this.usingColumns.isEmpty()) && (!type.acceptsCondition() || natural)) {
            throw new IllegalArgumentException(type.keyword() + (natural ? " (natural)" : "") + " does not take a join condition");
        }
    }

    public static JoinClause on(JoinType type, SourceExpression source, ValueExpression condition) {
        return new JoinClause(type, false, false, source, condition, null);
    }

    public JoinType type() {
        return type;
    }

    public boolean isNatural() {
        return natural;
    }

    public boolean isLateral() {
        return lateral;
    }

    public SourceExpression source() {
        return source;
    }

    /**
     * Returns the ON condition, or null.
     */
    public ValueExpression condition() {
        return condition;
    }

    public List<String> usingColumns() {
        return usingColumns;
    }
}
