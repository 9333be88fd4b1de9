package com.sqlshaper.query;

import com.sqlshaper.exception.DuplicateCTEException;
import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.model.SqlComponent;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Two queries combined by a set operation. Chains are left-deep:
 * {@code a UNION b UNION c} is {@code (a UNION b) UNION c}.
 */
public final class BinarySelectQuery extends SqlComponent implements SelectQuery {

    /** Alias of the derived table produced by {@link #toSimpleQuery()}. */
    public static final String DERIVED_ALIAS = "bq";

    private SelectQuery left;
    private SetOperator operator;
    private SelectQuery right;

    public BinarySelectQuery(SelectQuery left, SetOperator operator, SelectQuery right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public SelectQuery getLeft() {
        return left;
    }

    public void setLeft(SelectQuery left) {
        this.left = Objects.requireNonNull(left, "left must not be null");
    }

    public SetOperator getOperator() {
        return operator;
    }

    public void setOperator(SetOperator operator) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
    }

    public SelectQuery getRight() {
        return right;
    }

    public void setRight(SelectQuery right) {
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    /**
     * Wraps this set operation as {@code select * from (...) as "bq"}.
     *
     * <p>An ORDER BY written on a branch sorts the combined result, so it moves to the
     * wrapper: the right branch is searched first, then the left, descending into nested
     * set operations, and the first ORDER BY found is removed from its branch. Every other
     * ORDER BY stays where it is.
     *
     * <p>WITH clauses on the branches move to the wrapper as well, leftmost branch first,
     * so the common tables stay visible to the whole query.
     *
     * @return a new query; this query becomes its derived table
     * @throws DuplicateCTEException if two branches define a common table with the same name
     */
    @Override
    public SimpleSelectQuery toSimpleQuery() {
        List<OrderByItem> orderBy = takeOrderBy(this);
        SourceExpression derived = new SourceExpression(new SubQuerySource(this), DERIVED_ALIAS, null);
        SimpleSelectQuery wrapper = new SimpleSelectQuery(
            List.of(SelectItem.of(ColumnReference.wildcard())), new FromClause(derived));
        wrapper.setOrderBy(orderBy);
        WithClause with = takeWithClauses(this, null);
        if (with != null) {
            wrapper.setWithClause(with);
        }
        return wrapper;
    }

    private static WithClause takeWithClauses(SelectQuery query, WithClause merged) {
        if (query instanceof BinarySelectQuery binary) {
            return takeWithClauses(binary.right, takeWithClauses(binary.left, merged));
        }
        if (!(query instanceof SimpleSelectQuery simple) || simple.getWithClause() == null) {
            return merged;
        }
        WithClause with = simple.getWithClause();
        simple.setWithClause(null);
        if (merged == null) {
            return with;
        }
        for (CommonTable table : with.tables()) {
            merged.add(table);
        }
        merged.setRecursive(merged.isRecursive() || with.isRecursive());
        return merged;
    }

    private static List<OrderByItem> takeOrderBy(SelectQuery query) {
        if (query instanceof SimpleSelectQuery simple) {
            if (!simple.hasOrderBy()) {
                return Collections.emptyList();
            }
            List<OrderByItem> items = simple.getOrderBy();
            simple.setOrderBy(null);
            return items;
        }
        if (query instanceof BinarySelectQuery binary) {
            List<OrderByItem> items = takeOrderBy(binary.right);
            return items.isEmpty() ? takeOrderBy(binary.left) : items;
        }
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "BinarySelectQuery(" + left + " " + operator.keyword() + " " + right + ")";
    }
}
