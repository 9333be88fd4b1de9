package com.sqlshaper.query;

import com.sqlshaper.exception.CTENotFoundException;
import com.sqlshaper.exception.DuplicateCTEException;
import com.sqlshaper.exception.InvalidCTENameException;
import com.sqlshaper.expression.BinaryExpression;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.model.SqlComponent;
import com.sqlshaper.parser.SQLParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single SELECT statement with its optional clauses.
 *
 * <p>This is the node callers reshape: common table expressions are managed through
 * {@link #addCTE}, {@link #removeCTE} and {@link #replaceCTE}, and predicates are
 * extended with {@link #appendWhere} or its raw-SQL form {@link #appendWhereRaw}.
 * All mutators work in place and return this instance.
 *
 * <p>Example:
 * <pre>
 *   SimpleSelectQuery query = SQLParser.parse("SELECT id FROM users").toSimpleQuery();
 *   query.appendWhereRaw("status = 'active'")
 *        .addCTE("recent", SQLParser.parse("SELECT * FROM orders"));
 * </pre>
 */
public final class SimpleSelectQuery extends SqlComponent implements SelectQuery {

    private static final Logger logger = LoggerFactory.getLogger(SimpleSelectQuery.class);

    private WithClause withClause;
    private boolean distinct;
    private List<ValueExpression> distinctOn = new ArrayList<>();
    private List<SelectItem> selectItems = new ArrayList<>();
    private FromClause from;
    private ValueExpression where;
    private List<ValueExpression> groupBy = new ArrayList<>();
    private ValueExpression having;
    private List<OrderByItem> orderBy = new ArrayList<>();
    private ValueExpression limit;
    private ValueExpression offset;

    public SimpleSelectQuery() {
    }

    public SimpleSelectQuery(List<SelectItem> selectItems, FromClause from) {
        setSelectItems(selectItems);
        this.from = from;
    }

    // ---------------------------------------------------------------------
    // Common table expressions
    // ---------------------------------------------------------------------

    public SimpleSelectQuery addCTE(String name, SelectQuery query) {
        return addCTE(name, query, null);
    }

    /**
     * Adds a common table expression after the existing ones.
     *
     * @param name the CTE name
     * @param query the CTE body
     * @param materialized the materialization hint, or null for none
     * @return this query
     * @throws InvalidCTENameException if the name is null, empty or whitespace-only
     * @throws DuplicateCTEException if a CTE with this name exists
     */
    public SimpleSelectQuery addCTE(String name, SelectQuery query, Boolean materialized) {
        validateName(name);
        Objects.requireNonNull(query, "query must not be null");
        if (hasCTE(name)) {
            throw new DuplicateCTEException(name);
        }
        if (withClause == null) {
            withClause = new WithClause(false);
        }
        withClause.add(new CommonTable(name, null, query, materialized));
        logger.debug("Added CTE '{}' ({} total)", name, withClause.tables().size());
        return this;
    }

    /**
     * Removes a common table expression. The WITH clause disappears with its last entry.
     *
     * @return this query
     * @throws CTENotFoundException if no CTE has this name
     */
    public SimpleSelectQuery removeCTE(String name) {
        if (!hasCTE(name)) {
            throw new CTENotFoundException(name);
        }
        withClause.remove(name);
        if (withClause.isEmpty()) {
            withClause = null;
        }
        logger.debug("Removed CTE '{}'", name);
        return this;
    }

    /**
     * Replaces the body of an existing CTE, keeping its position and materialization hint.
     *
     * @return this query
     * @throws InvalidCTENameException if the name is null, empty or whitespace-only
     * @throws CTENotFoundException if no CTE has this name
     */
    public SimpleSelectQuery replaceCTE(String name, SelectQuery query) {
        validateName(name);
        CommonTable table = requireCTE(name);
        table.setQuery(query);
        logger.debug("Replaced CTE '{}'", name);
        return this;
    }

    /**
     * Replaces the body and the materialization hint of an existing CTE.
     *
     * @return this query
     * @throws InvalidCTENameException if the name is null, empty or whitespace-only
     * @throws CTENotFoundException if no CTE has this name
     */
    public SimpleSelectQuery replaceCTE(String name, SelectQuery query, Boolean materialized) {
        replaceCTE(name, query);
        requireCTE(name).setMaterialized(materialized);
        return this;
    }

    public boolean hasCTE(String name) {
        return withClause != null && withClause.find(name) != null;
    }

    /**
     * Returns the CTE names in definition order.
     */
    public List<String> getCTENames() {
        return withClause == null ? Collections.emptyList() : withClause.names();
    }

    private CommonTable requireCTE(String name) {
        CommonTable table = withClause == null ? null : withClause.find(name);
        if (table == null) {
            throw new CTENotFoundException(name);
        }
        return table;
    }

    private static void validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidCTENameException(name);
        }
    }

    // ---------------------------------------------------------------------
    // Predicate splicing
    // ---------------------------------------------------------------------

    /**
     * AND-combines a condition with the current WHERE predicate, or sets it when there is none.
     *
     * @return this query
     */
    public SimpleSelectQuery appendWhere(ValueExpression condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        where = where == null ? condition : BinaryExpression.and(where, condition);
        return this;
    }

    /**
     * Parses {@code sql} as a boolean expression and AND-combines it with the WHERE predicate.
     *
     * @return this query
     * @throws com.sqlshaper.exception.SQLParsingException if the fragment is not a valid expression
     */
    public SimpleSelectQuery appendWhereRaw(String sql) {
        return appendWhere(SQLParser.parseExpression(sql));
    }

    public SimpleSelectQuery appendHaving(ValueExpression condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        having = having == null ? condition : BinaryExpression.and(having, condition);
        return this;
    }

    public SimpleSelectQuery appendHavingRaw(String sql) {
        return appendHaving(SQLParser.parseExpression(sql));
    }

    @Override
    public SimpleSelectQuery toSimpleQuery() {
        return this;
    }

    // ---------------------------------------------------------------------
    // Clause accessors
    // ---------------------------------------------------------------------

    /**
     * Returns the WITH clause, or null.
     */
    public WithClause getWithClause() {
        return withClause;
    }

    public void setWithClause(WithClause withClause) {
        this.withClause = withClause;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    /**
     * Returns the {@code DISTINCT ON} expressions, empty when the clause is absent.
     */
    public List<ValueExpression> getDistinctOn() {
        return Collections.unmodifiableList(distinctOn);
    }

    public void setDistinctOn(List<ValueExpression> distinctOn) {
        this.distinctOn = distinctOn == null ? new ArrayList<>() : new ArrayList<>(distinctOn);
    }

    public List<SelectItem> getSelectItems() {
        return Collections.unmodifiableList(selectItems);
    }

    public void setSelectItems(List<SelectItem> selectItems) {
        this.selectItems = selectItems == null ? new ArrayList<>() : new ArrayList<>(selectItems);
    }

    public SimpleSelectQuery addSelectItem(SelectItem item) {
        selectItems.add(Objects.requireNonNull(item, "item must not be null"));
        return this;
    }

    public FromClause getFrom() {
        return from;
    }

    public void setFrom(FromClause from) {
        this.from = from;
    }

    public ValueExpression getWhere() {
        return where;
    }

    public void setWhere(ValueExpression where) {
        this.where = where;
    }

    public List<ValueExpression> getGroupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public void setGroupBy(List<ValueExpression> groupBy) {
        this.groupBy = groupBy == null ? new ArrayList<>() : new ArrayList<>(groupBy);
    }

    public ValueExpression getHaving() {
        return having;
    }

    public void setHaving(ValueExpression having) {
        this.having = having;
    }

    public List<OrderByItem> getOrderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public void setOrderBy(List<OrderByItem> orderBy) {
        this.orderBy = orderBy == null ? new ArrayList<>() : new ArrayList<>(orderBy);
    }

    public boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    public ValueExpression getLimit() {
        return limit;
    }

    public void setLimit(ValueExpression limit) {
        this.limit = limit;
    }

    public ValueExpression getOffset() {
        return offset;
    }

    public void setOffset(ValueExpression offset) {
        this.offset = offset;
    }

    @Override
    public String toString() {
        return "SimpleSelectQuery(items=" + selectItems.size()
            + ", ctes=" + getCTENames()
            + ", where=" + (where != null)
            + ", orderBy=" + orderBy.size() + ")";
    }
}
