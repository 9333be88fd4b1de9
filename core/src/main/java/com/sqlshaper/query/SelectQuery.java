package com.sqlshaper.query;

import com.sqlshaper.expression.ParameterExpression;
import com.sqlshaper.model.SqlNode;
import com.sqlshaper.parser.SQLParser;

import java.util.List;

/**
 * Root of every parsed query: a simple SELECT, a set operation or a VALUES list.
 *
 * <p>Set-operation builders never modify their operands' shape; they return a new
 * {@link BinarySelectQuery} with this query on the left.
 */
public sealed interface SelectQuery extends SqlNode
    permits SimpleSelectQuery, BinarySelectQuery, ValuesQuery {

    /**
     * Normalizes this query to a simple SELECT.
     *
     * <p>A {@link SimpleSelectQuery} returns itself. Other shapes return a new query
     * selecting from this one as a derived table.
     */
    SimpleSelectQuery toSimpleQuery();

    default BinarySelectQuery toBinaryQuery(SetOperator operator, SelectQuery right) {
        return new BinarySelectQuery(this, operator, right);
    }

    default BinarySelectQuery toUnion(SelectQuery right) {
        return toBinaryQuery(SetOperator.UNION, right);
    }

    default BinarySelectQuery toUnionAll(SelectQuery right) {
        return toBinaryQuery(SetOperator.UNION_ALL, right);
    }

    default BinarySelectQuery toIntersect(SelectQuery right) {
        return toBinaryQuery(SetOperator.INTERSECT, right);
    }

    default BinarySelectQuery toIntersectAll(SelectQuery right) {
        return toBinaryQuery(SetOperator.INTERSECT_ALL, right);
    }

    default BinarySelectQuery toExcept(SelectQuery right) {
        return toBinaryQuery(SetOperator.EXCEPT, right);
    }

    default BinarySelectQuery toExceptAll(SelectQuery right) {
        return toBinaryQuery(SetOperator.EXCEPT_ALL, right);
    }

    /**
     * Parses {@code sql} as a query and combines it with this one using UNION.
     *
     * @throws com.sqlshaper.exception.SQLParsingException if the fragment is not a valid query
     */
    default BinarySelectQuery unionRaw(String sql) {
        return toUnion(SQLParser.parse(sql));
    }

    default BinarySelectQuery unionAllRaw(String sql) {
        return toUnionAll(SQLParser.parse(sql));
    }

    default BinarySelectQuery intersectRaw(String sql) {
        return toIntersect(SQLParser.parse(sql));
    }

    default BinarySelectQuery intersectAllRaw(String sql) {
        return toIntersectAll(SQLParser.parse(sql));
    }

    default BinarySelectQuery exceptRaw(String sql) {
        return toExcept(SQLParser.parse(sql));
    }

    default BinarySelectQuery exceptAllRaw(String sql) {
        return toExceptAll(SQLParser.parse(sql));
    }

    /**
     * Binds a value to every parameter with the given name in this query tree,
     * including CTE bodies and subqueries.
     *
     * @return this query
     * @throws IllegalArgumentException if no parameter has that name
     */
    default SelectQuery setParameter(String name, Object value) {
        List<ParameterExpression> matches = SqlTreeWalker.collectParameters(this).stream()
            .filter(p -> name.equals(p.name()))
            .toList();
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("Parameter not found: " + name);
        }
        matches.forEach(p -> p.setValue(value));
        return this;
    }
}
