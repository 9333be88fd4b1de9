package com.sqlshaper.printer;

/**
 * Layout labels for container tokens. Tags have no meaning for the query itself; the
 * renderer uses them to decide indentation, one-line regions and comma breaks.
 */
public enum ContainerTag {
    SELECT_QUERY,
    SELECT_CLAUSE,
    FROM_CLAUSE,
    WHERE_CLAUSE,
    GROUP_BY_CLAUSE,
    HAVING_CLAUSE,
    ORDER_BY_CLAUSE,
    WITH_CLAUSE,
    WITH_CLAUSE_BODY,
    COMMON_TABLE,
    SUBQUERY,
    INLINE_QUERY,
    SET_OPERATION,
    JOIN_CLAUSE,
    JOIN_CONDITION,
    VALUES_LIST,
    CASE_EXPRESSION,
    CASE_WHEN_PAIR,
    CASE_THEN_VALUE,
    CASE_ELSE_VALUE,
    BETWEEN_EXPRESSION,
    PAREN_EXPRESSION,
    FUNCTION_CALL,
    WINDOW_SPEC,
    VALUE_EXPRESSION
}
