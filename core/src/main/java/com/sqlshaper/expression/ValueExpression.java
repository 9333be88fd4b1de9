package com.sqlshaper.expression;

import com.sqlshaper.model.SqlNode;

/**
 * A value expression: anything that can appear in a select item, a predicate,
 * a function argument or a sort key.
 *
 * <p>The variants are closed; consumers switch over them with pattern matching.
 */
public sealed interface ValueExpression extends SqlNode
    permits ColumnReference, LiteralValue, BinaryExpression, UnaryExpression, FunctionCall,
            CaseExpression, TupleExpression, SubqueryExpression, ParameterExpression,
            BetweenExpression, CastExpression, ParenExpression {
}
