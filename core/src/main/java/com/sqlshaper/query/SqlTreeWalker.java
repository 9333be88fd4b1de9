package com.sqlshaper.query;

import com.sqlshaper.expression.BetweenExpression;
import com.sqlshaper.expression.BinaryExpression;
import com.sqlshaper.expression.CaseExpression;
import com.sqlshaper.expression.CastExpression;
import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.FunctionCall;
import com.sqlshaper.expression.LiteralValue;
import com.sqlshaper.expression.ParameterExpression;
import com.sqlshaper.expression.ParenExpression;
import com.sqlshaper.expression.SubqueryExpression;
import com.sqlshaper.expression.TupleExpression;
import com.sqlshaper.expression.UnaryExpression;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.expression.WindowFrame;
import com.sqlshaper.expression.WindowSpec;
import com.sqlshaper.model.SqlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Depth-first, left-to-right traversal of a query tree.
 *
 * <p>Nodes are visited in the order the printer emits them: WITH clause, select list,
 * FROM, WHERE, GROUP BY, HAVING, ORDER BY, LIMIT, OFFSET.
 */
public final class SqlTreeWalker {

    private final Consumer<SqlNode> visitor;

    private SqlTreeWalker(Consumer<SqlNode> visitor) {
        this.visitor = visitor;
    }

    /**
     * Visits {@code root} and every node below it.
     */
    public static void walk(SqlNode root, Consumer<SqlNode> visitor) {
        new SqlTreeWalker(visitor).visit(root);
    }

    /**
     * Returns every parameter of the tree in printing order.
     */
    public static List<ParameterExpression> collectParameters(SqlNode root) {
        List<ParameterExpression> parameters = new ArrayList<>();
        walk(root, node -> {
            if (node instanceof ParameterExpression parameter) {
                parameters.add(parameter);
            }
        });
        return parameters;
    }

    private void visit(SqlNode node) {
        if (node == null) {
            return;
        }
        visitor.accept(node);

        if (node instanceof SimpleSelectQuery query) {
            visitSimple(query);
        } else if (node instanceof BinarySelectQuery query) {
            visit(query.getLeft());
            visit(query.getRight());
        } else if (node instanceof ValuesQuery query) {
            query.getTuples().forEach(this::visit);
        } else if (node instanceof WithClause with) {
            with.tables().forEach(this::visit);
        } else if (node instanceof CommonTable table) {
            visit(table.query());
        } else if (node instanceof SelectItem item) {
            visit(item.value());
        } else if (node instanceof FromClause from) {
            visit(from.source());
            from.joins().forEach(this::visit);
        } else if (node instanceof JoinClause join) {
            visit(join.source());
            visit(join.condition());
        } else if (node instanceof SourceExpression source) {
            visitSource(source.source());
        } else if (node instanceof ValueExpression value) {
            visitValue(value);
        } else {
            throw new UnsupportedOperationException(
                "Tree walking not implemented for: " + node.getClass().getSimpleName());
        }
    }

    private void visitSimple(SimpleSelectQuery query) {
        visit(query.getWithClause());
        query.getDistinctOn().forEach(this::visit);
        query.getSelectItems().forEach(this::visit);
        visit(query.getFrom());
        visit(query.getWhere());
        query.getGroupBy().forEach(this::visit);
        visit(query.getHaving());
        visitOrderBy(query.getOrderBy());
        visit(query.getLimit());
        visit(query.getOffset());
    }

    private void visitSource(Source source) {
        if (source instanceof SubQuerySource sub) {
            visit(sub.query());
        } else if (source instanceof FunctionSource function) {
            visit(function.call());
        }
    }

    private void visitOrderBy(List<OrderByItem> items) {
        for (OrderByItem item : items) {
            visit(item.value());
        }
    }

    private void visitValue(ValueExpression value) {
        if (value instanceof BinaryExpression binary) {
            visit(binary.left());
            visit(binary.right());
        } else if (value instanceof UnaryExpression unary) {
            visit(unary.operand());
        } else if (value instanceof FunctionCall call) {
            call.arguments().forEach(this::visit);
            visitWindow(call.window());
        } else if (value instanceof CaseExpression caseExpr) {
            visit(caseExpr.operand());
            for (CaseExpression.WhenThen branch : caseExpr.branches()) {
                visit(branch.when());
                visit(branch.then());
            }
            visit(caseExpr.elseValue());
        } else if (value instanceof TupleExpression tuple) {
            tuple.items().forEach(this::visit);
        } else if (value instanceof SubqueryExpression subquery) {
            visit(subquery.query());
        } else if (value instanceof BetweenExpression between) {
            visit(between.value());
            visit(between.lower());
            visit(between.upper());
        } else if (value instanceof CastExpression cast) {
            visit(cast.value());
        } else if (value instanceof ParenExpression paren) {
            visit(paren.inner());
        } else if (!(value instanceof ColumnReference)
                && !(value instanceof LiteralValue)
                && !(value instanceof ParameterExpression)) {
            throw new UnsupportedOperationException(
                "Tree walking not implemented for: " + value.getClass().getSimpleName());
        }
    }

    private void visitWindow(WindowSpec window) {
        if (window == null) {
            return;
        }
        window.partitionBy().forEach(this::visit);
        visitOrderBy(window.orderBy());
        WindowFrame frame = window.frame();
        if (frame != null) {
            visit(frame.start().offset());
            if (frame.end() != null) {
                visit(frame.end().offset());
            }
        }
    }
}
