package com.sqlshaper.parser;

import com.sqlshaper.expression.BinaryExpression;
import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.FunctionCall;
import com.sqlshaper.expression.LiteralValue;
import com.sqlshaper.query.BinarySelectQuery;
import com.sqlshaper.query.CommonTable;
import com.sqlshaper.query.FunctionSource;
import com.sqlshaper.query.JoinClause;
import com.sqlshaper.query.OrderByItem;
import com.sqlshaper.query.SelectItem;
import com.sqlshaper.query.SelectQuery;
import com.sqlshaper.query.SetOperator;
import com.sqlshaper.query.SimpleSelectQuery;
import com.sqlshaper.query.SourceExpression;
import com.sqlshaper.query.SubQuerySource;
import com.sqlshaper.query.TableSource;
import com.sqlshaper.query.ValuesQuery;
import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for statement parsing through {@link SQLParser#parse(String)}.
 */
@DisplayName("Statement Parser Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class SelectQueryParserTest extends TestBase {

    private static SimpleSelectQuery parseSimple(String sql) {
        SelectQuery query = SQLParser.parse(sql);
        assertThat(query).isInstanceOf(SimpleSelectQuery.class);
        return (SimpleSelectQuery) query;
    }

    @Nested
    @DisplayName("SELECT clauses")
    class SelectClauses {

        @Test
        @DisplayName("All clauses in order")
        void testAllClauses() {
            // Given: A query using every clause
            String sql = "SELECT dept, count(*) AS n FROM emp WHERE active = true "
                + "GROUP BY dept HAVING count(*) > 1 ORDER BY n DESC LIMIT 10 OFFSET 20";

            // When: Parsing
            SimpleSelectQuery query = parseSimple(sql);

            // Then: Every clause is populated
            assertThat(query.getSelectItems()).extracting(SelectItem::alias).containsExactly(null, "n");
            assertThat(query.getFrom().source().source()).isEqualTo(TableSource.of("emp"));
            assertThat(query.getWhere()).isEqualTo(
                BinaryExpression.equal(ColumnReference.of("active"), LiteralValue.ofBoolean(true)));
            assertThat(query.getGroupBy()).containsExactly(ColumnReference.of("dept"));
            assertThat(query.getHaving()).isInstanceOf(BinaryExpression.class);
            assertThat(query.getOrderBy()).containsExactly(
                OrderByItem.of(ColumnReference.of("n"), OrderByItem.Direction.DESC));
            assertThat(query.getLimit()).isEqualTo(LiteralValue.ofNumber("10"));
            assertThat(query.getOffset()).isEqualTo(LiteralValue.ofNumber("20"));
        }

        @Test
        @DisplayName("Aliases with and without AS")
        void testAliases() {
            SimpleSelectQuery query = parseSimple("select a as x, b y, \"c\" from t");

            assertThat(query.getSelectItems()).extracting(SelectItem::alias).containsExactly("x", "y", null);
        }

        @Test
        @DisplayName("DISTINCT and DISTINCT ON")
        void testDistinct() {
            SimpleSelectQuery distinct = parseSimple("select distinct a from t");
            SimpleSelectQuery distinctOn = parseSimple("select distinct on (a, b) a, c from t");

            assertThat(distinct.isDistinct()).isTrue();
            assertThat(distinctOn.isDistinct()).isFalse();
            assertThat(distinctOn.getDistinctOn()).containsExactly(ColumnReference.of("a"), ColumnReference.of("b"));
        }

        @Test
        @DisplayName("OFFSET may precede LIMIT")
        void testOffsetBeforeLimit() {
            SimpleSelectQuery query = parseSimple("select a from t offset 5 rows limit 2");

            assertThat(query.getLimit()).isEqualTo(LiteralValue.ofNumber("2"));
            assertThat(query.getOffset()).isEqualTo(LiteralValue.ofNumber("5"));
        }

        @Test
        @DisplayName("SELECT without FROM")
        void testSelectWithoutFrom() {
            SimpleSelectQuery query = parseSimple("select 1;");

            assertThat(query.getFrom()).isNull();
            assertThat(query.getSelectItems()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("FROM and joins")
    class FromAndJoins {

        @Test
        @DisplayName("Join types with ON and USING")
        void testJoins() {
            SimpleSelectQuery query = parseSimple(
                "select * from users u "
                    + "join orders o on o.user_id = u.id "
                    + "left outer join payments p using (order_id) "
                    + "cross join regions");

            List<JoinClause> joins = query.getFrom().joins();
            assertThat(joins).extracting(JoinClause::type).containsExactly(
                JoinClause.JoinType.JOIN, JoinClause.JoinType.LEFT_OUTER_JOIN, JoinClause.JoinType.CROSS_JOIN);
            assertThat(joins.get(0).condition()).isInstanceOf(BinaryExpression.class);
            assertThat(joins.get(1).usingColumns()).containsExactly("order_id");
            assertThat(joins.get(2).condition()).isNull();
            assertThat(query.getFrom().source().alias()).isEqualTo("u");
        }

        @Test
        @DisplayName("Comma-separated sources and NATURAL joins")
        void testCommaAndNatural() {
            SimpleSelectQuery query = parseSimple("select * from a, b natural join c");

            List<JoinClause> joins = query.getFrom().joins();
            assertThat(joins.get(0).type()).isEqualTo(JoinClause.JoinType.COMMA);
            assertThat(joins.get(1).isNatural()).isTrue();
        }

        @Test
        @DisplayName("Derived table with column aliases")
        void testDerivedTable() {
            SimpleSelectQuery query = parseSimple("select x from (select 1, 2) as d(x, y)");

            SourceExpression source = query.getFrom().source();
            assertThat(source.source()).isInstanceOf(SubQuerySource.class);
            assertThat(source.alias()).isEqualTo("d");
            assertThat(source.columnAliases()).containsExactly("x", "y");
        }

        @Test
        @DisplayName("Schema-qualified tables and table functions")
        void testQualifiedAndFunctionSources() {
            SimpleSelectQuery qualified = parseSimple("select * from public.users");
            SimpleSelectQuery function = parseSimple("select * from generate_series(1, 10) as g");

            assertThat(qualified.getFrom().source().source())
                .isEqualTo(new TableSource(List.of("public"), "users"));
            assertThat(function.getFrom().source().source()).isInstanceOf(FunctionSource.class);
            assertThat(((FunctionSource) function.getFrom().source().source()).call())
                .isEqualTo(FunctionCall.of("generate_series", LiteralValue.ofNumber("1"), LiteralValue.ofNumber("10")));
        }

        @Test
        @DisplayName("LATERAL subquery join")
        void testLateral() {
            SimpleSelectQuery query = parseSimple(
                "select * from users u left join lateral (select * from orders o where o.uid = u.id) x on true");

            JoinClause join = query.getFrom().joins().get(0);
            assertThat(join.isLateral()).isTrue();
            assertThat(join.source().alias()).isEqualTo("x");
        }
    }

    @Nested
    @DisplayName("WITH clause")
    class WithClauses {

        @Test
        @DisplayName("CTEs keep order, column lists and materialization hints")
        void testCommonTables() {
            SimpleSelectQuery query = parseSimple(
                "WITH a AS (SELECT 1), b(x) AS MATERIALIZED (SELECT 2), c AS NOT MATERIALIZED (SELECT 3) "
                    + "SELECT * FROM a");

            assertThat(query.getCTENames()).containsExactly("a", "b", "c");
            List<CommonTable> tables = query.getWithClause().tables();
            assertThat(tables.get(0).materialized()).isNull();
            assertThat(tables.get(1).materialized()).isTrue();
            assertThat(tables.get(1).columnAliases()).containsExactly("x");
            assertThat(tables.get(2).materialized()).isFalse();
        }

        @Test
        @DisplayName("RECURSIVE flag")
        void testRecursive() {
            SimpleSelectQuery query = parseSimple(
                "with recursive t(n) as (select 1 union all select n + 1 from t where n < 5) select n from t");

            assertThat(query.getWithClause().isRecursive()).isTrue();
            assertThat(query.getWithClause().find("t").query()).isInstanceOf(BinarySelectQuery.class);
        }

        @Test
        @DisplayName("WITH in front of a set operation belongs to the leftmost SELECT")
        void testWithBeforeSetOperation() {
            SelectQuery query = SQLParser.parse("with a as (select 1) select * from a union select 2");

            assertThat(query).isInstanceOf(BinarySelectQuery.class);
            SimpleSelectQuery left = (SimpleSelectQuery) ((BinarySelectQuery) query).getLeft();
            assertThat(left.hasCTE("a")).isTrue();
        }
    }

    @Nested
    @DisplayName("Set operations and VALUES")
    class SetOperations {

        @Test
        @DisplayName("Set operations chain to the left")
        void testLeftDeepChain() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "select 1 union all select 2 except select 3");

            assertThat(query.getOperator()).isEqualTo(SetOperator.EXCEPT);
            assertThat(query.getLeft()).isInstanceOf(BinarySelectQuery.class);
            assertThat(((BinarySelectQuery) query.getLeft()).getOperator()).isEqualTo(SetOperator.UNION_ALL);
        }

        @Test
        @DisplayName("INTERSECT binds tighter than UNION")
        void testIntersectPrecedence() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "select 1 union select 2 intersect select 3");

            assertThat(query.getOperator()).isEqualTo(SetOperator.UNION);
            assertThat(query.getLeft()).isInstanceOf(SimpleSelectQuery.class);
            assertThat(((BinarySelectQuery) query.getRight()).getOperator()).isEqualTo(SetOperator.INTERSECT);
        }

        @Test
        @DisplayName("Parenthesized branches group explicitly")
        void testParenthesizedBranch() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "select 1 intersect (select 2 union select 3)");

            assertThat(query.getOperator()).isEqualTo(SetOperator.INTERSECT);
            assertThat(query.getRight()).isInstanceOf(BinarySelectQuery.class);
        }

        @Test
        @DisplayName("UNION DISTINCT is plain UNION")
        void testUnionDistinct() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse("select 1 union distinct select 2");

            assertThat(query.getOperator()).isEqualTo(SetOperator.UNION);
        }

        @Test
        @DisplayName("VALUES lists")
        void testValues() {
            SelectQuery query = SQLParser.parse("values (1, 'a'), (2, 'b')");

            assertThat(query).isInstanceOf(ValuesQuery.class);
            assertThat(((ValuesQuery) query).getTuples()).hasSize(2);
        }
    }

    @Test
    @DisplayName("canParse reports success without throwing")
    void testCanParse() {
        assertThat(SQLParser.canParse("select 1")).isTrue();
        assertThat(SQLParser.canParse("select from where")).isFalse();
        assertThat(SQLParser.canParse("select 'open")).isFalse();
    }
}
