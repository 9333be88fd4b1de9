package com.sqlshaper.query;

import com.sqlshaper.exception.DuplicateCTEException;
import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.LiteralValue;
import com.sqlshaper.expression.TupleExpression;
import com.sqlshaper.parser.SQLParser;
import com.sqlshaper.printer.SQLFormatter;
import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SelectQuery#toSimpleQuery()} and ORDER BY relocation.
 */
@DisplayName("toSimpleQuery Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class ToSimpleQueryTest extends TestBase {

    @Test
    @DisplayName("A simple query returns itself")
    void testIdentity() {
        SelectQuery query = SQLParser.parse("select id from users");

        assertThat(query.toSimpleQuery()).isSameAs(query);
    }

    @Nested
    @DisplayName("Set operations")
    class SetOperations {

        @Test
        @DisplayName("ORDER BY on the right branch moves to the wrapper")
        void testOrderByRelocation() {
            // Given: SELECT id FROM users UNION SELECT id FROM customers ORDER BY name ASC
            SelectQuery users = SQLParser.parse("SELECT id FROM users");
            SelectQuery customers = SQLParser.parse("SELECT id FROM customers ORDER BY name ASC");
            BinarySelectQuery union = users.toUnion(customers);

            // When: Normalizing to a simple query
            SimpleSelectQuery wrapper = union.toSimpleQuery();

            // Then: The branch loses its ORDER BY and the wrapper sorts
            assertThat(wrapper).isNotSameAs(union);
            assertThat(((SimpleSelectQuery) customers).hasOrderBy()).isFalse();
            assertThat(wrapper.getOrderBy()).containsExactly(
                OrderByItem.of(ColumnReference.of("name"), OrderByItem.Direction.ASC));
            assertThat(SQLFormatter.toSql(wrapper)).isEqualTo(
                "select * from (select \"id\" from \"users\" union select \"id\" from \"customers\") "
                    + "as \"bq\" order by \"name\" asc");
        }

        @Test
        @DisplayName("Without ORDER BY on the right, the left branch is searched")
        void testLeftBranchSearched() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "(select a from t order by a desc) union all select b from u");

            SimpleSelectQuery wrapper = query.toSimpleQuery();

            assertThat(wrapper.getOrderBy()).containsExactly(
                OrderByItem.of(ColumnReference.of("a"), OrderByItem.Direction.DESC));
            assertThat(((SimpleSelectQuery) query.getLeft()).hasOrderBy()).isFalse();
        }

        @Test
        @DisplayName("Nested set operations are searched from the right")
        void testNestedSearch() {
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "select 1 as n union select 2 union select 3 order by n");

            SimpleSelectQuery wrapper = query.toSimpleQuery();

            assertThat(wrapper.getOrderBy()).extracting(OrderByItem::value)
                .containsExactly(ColumnReference.of("n"));
            assertThat(SQLFormatter.toSql(wrapper)).isEqualTo(
                "select * from (select 1 as \"n\" union select 2 union select 3) as \"bq\" order by \"n\"");
        }

        @Test
        @DisplayName("Without any ORDER BY the wrapper is unsorted")
        void testNoOrderBy() {
            SimpleSelectQuery wrapper = SQLParser.parse("select 1 except select 2").toSimpleQuery();

            assertThat(wrapper.hasOrderBy()).isFalse();
            assertThat(wrapper.getFrom().source().alias()).isEqualTo(BinarySelectQuery.DERIVED_ALIAS);
        }

        @Test
        @DisplayName("A WITH on the leftmost branch moves to the wrapper")
        void testWithClauseHoisted() {
            // Given: A top-level WITH, which the parser attaches to the leftmost branch
            BinarySelectQuery query = (BinarySelectQuery) SQLParser.parse(
                "with a as (select 1 as x) select x from a union select x from a");

            // When: Normalizing to a simple query
            SimpleSelectQuery wrapper = query.toSimpleQuery();

            // Then: The CTE is managed on the wrapper and no longer on the branch
            assertThat(wrapper.hasCTE("a")).isTrue();
            assertThat(((SimpleSelectQuery) query.getLeft()).hasCTE("a")).isFalse();
            assertThat(SQLFormatter.toSql(wrapper)).isEqualTo(
                "with \"a\" as (select 1 as \"x\") select * from "
                    + "(select \"x\" from \"a\" union select \"x\" from \"a\") as \"bq\"");
            assertThatThrownBy(() -> wrapper.addCTE("a", SQLParser.parse("select 2")))
                .isInstanceOf(DuplicateCTEException.class)
                .hasMessage("CTE 'a' already exists");
        }

        @Test
        @DisplayName("Branches defining the same CTE name are rejected")
        void testDuplicateBranchCTEs() {
            SelectQuery left = SQLParser.parse("with a as (select 1) select * from a");
            SelectQuery right = SQLParser.parse("with a as (select 2) select * from a");
            BinarySelectQuery union = left.toUnion(right);

            assertThatThrownBy(union::toSimpleQuery)
                .isInstanceOf(DuplicateCTEException.class)
                .hasMessage("CTE 'a' already exists");
        }
    }

    @Nested
    @DisplayName("VALUES")
    class Values {

        @Test
        @DisplayName("Column names become qualified select items")
        void testValuesWithColumns() {
            ValuesQuery values = new ValuesQuery(
                List.of(TupleExpression.of(LiteralValue.of(1), LiteralValue.ofString("a"))),
                List.of("id", "name"));

            SimpleSelectQuery wrapper = values.toSimpleQuery();

            assertThat(wrapper).isNotSameAs(values);
            assertThat(SQLFormatter.toSql(wrapper)).isEqualTo(
                "select \"vq\".\"id\", \"vq\".\"name\" from (values (1, 'a')) as \"vq\"(\"id\", \"name\")");
        }

        @Test
        @DisplayName("Without column names everything is selected")
        void testValuesWithoutColumns() {
            SelectQuery values = SQLParser.parse("values (1), (2)");

            assertThat(SQLFormatter.toSql(values.toSimpleQuery()))
                .isEqualTo("select * from (values (1), (2)) as \"vq\"");
        }

        @Test
        @DisplayName("An empty VALUES list cannot be converted")
        void testEmptyValues() {
            ValuesQuery values = new ValuesQuery(new ArrayList<>());

            assertThatThrownBy(values::toSimpleQuery)
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Column names must match the row width")
        void testColumnCountMismatch() {
            ValuesQuery values = new ValuesQuery(
                List.of(TupleExpression.of(LiteralValue.of(1), LiteralValue.of(2))),
                List.of("only"));

            assertThatThrownBy(values::toSimpleQuery)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("VALUES rows have 2 columns but 1 column names were given");
        }
    }
}
