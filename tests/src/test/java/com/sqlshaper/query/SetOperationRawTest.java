package com.sqlshaper.query;

import com.sqlshaper.exception.SQLParsingException;
import com.sqlshaper.parser.SQLParser;
import com.sqlshaper.printer.SQLFormatter;
import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.function.BiFunction;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the set-operation builders and their raw SQL variants.
 */
@DisplayName("Set Operation Builder Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class SetOperationRawTest extends TestBase {

    static Stream<Arguments> rawBuilders() {
        return Stream.of(
            Arguments.of(SetOperator.UNION, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::unionRaw),
            Arguments.of(SetOperator.UNION_ALL, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::unionAllRaw),
            Arguments.of(SetOperator.INTERSECT, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::intersectRaw),
            Arguments.of(SetOperator.INTERSECT_ALL, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::intersectAllRaw),
            Arguments.of(SetOperator.EXCEPT, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::exceptRaw),
            Arguments.of(SetOperator.EXCEPT_ALL, (BiFunction<SelectQuery, String, BinarySelectQuery>) SelectQuery::exceptAllRaw));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("rawBuilders")
    @DisplayName("Raw builders put the parsed fragment on the right")
    void testRawBuilders(SetOperator operator, BiFunction<SelectQuery, String, BinarySelectQuery> builder) {
        // Given: A base query
        SelectQuery base = SQLParser.parse("select id from users");

        // When: Combining it with a raw fragment
        BinarySelectQuery result = builder.apply(base, "select id from admins");

        // Then: The base is the left operand and the fragment the right
        assertThat(result.getLeft()).isSameAs(base);
        assertThat(result.getOperator()).isEqualTo(operator);
        assertThat(result.getRight()).isInstanceOf(SimpleSelectQuery.class);
        assertThat(SQLFormatter.toSql(result)).isEqualTo(
            "select \"id\" from \"users\" " + operator.keyword() + " select \"id\" from \"admins\"");
    }

    @Test
    @DisplayName("Chained builders associate to the left")
    void testChaining() {
        BinarySelectQuery query = SQLParser.parse("select 1")
            .unionAllRaw("select 2")
            .exceptRaw("select 3");

        assertThat(query.getLeft()).isInstanceOf(BinarySelectQuery.class);
        assertThat(SQLFormatter.toSql(query)).isEqualTo("select 1 union all select 2 except select 3");
    }

    @Test
    @DisplayName("A UNION combined by INTERSECT keeps its grouping")
    void testIntersectOverUnion() {
        BinarySelectQuery query = SQLParser.parse("select 1").unionRaw("select 2").intersectRaw("select 3");

        String sql = SQLFormatter.toSql(query);
        logData("SQL", sql);

        assertThat(sql).isEqualTo("(select 1 union select 2) intersect select 3");
        BinarySelectQuery reparsed = (BinarySelectQuery) SQLParser.parse(sql);
        assertThat(reparsed.getOperator()).isEqualTo(SetOperator.INTERSECT);
        assertThat(reparsed.getLeft()).isInstanceOf(BinarySelectQuery.class);
    }

    @Test
    @DisplayName("A set operation on the right is parenthesized")
    void testRightBranchParenthesized() {
        SelectQuery right = SQLParser.parse("select 2 union select 3");
        BinarySelectQuery query = SQLParser.parse("select 1").toExcept(right);

        assertThat(SQLFormatter.toSql(query)).isEqualTo("select 1 except (select 2 union select 3)");
    }

    @Test
    @DisplayName("A left branch with ORDER BY is parenthesized")
    void testLeftOrderByParenthesized() {
        BinarySelectQuery query = SQLParser.parse("select a from t order by a limit 1").unionRaw("select b from u");

        assertThat(SQLFormatter.toSql(query))
            .isEqualTo("(select \"a\" from \"t\" order by \"a\" limit 1) union select \"b\" from \"u\"");
    }

    @Test
    @DisplayName("An invalid fragment is rejected")
    void testInvalidFragment() {
        SelectQuery base = SQLParser.parse("select 1");

        assertThatThrownBy(() -> base.unionRaw("select from"))
            .isInstanceOf(SQLParsingException.class);
        assertThatThrownBy(() -> base.exceptRaw("delete from t"))
            .isInstanceOf(SQLParsingException.class);
    }
}
