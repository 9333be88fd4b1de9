package com.sqlshaper.model;

import com.sqlshaper.expression.ColumnReference;
import com.sqlshaper.expression.ValueExpression;
import com.sqlshaper.parser.SQLParser;
import com.sqlshaper.query.SelectQuery;
import com.sqlshaper.query.SimpleSelectQuery;
import com.sqlshaper.query.SqlTreeWalker;
import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for header and positioned comments on AST nodes.
 */
@DisplayName("Positioned Comment Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class PositionedCommentTest extends TestBase {

    @Nested
    @DisplayName("Comment API")
    class CommentApi {

        @Test
        @DisplayName("Comments at the same position merge in attachment order")
        void testMerge() {
            ColumnReference node = ColumnReference.of("id");

            node.addPositionedComments(CommentPosition.BEFORE, List.of("one"));
            node.addPositionedComments(CommentPosition.BEFORE, List.of("two", "three"));

            assertThat(node.getPositionedComments(CommentPosition.BEFORE)).containsExactly("one", "two", "three");
            assertThat(node.getPositionedCommentGroups()).hasSize(1);
        }

        @Test
        @DisplayName("All comments list BEFORE entries first")
        void testAllPositionedCommentsOrder() {
            ColumnReference node = ColumnReference.of("id");

            node.addPositionedComments(CommentPosition.AFTER, List.of("a1"));
            node.addPositionedComments(CommentPosition.BEFORE, List.of("b1"));
            node.addPositionedComments(CommentPosition.AFTER, List.of("a2"));
            node.addPositionedComments(CommentPosition.BEFORE, List.of("b2"));

            assertThat(node.getAllPositionedComments()).containsExactly("b1", "b2", "a1", "a2");
        }

        @Test
        @DisplayName("Empty lists are ignored and missing positions are empty")
        void testEmpty() {
            ColumnReference node = ColumnReference.of("id");

            node.addPositionedComments(CommentPosition.AFTER, List.of());

            assertThat(node.getPositionedCommentGroups()).isEmpty();
            assertThat(node.getPositionedComments(CommentPosition.AFTER)).isEmpty();
            assertThat(node.getAllPositionedComments()).isEmpty();
        }

        @Test
        @DisplayName("Comments do not affect equality")
        void testEqualityIgnoresComments() {
            ColumnReference plain = ColumnReference.of("id");
            ColumnReference commented = ColumnReference.of("id");
            commented.addComment("note");
            commented.addPositionedComments(CommentPosition.BEFORE, List.of("before"));

            assertThat(commented).isEqualTo(plain).hasSameHashCodeAs(plain);
        }
    }

    @Nested
    @DisplayName("Parser capture")
    class ParserCapture {

        @Test
        @DisplayName("Leading comments become header comments")
        void testHeaderComments() {
            SelectQuery query = SQLParser.parse("-- report\n/* daily */ select id from t");

            assertThat(query.getComments()).containsExactly("report", "daily");
            assertThat(query.getAllPositionedComments()).isEmpty();
        }

        @Test
        @DisplayName("Comments inside a clause attach to the nearest expression")
        void testPositionedCapture() {
            // Given: Comments before and after a select item
            SimpleSelectQuery query = (SimpleSelectQuery) SQLParser.parse(
                "select /* key */ id /* end of key */, name from t");

            // When: Looking at the first select item
            ValueExpression first = query.getSelectItems().get(0).value();

            // Then: The comments are positioned on it, not merged into the header
            assertThat(first.getPositionedComments(CommentPosition.BEFORE)).containsExactly("key");
            assertThat(first.getPositionedComments(CommentPosition.AFTER)).containsExactly("end of key");
            assertThat(query.getComments()).isEmpty();
        }

        @Test
        @DisplayName("Comments after THEN attach to the result value")
        void testThenComment() {
            SimpleSelectQuery query = (SimpleSelectQuery) SQLParser.parse(
                "select case when a = 1 then /* one */ 'x' end from t");

            List<String> all = new ArrayList<>();
            SqlTreeWalker.walk(query, node -> all.addAll(node.getAllPositionedComments()));

            assertThat(all).containsExactly("one");
            assertThat(query.getComments()).isEmpty();
        }

        @Test
        @DisplayName("Trailing comments are kept as header comments")
        void testTrailingComment() {
            SelectQuery query = SQLParser.parse("select 1 from t -- done");

            assertThat(query.getComments()).containsExactly("done");
        }
    }
}
