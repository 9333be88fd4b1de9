package com.sqlshaper.lexer;

import com.sqlshaper.exception.SQLLexException;
import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link SQLLexer}.
 */
@DisplayName("SQLLexer Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class SQLLexerTest extends TestBase {

    @Nested
    @DisplayName("Words and punctuation")
    class WordsAndPunctuation {

        @Test
        @DisplayName("Reserved words become lower-case keywords, other words identifiers")
        void testKeywordsAndIdentifiers() {
            List<Lexeme> lexemes = SQLLexer.tokenize("SELECT id, Name FROM users");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text, Lexeme::raw)
                .containsExactly(
                    tuple(LexemeKind.KEYWORD, "select", "SELECT"),
                    tuple(LexemeKind.IDENTIFIER, "id", "id"),
                    tuple(LexemeKind.PUNCTUATION, ",", ","),
                    tuple(LexemeKind.IDENTIFIER, "Name", "Name"),
                    tuple(LexemeKind.KEYWORD, "from", "FROM"),
                    tuple(LexemeKind.IDENTIFIER, "users", "users"));
        }

        @Test
        @DisplayName("Positions are zero-based character offsets")
        void testPositions() {
            List<Lexeme> lexemes = SQLLexer.tokenize("SELECT  id\nFROM t");

            assertThat(lexemes).extracting(Lexeme::position).containsExactly(0, 8, 11, 16);
        }

        @Test
        @DisplayName("Contextual words stay identifiers")
        void testContextualWordsAreIdentifiers() {
            List<Lexeme> lexemes = SQLLexer.tokenize("recursive materialized nulls first rows window");

            assertThat(lexemes).allMatch(l -> l.kind() == LexemeKind.IDENTIFIER);
            assertThat(lexemes.get(1).isWord("MATERIALIZED")).isTrue();
        }

        @Test
        @DisplayName("Whitespace-only input yields no lexemes")
        void testBlankInput() {
            assertThat(SQLLexer.tokenize("  \n\t ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Doubled single quotes are unescaped")
        void testStringEscapes() {
            Lexeme lexeme = SQLLexer.tokenize("'O''Reilly'").get(0);

            assertThat(lexeme.kind()).isEqualTo(LexemeKind.STRING_LITERAL);
            assertThat(lexeme.text()).isEqualTo("O'Reilly");
            assertThat(lexeme.raw()).isEqualTo("'O''Reilly'");
        }

        @Test
        @DisplayName("Dollar-quoted strings keep their body verbatim")
        void testDollarQuoting() {
            List<Lexeme> lexemes = SQLLexer.tokenize("$$it's$$ $tag$a$b$tag$");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.STRING_LITERAL, "it's"),
                    tuple(LexemeKind.STRING_LITERAL, "a$b"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"42", "3.14", ".5", "1e10", "2.5E-3", "7."})
        @DisplayName("Numerals are single numeric lexemes")
        void testNumerals(String numeral) {
            List<Lexeme> lexemes = SQLLexer.tokenize(numeral);

            assertThat(lexemes).hasSize(1);
            assertThat(lexemes.get(0).kind()).isEqualTo(LexemeKind.NUMERIC_LITERAL);
            assertThat(lexemes.get(0).text()).isEqualTo(numeral);
        }

        @Test
        @DisplayName("An exponent marker without digits is not part of the numeral")
        void testIncompleteExponent() {
            List<Lexeme> lexemes = SQLLexer.tokenize("1e");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.NUMERIC_LITERAL, "1"),
                    tuple(LexemeKind.IDENTIFIER, "e"));
        }
    }

    @Nested
    @DisplayName("Quoted identifiers")
    class QuotedIdentifiers {

        @Test
        @DisplayName("Double quotes, brackets and backticks are all identifiers")
        void testQuotingStyles() {
            List<Lexeme> lexemes = SQLLexer.tokenize("\"my \"\"col\"\"\" [order] `select`");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.IDENTIFIER, "my \"col\""),
                    tuple(LexemeKind.IDENTIFIER, "order"),
                    tuple(LexemeKind.IDENTIFIER, "select"));
            assertThat(lexemes).allMatch(Lexeme::isQuotedIdentifier);
        }

        @Test
        @DisplayName("A quoted keyword never matches as a word")
        void testQuotedKeywordIsNotAWord() {
            Lexeme lexeme = SQLLexer.tokenize("\"from\"").get(0);

            assertThat(lexeme.isKeyword("from")).isFalse();
            assertThat(lexeme.isWord("from")).isFalse();
        }
    }

    @Nested
    @DisplayName("Parameters and operators")
    class ParametersAndOperators {

        @Test
        @DisplayName("All parameter markers are recognized")
        void testParameterMarkers() {
            List<Lexeme> lexemes = SQLLexer.tokenize(":id @name $1 ?");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.PARAMETER, ":id"),
                    tuple(LexemeKind.PARAMETER, "@name"),
                    tuple(LexemeKind.PARAMETER, "$1"),
                    tuple(LexemeKind.PARAMETER, "?"));
        }

        @Test
        @DisplayName("Multi-character operators win over their prefixes")
        void testLongestOperatorMatch() {
            List<Lexeme> lexemes = SQLLexer.tokenize("a<=b<>c!=d||e->>f::int>=g");

            assertThat(lexemes)
                .filteredOn(l -> l.kind() == LexemeKind.OPERATOR)
                .extracting(Lexeme::text)
                .containsExactly("<=", "<>", "!=", "||", "->>", "::", ">=");
        }

        @Test
        @DisplayName("A cast is not mistaken for a named parameter")
        void testCastIsNotParameter() {
            List<Lexeme> lexemes = SQLLexer.tokenize("x::text");

            assertThat(lexemes)
                .extracting(Lexeme::kind)
                .containsExactly(LexemeKind.IDENTIFIER, LexemeKind.OPERATOR, LexemeKind.IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("Line and block comments are kept with trimmed bodies")
        void testComments() {
            List<Lexeme> lexemes = SQLLexer.tokenize("-- header\nSELECT /* inline */ 1");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.COMMENT, "header"),
                    tuple(LexemeKind.KEYWORD, "select"),
                    tuple(LexemeKind.COMMENT, "inline"),
                    tuple(LexemeKind.NUMERIC_LITERAL, "1"));
        }

        @Test
        @DisplayName("Block comments do not nest")
        void testFlatBlockComments() {
            List<Lexeme> lexemes = SQLLexer.tokenize("/* a /* b */ 1");

            assertThat(lexemes)
                .extracting(Lexeme::kind, Lexeme::text)
                .containsExactly(
                    tuple(LexemeKind.COMMENT, "a /* b"),
                    tuple(LexemeKind.NUMERIC_LITERAL, "1"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unterminated string reports its start position")
        void testUnterminatedString() {
            assertThatThrownBy(() -> SQLLexer.tokenize("SELECT 'abc"))
                .isInstanceOf(SQLLexException.class)
                .hasMessage("Unterminated string literal at position 7")
                .extracting(e -> ((SQLLexException) e).getPosition())
                .isEqualTo(7);
        }

        @Test
        @DisplayName("Unterminated block comment is rejected")
        void testUnterminatedBlockComment() {
            assertThatThrownBy(() -> SQLLexer.tokenize("SELECT 1 /* open"))
                .isInstanceOf(SQLLexException.class)
                .hasMessage("Unterminated block comment at position 9");
        }

        @Test
        @DisplayName("Unterminated quoted identifier is rejected")
        void testUnterminatedIdentifier() {
            assertThatThrownBy(() -> SQLLexer.tokenize("\"abc"))
                .isInstanceOf(SQLLexException.class)
                .hasMessageStartingWith("Unterminated quoted identifier");
        }

        @Test
        @DisplayName("Unknown characters are rejected")
        void testUnexpectedCharacter() {
            assertThatThrownBy(() -> SQLLexer.tokenize("SELECT #"))
                .isInstanceOf(SQLLexException.class)
                .hasMessage("Unexpected character '#' at position 7");
        }

        @Test
        @DisplayName("Unterminated dollar quote is rejected")
        void testUnterminatedDollarQuote() {
            assertThatThrownBy(() -> SQLLexer.tokenize("$$abc"))
                .isInstanceOf(SQLLexException.class)
                .hasMessage("Unterminated dollar-quoted string at position 0");
        }
    }
}
