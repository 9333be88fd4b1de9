package com.sqlshaper.printer;

import com.sqlshaper.test.TestBase;
import com.sqlshaper.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FormatStyle} construction and option parsing.
 */
@DisplayName("FormatStyle Tests")
@TestCategories.Tier1
@TestCategories.Unit
public class FormatStyleTest extends TestBase {

    @Test
    @DisplayName("Defaults describe single-line output")
    void testDefaults() {
        FormatStyle style = FormatStyle.defaults();

        assertThat(style.identifierEscape()).isEqualTo(IdentifierEscape.DOUBLE_QUOTE);
        assertThat(style.parameterStyle()).isEqualTo(ParameterStyle.NAMED);
        assertThat(style.parameterSymbol()).isEqualTo(":");
        assertThat(style.newline()).isEqualTo(NewlineStyle.SPACE);
        assertThat(style.keywordCase()).isEqualTo(KeywordCase.PRESERVE);
        assertThat(style.exportComment()).isFalse();
        assertThat(style.withClauseStyle()).isEqualTo(WithClauseStyle.STANDARD);
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void testToBuilder() {
        FormatStyle pretty = FormatStyle.preset("pretty");

        FormatStyle copy = pretty.toBuilder().exportComment(true).build();

        assertThat(copy.newline()).isEqualTo(NewlineStyle.LF);
        assertThat(copy.indentSize()).isEqualTo(4);
        assertThat(copy.keywordCase()).isEqualTo(KeywordCase.UPPER);
        assertThat(copy.commaBreak()).isEqualTo(BreakStyle.BEFORE);
        assertThat(copy.exportComment()).isTrue();
        assertThat(pretty.exportComment()).isFalse();
    }

    @Test
    @DisplayName("Negative indent size is rejected")
    void testNegativeIndent() {
        assertThatThrownBy(() -> FormatStyle.builder().indentSize(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("indentSize must not be negative: -1");
    }

    @Nested
    @DisplayName("Presets")
    class Presets {

        @ParameterizedTest
        @ValueSource(strings = {"postgres", "postgresWithNamedParams", "mysql", "sqlserver",
            "sqlite", "oracle", "duckdb", "bigquery", "pretty", "  MySQL  "})
        @DisplayName("Known presets resolve")
        void testKnownPresets(String name) {
            assertThat(FormatStyle.preset(name)).isNotNull();
        }

        @Test
        @DisplayName("Preset settings")
        void testPresetSettings() {
            FormatStyle bigquery = FormatStyle.preset("bigquery");

            assertThat(bigquery.identifierEscape()).isEqualTo(IdentifierEscape.BACKTICK);
            assertThat(bigquery.parameterStyle()).isEqualTo(ParameterStyle.NAMED);
            assertThat(bigquery.parameterSymbol()).isEqualTo("@");
            assertThat(FormatStyle.preset("postgres").parameterStyle()).isEqualTo(ParameterStyle.INDEXED);
        }

        @Test
        @DisplayName("Preset names are case-insensitive under any default locale")
        void testPresetNameCase() {
            Locale saved = Locale.getDefault();
            try {
                Locale.setDefault(Locale.forLanguageTag("tr-TR"));

                assertThat(FormatStyle.preset("SQLITE").parameterStyle()).isEqualTo(ParameterStyle.NAMED);
                assertThat(FormatStyle.preset("BIGQUERY").identifierEscape()).isEqualTo(IdentifierEscape.BACKTICK);
            } finally {
                Locale.setDefault(saved);
            }
        }

        @Test
        @DisplayName("Unknown preset lists the valid names")
        void testUnknownPreset() {
            assertThatThrownBy(() -> FormatStyle.preset("db2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unknown format preset: 'db2'. Valid values: postgres");
        }
    }

    @Nested
    @DisplayName("fromOptions")
    class FromOptions {

        @Test
        @DisplayName("Options override the preset")
        void testOverrides() {
            // Given: String options as read from a configuration file
            Map<String, String> options = new LinkedHashMap<>();
            options.put("preset", "mysql");
            options.put("keywordCase", "upper");
            options.put("newline", "crlf");
            options.put("indentChar", "tab");
            options.put("indentSize", "1");
            options.put("andBreak", "after");
            options.put("withClauseStyle", "cte_oneline");
            options.put("caseOneLine", "true");

            // When: Building the style
            FormatStyle style = FormatStyle.fromOptions(options);
            logData("Style", style);

            // Then: Preset settings survive unless overridden
            assertThat(style.identifierEscape()).isEqualTo(IdentifierEscape.BACKTICK);
            assertThat(style.parameterStyle()).isEqualTo(ParameterStyle.ANONYMOUS);
            assertThat(style.keywordCase()).isEqualTo(KeywordCase.UPPER);
            assertThat(style.newline()).isEqualTo(NewlineStyle.CRLF);
            assertThat(style.indentChar()).isEqualTo('\t');
            assertThat(style.indentSize()).isEqualTo(1);
            assertThat(style.andBreak()).isEqualTo(BreakStyle.AFTER);
            assertThat(style.withClauseStyle()).isEqualTo(WithClauseStyle.CTE_ONELINE);
            assertThat(style.caseOneLine()).isTrue();
        }

        @Test
        @DisplayName("Custom identifier escape pairs")
        void testCustomEscape() {
            FormatStyle style = FormatStyle.fromOptions(Map.of("identifierEscape", "<>"));

            assertThat(style.identifierEscape()).isEqualTo(new IdentifierEscape("<", ">"));
            assertThat(SQLQuoting.quoteIdentifier("a>b", style.identifierEscape())).isEqualTo("<a>>b>");
        }

        @Test
        @DisplayName("Literal newline separators are accepted")
        void testLiteralNewline() {
            assertThat(FormatStyle.fromOptions(Map.of("newline", "\n")).newline()).isEqualTo(NewlineStyle.LF);
            assertThat(FormatStyle.fromOptions(Map.of("newline", " ")).newline()).isEqualTo(NewlineStyle.SPACE);
        }

        @Test
        @DisplayName("Unknown keys are rejected")
        void testUnknownKey() {
            assertThatThrownBy(() -> FormatStyle.fromOptions(Map.of("k", "v")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown format option: 'k'");
        }

        @Test
        @DisplayName("Invalid values are rejected with the option name")
        void testInvalidValues() {
            assertThatThrownBy(() -> FormatStyle.fromOptions(Map.of("indentSize", "four")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Option 'indentSize' must be an integer: 'four'");
            assertThatThrownBy(() -> FormatStyle.fromOptions(Map.of("exportComment", "yes")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Option 'exportComment' must be true or false: 'yes'");
            assertThatThrownBy(() -> FormatStyle.fromOptions(Map.of("keywordCase", "title")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown keyword case: 'title'. Valid values: upper, lower, preserve");
        }
    }

    @Nested
    @DisplayName("SQLQuoting")
    class Quoting {

        @Test
        @DisplayName("Identifiers and literals")
        void testQuoting() {
            assertThat(SQLQuoting.quoteIdentifier("my\"col")).isEqualTo("\"my\"\"col\"");
            assertThat(SQLQuoting.quoteIdentifier("col", IdentifierEscape.NONE)).isEqualTo("col");
            assertThat(SQLQuoting.quoteLiteral("O'Reilly")).isEqualTo("'O''Reilly'");
            assertThat(SQLQuoting.quoteLiteral(null)).isEqualTo("null");
            assertThat(SQLQuoting.blockComment("  note */ x ")).isEqualTo("/* note * / x */");
        }

        @Test
        @DisplayName("Empty identifiers are rejected")
        void testEmptyIdentifier() {
            assertThatThrownBy(() -> SQLQuoting.quoteIdentifier(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Identifier cannot be null or empty");
        }
    }
}
