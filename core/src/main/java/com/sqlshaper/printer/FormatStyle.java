package com.sqlshaper.printer;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable output style for {@link SQLFormatter}.
 *
 * <p>The default style writes single-line SQL with double-quoted identifiers,
 * {@code :name} parameters and keywords as emitted (lower case):
 * <pre>
 *   select "id" from "users" where "id" = :id
 * </pre>
 *
 * <p>Styles are built with {@link #builder()}, taken from a named dialect preset
 * ({@link #preset(String)}), or read from string options ({@link #fromOptions(Map)}).
 */
public final class FormatStyle {

    private static final FormatStyle DEFAULT = builder().build();

    private final IdentifierEscape identifierEscape;
    private final ParameterStyle parameterStyle;
    private final String parameterSymbol;
    private final String parameterSuffix;
    private final char indentChar;
    private final int indentSize;
    private final NewlineStyle newline;
    private final KeywordCase keywordCase;
    private final BreakStyle commaBreak;
    private final BreakStyle andBreak;
    private final BreakStyle orBreak;
    private final boolean exportComment;
    private final WithClauseStyle withClauseStyle;
    private final boolean caseOneLine;
    private final boolean joinOneLine;
    private final boolean subqueryOneLine;
    private final boolean valuesOneLine;
    private final boolean betweenOneLine;
    private final boolean parenthesesOneLine;

    private FormatStyle(Builder b) {
        this.identifierEscape = b.identifierEscape;
        this.parameterStyle = b.parameterStyle;
        this.parameterSymbol = b.parameterSymbol;
        this.parameterSuffix = b.parameterSuffix;
        this.indentChar = b.indentChar;
        this.indentSize = b.indentSize;
        this.newline = b.newline;
        this.keywordCase = b.keywordCase;
        this.commaBreak = b.commaBreak;
        this.andBreak = b.andBreak;
        this.orBreak = b.orBreak;
        this.exportComment = b.exportComment;
        this.withClauseStyle = b.withClauseStyle;
        this.caseOneLine = b.caseOneLine;
        this.joinOneLine = b.joinOneLine;
        this.subqueryOneLine = b.subqueryOneLine;
        this.valuesOneLine = b.valuesOneLine;
        this.betweenOneLine = b.betweenOneLine;
        this.parenthesesOneLine = b.parenthesesOneLine;
    }

    public static FormatStyle defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this style's settings.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.identifierEscape = identifierEscape;
        b.parameterStyle = parameterStyle;
        b.parameterSymbol = parameterSymbol;
        b.parameterSuffix = parameterSuffix;
        b.indentChar = indentChar;
        b.indentSize = indentSize;
        b.newline = newline;
        b.keywordCase = keywordCase;
        b.commaBreak = commaBreak;
        b.andBreak = andBreak;
        b.orBreak = orBreak;
        b.exportComment = exportComment;
        b.withClauseStyle = withClauseStyle;
        b.caseOneLine = caseOneLine;
        b.joinOneLine = joinOneLine;
        b.subqueryOneLine = subqueryOneLine;
        b.valuesOneLine = valuesOneLine;
        b.betweenOneLine = betweenOneLine;
        b.parenthesesOneLine = parenthesesOneLine;
        return b;
    }

    /**
     * Returns a named dialect preset.
     *
     * <ul>
     *   <li>{@code postgres}: {@code "id"}, {@code $1}</li>
     *   <li>{@code postgresWithNamedParams}: {@code "id"}, {@code :id}</li>
     *   <li>{@code mysql}: {@code `id`}, {@code ?}</li>
     *   <li>{@code sqlserver}: {@code [id]}, {@code @id}</li>
     *   <li>{@code sqlite}, {@code oracle}: {@code "id"}, {@code :id}</li>
     *   <li>{@code duckdb}: {@code "id"}, {@code ?}</li>
     *   <li>{@code bigquery}: {@code `id`}, {@code @id}</li>
     *   <li>{@code pretty}: multi-line, four-space indent, upper-case keywords, leading commas</li>
     * </ul>
     *
     * @throws IllegalArgumentException for an unknown preset name
     */
    public static FormatStyle preset(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "postgres" -> builder()
                .identifierEscape(IdentifierEscape.DOUBLE_QUOTE).parameter(ParameterStyle.INDEXED, "$").build();
            case "postgreswithnamedparams" -> builder()
                .identifierEscape(IdentifierEscape.DOUBLE_QUOTE).parameter(ParameterStyle.NAMED, ":").build();
            case "mysql" -> builder()
                .identifierEscape(IdentifierEscape.BACKTICK).parameter(ParameterStyle.ANONYMOUS, "?").build();
            case "sqlserver" -> builder()
                .identifierEscape(IdentifierEscape.BRACKET).parameter(ParameterStyle.NAMED, "@").build();
            case "sqlite", "oracle" -> builder()
                .identifierEscape(IdentifierEscape.DOUBLE_QUOTE).parameter(ParameterStyle.NAMED, ":").build();
            case "duckdb" -> builder()
                .identifierEscape(IdentifierEscape.DOUBLE_QUOTE).parameter(ParameterStyle.ANONYMOUS, "?").build();
            case "bigquery" -> builder()
                .identifierEscape(IdentifierEscape.BACKTICK).parameter(ParameterStyle.NAMED, "@").build();
            case "pretty" -> builder()
                .newline(NewlineStyle.LF).indent(' ', 4).keywordCase(KeywordCase.UPPER)
                .commaBreak(BreakStyle.BEFORE).andBreak(BreakStyle.BEFORE).build();
            default -> throw new IllegalArgumentException(
                ("Unknown format preset: '%s'. Valid values: postgres, postgresWithNamedParams, mysql, "
                    + "sqlserver, sqlite, oracle, duckdb, bigquery, pretty").formatted(name));
        };
    }

    /**
     * Builds a style from string options, as read from a configuration file.
     *
     * <p>A {@code preset} key selects the starting point; every other key overrides one setting.
     * Recognized keys: {@code preset}, {@code identifierEscape}, {@code parameterStyle},
     * {@code parameterSymbol}, {@code parameterSuffix}, {@code indentChar}, {@code indentSize},
     * {@code newline}, {@code keywordCase}, {@code commaBreak}, {@code andBreak}, {@code orBreak},
     * {@code exportComment}, {@code withClauseStyle}, {@code caseOneLine}, {@code joinOneLine},
     * {@code subqueryOneLine}, {@code valuesOneLine}, {@code betweenOneLine},
     * {@code parenthesesOneLine}.
     *
     * @throws IllegalArgumentException for an unknown key or an invalid value
     */
    public static FormatStyle fromOptions(Map<String, String> options) {
        Objects.requireNonNull(options, "options must not be null");
        String preset = options.get("preset");
        Builder b = preset == null ? builder() : preset(preset).toBuilder();
        for (Map.Entry<String, String> option : options.entrySet()) {
            String value = Objects.requireNonNull(option.getValue(), "value of option " + option.getKey());
            switch (option.getKey()) {
                case "preset" -> { }
                case "identifierEscape" -> b.identifierEscape(IdentifierEscape.parse(value));
                case "parameterStyle" -> b.parameterStyle(ParameterStyle.parse(value));
                case "parameterSymbol" -> b.parameterSymbol(value);
                case "parameterSuffix" -> b.parameterSuffix(value);
                case "indentChar" -> b.indentChar(parseIndentChar(value));
                case "indentSize" -> b.indentSize(parseInt(option.getKey(), value));
                case "newline" -> b.newline(NewlineStyle.parse(value));
                case "keywordCase" -> b.keywordCase(KeywordCase.parse(value));
                case "commaBreak" -> b.commaBreak(BreakStyle.parse(value));
                case "andBreak" -> b.andBreak(BreakStyle.parse(value));
                case "orBreak" -> b.orBreak(BreakStyle.parse(value));
                case "exportComment" -> b.exportComment(parseBoolean(option.getKey(), value));
                case "withClauseStyle" -> b.withClauseStyle(WithClauseStyle.parse(value));
                case "caseOneLine" -> b.caseOneLine(parseBoolean(option.getKey(), value));
                case "joinOneLine" -> b.joinOneLine(parseBoolean(option.getKey(), value));
                case "subqueryOneLine" -> b.subqueryOneLine(parseBoolean(option.getKey(), value));
                case "valuesOneLine" -> b.valuesOneLine(parseBoolean(option.getKey(), value));
                case "betweenOneLine" -> b.betweenOneLine(parseBoolean(option.getKey(), value));
                case "parenthesesOneLine" -> b.parenthesesOneLine(parseBoolean(option.getKey(), value));
                default -> throw new IllegalArgumentException("Unknown format option: '" + option.getKey() + "'");
            }
        }
        return b.build();
    }

    private static char parseIndentChar(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "space", " " -> ' ';
            case "tab", "\t" -> '\t';
            case "", "none" -> ' ';
            default -> throw new IllegalArgumentException(
                "Unknown indent character: '%s'. Valid values: space, tab".formatted(value));
        };
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + key + "' must be an integer: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException("Option '" + key + "' must be true or false: '" + value + "'");
        };
    }

    public IdentifierEscape identifierEscape() {
        return identifierEscape;
    }

    public ParameterStyle parameterStyle() {
        return parameterStyle;
    }

    public String parameterSymbol() {
        return parameterSymbol;
    }

    public String parameterSuffix() {
        return parameterSuffix;
    }

    public char indentChar() {
        return indentChar;
    }

    public int indentSize() {
        return indentSize;
    }

    public NewlineStyle newline() {
        return newline;
    }

    public KeywordCase keywordCase() {
        return keywordCase;
    }

    public BreakStyle commaBreak() {
        return commaBreak;
    }

    public BreakStyle andBreak() {
        return andBreak;
    }

    public BreakStyle orBreak() {
        return orBreak;
    }

    public boolean exportComment() {
        return exportComment;
    }

    public WithClauseStyle withClauseStyle() {
        return withClauseStyle;
    }

    public boolean caseOneLine() {
        return caseOneLine;
    }

    public boolean joinOneLine() {
        return joinOneLine;
    }

    public boolean subqueryOneLine() {
        return subqueryOneLine;
    }

    public boolean valuesOneLine() {
        return valuesOneLine;
    }

    public boolean betweenOneLine() {
        return betweenOneLine;
    }

    public boolean parenthesesOneLine() {
        return parenthesesOneLine;
    }

    @Override
    public String toString() {
        return "FormatStyle(escape=" + identifierEscape + ", parameters=" + parameterStyle + " '" + parameterSymbol
            + "', newline=" + newline + ", indent=" + indentSize + ", keywordCase=" + keywordCase + ")";
    }

    /**
     * Builder for {@link FormatStyle}. Unset options keep their defaults.
     */
    public static final class Builder {

        private IdentifierEscape identifierEscape = IdentifierEscape.DOUBLE_QUOTE;
        private ParameterStyle parameterStyle = ParameterStyle.NAMED;
        private String parameterSymbol = ":";
        private String parameterSuffix = "";
        private char indentChar = ' ';
        private int indentSize = 0;
        private NewlineStyle newline = NewlineStyle.SPACE;
        private KeywordCase keywordCase = KeywordCase.PRESERVE;
        private BreakStyle commaBreak = BreakStyle.NONE;
        private BreakStyle andBreak = BreakStyle.NONE;
        private BreakStyle orBreak = BreakStyle.NONE;
        private boolean exportComment = false;
        private WithClauseStyle withClauseStyle = WithClauseStyle.STANDARD;
        private boolean caseOneLine;
        private boolean joinOneLine;
        private boolean subqueryOneLine;
        private boolean valuesOneLine;
        private boolean betweenOneLine;
        private boolean parenthesesOneLine;

        private Builder() {
        }

        public Builder identifierEscape(IdentifierEscape identifierEscape) {
            this.identifierEscape = Objects.requireNonNull(identifierEscape, "identifierEscape must not be null");
            return this;
        }

        public Builder parameter(ParameterStyle style, String symbol) {
            return parameterStyle(style).parameterSymbol(symbol);
        }

        public Builder parameterStyle(ParameterStyle parameterStyle) {
            this.parameterStyle = Objects.requireNonNull(parameterStyle, "parameterStyle must not be null");
            return this;
        }

        public Builder parameterSymbol(String parameterSymbol) {
            this.parameterSymbol = Objects.requireNonNull(parameterSymbol, "parameterSymbol must not be null");
            return this;
        }

        /**
         * Sets text written after each placeholder, for templates like {@code ${name}}.
         */
        public Builder parameterSuffix(String parameterSuffix) {
            this.parameterSuffix = Objects.requireNonNull(parameterSuffix, "parameterSuffix must not be null");
            return this;
        }

        public Builder indent(char indentChar, int indentSize) {
            return indentChar(indentChar).indentSize(indentSize);
        }

        public Builder indentChar(char indentChar) {
            this.indentChar = indentChar;
            return this;
        }

        public Builder indentSize(int indentSize) {
            if (indentSize < 0) {
                throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
            }
            this.indentSize = indentSize;
            return this;
        }

        public Builder newline(NewlineStyle newline) {
            this.newline = Objects.requireNonNull(newline, "newline must not be null");
            return this;
        }

        public Builder keywordCase(KeywordCase keywordCase) {
            this.keywordCase = Objects.requireNonNull(keywordCase, "keywordCase must not be null");
            return this;
        }

        public Builder commaBreak(BreakStyle commaBreak) {
            this.commaBreak = Objects.requireNonNull(commaBreak, "commaBreak must not be null");
            return this;
        }

        public Builder andBreak(BreakStyle andBreak) {
            this.andBreak = Objects.requireNonNull(andBreak, "andBreak must not be null");
            return this;
        }

        public Builder orBreak(BreakStyle orBreak) {
            this.orBreak = Objects.requireNonNull(orBreak, "orBreak must not be null");
            return this;
        }

        public Builder exportComment(boolean exportComment) {
            this.exportComment = exportComment;
            return this;
        }

        public Builder withClauseStyle(WithClauseStyle withClauseStyle) {
            this.withClauseStyle = Objects.requireNonNull(withClauseStyle, "withClauseStyle must not be null");
            return this;
        }

        public Builder caseOneLine(boolean caseOneLine) {
            this.caseOneLine = caseOneLine;
            return this;
        }

        public Builder joinOneLine(boolean joinOneLine) {
            this.joinOneLine = joinOneLine;
            return this;
        }

        public Builder subqueryOneLine(boolean subqueryOneLine) {
            this.subqueryOneLine = subqueryOneLine;
            return this;
        }

        public Builder valuesOneLine(boolean valuesOneLine) {
            this.valuesOneLine = valuesOneLine;
            return this;
        }

        public Builder betweenOneLine(boolean betweenOneLine) {
            this.betweenOneLine = betweenOneLine;
            return this;
        }

        public Builder parenthesesOneLine(boolean parenthesesOneLine) {
            this.parenthesesOneLine = parenthesesOneLine;
            return this;
        }

        public FormatStyle build() {
            return new FormatStyle(this);
        }
    }
}
