package com.sqlshaper.printer;

import com.sqlshaper.expression.ParameterExpression;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lays out a {@link SqlPrintToken} tree as text under a {@link FormatStyle}.
 *
 * <p>With a multi-line newline style, clause bodies, subqueries, VALUES lists and CASE
 * branches are indented one level below their keyword; {@link PrintTokenKind#BREAK}
 * tokens start a new line; commas and AND/OR break according to the style. A one-line
 * region (for example a CASE expression with {@code caseOneLine}) suppresses all of
 * that for its contents. With {@link NewlineStyle#SPACE} everything is a single line.
 *
 * <p>A renderer is immutable and can be shared; each {@link #render} call uses its own
 * state.
 */
public final class SQLRenderer {

    private static final Set<ContainerTag> INDENTED = EnumSet.of(
        ContainerTag.SELECT_CLAUSE, ContainerTag.FROM_CLAUSE, ContainerTag.WHERE_CLAUSE,
        ContainerTag.GROUP_BY_CLAUSE, ContainerTag.HAVING_CLAUSE, ContainerTag.ORDER_BY_CLAUSE,
        ContainerTag.SUBQUERY, ContainerTag.INLINE_QUERY, ContainerTag.VALUES_LIST,
        ContainerTag.CASE_EXPRESSION);

    /** Containers whose direct comma children separate list items that may go on their own line. */
    private static final Set<ContainerTag> BREAKABLE_LISTS = EnumSet.of(
        ContainerTag.SELECT_CLAUSE, ContainerTag.FROM_CLAUSE, ContainerTag.GROUP_BY_CLAUSE,
        ContainerTag.ORDER_BY_CLAUSE, ContainerTag.WITH_CLAUSE_BODY, ContainerTag.VALUES_LIST);

    private final FormatStyle style;

    public SQLRenderer(FormatStyle style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    public FormatStyle style() {
        return style;
    }

    /**
     * Renders a token tree.
     *
     * @param root the tree built by {@link PrintTokenBuilder}
     * @return the SQL text and the collected parameter values
     */
    public FormatResult render(SqlPrintToken root) {
        Objects.requireNonNull(root, "root must not be null");
        Session session = new Session();
        session.render(root, 0, null);
        return new FormatResult(session.printer.text(), session.params.toParamList());
    }

    private final class Session {

        private final LinePrinter printer = new LinePrinter();
        private final ParameterCollector params = new ParameterCollector();
        private int oneLineDepth;

        private boolean breaking() {
            return style.newline().isMultiline() && oneLineDepth == 0;
        }

        private void render(SqlPrintToken token, int level, ContainerTag parent) {
            switch (token.kind()) {
                case CONTAINER -> renderContainer(token, level);
                case KEYWORD -> printer.append(applyCase(token.text()));
                case OPERATOR -> renderOperator(token.text(), level);
                case IDENTIFIER -> printer.append(SQLQuoting.quoteIdentifier(token.text(), style.identifierEscape()));
                case VALUE, PARENTHESIS, RAW -> printer.append(token.text());
                case COMMA -> renderComma(level, parent);
                case SPACE -> printer.space();
                case BREAK -> lineBreak(level);
                case PARAMETER -> printer.append(params.placeholder(token.parameterExpression()));
                case COMMENT -> renderComment(token.text(), level);
            }
        }

        private void renderContainer(SqlPrintToken token, int level) {
            ContainerTag tag = token.tag();
            boolean oneLine = isOneLineRegion(tag);
            if (oneLine) {
                oneLineDepth++;
            }
            boolean indent = tag != null && INDENTED.contains(tag) && breaking();
            int childLevel = indent ? level + 1 : level;
            if (indent) {
                printer.newline(childLevel);
            }
            for (SqlPrintToken child : token.children()) {
                render(child, childLevel, tag);
            }
            if (indent) {
                printer.newline(level);
            }
            if (oneLine) {
                oneLineDepth--;
            }
        }

        private void renderOperator(String symbol, int level) {
            boolean word = Character.isLetter(symbol.charAt(0));
            BreakStyle breakStyle = switch (symbol) {
                case "and" -> style.andBreak();
                case "or" -> style.orBreak();
                default -> BreakStyle.NONE;
            };
            if (breakStyle == BreakStyle.BEFORE && breaking()) {
                printer.newline(level);
            }
            printer.append(word ? applyCase(symbol) : symbol);
            if (breakStyle == BreakStyle.AFTER && breaking()) {
                printer.newline(level);
            }
        }

        private void renderComma(int level, ContainerTag parent) {
            boolean breakable = parent != null && BREAKABLE_LISTS.contains(parent) && breaking();
            BreakStyle breakStyle = breakable ? style.commaBreak() : BreakStyle.NONE;
            if (breakStyle == BreakStyle.BEFORE) {
                printer.newline(level);
            }
            printer.append(",");
            if (breakStyle == BreakStyle.AFTER) {
                printer.newline(level);
            }
        }

        private void renderComment(String text, int level) {
            if (!style.exportComment()) {
                return;
            }
            if (breaking()) {
                printer.newline(level);
                printer.append(SQLQuoting.blockComment(text));
                printer.newline(level);
            } else {
                printer.space();
                printer.append(SQLQuoting.blockComment(text));
                printer.space();
            }
        }

        private void lineBreak(int level) {
            if (breaking()) {
                printer.newline(level);
            } else {
                printer.space();
            }
        }

        private boolean isOneLineRegion(ContainerTag tag) {
            if (tag == null) {
                return false;
            }
            return switch (tag) {
                case CASE_EXPRESSION -> style.caseOneLine();
                case JOIN_CLAUSE -> style.joinOneLine();
                case INLINE_QUERY -> style.subqueryOneLine();
                case VALUES_LIST -> style.valuesOneLine();
                case BETWEEN_EXPRESSION -> style.betweenOneLine();
                case PAREN_EXPRESSION -> style.parenthesesOneLine();
                case COMMON_TABLE -> style.withClauseStyle() == WithClauseStyle.CTE_ONELINE;
                case WITH_CLAUSE -> style.withClauseStyle() == WithClauseStyle.FULL_ONELINE;
                default -> false;
            };
        }

        private String applyCase(String text) {
            return switch (style.keywordCase()) {
                case UPPER -> text.toUpperCase(Locale.ROOT);
                case LOWER -> text.toLowerCase(Locale.ROOT);
                case PRESERVE -> text;
            };
        }
    }

    /**
     * Turns parameter nodes into placeholders and records their values.
     */
    private final class ParameterCollector {

        private final List<Object> values = new ArrayList<>();
        private final Map<String, Object> named = new LinkedHashMap<>();
        private int unnamed;

        String placeholder(ParameterExpression parameter) {
            String symbol = style.parameterSymbol();
            String suffix = style.parameterSuffix();
            return switch (style.parameterStyle()) {
                case ANONYMOUS -> {
                    values.add(parameter.value());
                    yield symbol + suffix;
                }
                case INDEXED -> {
                    values.add(parameter.value());
                    yield symbol + values.size() + suffix;
                }
                case NAMED -> {
                    String name = nameOf(parameter);
                    named.putIfAbsent(name, parameter.value());
                    yield symbol + name + suffix;
                }
            };
        }

        private String nameOf(ParameterExpression parameter) {
            if (parameter.name() != null) {
                return parameter.name();
            }
            if (parameter.index() != null) {
                return "param" + parameter.index();
            }
            unnamed++;
            return "param" + unnamed;
        }

        ParamList toParamList() {
            return style.parameterStyle() == ParameterStyle.NAMED
                ? ParamList.named(named)
                : ParamList.positional(values);
        }
    }

    /**
     * Accumulates output lines, each with its own indentation level.
     */
    private final class LinePrinter {

        private final List<Line> lines = new ArrayList<>();
        private Line current = new Line(0);

        LinePrinter() {
            lines.add(current);
        }

        void append(String text) {
            current.text.append(text);
        }

        /**
         * Writes a single space, unless at the start of a line or after another space.
         */
        void space() {
            StringBuilder text = current.text;
            if (text.length() > 0 && text.charAt(text.length() - 1) != ' ') {
                text.append(' ');
            }
        }

        /**
         * Starts a new line at a level; an empty current line is reused.
         */
        void newline(int level) {
            if (current.text.length() == 0) {
                current.level = level;
                return;
            }
            current = new Line(level);
            lines.add(current);
        }

        String text() {
            String indentUnit = String.valueOf(style.indentChar()).repeat(style.indentSize());
            List<String> rendered = new ArrayList<>();
            for (Line line : lines) {
                String text = line.text.toString().stripTrailing();
                if (!text.isEmpty()) {
                    rendered.add(indentUnit.repeat(line.level) + text);
                }
            }
            return String.join(style.newline().separator(), rendered);
        }
    }

    private static final class Line {
        private int level;
        private final StringBuilder text = new StringBuilder();

        Line(int level) {
            this.level = level;
        }
    }
}
