package com.sqlshaper.printer;

import com.sqlshaper.expression.ParameterExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Style-free intermediate representation of formatted SQL.
 *
 * <p>Leaf tokens carry text; container tokens carry children and an optional
 * {@link ContainerTag}. Parameter tokens keep a reference to their
 * {@link ParameterExpression} so the renderer can report bound values.
 */
public final class SqlPrintToken {

    private final PrintTokenKind kind;
    private final String text;
    private final ContainerTag tag;
    private final ParameterExpression parameter;
    private final List<SqlPrintToken> children;

    private SqlPrintToken(PrintTokenKind kind, String text, ContainerTag tag, ParameterExpression parameter) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = text == null ? "" : text;
        this.tag = tag;
        this.parameter = parameter;
        this.children = kind == PrintTokenKind.CONTAINER ? new ArrayList<>() : Collections.emptyList();
    }

    public static SqlPrintToken container(ContainerTag tag) {
        return new SqlPrintToken(PrintTokenKind.CONTAINER, "", tag, null);
    }

    public static SqlPrintToken keyword(String text) {
        return new SqlPrintToken(PrintTokenKind.KEYWORD, text, null, null);
    }

    public static SqlPrintToken value(String text) {
        return new SqlPrintToken(PrintTokenKind.VALUE, text, null, null);
    }

    public static SqlPrintToken identifier(String name) {
        return new SqlPrintToken(PrintTokenKind.IDENTIFIER, name, null, null);
    }

    public static SqlPrintToken operator(String symbol) {
        return new SqlPrintToken(PrintTokenKind.OPERATOR, symbol, null, null);
    }

    public static SqlPrintToken comma() {
        return new SqlPrintToken(PrintTokenKind.COMMA, ",", null, null);
    }

    public static SqlPrintToken parenthesis(String text) {
        return new SqlPrintToken(PrintTokenKind.PARENTHESIS, text, null, null);
    }

    public static SqlPrintToken parameter(ParameterExpression parameter) {
        Objects.requireNonNull(parameter, "parameter must not be null");
        return new SqlPrintToken(PrintTokenKind.PARAMETER, parameter.toString(), null, parameter);
    }

    public static SqlPrintToken comment(String text) {
        return new SqlPrintToken(PrintTokenKind.COMMENT, text, null, null);
    }

    public static SqlPrintToken space() {
        return new SqlPrintToken(PrintTokenKind.SPACE, " ", null, null);
    }

    public static SqlPrintToken lineBreak() {
        return new SqlPrintToken(PrintTokenKind.BREAK, "", null, null);
    }

    public static SqlPrintToken raw(String text) {
        return new SqlPrintToken(PrintTokenKind.RAW, text, null, null);
    }

    public PrintTokenKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    /**
     * Returns the layout tag of a container, or null.
     */
    public ContainerTag tag() {
        return tag;
    }

    public ParameterExpression parameterExpression() {
        return parameter;
    }

    public List<SqlPrintToken> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child to this container.
     *
     * @return this token
     * @throws IllegalStateException if this token is not a container
     */
    public SqlPrintToken add(SqlPrintToken child) {
        if (kind != PrintTokenKind.CONTAINER) {
            throw new IllegalStateException("Only container tokens have children: " + kind);
        }
        children.add(Objects.requireNonNull(child, "child must not be null"));
        return this;
    }

    @Override
    public String toString() {
        if (kind == PrintTokenKind.CONTAINER) {
            return (tag != null ? tag.name() : "CONTAINER") + children;
        }
        return kind + "(" + text + ")";
    }
}
