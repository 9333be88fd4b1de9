package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * A string, numeric, boolean or NULL literal.
 *
 * <p>Numeric literals keep their source text so that {@code 1.50} prints back as written.
 */
public final class LiteralValue extends SqlComponent implements ValueExpression {

    public enum Kind { STRING, NUMBER, BOOLEAN, NULL }

    private final Kind kind;
    private final String text;

    private LiteralValue(Kind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = text;
    }

    public static LiteralValue ofString(String value) {
        return new LiteralValue(Kind.STRING, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Creates a numeric literal from its source text.
     *
     * @throws IllegalArgumentException if the text is not a numeral
     */
    public static LiteralValue ofNumber(String numeral) {
        Objects.requireNonNull(numeral, "numeral must not be null");
        if (!numeral.matches("(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?")) {
            throw new IllegalArgumentException("Not a numeric literal: " + numeral);
        }
        return new LiteralValue(Kind.NUMBER, numeral);
    }

    public static LiteralValue of(Number value) {
        return ofNumber(String.valueOf(Objects.requireNonNull(value, "value must not be null")));
    }

    public static LiteralValue ofBoolean(boolean value) {
        return new LiteralValue(Kind.BOOLEAN, value ? "true" : "false");
    }

    public static LiteralValue nullValue() {
        return new LiteralValue(Kind.NULL, "null");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the literal text: the unescaped string content, the numeral as written,
     * {@code true}/{@code false} or {@code null}.
     */
    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LiteralValue)) return false;
        LiteralValue that = (LiteralValue) obj;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "'" + text + "'" : text;
    }
}
