package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Locale;
import java.util.Objects;

/**
 * A type conversion, kept in the syntax it was written in.
 */
public final class CastExpression extends SqlComponent implements ValueExpression {

    public enum Syntax {
        /** {@code value::type} */
        DOUBLE_COLON,
        /** {@code CAST(value AS type)} */
        CAST_FUNCTION,
        /** {@code type 'literal'}, such as {@code date '2024-01-01'} */
        TYPED_LITERAL
    }

    private final ValueExpression value;
    private final String typeName;
    private final Syntax syntax;

    public CastExpression(ValueExpression value, String typeName, Syntax syntax) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
        if (syntax == Syntax.TYPED_LITERAL
                && !(value instanceof LiteralValue lit && lit.kind() == LiteralValue.Kind.STRING)) {
            throw new IllegalArgumentException("A typed literal requires a string literal value");
        }
    }

    public ValueExpression value() {
        return value;
    }

    /**
     * Returns the target type as written, such as {@code numeric(10, 2)}.
     */
    public String typeName() {
        return typeName;
    }

    public Syntax syntax() {
        return syntax;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return value.equals(that.value) && typeName.equalsIgnoreCase(that.typeName) && syntax == that.syntax;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, typeName.toLowerCase(Locale.ROOT), syntax);
    }

    @Override
    public String toString() {
        return "CAST(" + value + " AS " + typeName + ")";
    }
}
