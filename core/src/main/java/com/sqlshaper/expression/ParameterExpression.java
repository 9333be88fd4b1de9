package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.Objects;

/**
 * A bind parameter.
 *
 * <p>A parameter is named ({@code :id}, {@code @id}), positional ({@code $1}) or anonymous
 * ({@code ?}). The placeholder printed for it depends only on the output style, not on the
 * marker it was parsed from. The bound value travels with the node and is reported by the
 * formatter in placeholder order.
 */
public final class ParameterExpression extends SqlComponent implements ValueExpression {

    private final String name;
    private final Integer index;
    private Object value;

    private ParameterExpression(String name, Integer index, Object value) {
        this.name = name;
        this.index = index;
        this.value = value;
    }

    public static ParameterExpression named(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        return new ParameterExpression(name, null, null);
    }

    public static ParameterExpression named(String name, Object value) {
        ParameterExpression parameter = named(name);
        parameter.value = value;
        return parameter;
    }

    public static ParameterExpression positional(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Parameter index must be positive: " + index);
        }
        return new ParameterExpression(null, index, null);
    }

    public static ParameterExpression anonymous() {
        return new ParameterExpression(null, null, null);
    }

    /**
     * Creates a parameter from a source marker: {@code :name}, {@code @name}, {@code $n} or {@code ?}.
     *
     * @throws IllegalArgumentException for an unknown marker
     */
    public static ParameterExpression fromMarker(String marker) {
        Objects.requireNonNull(marker, "marker must not be null");
        if (marker.equals("?")) {
            return anonymous();
        }
        if (marker.length() > 1) {
            char prefix = marker.charAt(0);
            String rest = marker.substring(1);
            if (prefix == ':' || prefix == '@') {
                return named(rest);
            }
            if (prefix == '$' && rest.chars().allMatch(Character::isDigit)) {
                return positional(Integer.parseInt(rest));
            }
        }
        throw new IllegalArgumentException("Unknown parameter marker: " + marker);
    }

    /**
     * Returns the parameter name, or null for positional and anonymous parameters.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the 1-based source index of a {@code $n} parameter, or null.
     */
    public Integer index() {
        return index;
    }

    public Object value() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ParameterExpression)) return false;
        ParameterExpression that = (ParameterExpression) obj;
        return Objects.equals(name, that.name) && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index);
    }

    @Override
    public String toString() {
        if (name != null) return ":" + name;
        if (index != null) return "$" + index;
        return "?";
    }
}
