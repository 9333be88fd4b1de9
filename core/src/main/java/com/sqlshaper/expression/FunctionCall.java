package com.sqlshaper.expression;

import com.sqlshaper.model.SqlComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A function or aggregate call, optionally {@code DISTINCT}-qualified and optionally
 * a window function ({@code OVER (...)} or {@code OVER name}).
 *
 * <p>{@code count(*)} is represented with a single wildcard {@link ColumnReference} argument.
 */
public final class FunctionCall extends SqlComponent implements ValueExpression {

    private final String name;
    private final List<ValueExpression> arguments;
    private final boolean distinct;
    private final WindowSpec window;
    private final String windowName;

    public FunctionCall(String name, List<ValueExpression> arguments, boolean distinct,
                        WindowSpec window, String windowName) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(arguments, "arguments must not be null")));
        this.distinct = distinct;
        if (window != null && windowName != null) {
            throw new IllegalArgumentException("A window function takes either a window specification or a window name");
        }
        this.window = window;
        this.windowName = windowName;
    }

    public FunctionCall(String name, List<ValueExpression> arguments) {
        this(name, arguments, false, null, null);
    }

    public static FunctionCall of(String name, ValueExpression... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    /**
     * Returns the function name as written, possibly schema-qualified ({@code pg_catalog.now}).
     */
    public String name() {
        return name;
    }

    public List<ValueExpression> arguments() {
        return arguments;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Returns the inline window specification, or null.
     */
    public WindowSpec window() {
        return window;
    }

    /**
     * Returns the referenced window name for {@code OVER name}, or null.
     */
    public String windowName() {
        return windowName;
    }

    public boolean isWindowFunction() {
        return window != null || windowName != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return name.equalsIgnoreCase(that.name)
            && arguments.equals(that.arguments)
            && distinct == that.distinct
            && Objects.equals(window, that.window)
            && Objects.equals(windowName, that.windowName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name.toLowerCase(Locale.ROOT), arguments, distinct, window, windowName);
    }

    @Override
    public String toString() {
        return name + "(" + (distinct ? "distinct " : "") + arguments + ")";
    }
}
