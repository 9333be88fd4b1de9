package com.sqlshaper.query;

import com.sqlshaper.expression.FunctionCall;

import java.util.Objects;

/**
 * A table function in FROM, such as {@code generate_series(1, 10)}.
 *
 * @param call the function call
 */
public record FunctionSource(FunctionCall call) implements Source {

    public FunctionSource {
        Objects.requireNonNull(call, "call must not be null");
    }
}
