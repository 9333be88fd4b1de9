package com.sqlshaper.printer;

import java.util.Objects;

/**
 * Formatted SQL text and the parameter values referenced by its placeholders.
 */
public record FormatResult(String sql, ParamList params) {

    public FormatResult {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(params, "params must not be null");
    }
}
