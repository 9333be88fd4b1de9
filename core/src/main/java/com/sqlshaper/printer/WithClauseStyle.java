package com.sqlshaper.printer;

import java.util.Locale;

/**
 * Layout of WITH clauses in multi-line output.
 *
 * <ul>
 *   <li>{@code STANDARD}: CTE bodies are laid out like any other query</li>
 *   <li>{@code CTE_ONELINE}: each CTE body is kept on one line</li>
 *   <li>{@code FULL_ONELINE}: the whole WITH clause is kept on one line</li>
 * </ul>
 */
public enum WithClauseStyle {
    STANDARD, CTE_ONELINE, FULL_ONELINE;

    public static WithClauseStyle parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "standard" -> STANDARD;
            case "cte-oneline" -> CTE_ONELINE;
            case "full-oneline" -> FULL_ONELINE;
            default -> throw new IllegalArgumentException(
                "Unknown WITH clause style: '%s'. Valid values: standard, cte-oneline, full-oneline".formatted(value));
        };
    }
}
