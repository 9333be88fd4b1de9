package com.sqlshaper.printer;

import java.util.Locale;

/**
 * Where a line break goes around a comma or a logical operator in multi-line output.
 */
public enum BreakStyle {
    NONE, BEFORE, AFTER;

    public static BreakStyle parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "before" -> BEFORE;
            case "after" -> AFTER;
            default -> throw new IllegalArgumentException(
                "Unknown break style: '%s'. Valid values: none, before, after".formatted(value));
        };
    }
}
