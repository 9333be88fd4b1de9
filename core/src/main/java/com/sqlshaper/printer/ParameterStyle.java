package com.sqlshaper.printer;

import java.util.Locale;

/**
 * How bind parameters are written in formatted SQL.
 *
 * <ul>
 *   <li>{@code ANONYMOUS}: the symbol alone, such as {@code ?}</li>
 *   <li>{@code INDEXED}: the symbol and a 1-based occurrence number, such as {@code $1}</li>
 *   <li>{@code NAMED}: the symbol and the parameter name, such as {@code :id}</li>
 * </ul>
 */
public enum ParameterStyle {
    ANONYMOUS, INDEXED, NAMED;

    /**
     * Parses a style name (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ParameterStyle parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "anonymous" -> ANONYMOUS;
            case "indexed" -> INDEXED;
            case "named" -> NAMED;
            default -> throw new IllegalArgumentException(
                "Unknown parameter style: '%s'. Valid values: anonymous, indexed, named".formatted(value));
        };
    }
}
