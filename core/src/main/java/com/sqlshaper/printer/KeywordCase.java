package com.sqlshaper.printer;

import java.util.Locale;

/**
 * Letter case applied to keywords and word operators.
 *
 * <p>{@code PRESERVE} prints keywords as the token tree carries them, which is lower case.
 */
public enum KeywordCase {
    UPPER, LOWER, PRESERVE;

    public static KeywordCase parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "upper" -> UPPER;
            case "lower" -> LOWER;
            case "preserve", "none" -> PRESERVE;
            default -> throw new IllegalArgumentException(
                "Unknown keyword case: '%s'. Valid values: upper, lower, preserve".formatted(value));
        };
    }
}
