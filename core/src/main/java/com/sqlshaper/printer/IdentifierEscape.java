package com.sqlshaper.printer;

import java.util.Locale;
import java.util.Objects;

/**
 * Delimiters written around identifiers.
 *
 * @param start opening delimiter, empty for none
 * @param end closing delimiter, empty for none
 */
public record IdentifierEscape(String start, String end) {

    public static final IdentifierEscape NONE = new IdentifierEscape("", "");
    public static final IdentifierEscape DOUBLE_QUOTE = new IdentifierEscape("\"", "\"");
    public static final IdentifierEscape BACKTICK = new IdentifierEscape("`", "`");
    public static final IdentifierEscape BRACKET = new IdentifierEscape("[", "]");

    public IdentifierEscape {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    public boolean isNone() {
        return start.isEmpty() && end.isEmpty();
    }

    /**
     * Parses {@code none}, {@code "}, {@code `}, {@code []}, or a two-character start/end pair.
     */
    public static IdentifierEscape parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none", "" -> NONE;
            case "\"", "double-quote" -> DOUBLE_QUOTE;
            case "`", "backtick" -> BACKTICK;
            case "[]", "[", "bracket" -> BRACKET;
            default -> {
                String v = value.trim();
                if (v.length() == 2) {
                    yield new IdentifierEscape(v.substring(0, 1), v.substring(1));
                }
                throw new IllegalArgumentException(
                    "Unknown identifier escape: '%s'. Valid values: none, \", `, []".formatted(value));
            }
        };
    }
}
