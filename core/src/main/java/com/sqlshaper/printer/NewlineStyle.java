package com.sqlshaper.printer;

import java.util.Locale;

/**
 * Line separator of formatted SQL. {@code SPACE} produces single-line output.
 */
public enum NewlineStyle {
    SPACE(" "),
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    NewlineStyle(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    public boolean isMultiline() {
        return this != SPACE;
    }

    /**
     * Parses a style name or a literal separator ({@code " "}, {@code "\n"}, {@code "\r\n"}).
     */
    public static NewlineStyle parse(String value) {
        switch (value) {
            case " ":
                return SPACE;
            case "\n":
                return LF;
            case "\r\n":
                return CRLF;
            default:
                break;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "space", "single-space" -> SPACE;
            case "lf" -> LF;
            case "crlf" -> CRLF;
            default -> throw new IllegalArgumentException(
                "Unknown newline style: '%s'. Valid values: space, lf, crlf".formatted(value));
        };
    }
}
