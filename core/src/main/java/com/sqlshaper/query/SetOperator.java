package com.sqlshaper.query;

import java.util.Locale;

/**
 * Set operations combining two queries.
 */
public enum SetOperator {
    UNION("union"),
    UNION_ALL("union all"),
    INTERSECT("intersect"),
    INTERSECT_ALL("intersect all"),
    EXCEPT("except"),
    EXCEPT_ALL("except all");

    private final String keyword;

    SetOperator(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the SQL spelling in lower case, such as {@code union all}.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves an operator from its base keyword and ALL flag.
     *
     * @param base {@code union}, {@code intersect} or {@code except}, case-insensitive
     * @param all whether {@code ALL} follows
     * @throws IllegalArgumentException for an unknown keyword
     */
    public static SetOperator of(String base, boolean all) {
        return switch (base.toLowerCase(Locale.ROOT)) {
            case "union" -> all ? UNION_ALL : UNION;
            case "intersect" -> all ? INTERSECT_ALL : INTERSECT;
            case "except" -> all ? EXCEPT_ALL : EXCEPT;
            default -> throw new IllegalArgumentException(
                "Unknown set operator: '%s'. Valid values: union, intersect, except".formatted(base));
        };
    }
}
