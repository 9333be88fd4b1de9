package com.sqlshaper.lexer;

import java.util.Locale;
import java.util.Set;

/**
 * Reserved words of the supported SELECT grammar.
 *
 * <p>Only reserved words are lexed as {@link LexemeKind#KEYWORD}. Words that are
 * special in a single position ({@code recursive}, {@code materialized},
 * {@code nulls}, {@code first}, {@code rows}, ...) stay identifiers and are
 * recognized by the parser through {@link Lexeme#isWord(String)}, so they remain
 * usable as column names.
 */
public final class SqlKeywords {

    private static final Set<String> RESERVED = Set.of(
        "select", "from", "where", "group", "by", "having", "order", "limit", "offset",
        "union", "intersect", "except", "all", "distinct", "on", "using",
        "join", "inner", "left", "right", "full", "outer", "cross", "natural",
        "as", "with", "not", "and", "or", "is", "null", "in", "between", "like", "ilike",
        "exists", "case", "when", "then", "else", "end", "cast", "values",
        "true", "false", "over", "asc", "desc", "lateral"
    );

    private SqlKeywords() {
        // Utility class
    }

    /**
     * Checks whether a bare word is reserved.
     *
     * @param word the word in any case
     * @return true if reserved
     */
    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word.toLowerCase(Locale.ROOT));
    }
}
