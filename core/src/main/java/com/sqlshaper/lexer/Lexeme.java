package com.sqlshaper.lexer;

import java.util.Objects;

/**
 * A classified unit of SQL text.
 *
 * <p>{@code text} is the normalized value: lower-case for keywords, the unescaped name
 * for quoted identifiers, the unescaped content for string literals and the body
 * without delimiters for comments. {@code raw} is the exact source slice.
 *
 * @param kind the lexeme classification
 * @param text the normalized text
 * @param raw the source text as written
 * @param position zero-based character offset in the input
 */
public record Lexeme(LexemeKind kind, String text, String raw, int position) {

    public Lexeme {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    /**
     * Checks whether this lexeme is the given keyword.
     *
     * @param keyword lower-case keyword
     * @return true if this is a keyword lexeme with that text
     */
    public boolean isKeyword(String keyword) {
        return kind == LexemeKind.KEYWORD && text.equals(keyword);
    }

    /**
     * Checks whether this lexeme is the given bare word, reserved or not.
     *
     * <p>Used for contextual words such as {@code materialized} or {@code nulls}
     * that are only special in one position. Quoted identifiers never match.
     *
     * @param word the word, case-insensitive
     * @return true if the unquoted source text equals the word
     */
    public boolean isWord(String word) {
        return (kind == LexemeKind.KEYWORD || kind == LexemeKind.IDENTIFIER)
            && raw.equalsIgnoreCase(word);
    }

    public boolean isOperator(String symbol) {
        return kind == LexemeKind.OPERATOR && text.equals(symbol);
    }

    public boolean isPunctuation(String symbol) {
        return kind == LexemeKind.PUNCTUATION && text.equals(symbol);
    }

    /**
     * Returns true for an identifier written with quote, bracket or backtick delimiters.
     */
    public boolean isQuotedIdentifier() {
        return kind == LexemeKind.IDENTIFIER && !raw.equals(text)
            && !raw.isEmpty() && "\"`[".indexOf(raw.charAt(0)) >= 0;
    }

    @Override
    public String toString() {
        return kind + "(" + raw + ")@" + position;
    }
}
