package com.sqlshaper.lexer;

/**
 * Classification of a lexeme produced by {@link SQLLexer}.
 */
public enum LexemeKind {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    PARAMETER,
    COMMENT,
    PUNCTUATION
}
