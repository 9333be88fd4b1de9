package com.sqlshaper.printer;

/**
 * Kinds of {@link SqlPrintToken}.
 */
public enum PrintTokenKind {
    /** A keyword; subject to keyword case. */
    KEYWORD,
    /** Literal text: numbers, quoted strings, function and type names. */
    VALUE,
    /** A name; escaped with the style's identifier delimiters. */
    IDENTIFIER,
    /** A symbolic or word operator; word operators follow keyword case. */
    OPERATOR,
    COMMA,
    PARENTHESIS,
    /** A bind parameter; the placeholder depends on the parameter style. */
    PARAMETER,
    /** A comment body; written only when comment export is on. */
    COMMENT,
    /** A separating space; never doubled and never written at the start of a line. */
    SPACE,
    /** A line break in multi-line output, a space otherwise. */
    BREAK,
    /** A group of tokens, tagged for layout. */
    CONTAINER,
    /** Text written as is. */
    RAW
}
