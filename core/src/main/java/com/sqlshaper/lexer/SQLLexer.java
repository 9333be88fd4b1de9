package com.sqlshaper.lexer;

import com.sqlshaper.exception.SQLLexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits SQL text into an ordered list of {@link Lexeme}s.
 *
 * <p>The accepted lexical syntax is ANSI SQL plus common PostgreSQL extensions:
 * <ul>
 *   <li>{@code --} line comments and flat {@code /* *}{@code /} block comments</li>
 *   <li>single-quoted strings with {@code ''} escapes and {@code $tag$...$tag$} dollar quoting</li>
 *   <li>identifiers quoted with {@code "..."}, {@code [...]} or backticks</li>
 *   <li>integer, decimal and exponent numerals</li>
 *   <li>parameters {@code :name}, {@code @name}, {@code $1} and {@code ?}</li>
 * </ul>
 *
 * <p>Block comments do not nest. Whitespace is dropped; comments are kept as
 * {@link LexemeKind#COMMENT} lexemes so the parser can attach them to nodes.
 *
 * <p>Instances are single-use and not thread-safe; {@link #tokenize(String)} creates one per call.
 */
public final class SQLLexer {

    private static final String[] OPERATORS = {
        "->>", "::", "<=", ">=", "<>", "!=", "||", "->",
        "+", "-", "*", "/", "%", "^", "=", "<", ">"
    };

    private final String input;
    private int pos;

    private SQLLexer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Tokenizes SQL text.
     *
     * @param sql the SQL text
     * @return immutable list of lexemes in source order
     * @throws SQLLexException on an unterminated literal, identifier or comment, or an unexpected character
     */
    public static List<Lexeme> tokenize(String sql) {
        if (sql == null) {
            throw new NullPointerException("sql must not be null");
        }
        return new SQLLexer(sql).run();
    }

    private List<Lexeme> run() {
        List<Lexeme> lexemes = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            lexemes.add(next());
        }
        return Collections.unmodifiableList(lexemes);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private Lexeme next() {
        int start = pos;
        char c = input.charAt(pos);

        if (c == '-' && peek(1) == '-') {
            return lineComment(start);
        }
        if (c == '/' && peek(1) == '*') {
            return blockComment(start);
        }
        if (c == '\'') {
            return string(start);
        }
        if (c == '"') {
            return quotedIdentifier(start, '"', '"');
        }
        if (c == '`') {
            return quotedIdentifier(start, '`', '`');
        }
        if (c == '[') {
            return quotedIdentifier(start, '[', ']');
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            return number(start);
        }
        if (c == '$') {
            if (Character.isDigit(peek(1))) {
                pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
                return lexeme(LexemeKind.PARAMETER, start);
            }
            return dollarQuoted(start);
        }
        if (c == ':' && isIdentifierStart(peek(1))) {
            return namedParameter(start);
        }
        if (c == '@' && isIdentifierStart(peek(1))) {
            return namedParameter(start);
        }
        if (c == '?') {
            pos++;
            return lexeme(LexemeKind.PARAMETER, start);
        }
        if (isIdentifierStart(c)) {
            return word(start);
        }
        if ("(),.;".indexOf(c) >= 0) {
            pos++;
            return lexeme(LexemeKind.PUNCTUATION, start);
        }
        for (String op : OPERATORS) {
            if (input.startsWith(op, pos)) {
                pos += op.length();
                return lexeme(LexemeKind.OPERATOR, start);
            }
        }
        throw new SQLLexException("Unexpected character '" + c + "'", start);
    }

    private Lexeme lineComment(int start) {
        pos += 2;
        int bodyStart = pos;
        while (pos < input.length() && input.charAt(pos) != '\n' && input.charAt(pos) != '\r') {
            pos++;
        }
        String body = input.substring(bodyStart, pos).trim();
        return new Lexeme(LexemeKind.COMMENT, body, input.substring(start, pos), start);
    }

    private Lexeme blockComment(int start) {
        int end = input.indexOf("*/", pos + 2);
        if (end < 0) {
            throw new SQLLexException("Unterminated block comment", start);
        }
        String body = input.substring(pos + 2, end).trim();
        pos = end + 2;
        return new Lexeme(LexemeKind.COMMENT, body, input.substring(start, pos), start);
    }

    private Lexeme string(int start) {
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    value.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Lexeme(LexemeKind.STRING_LITERAL, value.toString(), input.substring(start, pos), start);
            }
            value.append(c);
            pos++;
        }
        throw new SQLLexException("Unterminated string literal", start);
    }

    private Lexeme dollarQuoted(int start) {
        int tagEnd = pos + 1;
        while (tagEnd < input.length() && isIdentifierPart(input.charAt(tagEnd)) && input.charAt(tagEnd) != '$') {
            tagEnd++;
        }
        if (tagEnd >= input.length() || input.charAt(tagEnd) != '$') {
            throw new SQLLexException("Unexpected character '$'", start);
        }
        String tag = input.substring(pos, tagEnd + 1);
        int bodyStart = tagEnd + 1;
        int close = input.indexOf(tag, bodyStart);
        if (close < 0) {
            throw new SQLLexException("Unterminated dollar-quoted string", start);
        }
        pos = close + tag.length();
        return new Lexeme(LexemeKind.STRING_LITERAL, input.substring(bodyStart, close), input.substring(start, pos), start);
    }

    private Lexeme quotedIdentifier(int start, char open, char close) {
        StringBuilder name = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == close) {
                if (open == close && peek(1) == close) {
                    name.append(close);
                    pos += 2;
                    continue;
                }
                pos++;
                return new Lexeme(LexemeKind.IDENTIFIER, name.toString(), input.substring(start, pos), start);
            }
            name.append(c);
            pos++;
        }
        throw new SQLLexException("Unterminated quoted identifier", start);
    }

    private Lexeme number(int start) {
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.' && peek(1) != '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        return lexeme(LexemeKind.NUMERIC_LITERAL, start);
    }

    private Lexeme namedParameter(int start) {
        pos++;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        return lexeme(LexemeKind.PARAMETER, start);
    }

    private Lexeme word(int start) {
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        String raw = input.substring(start, pos);
        if (SqlKeywords.isReserved(raw)) {
            return new Lexeme(LexemeKind.KEYWORD, raw.toLowerCase(Locale.ROOT), raw, start);
        }
        return new Lexeme(LexemeKind.IDENTIFIER, raw, raw, start);
    }

    private Lexeme lexeme(LexemeKind kind, int start) {
        String raw = input.substring(start, pos);
        return new Lexeme(kind, raw, raw, start);
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
