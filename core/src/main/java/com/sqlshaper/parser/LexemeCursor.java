package com.sqlshaper.parser;

import com.sqlshaper.exception.SQLLexException;
import com.sqlshaper.exception.SQLParsingException;
import com.sqlshaper.lexer.Lexeme;
import com.sqlshaper.lexer.LexemeKind;
import com.sqlshaper.lexer.SQLLexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Left-to-right reader over the lexemes of one statement.
 *
 * <p>Comment lexemes are set aside when the cursor is built: each comment is filed under
 * the next non-comment lexeme, and comments after the last lexeme are filed at the end.
 * The parsers pick them up with {@link #takeComments()} when they create a node; whatever
 * is never picked up is returned by {@link #drainComments()}.
 *
 * <p>The cursor also tracks nesting depth so that deeply nested input fails with a
 * {@link SQLParsingException} instead of exhausting the stack.
 */
final class LexemeCursor {

    private final String sql;
    private final List<Lexeme> lexemes;
    private final List<List<String>> comments;
    private final int maxDepth;
    private int index;
    private int depth;

    private LexemeCursor(String sql, List<Lexeme> all, ParserConfig config) {
        this.sql = sql;
        this.maxDepth = config.maxNestingDepth();
        this.lexemes = new ArrayList<>();
        this.comments = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (Lexeme lexeme : all) {
            if (lexeme.kind() == LexemeKind.COMMENT) {
                pending.add(lexeme.text());
            } else {
                lexemes.add(lexeme);
                comments.add(pending);
                pending = new ArrayList<>();
            }
        }
        comments.add(pending);
    }

    /**
     * Tokenizes {@code sql} and opens a cursor on it.
     *
     * @throws SQLParsingException wrapping the {@link SQLLexException} if tokenizing fails
     */
    static LexemeCursor open(String sql, ParserConfig config) {
        try {
            return new LexemeCursor(sql, SQLLexer.tokenize(sql), config);
        } catch (SQLLexException e) {
            throw new SQLParsingException(e.getMessage(), sql, e.getPosition(), e);
        }
    }

    String sql() {
        return sql;
    }

    boolean atEnd() {
        return index >= lexemes.size();
    }

    /**
     * Returns the current lexeme without consuming it, or null at the end.
     */
    Lexeme peek() {
        return peek(0);
    }

    Lexeme peek(int ahead) {
        int i = index + ahead;
        return i < lexemes.size() ? lexemes.get(i) : null;
    }

    Lexeme next() {
        if (atEnd()) {
            throw error("Unexpected end of input");
        }
        return lexemes.get(index++);
    }

    boolean isKeyword(String keyword) {
        Lexeme current = peek();
        return current != null && current.isKeyword(keyword);
    }

    boolean isWord(String word) {
        Lexeme current = peek();
        return current != null && current.isWord(word);
    }

    boolean isPunctuation(String symbol) {
        Lexeme current = peek();
        return current != null && current.isPunctuation(symbol);
    }

    boolean isOperator(String symbol) {
        Lexeme current = peek();
        return current != null && current.isOperator(symbol);
    }

    boolean isKind(LexemeKind kind) {
        Lexeme current = peek();
        return current != null && current.kind() == kind;
    }

    boolean matchKeyword(String keyword) {
        if (isKeyword(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    boolean matchWord(String word) {
        if (isWord(word)) {
            index++;
            return true;
        }
        return false;
    }

    boolean matchPunctuation(String symbol) {
        if (isPunctuation(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    void expectKeyword(String keyword) {
        if (!matchKeyword(keyword)) {
            throw unexpected("'" + keyword.toUpperCase(Locale.ROOT) + "'");
        }
    }

    void expectWord(String word) {
        if (!matchWord(word)) {
            throw unexpected("'" + word.toUpperCase(Locale.ROOT) + "'");
        }
    }

    void expectPunctuation(String symbol) {
        if (!matchPunctuation(symbol)) {
            throw unexpected("'" + symbol + "'");
        }
    }

    /**
     * Consumes an identifier, quoted or not, and returns its name.
     *
     * @param what description used in the error message, such as "table name"
     */
    String expectIdentifier(String what) {
        if (!isKind(LexemeKind.IDENTIFIER)) {
            throw unexpected(what);
        }
        return next().text();
    }

    /**
     * Returns the comments filed before the current lexeme and forgets them.
     */
    List<String> takeComments() {
        List<String> slot = comments.get(Math.min(index, lexemes.size()));
        if (slot.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> taken = new ArrayList<>(slot);
        slot.clear();
        return taken;
    }

    /**
     * Returns every comment not yet taken, in source order, and forgets them.
     */
    List<String> drainComments() {
        List<String> rest = new ArrayList<>();
        for (List<String> slot : comments) {
            rest.addAll(slot);
            slot.clear();
        }
        return rest;
    }

    void enter() {
        if (++depth > maxDepth) {
            throw error("Maximum nesting depth of " + maxDepth + " exceeded");
        }
    }

    void exit() {
        depth--;
    }

    SQLParsingException unexpected(String expected) {
        Lexeme current = peek();
        String found = current == null ? "end of input" : "'" + current.raw() + "'";
        return error("Expected " + expected + " but found " + found);
    }

    SQLParsingException error(String message) {
        return error(message, null);
    }

    SQLParsingException error(String message, Throwable cause) {
        return new SQLParsingException(message, sql, currentPosition(), cause);
    }

    int currentPosition() {
        Lexeme current = peek();
        return current == null ? sql.length() : current.position();
    }
}
