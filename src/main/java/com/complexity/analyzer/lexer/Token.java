package com.complexity.analyzer.lexer;

import java.util.Locale;
import java.util.Objects;

/**
 * A single lexical token with its source position (1-based line and column).
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;

    public Token(TokenType type, String text, int line, int column) {
        this.type = Objects.requireNonNull(type);
        this.text = Objects.requireNonNull(text);
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /**
     * Lowercased text, used for case-insensitive keyword matching.
     */
    public String getKeyword() {
        return text.toLowerCase(Locale.ROOT);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.ID && getKeyword().equals(keyword);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return line == other.line && column == other.column
                && type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, line, column);
    }

    @Override
    public String toString() {
        return "Token(" + type + ", '" + text + "', " + line + ":" + column + ")";
    }
}
