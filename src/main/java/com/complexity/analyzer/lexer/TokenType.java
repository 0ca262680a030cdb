package com.complexity.analyzer.lexer;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 * Keywords are not distinguished here; they are lexed as {@link #ID} and
 * recognized by the parser through their lowercased text.
 */
public enum TokenType {
    STRING,
    NUMBER,
    ASSIGN,
    LE,
    GE,
    NE,
    EQ,
    LT,
    GT,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    DOTDOT,
    DOT,
    COMMA,
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MOD,
    DIV,
    CEIL,
    CEIL_END,
    FLOOR,
    FLOOR_END,
    ID;

    public boolean isRelational() {
        return this == LT || this == GT || this == LE || this == GE || this == EQ || this == NE;
    }

    public boolean isAdditive() {
        return this == PLUS || this == MINUS;
    }

    public boolean isMultiplicative() {
        return this == MULTIPLY || this == DIVIDE || this == MOD || this == DIV;
    }
}
