package com.complexity.analyzer.lexer;

/**
 * Raised when the lexer meets a character that no token pattern accepts.
 */
public class LexException extends SourceException {

    private final String character;

    public LexException(String character, int line, int column) {
        super(String.format("Unexpected character '%s' at line %d, column %d", character, line, column),
                line, column);
        this.character = character;
    }

    public String getCharacter() {
        return character;
    }
}
