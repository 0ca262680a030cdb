package com.complexity.analyzer.lexer;

/**
 * Base class for errors that make a source file unusable for analysis.
 * Carries the position at which the problem was noticed.
 */
public abstract class SourceException extends Exception {

    private final int line;
    private final int column;

    protected SourceException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return the column, or -1 when only the line is known
     */
    public int getColumn() {
        return column;
    }
}
