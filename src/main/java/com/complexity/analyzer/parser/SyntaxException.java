package com.complexity.analyzer.parser;

import com.complexity.analyzer.lexer.SourceException;
import com.complexity.analyzer.lexer.Token;

/**
 * Raised by the parser at the first unmet expectation. There is no recovery:
 * one syntax error rejects the whole file.
 */
public class SyntaxException extends SourceException {

    public static final String END_OF_INPUT = "end of input";

    private final String expected;
    private final String found;
    private final boolean endOfInput;

    public SyntaxException(String expected, Token found) {
        super(String.format("Expected %s, got %s ('%s') at line %d",
                expected, found.getType(), found.getText(), found.getLine()),
                found.getLine(), found.getColumn());
        this.expected = expected;
        this.found = found.getText();
        this.endOfInput = false;
    }

    private SyntaxException(String expected, int line) {
        super(String.format("Expected %s, got %s after line %d", expected, END_OF_INPUT, line), line, -1);
        this.expected = expected;
        this.found = END_OF_INPUT;
        this.endOfInput = true;
    }

    /**
     * @param lastLine line of the last token read, or 1 for empty input
     */
    public static SyntaxException endOfInput(String expected, int lastLine) {
        return new SyntaxException(expected, lastLine);
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public boolean isEndOfInput() {
        return endOfInput;
    }
}
