package com.complexity.analyzer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts pseudocode source text into an ordered list of tokens.
 *
 * At each position the rules are tried in declaration order and the first one
 * that matches wins. The order is part of the grammar: two-character operators
 * ({@code <-}, {@code <=}, {@code <>}) must be tried before {@code <}, and
 * {@code ..} before {@code .}.
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    private enum Action {
        EMIT, SKIP, NEWLINE
    }

    private static final class Rule {
        final TokenType type;
        final Pattern pattern;
        final Action action;

        Rule(TokenType type, String regex, Action action) {
            this.type = type;
            this.pattern = Pattern.compile(regex);
            this.action = action;
        }
    }

    private static final List<Rule> RULES = List.of(
            // comment marker: ► or //
            new Rule(null, "(?:►|//)[^\n]*", Action.SKIP),
            new Rule(TokenType.STRING, "\"[^\"]*\"", Action.EMIT),
            new Rule(TokenType.NUMBER, "\\d+(?:\\.\\d+)?", Action.EMIT),
            // 🡨, ← or the ASCII forms
            new Rule(TokenType.ASSIGN, "🡨|←|<-|:=", Action.EMIT),
            new Rule(TokenType.LE, "≤|<=", Action.EMIT),
            new Rule(TokenType.GE, "≥|>=", Action.EMIT),
            new Rule(TokenType.NE, "≠|<>", Action.EMIT),
            new Rule(TokenType.EQ, "=", Action.EMIT),
            new Rule(TokenType.LT, "<", Action.EMIT),
            new Rule(TokenType.GT, ">", Action.EMIT),
            new Rule(TokenType.LPAREN, "\\(", Action.EMIT),
            new Rule(TokenType.RPAREN, "\\)", Action.EMIT),
            new Rule(TokenType.LBRACKET, "\\[", Action.EMIT),
            new Rule(TokenType.RBRACKET, "\\]", Action.EMIT),
            new Rule(TokenType.LBRACE, "\\{", Action.EMIT),
            new Rule(TokenType.RBRACE, "\\}", Action.EMIT),
            new Rule(TokenType.DOTDOT, "\\.\\.", Action.EMIT),
            new Rule(TokenType.DOT, "\\.", Action.EMIT),
            new Rule(TokenType.COMMA, ",", Action.EMIT),
            new Rule(TokenType.PLUS, "\\+", Action.EMIT),
            new Rule(TokenType.MINUS, "-", Action.EMIT),
            new Rule(TokenType.MULTIPLY, "\\*", Action.EMIT),
            new Rule(TokenType.DIVIDE, "/", Action.EMIT),
            new Rule(TokenType.MOD, "(?i:mod)" + WORD_END, Action.EMIT),
            new Rule(TokenType.DIV, "(?i:div)" + WORD_END, Action.EMIT),
            // ┌ ⌈ ceil, closed by ┐ ⌉
            new Rule(TokenType.CEIL, "┌|⌈|ceil" + WORD_END, Action.EMIT),
            new Rule(TokenType.CEIL_END, "┐|⌉", Action.EMIT),
            // └ ⌊ floor, closed by ┘ ⌋
            new Rule(TokenType.FLOOR, "└|⌊|floor" + WORD_END, Action.EMIT),
            new Rule(TokenType.FLOOR_END, "┘|⌋", Action.EMIT),
            new Rule(TokenType.ID, "[\\p{L}_][\\p{L}\\p{N}_]*", Action.EMIT),
            new Rule(null, "\n", Action.NEWLINE),
            new Rule(null, "[ \t\r\f]+", Action.SKIP)
    );

    private final String source;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source.
     *
     * @return the tokens in source order, never null
     * @throws LexException at the first character no rule accepts
     */
    public List<Token> tokenize() throws LexException {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int line = 1;
        int column = 1;

        List<Matcher> matchers = new ArrayList<>(RULES.size());
        for (Rule rule : RULES) {
            matchers.add(rule.pattern.matcher(source));
        }

        while (pos < source.length()) {
            boolean matched = false;
            for (int i = 0; i < RULES.size(); i++) {
                Rule rule = RULES.get(i);
                Matcher matcher = matchers.get(i);
                matcher.region(pos, source.length());
                if (!matcher.lookingAt()) {
                    continue;
                }

                String text = matcher.group();
                switch (rule.action) {
                    case EMIT -> {
                        tokens.add(new Token(rule.type, text, line, column));
                        column += text.codePointCount(0, text.length());
                    }
                    case SKIP -> column += text.codePointCount(0, text.length());
                    case NEWLINE -> {
                        line++;
                        column = 1;
                    }
                }
                pos = matcher.end();
                matched = true;
                break;
            }

            if (!matched) {
                String character = new String(Character.toChars(source.codePointAt(pos)));
                throw new LexException(character, line, column);
            }
        }

        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return Collections.unmodifiableList(tokens);
    }
}
