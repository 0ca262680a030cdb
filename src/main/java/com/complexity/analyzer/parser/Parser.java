package com.complexity.analyzer.parser;

import com.complexity.analyzer.ast.*;
import com.complexity.analyzer.lexer.Lexer;
import com.complexity.analyzer.lexer.SourceException;
import com.complexity.analyzer.lexer.Token;
import com.complexity.analyzer.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the pseudocode language.
 *
 * <pre>
 * program     := classDef* procedureDef* ("begin" block "end")?
 * classDef    := "Clase" ID "{" ID* "}"
 * procedure   := ID "(" params? ")" "begin" block "end"
 * statement   := if | for | while | repeat | call | lvalue ASSIGN expression
 * expression  := relational (("and" | "or") relational)*
 * relational  := additive (("<" | ">" | "<=" | ">=" | "=" | "<>") additive)*
 * additive    := term (("+" | "-") term)*
 * term        := unary (("*" | "/" | "mod" | "div") unary)*
 * unary       := ("-" | "not") unary | primary
 * primary     := literal | "(" expression ")" | "length" "(" expression ")"
 *              | ceil | floor | ID ("." ID | "[" expression "]")*
 * </pre>
 *
 * Keywords are matched case-insensitively on identifier tokens. Blocks end,
 * without consuming it, at the first {@code end}, {@code until} or
 * {@code else}; the enclosing production consumes the terminator.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> BLOCK_TERMINATORS = Set.of("end", "until", "else");

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses a whole source text.
     *
     * @param source the pseudocode text
     * @param programName name recorded on the resulting {@link Program}
     * @return the syntax tree
     * @throws SourceException on the first lexical or syntax error
     */
    public static Program parse(String source, String programName) throws SourceException {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parseProgram(programName);
    }

    public Program parseProgram(String programName) throws SyntaxException {
        List<ClassDef> classes = new ArrayList<>();
        List<ProcedureDef> procedures = new ArrayList<>();

        while (checkKeyword("clase")) {
            classes.add(classDef());
        }

        // a procedure definition is an identifier immediately followed by '('
        while (check(TokenType.ID) && checkNext(TokenType.LPAREN)) {
            procedures.add(procedureDef());
        }

        Block mainBlock = Block.empty();
        if (checkKeyword("begin")) {
            advance();
            mainBlock = block();
            consumeKeyword("end");
        }

        if (!isAtEnd()) {
            throw new SyntaxException(SyntaxException.END_OF_INPUT, peek());
        }

        logger.debug("Parsed program '{}': {} classes, {} procedures, {} main statements",
                programName, classes.size(), procedures.size(), mainBlock.getStatements().size());
        return new Program(programName, classes, procedures, mainBlock);
    }

    private ClassDef classDef() throws SyntaxException {
        consumeKeyword("clase");
        String name = consume(TokenType.ID, "class name").getText();
        consume(TokenType.LBRACE, "'{'");

        List<String> attributes = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            attributes.add(consume(TokenType.ID, "attribute name or '}'").getText());
        }
        consume(TokenType.RBRACE, "'}'");
        return new ClassDef(name, attributes);
    }

    private ProcedureDef procedureDef() throws SyntaxException {
        String name = consume(TokenType.ID, "procedure name").getText();
        consume(TokenType.LPAREN, "'('");

        List<Parameter> parameters = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                parameters.add(parameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')'");

        consumeKeyword("begin");
        Block body = block();
        consumeKeyword("end");
        return new ProcedureDef(name, parameters, body);
    }

    private Parameter parameter() throws SyntaxException {
        if (checkKeyword("clase")) {
            advance();
            String className = consume(TokenType.ID, "class name").getText();
            String objectName = consume(TokenType.ID, "object name").getText();
            return Parameter.object(objectName, className);
        }

        String name = consume(TokenType.ID, "parameter name").getText();
        if (!check(TokenType.LBRACKET)) {
            return Parameter.scalar(name);
        }

        // A[n], A[1..n], A[n]..[m], A[n][m]: dimensions are skipped
        while (match(TokenType.LBRACKET)) {
            skipDimension();
            consume(TokenType.RBRACKET, "']'");
            match(TokenType.DOTDOT);
        }
        return Parameter.array(name);
    }

    private void skipDimension() throws SyntaxException {
        int depth = 0;
        while (depth > 0 || !check(TokenType.RBRACKET)) {
            if (isAtEnd()) {
                throw SyntaxException.endOfInput("']'", lastLine());
            }
            Token token = advance();
            if (token.is(TokenType.LBRACKET)) {
                depth++;
            } else if (token.is(TokenType.RBRACKET)) {
                depth--;
            }
        }
    }

    /**
     * Parses statements up to, not including, a block terminator or the end
     * of input.
     */
    private Block block() throws SyntaxException {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd() && !BLOCK_TERMINATORS.contains(peek().getKeyword())) {
            statements.add(statement());
        }
        return new Block(statements);
    }

    private Statement statement() throws SyntaxException {
        Token token = peek();
        if (!token.is(TokenType.ID)) {
            throw new SyntaxException("statement", token);
        }

        switch (token.getKeyword()) {
            case "if":
                return ifStatement();
            case "for":
                return forLoop();
            case "while":
                return whileLoop();
            case "repeat":
                return repeatLoop();
            case "call":
                return call();
            default:
                return assignment();
        }
    }

    private Assignment assignment() throws SyntaxException {
        Token start = peek();
        Expression target = expression();
        if (!(target instanceof Variable || target instanceof ArrayAccess || target instanceof FieldAccess)) {
            throw new SyntaxException("assignable variable, array element or field", start);
        }
        consume(TokenType.ASSIGN, "assignment operator");
        Expression value = expression();
        return new Assignment(target, value);
    }

    private IfStatement ifStatement() throws SyntaxException {
        consumeKeyword("if");
        consume(TokenType.LPAREN, "'(' after 'if'");
        Expression condition = expression();
        consume(TokenType.RPAREN, "')' after if condition");
        consumeKeyword("then");

        Block thenBlock = beginEndBlock();
        Block elseBlock = null;
        if (checkKeyword("else")) {
            advance();
            elseBlock = beginEndBlock();
        }
        return new IfStatement(condition, thenBlock, elseBlock);
    }

    private ForLoop forLoop() throws SyntaxException {
        consumeKeyword("for");
        String variable = consume(TokenType.ID, "loop variable").getText();
        consume(TokenType.ASSIGN, "assignment operator");
        Expression start = expression();
        consumeKeyword("to");
        Expression end = expression();
        consumeKeyword("do");
        Block body = beginEndBlock();
        return new ForLoop(variable, start, end, body);
    }

    private WhileLoop whileLoop() throws SyntaxException {
        consumeKeyword("while");
        consume(TokenType.LPAREN, "'(' after 'while'");
        Expression condition = expression();
        consume(TokenType.RPAREN, "')' after while condition");
        consumeKeyword("do");
        Block body = beginEndBlock();
        return new WhileLoop(condition, body);
    }

    private RepeatLoop repeatLoop() throws SyntaxException {
        consumeKeyword("repeat");
        Block body;
        if (checkKeyword("begin")) {
            body = beginEndBlock();
        } else {
            body = block();
        }
        consumeKeyword("until");
        consume(TokenType.LPAREN, "'(' after 'until'");
        Expression condition = expression();
        consume(TokenType.RPAREN, "')' after until condition");
        return new RepeatLoop(condition, body);
    }

    private Call call() throws SyntaxException {
        consumeKeyword("call");
        String name = consume(TokenType.ID, "procedure name").getText();
        consume(TokenType.LPAREN, "'(' after procedure name");
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' after arguments");
        return new Call(name, arguments);
    }

    private Block beginEndBlock() throws SyntaxException {
        consumeKeyword("begin");
        Block block = block();
        consumeKeyword("end");
        return block;
    }

    // Expressions

    private Expression expression() throws SyntaxException {
        Expression left = relational();
        while (checkKeyword("and") || checkKeyword("or")) {
            String operator = advance().getKeyword();
            Expression right = relational();
            left = new BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression relational() throws SyntaxException {
        Expression left = additive();
        while (!isAtEnd() && peek().getType().isRelational()) {
            String operator = operatorText(advance());
            Expression right = additive();
            left = new BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression additive() throws SyntaxException {
        Expression left = term();
        while (!isAtEnd() && peek().getType().isAdditive()) {
            String operator = operatorText(advance());
            Expression right = term();
            left = new BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression term() throws SyntaxException {
        Expression left = unary();
        while (!isAtEnd() && peek().getType().isMultiplicative()) {
            String operator = operatorText(advance());
            Expression right = unary();
            left = new BinaryOp(left, operator, right);
        }
        return left;
    }

    private Expression unary() throws SyntaxException {
        if (match(TokenType.MINUS)) {
            return new UnaryOp("-", unary());
        }
        if (checkKeyword("not")) {
            advance();
            return new UnaryOp("not", unary());
        }
        return primary();
    }

    private Expression primary() throws SyntaxException {
        if (isAtEnd()) {
            throw SyntaxException.endOfInput("expression", lastLine());
        }

        Token token = peek();
        switch (token.getType()) {
            case LPAREN: {
                advance();
                Expression inner = expression();
                consume(TokenType.RPAREN, "')'");
                return inner;
            }
            case NUMBER:
                advance();
                return new Literal(token.getText(),
                        token.getText().contains(".") ? LiteralKind.REAL : LiteralKind.INTEGER);
            case STRING:
                advance();
                return new Literal(token.getText(), LiteralKind.STRING);
            case CEIL:
                return rounding("ceil", TokenType.CEIL_END);
            case FLOOR:
                return rounding("floor", TokenType.FLOOR_END);
            case ID:
                return identifierExpression();
            default:
                throw new SyntaxException("expression", token);
        }
    }

    private Expression identifierExpression() throws SyntaxException {
        Token token = peek();
        switch (token.getKeyword()) {
            case "length":
                if (checkNext(TokenType.LPAREN)) {
                    advance();
                    advance();
                    Expression argument = expression();
                    consume(TokenType.RPAREN, "')' after length argument");
                    return new UnaryOp("length", argument);
                }
                break;
            case "true":
            case "false":
                advance();
                return new Literal(token.getKeyword(), LiteralKind.BOOLEAN);
            case "null":
                advance();
                return new Literal(token.getKeyword(), LiteralKind.NULL);
            default:
                break;
        }

        advance();
        Expression expression = new Variable(token.getText());
        while (true) {
            if (match(TokenType.DOT)) {
                String field = consume(TokenType.ID, "field name").getText();
                expression = new FieldAccess(expression.toString(), field);
            } else if (match(TokenType.LBRACKET)) {
                Expression index = expression();
                consume(TokenType.RBRACKET, "']'");
                expression = new ArrayAccess(expression.toString(), index);
            } else {
                return expression;
            }
        }
    }

    /**
     * {@code ceil(x)} / {@code floor(x)} in word form, {@code ┌x┐} / {@code └x┘}
     * in glyph form.
     */
    private Expression rounding(String operator, TokenType closing) throws SyntaxException {
        Token opening = advance();
        Expression operand;
        if (opening.getKeyword().equals(operator)) {
            consume(TokenType.LPAREN, "'(' after '" + operator + "'");
            operand = expression();
            consume(TokenType.RPAREN, "')'");
        } else {
            operand = expression();
            consume(closing, "closing " + operator + " bracket");
        }
        return new UnaryOp(operator, operand);
    }

    private static String operatorText(Token token) {
        switch (token.getType()) {
            case LE:
                return "<=";
            case GE:
                return ">=";
            case NE:
                return "<>";
            case MOD:
            case DIV:
                return token.getKeyword();
            default:
                return token.getText();
        }
    }

    // Token stream helpers

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return isAtEnd() ? null : tokens.get(current);
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private int lastLine() {
        if (tokens.isEmpty()) {
            return 1;
        }
        int last = Math.max(0, Math.min(current, tokens.size()) - 1);
        return tokens.get(last).getLine();
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().is(type);
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(type);
    }

    private boolean checkKeyword(String keyword) {
        return !isAtEnd() && peek().isKeyword(keyword);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) throws SyntaxException {
        if (isAtEnd()) {
            throw SyntaxException.endOfInput(expected, lastLine());
        }
        if (!peek().is(type)) {
            throw new SyntaxException(expected, peek());
        }
        return advance();
    }

    private void consumeKeyword(String keyword) throws SyntaxException {
        String expected = "keyword '" + keyword + "'";
        if (isAtEnd()) {
            throw SyntaxException.endOfInput(expected, lastLine());
        }
        if (!peek().isKeyword(keyword)) {
            throw new SyntaxException(expected, peek());
        }
        advance();
    }
}
