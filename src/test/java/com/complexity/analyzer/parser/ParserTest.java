package com.complexity.analyzer.parser;

import com.complexity.analyzer.ast.*;
import com.complexity.analyzer.lexer.SourceException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static Program parse(String source) throws SourceException {
        return Parser.parse(source, "Test");
    }

    private static Statement firstMainStatement(String source) throws SourceException {
        return parse(source).getMainBlock().getStatements().get(0);
    }

    private static Expression assignedValue(String expression) throws SourceException {
        Statement statement = firstMainStatement("begin x <- " + expression + " end");
        return ((Assignment) statement).getValue();
    }

    @Test
    void parsesProcedureWithSingleAssignment() throws SourceException {
        Program program = parse("p() begin x <- 1 end");

        assertEquals("Test", program.getName());
        assertEquals(1, program.getProcedures().size());
        assertTrue(program.getMainBlock().isEmpty());

        ProcedureDef procedure = program.getProcedures().get(0);
        assertEquals("p", procedure.getName());
        assertTrue(procedure.getParameters().isEmpty());
        assertEquals(1, procedure.getBody().getStatements().size());

        Assignment assignment = (Assignment) procedure.getBody().getStatements().get(0);
        assertEquals("x", assignment.getTargetText());
        Literal value = (Literal) assignment.getValue();
        assertEquals("1", value.getValue());
        assertEquals(LiteralKind.INTEGER, value.getKind());
    }

    @Test
    void emptySourceIsAnEmptyProgram() throws SourceException {
        Program program = parse("");
        assertTrue(program.getClasses().isEmpty());
        assertTrue(program.getProcedures().isEmpty());
        assertTrue(program.getMainBlock().isEmpty());
    }

    @Test
    void parsesClassDefinitions() throws SourceException {
        Program program = parse("Clase Casa {area color}\nclase Vacia {}");

        assertEquals(2, program.getClasses().size());
        ClassDef casa = program.getClasses().get(0);
        assertEquals("Casa", casa.getName());
        assertEquals(List.of("area", "color"), casa.getAttributes());
        assertTrue(program.getClasses().get(1).getAttributes().isEmpty());
    }

    @Test
    void parsesScalarArrayAndObjectParameters() throws SourceException {
        Program program = parse("ordenar(A[1..n]..[1..m], n, B[n][m], Clase Casa c) begin end");

        List<Parameter> parameters = program.getProcedures().get(0).getParameters();
        assertEquals(4, parameters.size());

        assertEquals("A", parameters.get(0).getName());
        assertEquals(ParameterKind.ARRAY, parameters.get(0).getKind());
        assertEquals(ParameterKind.SCALAR, parameters.get(1).getKind());
        assertEquals(ParameterKind.ARRAY, parameters.get(2).getKind());

        Parameter object = parameters.get(3);
        assertEquals("c", object.getName());
        assertEquals(ParameterKind.OBJECT, object.getKind());
        assertEquals("Casa", object.getClassName().orElseThrow());
        assertTrue(parameters.get(1).getClassName().isEmpty());
    }

    @Test
    void parsesProceduresThenMainBlock() throws SourceException {
        Program program = parse("a() begin end\nb(x) begin call a() end\nbegin call b(1) end");

        assertEquals(2, program.getProcedures().size());
        Call call = (Call) program.getMainBlock().getStatements().get(0);
        assertEquals("b", call.getProcedureName());
        assertEquals(1, call.getArguments().size());
    }

    @Test
    void keywordsAreCaseInsensitive() throws SourceException {
        Program program = parse("BEGIN FOR i <- 1 TO n DO Begin x <- i End END");
        assertTrue(program.getMainBlock().getStatements().get(0) instanceof ForLoop);
    }

    @Test
    void parsesIfWithAndWithoutElse() throws SourceException {
        IfStatement withElse = (IfStatement) firstMainStatement(
                "begin if (x > 0) then begin y <- 1 end else begin y <- 2 end end");
        assertEquals("(x > 0)", withElse.getCondition().toString());
        assertEquals(1, withElse.getThenBlock().getStatements().size());
        assertTrue(withElse.getElseBlock().isPresent());

        IfStatement withoutElse = (IfStatement) firstMainStatement("begin if (x > 0) then begin end end");
        assertTrue(withoutElse.getThenBlock().isEmpty());
        assertTrue(withoutElse.getElseBlock().isEmpty());
    }

    @Test
    void parsesForLoop() throws SourceException {
        ForLoop loop = (ForLoop) firstMainStatement("begin for i 🡨 1 to n - 1 do begin s <- s + A[i] end end");

        assertEquals("i", loop.getVariable());
        assertEquals("1", loop.getStart().toString());
        assertEquals("(n - 1)", loop.getEnd().toString());
        assertEquals(1, loop.getBody().getStatements().size());
    }

    @Test
    void parsesWhileAndRepeatLoops() throws SourceException {
        WhileLoop whileLoop = (WhileLoop) firstMainStatement("begin while (i ≤ n) do begin i <- i + 1 end end");
        assertEquals("(i <= n)", whileLoop.getCondition().toString());

        RepeatLoop bare = (RepeatLoop) firstMainStatement("begin repeat i <- i + 1 j <- j until (i > n) end");
        assertEquals(2, bare.getBody().getStatements().size());
        assertEquals("(i > n)", bare.getCondition().toString());

        RepeatLoop wrapped = (RepeatLoop) firstMainStatement("begin repeat begin i <- i + 1 end until (i > n) end");
        assertEquals(1, wrapped.getBody().getStatements().size());
    }

    @Test
    void assignsToArrayElementsAndFields() throws SourceException {
        Block block = parse("begin A[i] <- 0 c.area <- 5 end").getMainBlock();

        Assignment toArray = (Assignment) block.getStatements().get(0);
        assertTrue(toArray.getTarget() instanceof ArrayAccess);
        assertEquals("A[i]", toArray.getTargetText());

        Assignment toField = (Assignment) block.getStatements().get(1);
        assertTrue(toField.getTarget() instanceof FieldAccess);
        assertEquals("c.area", toField.getTargetText());
    }

    @Test
    void multiplicationBindsTighterThanAddition() throws SourceException {
        BinaryOp sum = (BinaryOp) assignedValue("a + b * c");
        assertEquals("+", sum.getOperator());
        assertTrue(sum.getLeft() instanceof Variable);
        BinaryOp product = (BinaryOp) sum.getRight();
        assertEquals("*", product.getOperator());
    }

    @Test
    void relationalBindsLooserThanArithmeticAndTighterThanLogical() throws SourceException {
        BinaryOp and = (BinaryOp) assignedValue("a < b + 1 and not c");
        assertEquals("and", and.getOperator());
        assertEquals("(a < (b + 1))", and.getLeft().toString());
        assertEquals("not c", and.getRight().toString());
    }

    @Test
    void parenthesesOverridePrecedence() throws SourceException {
        assertEquals("((a + b) * c)", assignedValue("(a + b) * c").toString());
    }

    @Test
    void glyphOperatorsAreNormalized() throws SourceException {
        assertEquals("<=", ((BinaryOp) assignedValue("a ≤ b")).getOperator());
        assertEquals(">=", ((BinaryOp) assignedValue("a ≥ b")).getOperator());
        assertEquals("<>", ((BinaryOp) assignedValue("a ≠ b")).getOperator());
        assertEquals("mod", ((BinaryOp) assignedValue("a MOD b")).getOperator());
        assertEquals("div", ((BinaryOp) assignedValue("a Div b")).getOperator());
    }

    @Test
    void parsesSuffixChains() throws SourceException {
        FieldAccess access = (FieldAccess) assignedValue("a.b[i].c");
        assertEquals("a.b[i]", access.getBaseText());
        assertEquals("c", access.getFieldName());

        ArrayAccess matrix = (ArrayAccess) assignedValue("M[i][j + 1]");
        assertEquals("M[i]", matrix.getBaseText());
        assertEquals("(j + 1)", matrix.getIndex().toString());
    }

    @Test
    void parsesLengthCeilAndFloor() throws SourceException {
        UnaryOp length = (UnaryOp) assignedValue("length(A)");
        assertEquals("length", length.getOperator());
        assertTrue(length.getOperand() instanceof Variable);

        assertEquals("floor", ((UnaryOp) assignedValue("└(a + b) / 2┘")).getOperator());
        assertEquals("floor", ((UnaryOp) assignedValue("floor(n / 2)")).getOperator());
        assertEquals("ceil", ((UnaryOp) assignedValue("⌈n / 2⌉")).getOperator());
    }

    @Test
    void lengthWithoutParenthesesIsAVariable() throws SourceException {
        assertTrue(assignedValue("length + 1") instanceof BinaryOp);
    }

    @Test
    void parsesLiterals() throws SourceException {
        assertEquals(LiteralKind.REAL, ((Literal) assignedValue("3.5")).getKind());
        assertEquals(LiteralKind.STRING, ((Literal) assignedValue("\"azul\"")).getKind());
        assertEquals(LiteralKind.BOOLEAN, ((Literal) assignedValue("TRUE")).getKind());
        assertEquals("true", ((Literal) assignedValue("TRUE")).getValue());
        assertEquals(LiteralKind.NULL, ((Literal) assignedValue("null")).getKind());
        assertEquals("-x", assignedValue("-x").toString());
    }

    @Test
    void reportsMissingKeyword() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> parse("begin\nif (x > 0)\nbegin y <- 1 end end"));
        assertEquals("keyword 'then'", e.getExpected());
        assertEquals("begin", e.getFound());
        assertEquals(3, e.getLine());
        assertFalse(e.isEndOfInput());
    }

    @Test
    void reportsMissingAssignmentOperator() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("begin x 1 end"));
        assertEquals("assignment operator", e.getExpected());
        assertEquals("1", e.getFound());
        assertTrue(e.getMessage().startsWith("Expected assignment operator, got NUMBER ('1')"));
    }

    @Test
    void reportsUnexpectedEndOfInput() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("begin\nx <- 1"));
        assertTrue(e.isEndOfInput());
        assertEquals("keyword 'end'", e.getExpected());
        assertEquals(SyntaxException.END_OF_INPUT, e.getFound());
        assertEquals(2, e.getLine());
    }

    @Test
    void rejectsStatementStartingWithALiteral() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("begin 1 <- 2 end"));
        assertEquals("statement", e.getExpected());
    }

    @Test
    void rejectsAssignmentToAnExpression() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("begin a + b <- 2 end"));
        assertEquals("assignable variable, array element or field", e.getExpected());
    }

    @Test
    void rejectsTrailingTokens() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("begin end end"));
        assertEquals(SyntaxException.END_OF_INPUT, e.getExpected());
        assertEquals("end", e.getFound());
    }

    @Test
    void lexicalErrorsSurfaceThroughParse() {
        assertThrows(SourceException.class, () -> parse("begin x <- 1 # end"));
    }
}
