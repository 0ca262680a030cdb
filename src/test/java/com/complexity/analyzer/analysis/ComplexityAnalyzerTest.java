package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.ProcedureDef;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.lexer.SourceException;
import com.complexity.analyzer.model.CostTriple;
import com.complexity.analyzer.oracle.ComplexityOracle;
import com.complexity.analyzer.oracle.OracleResult;
import com.complexity.analyzer.parser.Parser;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private static final String DEPENDENT_NEST =
            "begin for i <- 1 to n do begin for j <- 1 to i do begin s <- s + 1 end end end";

    /**
     * Oracle stub that records what it was asked and answers with a fixed result.
     */
    private static class RecordingOracle implements ComplexityOracle {
        private final OracleResult answer;
        private final List<JsonObject> requests = new ArrayList<>();

        RecordingOracle(OracleResult answer) {
            this.answer = answer;
        }

        @Override
        public OracleResult classify(JsonObject subtree) {
            requests.add(subtree);
            return answer;
        }
    }

    private static Program parse(String source) throws SourceException {
        return Parser.parse(source, "Test");
    }

    private static ComplexityAnalyzer analyzerWith(ComplexityOracle oracle) {
        return new ComplexityAnalyzer(new ComplexityCache(), oracle);
    }

    private static ComplexityOracle unusedOracle() {
        return subtree -> fail("oracle must not be consulted for " + subtree);
    }

    @Test
    void straightLineCodeIsConstant() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        CostTriple cost = analyzer.analyze(parse("begin a <- 1 b <- a + 2 c <- A[b] end"));
        assertEquals(CostTriple.CONSTANT, cost);
    }

    @Test
    void emptyProgramIsConstant() throws SourceException {
        assertEquals(CostTriple.CONSTANT, analyzerWith(unusedOracle()).analyze(parse("")));
    }

    @Test
    void singleLoopIsLinear() throws SourceException {
        CostTriple cost = analyzerWith(unusedOracle())
                .analyze(parse("begin for i <- 1 to n do begin s <- s + A[i] end end"));
        assertEquals(CostTriple.LINEAR, cost);
        assertEquals("O(n), Ω(n), Θ(n)", cost.toString());
    }

    @Test
    void independentNestedLoopsMultiply() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        CostTriple cost = analyzer.analyze(parse(
                "begin for i <- 1 to n do begin for j <- 1 to m do begin "
                        + "for k <- 1 to p do begin s <- 1 end end end end"));
        assertEquals(CostTriple.of("n^3"), cost);
        assertEquals(0, analyzer.getOracleCalls());
    }

    @Test
    void independentTwoLevelNestIsQuadratic() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        CostTriple cost = analyzer.analyze(parse(
                "begin for i := 1 to n do begin for j := 1 to m do begin s := s + 1 end end end"));
        assertEquals(CostTriple.of("n^2"), cost);
        assertEquals(0, analyzer.getOracleCalls());
    }

    @Test
    void sequentialLoopsAdd() throws SourceException {
        CostTriple cost = analyzerWith(unusedOracle()).analyze(parse(
                "begin for i <- 1 to n do begin a <- 1 end "
                        + "for i <- 1 to n do begin for j <- 1 to n do begin b <- 1 end end end"));
        assertEquals(CostTriple.of("max(n, n^2)"), cost);
    }

    @Test
    void ifAddsConditionAndBothBranches() throws SourceException {
        CostTriple cost = analyzerWith(unusedOracle()).analyze(parse(
                "begin if (x > 0) then begin for i <- 1 to n do begin a <- 1 end end "
                        + "else begin b <- 1 end end"));
        assertEquals(CostTriple.LINEAR, cost);
    }

    @Test
    void whileAndRepeatAreLinearInTheirBody() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        assertEquals(CostTriple.LINEAR,
                analyzer.analyze(parse("begin while (x > 0) do begin x <- x - 1 end end")));
        assertEquals(CostTriple.of("n^2"), analyzer.analyze(parse(
                "begin for i <- 1 to n do begin repeat k <- k + 1 until (k > n) end end")));
    }

    @Test
    void callsAreConstant() throws SourceException {
        Program program = parse("f(A[1..n], n) begin for i <- 1 to n do begin s <- A[i] end end\n"
                + "begin call f(A, n) end");
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());

        assertEquals(CostTriple.CONSTANT, analyzer.analyze(program));
        ProcedureDef procedure = program.getProcedures().get(0);
        assertEquals(CostTriple.LINEAR, analyzer.analyze(procedure));
    }

    @Test
    void dependentLoopIsClassifiedByTheOracle() throws SourceException {
        RecordingOracle oracle = new RecordingOracle(OracleResult.success(CostTriple.LINEAR));
        ComplexityAnalyzer analyzer = analyzerWith(oracle);

        CostTriple cost = analyzer.analyze(parse(DEPENDENT_NEST));

        assertEquals(CostTriple.of("n^2"), cost);
        assertEquals(1, oracle.requests.size());
        JsonObject request = oracle.requests.get(0);
        assertEquals("ForLoop", request.get("node").getAsString());
        assertEquals("j", request.get("variable").getAsString());
        assertEquals(1, analyzer.getOracleCalls());
        assertEquals(0, analyzer.getOracleFailures());
    }

    @Test
    void siblingLoopVariableDoesNotLeak() throws SourceException {
        CostTriple cost = analyzerWith(unusedOracle()).analyze(parse(
                "begin for i <- 1 to n do begin a <- 1 end for j <- 1 to i do begin b <- 1 end end"));
        assertEquals(CostTriple.LINEAR, cost);
    }

    @Test
    void oracleFailureYieldsUncachedErrorTriple() throws SourceException {
        RecordingOracle oracle = new RecordingOracle(OracleResult.failure("Missing API Key"));
        ComplexityAnalyzer analyzer = analyzerWith(oracle);
        Program program = parse(DEPENDENT_NEST);

        CostTriple cost = analyzer.analyze(program);

        assertTrue(cost.isFailed());
        assertTrue(cost.getO().contains("Error: Missing API Key"), cost.getO());
        assertEquals(1, analyzer.getOracleFailures());
        assertTrue(analyzer.getCache().getAll().values().stream().noneMatch(CostTriple::isFailed));
        assertFalse(analyzer.getCache().contains(NodeSignature.of(program)));

        analyzer.analyze(program);
        assertEquals(2, oracle.requests.size());
    }

    @Test
    void oracleExceptionIsReportedAsFailure() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(subtree -> {
            throw new IllegalStateException("boom");
        });

        CostTriple cost = analyzer.analyze(parse(DEPENDENT_NEST));

        assertTrue(cost.isFailed());
        assertTrue(cost.getO().contains("boom"), cost.getO());
        assertEquals(1, analyzer.getOracleFailures());
    }

    @Test
    void repeatedAnalysisIsServedFromTheCache() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        Program program = parse("begin for i <- 1 to n do begin for j <- 1 to n do begin s <- 1 end end end");

        CostTriple first = analyzer.analyze(program);
        int hits = analyzer.getCacheHits();
        int misses = analyzer.getCacheMisses();

        CostTriple second = analyzer.analyze(program);

        assertEquals(first, second);
        assertEquals(hits + 1, analyzer.getCacheHits());
        assertEquals(misses, analyzer.getCacheMisses());
        assertTrue(analyzer.getCache().contains(NodeSignature.of(program)));
    }

    @Test
    void identicalSubtreesShareOneCacheEntry() throws SourceException {
        ComplexityAnalyzer analyzer = analyzerWith(unusedOracle());
        analyzer.analyze(parse(
                "begin for i <- 1 to n do begin a <- 1 end for i <- 1 to n do begin a <- 1 end end"));

        assertEquals(1, analyzer.getCacheHits());
    }

    @Test
    void cachedOracleAnswerIsReusedAcrossPrograms() throws SourceException {
        RecordingOracle oracle = new RecordingOracle(OracleResult.success(CostTriple.of("n")));
        ComplexityAnalyzer analyzer = analyzerWith(oracle);

        analyzer.analyze(parse(DEPENDENT_NEST));
        analyzer.analyze(parse("begin x <- 0 " + DEPENDENT_NEST.substring("begin ".length())));

        assertEquals(1, oracle.requests.size());
    }
}
