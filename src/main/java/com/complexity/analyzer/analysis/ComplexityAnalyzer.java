package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.*;
import com.complexity.analyzer.model.CostTriple;
import com.complexity.analyzer.oracle.ComplexityOracle;
import com.complexity.analyzer.oracle.OracleResult;
import com.complexity.analyzer.visitor.NodeSerializer;
import com.complexity.analyzer.visitor.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Infers worst/best/average case cost triples for syntax trees.
 *
 * Every node goes through {@link #analyze(Node, AnalysisContext)}, which
 * looks the node's structural signature up in the cache first and stores the
 * computed triple afterwards. For-loops whose bounds depend on an enclosing
 * loop variable are handed to the oracle; everything else is computed with
 * {@link CostAlgebra}.
 *
 * Analysis never throws. An oracle failure becomes a failed triple that
 * shows the error in the result and is never cached.
 */
public class ComplexityAnalyzer implements NodeVisitor<CostTriple, AnalysisContext> {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final ComplexityCache cache;
    private final ComplexityOracle oracle;
    private final LoopDependencyDetector dependencyDetector = new LoopDependencyDetector();

    private int cacheHits = 0;
    private int cacheMisses = 0;
    private int oracleCalls = 0;
    private int oracleFailures = 0;

    public ComplexityAnalyzer(ComplexityCache cache, ComplexityOracle oracle) {
        this.cache = cache != null ? cache : new ComplexityCache();
        this.oracle = Objects.requireNonNull(oracle);
    }

    public CostTriple analyze(Node node) {
        return analyze(node, AnalysisContext.empty());
    }

    public CostTriple analyze(Node node, AnalysisContext context) {
        String signature = NodeSignature.of(node);
        Optional<CostTriple> cached = cache.get(signature);
        if (cached.isPresent()) {
            cacheHits++;
            logger.debug("Cache hit for {} {}", node.getClass().getSimpleName(), signature);
            return cached.get();
        }

        cacheMisses++;
        CostTriple result = node.accept(this, context);
        if (!result.isFailed()) {
            cache.put(signature, result);
        }
        return result;
    }

    @Override
    public CostTriple visit(Program program, AnalysisContext context) {
        return analyze(program.getMainBlock(), context);
    }

    @Override
    public CostTriple visit(ClassDef classDef, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    @Override
    public CostTriple visit(ProcedureDef procedureDef, AnalysisContext context) {
        return analyze(procedureDef.getBody(), context);
    }

    @Override
    public CostTriple visit(Parameter parameter, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    @Override
    public CostTriple visit(Block block, AnalysisContext context) {
        CostTriple total = CostTriple.CONSTANT;
        for (Statement statement : block.getStatements()) {
            total = total.plus(analyze(statement, context));
        }
        return total;
    }

    @Override
    public CostTriple visit(Assignment assignment, AnalysisContext context) {
        return CostTriple.CONSTANT.plus(analyze(assignment.getValue(), context));
    }

    /**
     * Both branches are added rather than maxed, which over-estimates work
     * across mutually exclusive branches.
     */
    @Override
    public CostTriple visit(IfStatement ifStatement, AnalysisContext context) {
        CostTriple condition = analyze(ifStatement.getCondition(), context);
        CostTriple thenCost = analyze(ifStatement.getThenBlock(), context);
        CostTriple elseCost = ifStatement.getElseBlock()
                .map(elseBlock -> analyze(elseBlock, context))
                .orElse(CostTriple.CONSTANT);
        return condition.plus(thenCost.plus(elseCost));
    }

    @Override
    public CostTriple visit(ForLoop forLoop, AnalysisContext context) {
        if (dependencyDetector.isDependent(forLoop, context)) {
            return consultOracle(forLoop, context);
        }

        AnalysisContext bodyContext = context.withLoopVariable(forLoop.getVariable());
        CostTriple iterations = estimateIterations(forLoop);
        return iterations.times(analyze(forLoop.getBody(), bodyContext));
    }

    private CostTriple consultOracle(ForLoop forLoop, AnalysisContext context) {
        oracleCalls++;
        logger.debug("Loop over '{}' depends on enclosing loop variables {}, consulting oracle",
                forLoop.getVariable(), context.getLoopVariables());

        OracleResult result;
        try {
            result = oracle.classify(NodeSerializer.serialize(forLoop));
        } catch (RuntimeException e) {
            result = OracleResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (!result.isSuccess()) {
            oracleFailures++;
            logger.warn("Oracle could not classify loop over '{}': {}",
                    forLoop.getVariable(), result.getFailureReason().orElse(""));
        }
        return result.toCostTriple();
    }

    /**
     * Iteration count of an independent loop. Always {@code n}: the bound
     * expressions are not inspected.
     */
    CostTriple estimateIterations(ForLoop forLoop) {
        return CostTriple.LINEAR;
    }

    @Override
    public CostTriple visit(WhileLoop whileLoop, AnalysisContext context) {
        return CostTriple.LINEAR.times(analyze(whileLoop.getBody(), context));
    }

    @Override
    public CostTriple visit(RepeatLoop repeatLoop, AnalysisContext context) {
        return CostTriple.LINEAR.times(analyze(repeatLoop.getBody(), context));
    }

    @Override
    public CostTriple visit(Call call, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    @Override
    public CostTriple visit(BinaryOp binaryOp, AnalysisContext context) {
        return analyze(binaryOp.getLeft(), context).plus(analyze(binaryOp.getRight(), context));
    }

    @Override
    public CostTriple visit(UnaryOp unaryOp, AnalysisContext context) {
        return analyze(unaryOp.getOperand(), context);
    }

    @Override
    public CostTriple visit(Literal literal, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    @Override
    public CostTriple visit(Variable variable, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    @Override
    public CostTriple visit(ArrayAccess arrayAccess, AnalysisContext context) {
        return analyze(arrayAccess.getIndex(), context);
    }

    @Override
    public CostTriple visit(FieldAccess fieldAccess, AnalysisContext context) {
        return CostTriple.CONSTANT;
    }

    public ComplexityCache getCache() {
        return cache;
    }

    public int getCacheHits() {
        return cacheHits;
    }

    public int getCacheMisses() {
        return cacheMisses;
    }

    public int getOracleCalls() {
        return oracleCalls;
    }

    public int getOracleFailures() {
        return oracleFailures;
    }
}
