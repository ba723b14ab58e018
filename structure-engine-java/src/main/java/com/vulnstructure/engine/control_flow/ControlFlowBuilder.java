package com.vulnstructure.engine.control_flow;

import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.support.Texts;
import com.vulnstructure.engine.syntax.FunctionLocator;
import com.vulnstructure.engine.syntax.FunctionUnit;
import com.vulnstructure.engine.syntax.NodeKind;
import com.vulnstructure.engine.syntax.SyntaxNode;
import com.vulnstructure.engine.syntax.SyntaxTree;

import java.util.List;
import java.util.Map;

/**
 * Builds a block-level control-flow graph for every named function of a tree.
 *
 * The graph is an approximation: blocks are chained in source order between
 * "entry" and "exit", a block holding an if/while/for also jumps two blocks ahead
 * (or to exit), loops get a self-edge and returns go to exit. Cyclomatic
 * complexity is E - N + 2, floored at 1.
 *
 * A function whose graph cannot be built is reported as failed without
 * affecting the others.
 */
public class ControlFlowBuilder {

    static final String ENTRY = "entry";
    static final String EXIT = "exit";

    private final EngineConfig config;

    public ControlFlowBuilder(EngineConfig config) {
        this.config = config;
    }

    public ControlFlowReport build(SyntaxTree tree) {
        ControlFlowReport report = new ControlFlowReport();
        report.success = true;

        Map<String, FunctionUnit> units = FunctionLocator.locateNamed(tree.root());
        for (Map.Entry<String, FunctionUnit> entry : units.entrySet()) {
            FunctionControlFlow cfg;
            try {
                cfg = buildFunction(entry.getValue());
            } catch (RuntimeException | StackOverflowError e) {
                System.err.println("[structure-engine] WARNING: control flow of "
                        + entry.getKey() + " failed: " + Texts.describe(e));
                cfg = FunctionControlFlow.failure(
                        Texts.cleanErrorMessage(Texts.describe(e), config.functionErrorMessageLength));
            }
            report.functions.put(entry.getKey(), cfg);
            report.globalStats.totalNodes += cfg.nodeCount;
            report.globalStats.totalEdges += cfg.edgeCount;
        }
        report.globalStats.totalFunctions = units.size();
        return report;
    }

    FunctionControlFlow buildFunction(FunctionUnit unit) {
        List<BasicBlock> blocks = unit.body() != null
                ? BlockPartitioner.partition(unit.body())
                : List.of();
        FlowGraph graph = connect(blocks);

        FunctionControlFlow cfg = new FunctionControlFlow();
        cfg.success = true;
        cfg.nodeCount = graph.nodeCount();
        cfg.edgeCount = graph.edgeCount();
        cfg.complexity = Math.max(1, cfg.edgeCount - cfg.nodeCount + 2);
        cfg.complexityRating = rate(cfg.complexity);
        cfg.cycles = SimpleCycles.find(graph);
        cfg.exitNodes = graph.sinks();
        cfg.basicBlocks = blocks.size();
        for (BasicBlock block : blocks) {
            cfg.blocks.add(view(block));
        }
        for (String source : graph.nodes()) {
            for (String target : graph.successors(source)) {
                FlowEdge edge = new FlowEdge();
                edge.source = source;
                edge.target = target;
                cfg.edges.add(edge);
            }
        }
        return cfg;
    }

    static FlowGraph connect(List<BasicBlock> blocks) {
        FlowGraph graph = new FlowGraph();
        graph.addNode(ENTRY);
        for (BasicBlock block : blocks) {
            graph.addNode(block.id());
        }
        graph.addNode(EXIT);

        if (blocks.isEmpty()) {
            graph.addEdge(ENTRY, EXIT);
            return graph;
        }

        graph.addEdge(ENTRY, blocks.get(0).id());
        for (int i = 0; i + 1 < blocks.size(); i++) {
            graph.addEdge(blocks.get(i).id(), blocks.get(i + 1).id());
        }
        graph.addEdge(blocks.get(blocks.size() - 1).id(), EXIT);

        int n = blocks.size();
        for (int i = 0; i < n; i++) {
            BasicBlock block = blocks.get(i);
            boolean loop = block.contains(NodeKind.WHILE_STATEMENT) || block.contains(NodeKind.FOR_STATEMENT);
            if ((loop || block.contains(NodeKind.IF_STATEMENT)) && i + 1 < n) {
                // Skip the following block: block k -> block k+2, or exit past the end.
                String target = i + 2 < n ? blocks.get(i + 2).id() : EXIT;
                graph.addEdge(block.id(), target);
            }
            if (loop) {
                graph.addEdge(block.id(), block.id());
            }
            if (block.contains(NodeKind.RETURN_STATEMENT)) {
                graph.addEdge(block.id(), EXIT);
            }
        }
        return graph;
    }

    private String rate(int complexity) {
        if (complexity >= config.complexityHighThreshold) return "high";
        if (complexity >= config.complexityMediumThreshold) return "medium";
        return "low";
    }

    private BasicBlockView view(BasicBlock block) {
        BasicBlockView view = new BasicBlockView();
        view.id = block.id();
        view.startLine = block.startLine();
        view.endLine = block.endLine();
        view.statementCount = block.statements().size();
        for (SyntaxNode statement : block.statements()) {
            BlockStatement s = new BlockStatement();
            s.line = statement.startLine();
            s.text = Texts.truncate(statement.text(), config.snippetTextLength);
            s.type = statement.type();
            view.statements.add(s);
        }
        return view;
    }
}
