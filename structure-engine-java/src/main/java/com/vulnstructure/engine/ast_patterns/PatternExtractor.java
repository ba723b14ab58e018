package com.vulnstructure.engine.ast_patterns;

import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.support.Texts;
import com.vulnstructure.engine.syntax.DeclaratorResolver;
import com.vulnstructure.engine.syntax.FunctionLocator;
import com.vulnstructure.engine.syntax.FunctionUnit;
import com.vulnstructure.engine.syntax.NodeCollector;
import com.vulnstructure.engine.syntax.NodeKind;
import com.vulnstructure.engine.syntax.SyntaxNode;
import com.vulnstructure.engine.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens a syntax tree into a {@link PatternSummary}: tree size and depth plus
 * lists of functions, calls, variable declarations, pointer and array operations,
 * conditionals and loops.
 */
public class PatternExtractor {

    private static final Set<NodeKind> VARIABLE_KINDS =
            EnumSet.of(NodeKind.DECLARATION, NodeKind.PARAMETER_DECLARATION);
    private static final Set<NodeKind> POINTER_KINDS =
            EnumSet.of(NodeKind.POINTER_EXPRESSION, NodeKind.FIELD_EXPRESSION);
    private static final Set<NodeKind> CONDITION_KINDS =
            EnumSet.of(NodeKind.IF_STATEMENT, NodeKind.CONDITIONAL_EXPRESSION, NodeKind.SWITCH_STATEMENT);
    private static final Set<NodeKind> LOOP_KINDS =
            EnumSet.of(NodeKind.FOR_STATEMENT, NodeKind.WHILE_STATEMENT, NodeKind.DO_STATEMENT);

    private final EngineConfig config;

    public PatternExtractor(EngineConfig config) {
        this.config = config;
    }

    public PatternSummary extract(SyntaxTree tree) {
        SyntaxNode root = tree.root();
        PatternSummary summary = new PatternSummary();
        summary.success = true;
        summary.nodeCount = NodeMetrics.countNodes(root, 0, config.astMaxDepth);
        summary.depth = NodeMetrics.maxDepth(root, 0);
        summary.syntaxErrorCount = tree.syntaxErrors().size();

        summary.functions = NodeCollector.collect(root, EnumSet.of(NodeKind.FUNCTION_DEFINITION), this::functionPattern);
        summary.calls = NodeCollector.collect(root, EnumSet.of(NodeKind.CALL_EXPRESSION), this::callPattern);
        summary.variables = NodeCollector.collect(root, VARIABLE_KINDS, this::variablePatterns);
        summary.pointers = NodeCollector.collect(root, POINTER_KINDS, this::pointerOperation);
        summary.arrays = NodeCollector.collect(root, EnumSet.of(NodeKind.SUBSCRIPT_EXPRESSION), this::arrayOperation);
        summary.conditions = NodeCollector.collect(root, CONDITION_KINDS, PatternExtractor::controlStructure);
        summary.loops = NodeCollector.collect(root, LOOP_KINDS, PatternExtractor::controlStructure);
        return summary;
    }

    private List<FunctionPattern> functionPattern(SyntaxNode definition) {
        FunctionUnit unit = FunctionLocator.toUnit(definition);
        if (unit.name() == null) {
            return List.of();
        }
        FunctionPattern pattern = new FunctionPattern();
        pattern.name = unit.name();
        pattern.returnType = unit.returnType();
        for (SyntaxNode parameter : unit.parameters()) {
            pattern.params.add(parameter.text().strip());
        }
        pattern.line = unit.line();
        return List.of(pattern);
    }

    private List<CallPattern> callPattern(SyntaxNode call) {
        SyntaxNode callee = call.children().isEmpty() ? null : call.children().get(0);
        if (callee == null || !callee.is(NodeKind.IDENTIFIER)) {
            return List.of();
        }
        CallPattern pattern = new CallPattern();
        pattern.functionName = callee.text();
        call.firstChild(NodeKind.ARGUMENT_LIST).ifPresent(args -> {
            for (SyntaxNode arg : args.namedChildren()) {
                pattern.args.add(arg.text());
            }
        });
        pattern.line = call.startLine();
        return List.of(pattern);
    }

    private List<VariablePattern> variablePatterns(SyntaxNode declaration) {
        List<VariablePattern> patterns = new ArrayList<>();
        DeclaratorResolver.declaredVariables(declaration).forEach(v -> {
            VariablePattern pattern = new VariablePattern();
            pattern.name = v.name();
            pattern.type = v.type();
            pattern.isPointer = v.pointer();
            pattern.isArray = v.array();
            pattern.line = v.line();
            patterns.add(pattern);
        });
        return patterns;
    }

    private List<PointerOperation> pointerOperation(SyntaxNode node) {
        PointerOperation op = new PointerOperation();
        op.operation = Texts.truncate(node.text(), config.operationTextLength);
        op.type = node.type();
        op.line = node.startLine();
        return List.of(op);
    }

    private List<ArrayOperation> arrayOperation(SyntaxNode node) {
        ArrayOperation op = new ArrayOperation();
        op.operation = Texts.truncate(node.text(), config.operationTextLength);
        op.line = node.startLine();
        return List.of(op);
    }

    private static List<ControlStructure> controlStructure(SyntaxNode node) {
        ControlStructure structure = new ControlStructure();
        structure.type = node.type();
        structure.line = node.startLine();
        return List.of(structure);
    }
}
