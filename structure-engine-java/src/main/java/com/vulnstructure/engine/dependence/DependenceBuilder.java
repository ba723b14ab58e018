package com.vulnstructure.engine.dependence;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a statement-level data-dependence view of every named function.
 *
 * For each variable a statement uses, the nearest earlier statement (in pre-order)
 * that defines it becomes the source of a data_dependency edge. Branches and loop
 * back-edges are not considered, so the result is a heuristic over source order.
 */
public class DependenceBuilder {

    private final EngineConfig config;
    private final StatementScanner statementScanner;
    private final IndicatorScanner indicatorScanner;

    public DependenceBuilder(EngineConfig config) {
        this.config = config;
        this.statementScanner = new StatementScanner(config.statementTextLength);
        this.indicatorScanner = new IndicatorScanner(config.trackedFunctions(), config.snippetTextLength);
    }

    public DependenceReport build(SyntaxTree tree) {
        DependenceReport report = new DependenceReport();
        report.success = true;

        Map<String, FunctionUnit> units = FunctionLocator.locateNamed(tree.root());
        for (Map.Entry<String, FunctionUnit> entry : units.entrySet()) {
            FunctionDependence pdg;
            try {
                pdg = buildFunction(entry.getValue());
            } catch (RuntimeException | StackOverflowError e) {
                System.err.println("[structure-engine] WARNING: dependence of "
                        + entry.getKey() + " failed: " + Texts.describe(e));
                pdg = FunctionDependence.failure(
                        Texts.cleanErrorMessage(Texts.describe(e), config.functionErrorMessageLength));
            }
            report.functions.put(entry.getKey(), pdg);
            report.globalStats.totalVariables += pdg.variableCount;
            report.globalStats.totalDependencies += pdg.dependencyCount;
        }
        report.globalStats.totalFunctions = units.size();
        return report;
    }

    FunctionDependence buildFunction(FunctionUnit unit) {
        SyntaxNode function = unit.definition();
        FunctionDependence pdg = new FunctionDependence();
        pdg.success = true;
        pdg.variables = variables(function);
        pdg.statements = statementScanner.scan(function);
        pdg.dependencies = dependencies(pdg.statements);
        pdg.patterns = indicatorScanner.scan(pdg.statements);
        pdg.variableCount = pdg.variables.size();
        pdg.dependencyCount = pdg.dependencies.size();
        pdg.statementCount = pdg.statements.size();
        pdg.vulnerabilityIndicators = IndicatorScanner.count(pdg.patterns);
        return pdg;
    }

    // Later declarations of the same name overwrite earlier ones.
    private static Map<String, VariableRecord> variables(SyntaxNode function) {
        Map<String, VariableRecord> variables = new LinkedHashMap<>();
        NodeCollector.collect(function,
                EnumSet.of(NodeKind.DECLARATION, NodeKind.PARAMETER_DECLARATION),
                node -> {
                    boolean parameter = node.is(NodeKind.PARAMETER_DECLARATION);
                    DeclaratorResolver.declaredVariables(node).forEach(v -> {
                        VariableRecord record = new VariableRecord();
                        record.type = v.type();
                        record.declarationLine = v.line();
                        record.isParameter = parameter;
                        record.isPointer = v.pointer();
                        record.isArray = v.array();
                        variables.put(v.name(), record);
                    });
                    return List.of();
                });
        return variables;
    }

    static List<DependencyEdge> dependencies(List<StatementRecord> statements) {
        List<DependencyEdge> edges = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            StatementRecord target = statements.get(i);
            for (String variable : target.variablesUsed) {
                for (int j = i - 1; j >= 0; j--) {
                    StatementRecord source = statements.get(j);
                    if (source.variablesDefined.contains(variable)) {
                        DependencyEdge edge = new DependencyEdge();
                        edge.source = source.id;
                        edge.target = target.id;
                        edge.variable = variable;
                        edge.sourceLine = source.line;
                        edge.targetLine = target.line;
                        edges.add(edge);
                        break;
                    }
                }
            }
        }
        return edges;
    }
}
