package com.vulnstructure.engine.syntax;

import com.vulnstructure.engine.support.Texts;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Visitor that maps every node of the given kinds to zero or more records.
 *
 * A mapping that throws is logged and skipped; the walk continues, so one odd
 * node costs only its own records.
 */
public class NodeCollector<T> extends SyntaxVisitor {

    private final Set<NodeKind> kinds;
    private final Function<SyntaxNode, List<T>> mapper;
    private final List<T> results = new ArrayList<>();

    public NodeCollector(Set<NodeKind> kinds, Function<SyntaxNode, List<T>> mapper) {
        this.kinds = EnumSet.copyOf(kinds);
        this.mapper = mapper;
    }

    public static <T> List<T> collect(SyntaxNode root, Set<NodeKind> kinds,
                                      Function<SyntaxNode, List<T>> mapper) {
        NodeCollector<T> collector = new NodeCollector<>(kinds, mapper);
        root.accept(collector);
        return collector.getResults();
    }

    public List<T> getResults() { return results; }

    @Override
    public boolean visit(SyntaxNode node) {
        if (kinds.contains(node.kind())) {
            try {
                results.addAll(mapper.apply(node));
            } catch (RuntimeException e) {
                System.err.println("[structure-engine] WARNING: skipped " + node.type()
                        + " at line " + node.startLine() + ": " + Texts.describe(e));
            }
        }
        return true;
    }
}
