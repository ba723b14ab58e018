package com.vulnstructure.engine.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds function definitions anywhere in a tree, in document order.
 */
public final class FunctionLocator {

    private FunctionLocator() {}

    public static List<FunctionUnit> locate(SyntaxNode root) {
        List<FunctionUnit> units = new ArrayList<>();
        root.accept(new SyntaxVisitor() {
            @Override
            public boolean visit(SyntaxNode node) {
                if (node.is(NodeKind.FUNCTION_DEFINITION)) {
                    units.add(toUnit(node));
                }
                return true;
            }
        });
        return units;
    }

    /**
     * Named units keyed by name. A later definition with the same name replaces
     * the earlier one but keeps its position.
     */
    public static Map<String, FunctionUnit> locateNamed(SyntaxNode root) {
        Map<String, FunctionUnit> named = new LinkedHashMap<>();
        for (FunctionUnit unit : locate(root)) {
            if (unit.name() != null) named.put(unit.name(), unit);
        }
        return named;
    }

    public static FunctionUnit toUnit(SyntaxNode definition) {
        SyntaxNode functionDeclarator = null;
        String name = null;
        for (SyntaxNode child : definition.children()) {
            if (isDeclaratorPath(child)) {
                SyntaxNode[] found = new SyntaxNode[1];
                name = nameOf(child, found);
                functionDeclarator = found[0];
                break;
            }
        }
        SyntaxNode body = definition.firstChild(NodeKind.COMPOUND_STATEMENT).orElse(null);
        return new FunctionUnit(name, definition, functionDeclarator, body);
    }

    // Walks pointer/parenthesized/function declarators down to the identifier,
    // remembering the innermost function declarator on the way.
    private static String nameOf(SyntaxNode node, SyntaxNode[] innermostFunction) {
        if (node.is(NodeKind.IDENTIFIER)) {
            return node.text();
        }
        if (node.is(NodeKind.FUNCTION_DECLARATOR)) {
            innermostFunction[0] = node;
        }
        for (SyntaxNode child : node.children()) {
            if (child.is(NodeKind.IDENTIFIER) || isDeclaratorPath(child)) {
                return nameOf(child, innermostFunction);
            }
        }
        return null;
    }

    private static boolean isDeclaratorPath(SyntaxNode node) {
        switch (node.kind()) {
            case FUNCTION_DECLARATOR:
            case POINTER_DECLARATOR:
            case PARENTHESIZED_DECLARATOR:
                return true;
            default:
                return false;
        }
    }
}
