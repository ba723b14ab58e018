package com.vulnstructure.engine.ast_patterns;

import com.vulnstructure.engine.syntax.SyntaxNode;

/**
 * Size and depth of a syntax tree.
 *
 * The node count stops descending below a depth ceiling and counts a node past
 * the ceiling as one; the depth is always the true maximum depth. For deep trees
 * the two numbers are therefore not consistent with each other.
 */
final class NodeMetrics {

    private NodeMetrics() {}

    /** Nodes counted from {@code node} at {@code depth}; nodes deeper than {@code maxDepth} count as one. */
    static int countNodes(SyntaxNode node, int depth, int maxDepth) {
        if (depth > maxDepth) {
            return 1;
        }
        int count = 1;
        for (SyntaxNode child : node.children()) {
            count += countNodes(child, depth + 1, maxDepth);
        }
        return count;
    }

    /** Depth of the deepest node below {@code node}, the root being at {@code depth}. */
    static int maxDepth(SyntaxNode node, int depth) {
        int max = depth;
        for (SyntaxNode child : node.children()) {
            max = Math.max(max, maxDepth(child, depth + 1));
        }
        return max;
    }
}
