package com.vulnstructure.engine.syntax;

/**
 * Pre-order visitor over {@link SyntaxNode} trees.
 * Returning false from {@link #visit} skips the node's children.
 */
public abstract class SyntaxVisitor {

    public boolean visit(SyntaxNode node) {
        return true;
    }

    public void endVisit(SyntaxNode node) {
    }
}
