package com.vulnstructure.engine.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable node of a parsed snippet.
 *
 * Lines are 1-based. Offsets are code point offsets into the source, end exclusive.
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final String text;
    private final int startLine;
    private final int endLine;
    private final int startOffset;
    private final int endOffset;
    private final List<SyntaxNode> children;

    public SyntaxNode(NodeKind kind, String text, int startLine, int endLine,
                      int startOffset, int endOffset, List<SyntaxNode> children) {
        this.kind = kind;
        this.text = text;
        this.startLine = startLine;
        this.endLine = endLine;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.children = List.copyOf(children);
    }

    public NodeKind kind()          { return kind; }
    public String text()            { return text; }
    public int startLine()          { return startLine; }
    public int endLine()            { return endLine; }
    public int startOffset()        { return startOffset; }
    public int endOffset()          { return endOffset; }
    public List<SyntaxNode> children() { return children; }

    /** Grammar type string; for keywords and punctuation the token text itself. */
    public String type() {
        return kind == NodeKind.TOKEN ? text : kind.typeName();
    }

    public boolean is(NodeKind candidate) {
        return kind == candidate;
    }

    public boolean isNamed() {
        return kind.isNamed();
    }

    public List<SyntaxNode> namedChildren() {
        List<SyntaxNode> named = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.isNamed()) named.add(child);
        }
        return named;
    }

    public Optional<SyntaxNode> firstChild(NodeKind childKind) {
        for (SyntaxNode child : children) {
            if (child.kind == childKind) return Optional.of(child);
        }
        return Optional.empty();
    }

    /** Walks this subtree depth-first, pre-order. */
    public void accept(SyntaxVisitor visitor) {
        if (visitor.visit(this)) {
            for (SyntaxNode child : children) {
                child.accept(visitor);
            }
        }
        visitor.endVisit(this);
    }

    @Override
    public String toString() {
        return type() + "@" + startLine;
    }
}
