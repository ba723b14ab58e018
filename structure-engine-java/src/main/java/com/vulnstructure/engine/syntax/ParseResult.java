package com.vulnstructure.engine.syntax;

/**
 * Outcome of the parse step: either a tree or the reason parsing failed.
 */
public final class ParseResult {

    private final SyntaxTree tree;
    private final String failureReason;

    private ParseResult(SyntaxTree tree, String failureReason) {
        this.tree = tree;
        this.failureReason = failureReason;
    }

    public static ParseResult success(SyntaxTree tree) {
        return new ParseResult(tree, null);
    }

    public static ParseResult failure(String reason) {
        return new ParseResult(null, reason);
    }

    public boolean isSuccess()     { return tree != null; }
    public SyntaxTree tree()       { return tree; }
    public String failureReason()  { return failureReason; }
}
