package com.vulnstructure.engine.syntax;

import java.util.List;

/**
 * A parsed snippet: the root node, the source it was parsed from and the
 * syntax errors the tolerant parser recovered from.
 */
public record SyntaxTree(
    SyntaxNode root,
    String source,
    List<String> syntaxErrors
) {
    public SyntaxTree {
        syntaxErrors = List.copyOf(syntaxErrors);
    }
}
