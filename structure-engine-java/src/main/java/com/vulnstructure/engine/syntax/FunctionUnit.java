package com.vulnstructure.engine.syntax;

import java.util.List;

/**
 * A function definition found in a snippet.
 *
 * @param name        declared name, null when it cannot be recovered
 * @param definition  the function_definition node
 * @param declarator  the function_declarator carrying the parameter list, or null
 * @param body        the compound_statement body, or null
 */
public record FunctionUnit(
    String name,
    SyntaxNode definition,
    SyntaxNode declarator,
    SyntaxNode body
) {

    public int line() {
        return definition.startLine();
    }

    public String returnType() {
        return DeclaratorResolver.typeText(definition);
    }

    /** Parameter declaration nodes in order; empty when the declarator is missing. */
    public List<SyntaxNode> parameters() {
        if (declarator == null) return List.of();
        return declarator.firstChild(NodeKind.PARAMETER_LIST)
                .map(list -> list.children().stream()
                        .filter(p -> p.is(NodeKind.PARAMETER_DECLARATION))
                        .toList())
                .orElse(List.of());
    }
}
