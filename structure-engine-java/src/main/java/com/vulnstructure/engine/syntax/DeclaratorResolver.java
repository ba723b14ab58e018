package com.vulnstructure.engine.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves declarator subtrees to the name they declare.
 *
 * The name is the innermost identifier. The pointer/array flag comes from the
 * first pointer or array wrapper met on the way down, so {@code int *a[4]}
 * declares a pointer and {@code char buf[16]} an array.
 */
public final class DeclaratorResolver {

    public static final String UNKNOWN_TYPE = "unknown";

    /** The closed set of declarator shapes the resolver understands. */
    enum Shape {
        IDENTIFIER,
        POINTER_WRAPPER,
        ARRAY_WRAPPER,
        INIT_WRAPPER,
        OTHER;

        static Shape of(SyntaxNode node) {
            switch (node.kind()) {
                case IDENTIFIER:         return IDENTIFIER;
                case POINTER_DECLARATOR: return POINTER_WRAPPER;
                case ARRAY_DECLARATOR:   return ARRAY_WRAPPER;
                case INIT_DECLARATOR:    return INIT_WRAPPER;
                default:                 return OTHER;
            }
        }
    }

    /** Name and wrapper flags of one resolved declarator. */
    public record Resolved(String name, boolean pointer, boolean array) {}

    private DeclaratorResolver() {}

    public static Optional<Resolved> resolve(SyntaxNode declarator) {
        return Optional.ofNullable(resolve(declarator, null));
    }

    private static Resolved resolve(SyntaxNode node, Shape firstWrapper) {
        Shape shape = Shape.of(node);
        switch (shape) {
            case IDENTIFIER:
                return new Resolved(node.text(),
                        firstWrapper == Shape.POINTER_WRAPPER,
                        firstWrapper == Shape.ARRAY_WRAPPER);
            case POINTER_WRAPPER:
            case ARRAY_WRAPPER:
            case INIT_WRAPPER:
                Shape wrapper = firstWrapper == null && shape != Shape.INIT_WRAPPER ? shape : firstWrapper;
                SyntaxNode inner = innerDeclarator(node);
                return inner != null ? resolve(inner, wrapper) : null;
            default:
                return null;
        }
    }

    // The wrapped declarator is the first named child other than qualifiers;
    // array sizes and initializers come after it.
    private static SyntaxNode innerDeclarator(SyntaxNode wrapper) {
        for (SyntaxNode child : wrapper.children()) {
            if (!child.isNamed()) continue;
            if (child.is(NodeKind.TYPE_QUALIFIER) || child.is(NodeKind.ATTRIBUTE_SPECIFIER)) continue;
            return child;
        }
        return null;
    }

    /**
     * Declared names of a declaration or parameter declaration node, in source order.
     * Declarators that are not variables (function prototypes, abstract declarators) are skipped.
     */
    public static List<DeclaredVariable> declaredVariables(SyntaxNode declaration) {
        String type = typeText(declaration);
        List<DeclaredVariable> variables = new ArrayList<>();
        for (SyntaxNode child : declaration.children()) {
            if (Shape.of(child) == Shape.OTHER) continue;
            resolve(child).ifPresent(r -> variables.add(
                    new DeclaredVariable(r.name(), type, r.pointer(), r.array(), declaration.startLine())));
        }
        return variables;
    }

    /** Text of the node's type specifier child, or {@value #UNKNOWN_TYPE}. */
    public static String typeText(SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            if (child.kind().isTypeSpecifier()) return child.text();
        }
        return UNKNOWN_TYPE;
    }
}
