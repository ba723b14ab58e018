package com.vulnstructure.engine.control_flow;

import com.vulnstructure.engine.syntax.NodeKind;
import com.vulnstructure.engine.syntax.SyntaxNode;

import java.util.List;

/**
 * A maximal run of statements with no control transfer in between, or a single
 * control-transfer statement.
 */
record BasicBlock(String id, List<SyntaxNode> statements) {

    BasicBlock {
        statements = List.copyOf(statements);
    }

    int startLine() {
        return statements.get(0).startLine();
    }

    int endLine() {
        return statements.get(statements.size() - 1).endLine();
    }

    boolean contains(NodeKind kind) {
        for (SyntaxNode statement : statements) {
            if (statement.is(kind)) return true;
        }
        return false;
    }
}
