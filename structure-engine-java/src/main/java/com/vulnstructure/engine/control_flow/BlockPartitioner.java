package com.vulnstructure.engine.control_flow;

import com.vulnstructure.engine.syntax.NodeKind;
import com.vulnstructure.engine.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a function body into basic blocks.
 *
 * Statements are taken in source order without descending into them; wrappers
 * such as compound, labeled, case and do statements are descended into. Each
 * control-transfer statement ends the current block and forms a block of its own.
 */
final class BlockPartitioner {

    static final Set<NodeKind> STATEMENT_KINDS = EnumSet.of(
            NodeKind.EXPRESSION_STATEMENT, NodeKind.DECLARATION,
            NodeKind.IF_STATEMENT, NodeKind.WHILE_STATEMENT, NodeKind.FOR_STATEMENT,
            NodeKind.SWITCH_STATEMENT, NodeKind.RETURN_STATEMENT,
            NodeKind.BREAK_STATEMENT, NodeKind.CONTINUE_STATEMENT, NodeKind.GOTO_STATEMENT);

    static final Set<NodeKind> CONTROL_TRANSFER_KINDS = EnumSet.of(
            NodeKind.IF_STATEMENT, NodeKind.WHILE_STATEMENT, NodeKind.FOR_STATEMENT,
            NodeKind.SWITCH_STATEMENT, NodeKind.RETURN_STATEMENT,
            NodeKind.BREAK_STATEMENT, NodeKind.CONTINUE_STATEMENT, NodeKind.GOTO_STATEMENT);

    private final List<List<SyntaxNode>> groups = new ArrayList<>();
    private List<SyntaxNode> current = new ArrayList<>();

    private BlockPartitioner() {}

    static List<BasicBlock> partition(SyntaxNode body) {
        BlockPartitioner partitioner = new BlockPartitioner();
        partitioner.walk(body);
        partitioner.closeCurrent();

        List<BasicBlock> blocks = new ArrayList<>();
        for (List<SyntaxNode> group : partitioner.groups) {
            blocks.add(new BasicBlock("block_" + (blocks.size() + 1), group));
        }
        return blocks;
    }

    private void walk(SyntaxNode node) {
        if (!STATEMENT_KINDS.contains(node.kind())) {
            for (SyntaxNode child : node.children()) {
                walk(child);
            }
            return;
        }
        if (CONTROL_TRANSFER_KINDS.contains(node.kind())) {
            closeCurrent();
            groups.add(List.of(node));
        } else {
            current.add(node);
        }
    }

    private void closeCurrent() {
        if (!current.isEmpty()) {
            groups.add(current);
            current = new ArrayList<>();
        }
    }
}
