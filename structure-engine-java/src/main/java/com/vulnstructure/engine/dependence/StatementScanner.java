package com.vulnstructure.engine.dependence;

import com.vulnstructure.engine.model.StructureModel.StatementRecord;
import com.vulnstructure.engine.support.Texts;
import com.vulnstructure.engine.syntax.DeclaratorResolver;
import com.vulnstructure.engine.syntax.NodeCollector;
import com.vulnstructure.engine.syntax.NodeKind;
import com.vulnstructure.engine.syntax.SyntaxNode;
import com.vulnstructure.engine.syntax.SyntaxVisitor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts statement records with their use, definition and call-name sets.
 *
 * Statements nest: an if statement and the assignments inside it are separate
 * records, listed in pre-order.
 */
final class StatementScanner {

    static final Set<NodeKind> STATEMENT_KINDS = EnumSet.of(
            NodeKind.EXPRESSION_STATEMENT, NodeKind.DECLARATION,
            NodeKind.ASSIGNMENT_EXPRESSION, NodeKind.CALL_EXPRESSION,
            NodeKind.IF_STATEMENT, NodeKind.WHILE_STATEMENT, NodeKind.FOR_STATEMENT,
            NodeKind.RETURN_STATEMENT);

    private static final Set<NodeKind> CONTROL_FLOW_KINDS = EnumSet.of(
            NodeKind.IF_STATEMENT, NodeKind.SWITCH_STATEMENT, NodeKind.WHILE_STATEMENT,
            NodeKind.DO_STATEMENT, NodeKind.FOR_STATEMENT, NodeKind.RETURN_STATEMENT,
            NodeKind.BREAK_STATEMENT, NodeKind.CONTINUE_STATEMENT, NodeKind.GOTO_STATEMENT);

    private final int textLength;

    StatementScanner(int textLength) {
        this.textLength = textLength;
    }

    List<StatementRecord> scan(SyntaxNode function) {
        List<StatementRecord> statements = NodeCollector.collect(function, STATEMENT_KINDS, n -> List.of(record(n)));
        for (int i = 0; i < statements.size(); i++) {
            statements.get(i).id = i;
        }
        return statements;
    }

    private StatementRecord record(SyntaxNode node) {
        StatementRecord record = new StatementRecord();
        record.line = node.startLine();
        record.text = Texts.truncate(node.text(), textLength);
        record.type = node.type();

        Set<String> used = new LinkedHashSet<>();
        Set<String> defined = new LinkedHashSet<>();
        Set<String> calls = new LinkedHashSet<>();
        node.accept(new SyntaxVisitor() {
            @Override
            public boolean visit(SyntaxNode n) {
                switch (n.kind()) {
                    // Keywords and type names are token, primitive_type or
                    // type_identifier nodes, never identifiers.
                    case IDENTIFIER:
                        used.add(n.text());
                        break;
                    case ASSIGNMENT_EXPRESSION:
                        firstChild(n, NodeKind.IDENTIFIER).ifPresent(left -> defined.add(left.text()));
                        break;
                    case INIT_DECLARATOR:
                        DeclaratorResolver.resolve(n).ifPresent(r -> defined.add(r.name()));
                        break;
                    case CALL_EXPRESSION:
                        firstChild(n, NodeKind.IDENTIFIER).ifPresent(callee -> calls.add(callee.text()));
                        break;
                    default:
                        break;
                }
                return true;
            }
        });
        record.variablesUsed = new ArrayList<>(used);
        record.variablesDefined = new ArrayList<>(defined);
        record.functionCalls = new ArrayList<>(calls);

        record.isAssignment = node.is(NodeKind.ASSIGNMENT_EXPRESSION) || !defined.isEmpty();
        record.isFunctionCall = node.is(NodeKind.CALL_EXPRESSION)
                || node.firstChild(NodeKind.CALL_EXPRESSION).isPresent();
        record.isControlFlow = CONTROL_FLOW_KINDS.contains(node.kind());
        return record;
    }

    // Left operand or callee: the first child, when it has the given kind.
    private static Optional<SyntaxNode> firstChild(SyntaxNode node, NodeKind kind) {
        if (node.children().isEmpty() || !node.children().get(0).is(kind)) {
            return Optional.empty();
        }
        return Optional.of(node.children().get(0));
    }
}
