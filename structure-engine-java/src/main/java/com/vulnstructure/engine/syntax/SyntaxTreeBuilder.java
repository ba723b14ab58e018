package com.vulnstructure.engine.syntax;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vulnstructure.engine.syntax.CSnippetParser.*;

/**
 * Converts an ANTLR parse tree into {@link SyntaxNode}s.
 *
 * Grammar rules without a node kind (wrappers such as "statement" or
 * "declarationSpecifiers") are spliced into their parent, so the resulting
 * tree has the shape of a conventional C syntax tree.
 */
final class SyntaxTreeBuilder {

    private static final Map<Class<? extends ParserRuleContext>, NodeKind> KINDS = Map.ofEntries(
        Map.entry(FunctionDefinitionContext.class, NodeKind.FUNCTION_DEFINITION),
        Map.entry(DeclarationContext.class, NodeKind.DECLARATION),
        Map.entry(StorageClassSpecifierContext.class, NodeKind.STORAGE_CLASS_SPECIFIER),
        Map.entry(FunctionSpecifierContext.class, NodeKind.STORAGE_CLASS_SPECIFIER),
        Map.entry(TypeQualifierContext.class, NodeKind.TYPE_QUALIFIER),
        Map.entry(AttributeSpecifierContext.class, NodeKind.ATTRIBUTE_SPECIFIER),
        Map.entry(PrimitiveTypeContext.class, NodeKind.PRIMITIVE_TYPE),
        Map.entry(SizedTypeSpecifierContext.class, NodeKind.SIZED_TYPE_SPECIFIER),
        Map.entry(FieldDeclarationListContext.class, NodeKind.FIELD_DECLARATION_LIST),
        Map.entry(FieldDeclarationContext.class, NodeKind.FIELD_DECLARATION),
        Map.entry(EnumSpecifierContext.class, NodeKind.ENUM_SPECIFIER),
        Map.entry(EnumeratorContext.class, NodeKind.ENUMERATOR),
        Map.entry(InitializedDeclaratorContext.class, NodeKind.INIT_DECLARATOR),
        Map.entry(PointerDeclaratorContext.class, NodeKind.POINTER_DECLARATOR),
        Map.entry(ParenthesizedDeclaratorContext.class, NodeKind.PARENTHESIZED_DECLARATOR),
        Map.entry(ArrayDeclaratorContext.class, NodeKind.ARRAY_DECLARATOR),
        Map.entry(FunctionDeclaratorContext.class, NodeKind.FUNCTION_DECLARATOR),
        Map.entry(ParameterListContext.class, NodeKind.PARAMETER_LIST),
        Map.entry(ParameterDeclarationContext.class, NodeKind.PARAMETER_DECLARATION),
        Map.entry(AbstractDeclaratorContext.class, NodeKind.ABSTRACT_DECLARATOR),
        Map.entry(TypeNameContext.class, NodeKind.TYPE_DESCRIPTOR),
        Map.entry(SizeofTypeNameContext.class, NodeKind.TYPE_DESCRIPTOR),
        Map.entry(InitializerListContext.class, NodeKind.INITIALIZER_LIST),
        Map.entry(DesignatedInitializerContext.class, NodeKind.INITIALIZER_PAIR),
        Map.entry(CompoundStatementContext.class, NodeKind.COMPOUND_STATEMENT),
        Map.entry(CaseStatementContext.class, NodeKind.CASE_STATEMENT),
        Map.entry(LabeledStatementContext.class, NodeKind.LABELED_STATEMENT),
        Map.entry(IfStatementContext.class, NodeKind.IF_STATEMENT),
        Map.entry(ElseClauseContext.class, NodeKind.ELSE_CLAUSE),
        Map.entry(SwitchStatementContext.class, NodeKind.SWITCH_STATEMENT),
        Map.entry(WhileStatementContext.class, NodeKind.WHILE_STATEMENT),
        Map.entry(DoStatementContext.class, NodeKind.DO_STATEMENT),
        Map.entry(ForStatementContext.class, NodeKind.FOR_STATEMENT),
        Map.entry(ReturnStatementContext.class, NodeKind.RETURN_STATEMENT),
        Map.entry(BreakStatementContext.class, NodeKind.BREAK_STATEMENT),
        Map.entry(ContinueStatementContext.class, NodeKind.CONTINUE_STATEMENT),
        Map.entry(GotoStatementContext.class, NodeKind.GOTO_STATEMENT),
        Map.entry(ExpressionStatementContext.class, NodeKind.EXPRESSION_STATEMENT),
        Map.entry(SubscriptExpressionContext.class, NodeKind.SUBSCRIPT_EXPRESSION),
        Map.entry(CallExpressionContext.class, NodeKind.CALL_EXPRESSION),
        Map.entry(ArgumentListContext.class, NodeKind.ARGUMENT_LIST),
        Map.entry(FieldExpressionContext.class, NodeKind.FIELD_EXPRESSION),
        Map.entry(PostfixUpdateExpressionContext.class, NodeKind.UPDATE_EXPRESSION),
        Map.entry(PrefixUpdateExpressionContext.class, NodeKind.UPDATE_EXPRESSION),
        Map.entry(CompoundLiteralExpressionContext.class, NodeKind.COMPOUND_LITERAL_EXPRESSION),
        Map.entry(PointerExpressionContext.class, NodeKind.POINTER_EXPRESSION),
        Map.entry(UnaryExpressionContext.class, NodeKind.UNARY_EXPRESSION),
        Map.entry(SizeofTypeExpressionContext.class, NodeKind.SIZEOF_EXPRESSION),
        Map.entry(SizeofExpressionContext.class, NodeKind.SIZEOF_EXPRESSION),
        Map.entry(CastExpressionContext.class, NodeKind.CAST_EXPRESSION),
        Map.entry(MultiplicativeExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(AdditiveExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(ShiftExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(RelationalExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(EqualityExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(BitwiseAndExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(BitwiseXorExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(BitwiseOrExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(LogicalAndExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(LogicalOrExpressionContext.class, NodeKind.BINARY_EXPRESSION),
        Map.entry(ConditionalExpressionContext.class, NodeKind.CONDITIONAL_EXPRESSION),
        Map.entry(AssignmentExpressionContext.class, NodeKind.ASSIGNMENT_EXPRESSION),
        Map.entry(ParenthesizedExpressionContext.class, NodeKind.PARENTHESIZED_EXPRESSION)
    );

    // Keyword-only nodes keep their text but not their single token child.
    private static final Set<NodeKind> LEAF_KINDS = EnumSet.of(
            NodeKind.PRIMITIVE_TYPE, NodeKind.TYPE_QUALIFIER, NodeKind.STORAGE_CLASS_SPECIFIER);

    private final CharStream input;

    SyntaxTreeBuilder(CharStream input) {
        this.input = input;
    }

    SyntaxNode build(TranslationUnitContext unit, String source) {
        List<SyntaxNode> children = new ArrayList<>();
        convertChildren(unit, children);
        int lastLine = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') lastLine++;
        }
        return new SyntaxNode(NodeKind.TRANSLATION_UNIT, source, 1, lastLine,
                0, input.size(), children);
    }

    private void convert(ParseTree tree, List<SyntaxNode> out) {
        if (tree instanceof ErrorNode error) {
            out.add(errorLeaf(error.getSymbol()));
            return;
        }
        if (tree instanceof TerminalNode terminal) {
            Token token = terminal.getSymbol();
            if (token.getType() != Token.EOF) {
                out.add(leaf(terminalKind(terminal), token));
            }
            return;
        }
        ParserRuleContext ctx = (ParserRuleContext) tree;
        NodeKind kind = kindOf(ctx);
        if (kind == null) {
            convertChildren(ctx, out);
            return;
        }
        List<SyntaxNode> children = new ArrayList<>();
        if (!LEAF_KINDS.contains(kind)) {
            convertChildren(ctx, children);
        }
        out.add(node(kind, ctx, children));
    }

    private void convertChildren(ParserRuleContext ctx, List<SyntaxNode> out) {
        for (int i = 0; i < ctx.getChildCount(); i++) {
            convert(ctx.getChild(i), out);
        }
    }

    private static NodeKind kindOf(ParserRuleContext ctx) {
        if (ctx instanceof StructSpecifierContext struct) {
            return struct.getStart().getText().equals("union")
                    ? NodeKind.UNION_SPECIFIER
                    : NodeKind.STRUCT_SPECIFIER;
        }
        // Single expressions and single strings are not wrapped.
        if (ctx instanceof CommaExpressionContext comma) {
            return comma.expression().size() > 1 ? NodeKind.COMMA_EXPRESSION : null;
        }
        if (ctx instanceof StringExpressionContext strings) {
            return strings.StringLiteral().size() > 1 ? NodeKind.CONCATENATED_STRING : null;
        }
        return KINDS.get(ctx.getClass());
    }

    private static NodeKind terminalKind(TerminalNode terminal) {
        switch (terminal.getSymbol().getType()) {
            case CSnippetParser.NumberLiteral: return NodeKind.NUMBER_LITERAL;
            case CSnippetParser.CharLiteral:   return NodeKind.CHAR_LITERAL;
            case CSnippetParser.StringLiteral: return NodeKind.STRING_LITERAL;
            case CSnippetParser.Identifier:    return identifierKind(terminal.getParent());
            default:                           return NodeKind.TOKEN;
        }
    }

    private static NodeKind identifierKind(ParseTree parent) {
        if (parent instanceof TypeIdentifierContext
                || parent instanceof StructSpecifierContext
                || parent instanceof EnumSpecifierContext) {
            return NodeKind.TYPE_IDENTIFIER;
        }
        if (parent instanceof FieldExpressionContext || parent instanceof DesignatorContext) {
            return NodeKind.FIELD_IDENTIFIER;
        }
        if (parent instanceof LabeledStatementContext || parent instanceof GotoStatementContext) {
            return NodeKind.STATEMENT_IDENTIFIER;
        }
        return NodeKind.IDENTIFIER;
    }

    private SyntaxNode node(NodeKind kind, ParserRuleContext ctx, List<SyntaxNode> children) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        int line = start.getLine();
        int startOffset = Math.max(start.getStartIndex(), 0);
        if (stop == null || start.getType() == Token.EOF || stop.getStopIndex() < start.getStartIndex()) {
            // Empty match left behind by error recovery.
            return new SyntaxNode(kind, "", line, line, startOffset, startOffset, children);
        }
        String text = input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        return new SyntaxNode(kind, text, line, stop.getLine(),
                startOffset, stop.getStopIndex() + 1, children);
    }

    private static SyntaxNode leaf(NodeKind kind, Token token) {
        return new SyntaxNode(kind, token.getText(), token.getLine(), token.getLine(),
                token.getStartIndex(), token.getStopIndex() + 1, List.of());
    }

    private static SyntaxNode errorLeaf(Token token) {
        // Tokens conjured by recovery ("<missing ';'>") have no source span.
        if (token.getTokenIndex() < 0 || token.getStartIndex() < 0 || token.getType() == Token.EOF) {
            return new SyntaxNode(NodeKind.ERROR, "", token.getLine(), token.getLine(), 0, 0, List.of());
        }
        return leaf(NodeKind.ERROR, token);
    }
}
