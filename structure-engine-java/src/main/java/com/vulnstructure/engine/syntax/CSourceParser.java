package com.vulnstructure.engine.syntax;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses C source text into a {@link SyntaxTree}.
 *
 * Parsing first runs in SLL mode and bails out on the first error; only input that
 * fails there is parsed again in full LL mode with error recovery. In tolerant mode
 * (the default) recovered syntax errors are recorded on the tree. In strict mode any
 * syntax error makes the parse fail.
 *
 * Never throws: null input and parser crashes are reported as failed results.
 */
public class CSourceParser {

    private final boolean strictSyntax;

    public CSourceParser() {
        this(false);
    }

    public CSourceParser(boolean strictSyntax) {
        this.strictSyntax = strictSyntax;
    }

    public ParseResult parse(String code) {
        if (code == null) {
            return ParseResult.failure("source text is null");
        }
        try {
            return parseSource(code);
        } catch (StackOverflowError e) {
            return ParseResult.failure("parser error: input nested too deeply");
        } catch (RuntimeException e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ParseResult.failure("parser error: " + detail);
        }
    }

    private ParseResult parseSource(String code) {
        CharStream input = CharStreams.fromString(code);
        SyntaxErrorCollector errors = new SyntaxErrorCollector();

        CSnippetLexer lexer = new CSnippetLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        CSnippetParser parser = new CSnippetParser(tokens);
        parser.removeErrorListeners();
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.setErrorHandler(new BailErrorStrategy());

        CSnippetParser.TranslationUnitContext unit;
        try {
            unit = parser.translationUnit();
        } catch (ParseCancellationException e) {
            tokens.seek(0);
            parser.reset();
            parser.addErrorListener(errors);
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            unit = parser.translationUnit();
        }

        if (strictSyntax && !errors.errors().isEmpty()) {
            return ParseResult.failure("syntax error at " + errors.errors().get(0));
        }
        SyntaxNode root = new SyntaxTreeBuilder(input).build(unit, code);
        return ParseResult.success(new SyntaxTree(root, code, errors.errors()));
    }
}
