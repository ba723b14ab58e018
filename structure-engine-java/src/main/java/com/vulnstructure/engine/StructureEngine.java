package com.vulnstructure.engine;

import com.vulnstructure.engine.ast_patterns.PatternExtractor;
import com.vulnstructure.engine.bounded.BoundedExecutor;
import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.control_flow.ControlFlowBuilder;
import com.vulnstructure.engine.dependence.DependenceBuilder;
import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.support.Texts;
import com.vulnstructure.engine.syntax.CSourceParser;
import com.vulnstructure.engine.syntax.ParseResult;
import com.vulnstructure.engine.syntax.SyntaxTree;

import java.time.Duration;
import java.util.function.Function;

/**
 * Entry point of the engine: analyses one C snippet into pattern, control-flow
 * and dependence results.
 *
 * Each layer parses the snippet itself and runs under its own time budget, so a
 * slow or failing layer never affects the others. No method throws for bad
 * input; failures come back as records with success=false.
 */
public class StructureEngine {

    public static final String DISABLED = "disabled";

    private final EngineConfig config;
    private final CSourceParser parser;
    private final BoundedExecutor executor;
    private final PatternExtractor patternExtractor;
    private final ControlFlowBuilder controlFlowBuilder;
    private final DependenceBuilder dependenceBuilder;

    public StructureEngine() {
        this(EngineConfig.defaults());
    }

    public StructureEngine(EngineConfig config) {
        this(config, new CSourceParser(config.strictSyntax));
    }

    StructureEngine(EngineConfig config, CSourceParser parser) {
        this.config = config;
        this.parser = parser;
        this.executor = new BoundedExecutor(config.errorMessageLength);
        this.patternExtractor = new PatternExtractor(config);
        this.controlFlowBuilder = new ControlFlowBuilder(config);
        this.dependenceBuilder = new DependenceBuilder(config);
    }

    /** Per-call timeout overrides in seconds; null keeps the configured budget. */
    public record Timeouts(Integer astSeconds, Integer cfgSeconds, Integer pdgSeconds) {

        public static final Timeouts CONFIGURED = new Timeouts(null, null, null);

        public Timeouts {
            requirePositive(astSeconds, "ast");
            requirePositive(cfgSeconds, "cfg");
            requirePositive(pdgSeconds, "pdg");
        }

        private static void requirePositive(Integer seconds, String layer) {
            if (seconds != null && seconds <= 0) {
                throw new IllegalArgumentException(layer + " timeout must be positive, got " + seconds);
            }
        }
    }

    public PatternSummary extractPatterns(String code) {
        return extractPatterns(code, config.astTimeoutSeconds);
    }

    public PatternSummary extractPatterns(String code, int timeoutSeconds) {
        return runLayer("ast", code, timeoutSeconds, patternExtractor::extract, PatternSummary::failure);
    }

    public ControlFlowReport buildControlFlow(String code) {
        return buildControlFlow(code, config.cfgTimeoutSeconds);
    }

    public ControlFlowReport buildControlFlow(String code, int timeoutSeconds) {
        return runLayer("cfg", code, timeoutSeconds, controlFlowBuilder::build, ControlFlowReport::failure);
    }

    public DependenceReport buildDependence(String code) {
        return buildDependence(code, config.pdgTimeoutSeconds);
    }

    public DependenceReport buildDependence(String code, int timeoutSeconds) {
        return runLayer("pdg", code, timeoutSeconds, dependenceBuilder::build, DependenceReport::failure);
    }

    public StructuralAnalysis analyze(String code) {
        return analyze(code, Timeouts.CONFIGURED);
    }

    /** All enabled layers, one after another; a disabled layer reports error "disabled". */
    public StructuralAnalysis analyze(String code, Timeouts timeouts) {
        StructuralAnalysis analysis = new StructuralAnalysis();
        analysis.astPatterns = config.astEnabled
                ? extractPatterns(code, orDefault(timeouts.astSeconds(), config.astTimeoutSeconds))
                : PatternSummary.failure(DISABLED);
        analysis.cfgAnalysis = config.cfgEnabled
                ? buildControlFlow(code, orDefault(timeouts.cfgSeconds(), config.cfgTimeoutSeconds))
                : ControlFlowReport.failure(DISABLED);
        analysis.pdgAnalysis = config.pdgEnabled
                ? buildDependence(code, orDefault(timeouts.pdgSeconds(), config.pdgTimeoutSeconds))
                : DependenceReport.failure(DISABLED);

        ExtractionSuccess success = new ExtractionSuccess();
        success.ast = analysis.astPatterns.success;
        success.cfg = analysis.cfgAnalysis.success;
        success.pdg = analysis.pdgAnalysis.success;
        analysis.extractionSuccess = success;
        return analysis;
    }

    private <T> T runLayer(String layer, String code, int timeoutSeconds,
                           Function<SyntaxTree, T> extractor, Function<String, T> onFailure) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException(layer + " timeout must be positive, got " + timeoutSeconds);
        }
        return executor.call(layer, () -> {
            ParseResult parsed = parser.parse(code);
            if (!parsed.isSuccess()) {
                return onFailure.apply(Texts.cleanErrorMessage(parsed.failureReason(), config.errorMessageLength));
            }
            return extractor.apply(parsed.tree());
        }, Duration.ofSeconds(timeoutSeconds), onFailure);
    }

    private static int orDefault(Integer override, int configured) {
        return override != null ? override : configured;
    }
}
