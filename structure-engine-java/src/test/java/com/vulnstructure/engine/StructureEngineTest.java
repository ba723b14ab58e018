package com.vulnstructure.engine;

import com.vulnstructure.engine.bounded.BoundedExecutor;
import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.model.StructureModel.*;
import com.vulnstructure.engine.syntax.CSourceParser;
import com.vulnstructure.engine.syntax.ParseResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StructureEngineTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/c-snippets");

    /** Parser that takes far longer than any budget used here. */
    private static class SlowParser extends CSourceParser {
        @Override
        public ParseResult parse(String code) {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.parse(code);
        }
    }

    @Test
    void analyzesFixtureWithAllLayers() throws IOException {
        String code = Files.readString(FIXTURES.resolve("two_functions.c"));
        StructuralAnalysis analysis = new StructureEngine().analyze(code);

        assertTrue(analysis.extractionSuccess.ast);
        assertTrue(analysis.extractionSuccess.cfg);
        assertTrue(analysis.extractionSuccess.pdg);

        assertEquals(2, analysis.astPatterns.functions.size());
        assertEquals(2, analysis.cfgAnalysis.globalStats.totalFunctions);
        assertEquals(8, analysis.cfgAnalysis.globalStats.totalNodes);
        assertEquals(4, analysis.pdgAnalysis.functions.get("log_message").vulnerabilityIndicators.trackedFuncs);
    }

    @Test
    void strictSyntaxFailsEveryLayer() {
        StructureEngine engine = new StructureEngine(EngineConfig.builder().strictSyntax(true).build());
        String broken = "int f( {";

        PatternSummary ast = engine.extractPatterns(broken);
        assertFalse(ast.success);
        assertTrue(ast.error.startsWith("syntax error at line 1:"), ast.error);
        assertEquals(0, ast.nodeCount);
        assertTrue(ast.functions.isEmpty());

        ControlFlowReport cfg = engine.buildControlFlow(broken);
        assertFalse(cfg.success);
        assertTrue(cfg.functions.isEmpty());
        assertEquals(0, cfg.globalStats.totalNodes);

        DependenceReport pdg = engine.buildDependence(broken);
        assertFalse(pdg.success);
        assertTrue(pdg.functions.isEmpty());
        assertEquals(0, pdg.globalStats.totalDependencies);
    }

    @Test
    void tolerantParseCountsSyntaxErrors() {
        PatternSummary ast = new StructureEngine().extractPatterns("int f( {");
        assertTrue(ast.success);
        assertTrue(ast.syntaxErrorCount > 0);
    }

    @Test
    void nullSourceIsReportedNotThrown() {
        PatternSummary ast = new StructureEngine().extractPatterns(null);
        assertFalse(ast.success);
        assertEquals("source text is null", ast.error);
    }

    @Test
    void slowLayerTimesOut() {
        StructureEngine engine = new StructureEngine(EngineConfig.defaults(), new SlowParser());
        long start = System.nanoTime();
        ControlFlowReport cfg = engine.buildControlFlow("int f(void) { return 0; }", 1);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(cfg.success);
        assertEquals(BoundedExecutor.TIMEOUT, cfg.error);
        assertTrue(elapsedMillis < 3000, "took " + elapsedMillis + " ms");
    }

    @Test
    void timeoutOfOneLayerLeavesOthersIntact() {
        EngineConfig config = EngineConfig.builder().cfgEnabled(false).pdgEnabled(false).build();
        StructureEngine engine = new StructureEngine(config, new SlowParser());
        StructuralAnalysis analysis = engine.analyze("int x;", new StructureEngine.Timeouts(1, null, null));

        assertEquals(BoundedExecutor.TIMEOUT, analysis.astPatterns.error);
        assertFalse(analysis.extractionSuccess.ast);
        assertEquals(StructureEngine.DISABLED, analysis.cfgAnalysis.error);
        assertEquals(StructureEngine.DISABLED, analysis.pdgAnalysis.error);
    }

    @Test
    void disabledLayerIsReportedAsFailed() {
        StructureEngine engine = new StructureEngine(EngineConfig.builder().pdgEnabled(false).build());
        StructuralAnalysis analysis = engine.analyze("void f(void) { g(); }");

        assertTrue(analysis.extractionSuccess.ast);
        assertTrue(analysis.extractionSuccess.cfg);
        assertFalse(analysis.extractionSuccess.pdg);
        assertEquals(StructureEngine.DISABLED, analysis.pdgAnalysis.error);
        assertTrue(analysis.pdgAnalysis.functions.isEmpty());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StructureEngine.Timeouts(0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new StructureEngine().extractPatterns("int x;", -1));
    }

    @Test
    void layersAreIndependentOfEachOther() {
        StructureEngine engine = new StructureEngine();
        String code = "int g(int a) { if (a) return 1; return 0; }";
        ControlFlowReport alone = engine.buildControlFlow(code);
        StructuralAnalysis together = engine.analyze(code);
        assertEquals(alone.functions.get("g").edgeCount,
                together.cfgAnalysis.functions.get("g").edgeCount);
    }
}
