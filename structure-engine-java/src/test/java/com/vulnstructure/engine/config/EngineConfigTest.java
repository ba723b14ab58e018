package com.vulnstructure.engine.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(5, config.astTimeoutSeconds);
        assertEquals(5, config.cfgTimeoutSeconds);
        assertEquals(10, config.pdgTimeoutSeconds);
        assertEquals(10, config.astMaxDepth);
        assertEquals(100, config.errorMessageLength);
        assertEquals(50, config.functionErrorMessageLength);
        assertEquals(200, config.statementTextLength);
        assertFalse(config.strictSyntax);
        assertTrue(config.astEnabled && config.cfgEnabled && config.pdgEnabled);
    }

    @Test
    void trackedFunctionsCombineAllLists() {
        List<String> tracked = EngineConfig.defaults().trackedFunctions();
        assertTrue(tracked.containsAll(List.of("gets", "malloc", "free", "strncpy", "fgets")));
        assertFalse(tracked.contains("memcpy"));
    }

    @Test
    void toBuilderKeepsValues() {
        EngineConfig custom = EngineConfig.builder()
                .astTimeoutSeconds(2)
                .highRiskFunctions(List.of("system"))
                .strictSyntax(true)
                .build();
        EngineConfig copy = custom.toBuilder().build();
        assertEquals(2, copy.astTimeoutSeconds);
        assertEquals(List.of("system"), copy.highRiskFunctions);
        assertTrue(copy.strictSyntax);
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.builder().cfgTimeoutSeconds(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.builder().pdgTimeoutSeconds(-3).build());
    }

    @Test
    void tinyTextCapIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.builder().errorMessageLength(3).build());
    }

    @Test
    void invertedComplexityThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.builder().complexityMediumThreshold(12).complexityHighThreshold(10).build());
    }

    @Test
    void trackedListsAreImmutable() {
        EngineConfig config = EngineConfig.defaults();
        assertThrows(UnsupportedOperationException.class, () -> config.highRiskFunctions.add("system"));
    }
}
