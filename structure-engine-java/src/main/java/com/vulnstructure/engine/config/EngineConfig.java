package com.vulnstructure.engine.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable configuration of the structure engine.
 * Built once and passed to the engine; {@link #defaults()} matches the values
 * documented for the JSON configuration file.
 */
public final class EngineConfig {

    public static final List<String> DEFAULT_HIGH_RISK_FUNCTIONS = List.of(
            "gets", "sprintf", "strcpy", "strcat", "scanf",
            "printf", "fprintf", "snprintf", "vsnprintf");

    public static final List<String> DEFAULT_MEMORY_MANAGEMENT_FUNCTIONS = List.of(
            "malloc", "free", "calloc", "realloc", "new", "delete", "new[]", "delete[]");

    public static final List<String> DEFAULT_STRING_MANIPULATION_FUNCTIONS = List.of(
            "strcpy", "strcat", "strncpy", "strncat", "sprintf", "snprintf",
            "vsprintf", "vsnprintf", "gets", "fgets", "scanf", "fscanf");

    /** Wall-clock budget of the pattern layer, in seconds. */
    public final int astTimeoutSeconds;
    /** Wall-clock budget of the control-flow layer, in seconds. */
    public final int cfgTimeoutSeconds;
    /** Wall-clock budget of the dependency layer, in seconds. */
    public final int pdgTimeoutSeconds;

    /** Depth below which the pattern layer's node count stops descending. */
    public final int astMaxDepth;

    public final int errorMessageLength;
    public final int functionErrorMessageLength;
    public final int statementTextLength;
    public final int snippetTextLength;
    public final int operationTextLength;

    public final List<String> highRiskFunctions;
    public final List<String> memoryManagementFunctions;
    public final List<String> stringManipulationFunctions;

    public final int complexityMediumThreshold;
    public final int complexityHighThreshold;

    /** When set, any syntax error fails the parse instead of being recovered. */
    public final boolean strictSyntax;

    public final boolean astEnabled;
    public final boolean cfgEnabled;
    public final boolean pdgEnabled;

    private EngineConfig(Builder b) {
        requirePositive(b.astTimeoutSeconds, "ast_timeout_seconds");
        requirePositive(b.cfgTimeoutSeconds, "cfg_timeout_seconds");
        requirePositive(b.pdgTimeoutSeconds, "pdg_timeout_seconds");
        if (b.astMaxDepth < 0) {
            throw new IllegalArgumentException("ast_max_depth must be >= 0, got " + b.astMaxDepth);
        }
        requireCap(b.errorMessageLength, "error_message_length");
        requireCap(b.functionErrorMessageLength, "function_error_message_length");
        requireCap(b.statementTextLength, "statement_text_length");
        requireCap(b.snippetTextLength, "snippet_text_length");
        requireCap(b.operationTextLength, "operation_text_length");
        if (b.complexityMediumThreshold > b.complexityHighThreshold) {
            throw new IllegalArgumentException("complexity_medium_threshold ("
                    + b.complexityMediumThreshold + ") exceeds complexity_high_threshold ("
                    + b.complexityHighThreshold + ")");
        }

        this.astTimeoutSeconds = b.astTimeoutSeconds;
        this.cfgTimeoutSeconds = b.cfgTimeoutSeconds;
        this.pdgTimeoutSeconds = b.pdgTimeoutSeconds;
        this.astMaxDepth = b.astMaxDepth;
        this.errorMessageLength = b.errorMessageLength;
        this.functionErrorMessageLength = b.functionErrorMessageLength;
        this.statementTextLength = b.statementTextLength;
        this.snippetTextLength = b.snippetTextLength;
        this.operationTextLength = b.operationTextLength;
        this.highRiskFunctions = List.copyOf(b.highRiskFunctions);
        this.memoryManagementFunctions = List.copyOf(b.memoryManagementFunctions);
        this.stringManipulationFunctions = List.copyOf(b.stringManipulationFunctions);
        this.complexityMediumThreshold = b.complexityMediumThreshold;
        this.complexityHighThreshold = b.complexityHighThreshold;
        this.strictSyntax = b.strictSyntax;
        this.astEnabled = b.astEnabled;
        this.cfgEnabled = b.cfgEnabled;
        this.pdgEnabled = b.pdgEnabled;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .astTimeoutSeconds(astTimeoutSeconds)
                .cfgTimeoutSeconds(cfgTimeoutSeconds)
                .pdgTimeoutSeconds(pdgTimeoutSeconds)
                .astMaxDepth(astMaxDepth)
                .errorMessageLength(errorMessageLength)
                .functionErrorMessageLength(functionErrorMessageLength)
                .statementTextLength(statementTextLength)
                .snippetTextLength(snippetTextLength)
                .operationTextLength(operationTextLength)
                .highRiskFunctions(highRiskFunctions)
                .memoryManagementFunctions(memoryManagementFunctions)
                .stringManipulationFunctions(stringManipulationFunctions)
                .complexityMediumThreshold(complexityMediumThreshold)
                .complexityHighThreshold(complexityHighThreshold)
                .strictSyntax(strictSyntax)
                .astEnabled(astEnabled)
                .cfgEnabled(cfgEnabled)
                .pdgEnabled(pdgEnabled);
    }

    /** Concatenation of the three tracked lists; used for membership tests only. */
    public List<String> trackedFunctions() {
        List<String> tracked = new ArrayList<>(highRiskFunctions);
        tracked.addAll(memoryManagementFunctions);
        tracked.addAll(stringManipulationFunctions);
        return Collections.unmodifiableList(tracked);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be a positive number of seconds, got " + value);
        }
    }

    private static void requireCap(int value, String name) {
        if (value < 4) {
            throw new IllegalArgumentException(name + " must be at least 4, got " + value);
        }
    }

    public static final class Builder {
        private int astTimeoutSeconds = 5;
        private int cfgTimeoutSeconds = 5;
        private int pdgTimeoutSeconds = 10;
        private int astMaxDepth = 10;
        private int errorMessageLength = 100;
        private int functionErrorMessageLength = 50;
        private int statementTextLength = 200;
        private int snippetTextLength = 100;
        private int operationTextLength = 50;
        private List<String> highRiskFunctions = DEFAULT_HIGH_RISK_FUNCTIONS;
        private List<String> memoryManagementFunctions = DEFAULT_MEMORY_MANAGEMENT_FUNCTIONS;
        private List<String> stringManipulationFunctions = DEFAULT_STRING_MANIPULATION_FUNCTIONS;
        private int complexityMediumThreshold = 5;
        private int complexityHighThreshold = 10;
        private boolean strictSyntax = false;
        private boolean astEnabled = true;
        private boolean cfgEnabled = true;
        private boolean pdgEnabled = true;

        private Builder() {}

        public Builder astTimeoutSeconds(int v)           { this.astTimeoutSeconds = v; return this; }
        public Builder cfgTimeoutSeconds(int v)           { this.cfgTimeoutSeconds = v; return this; }
        public Builder pdgTimeoutSeconds(int v)           { this.pdgTimeoutSeconds = v; return this; }
        public Builder astMaxDepth(int v)                 { this.astMaxDepth = v; return this; }
        public Builder errorMessageLength(int v)          { this.errorMessageLength = v; return this; }
        public Builder functionErrorMessageLength(int v)  { this.functionErrorMessageLength = v; return this; }
        public Builder statementTextLength(int v)         { this.statementTextLength = v; return this; }
        public Builder snippetTextLength(int v)           { this.snippetTextLength = v; return this; }
        public Builder operationTextLength(int v)         { this.operationTextLength = v; return this; }
        public Builder highRiskFunctions(List<String> v)  { this.highRiskFunctions = v; return this; }
        public Builder memoryManagementFunctions(List<String> v)   { this.memoryManagementFunctions = v; return this; }
        public Builder stringManipulationFunctions(List<String> v) { this.stringManipulationFunctions = v; return this; }
        public Builder complexityMediumThreshold(int v)   { this.complexityMediumThreshold = v; return this; }
        public Builder complexityHighThreshold(int v)     { this.complexityHighThreshold = v; return this; }
        public Builder strictSyntax(boolean v)            { this.strictSyntax = v; return this; }
        public Builder astEnabled(boolean v)              { this.astEnabled = v; return this; }
        public Builder cfgEnabled(boolean v)              { this.cfgEnabled = v; return this; }
        public Builder pdgEnabled(boolean v)              { this.pdgEnabled = v; return this; }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
