package com.vulnstructure.adapter.config;

import com.google.gson.annotations.SerializedName;
import com.vulnstructure.engine.config.EngineConfig;

import java.util.List;

/**
 * Deserialized form of an engine configuration JSON file. Every key is optional;
 * an absent key keeps the engine default.
 */
public class EngineConfigFile {

    @SerializedName("ast_timeout_seconds")
    private Integer astTimeoutSeconds;

    @SerializedName("cfg_timeout_seconds")
    private Integer cfgTimeoutSeconds;

    @SerializedName("pdg_timeout_seconds")
    private Integer pdgTimeoutSeconds;

    /** Depth below which nodes are not counted (default: 10). */
    @SerializedName("ast_max_depth")
    private Integer astMaxDepth;

    @SerializedName("error_message_length")
    private Integer errorMessageLength;

    @SerializedName("function_error_message_length")
    private Integer functionErrorMessageLength;

    @SerializedName("statement_text_length")
    private Integer statementTextLength;

    @SerializedName("snippet_text_length")
    private Integer snippetTextLength;

    @SerializedName("operation_text_length")
    private Integer operationTextLength;

    @SerializedName("high_risk_functions")
    private List<String> highRiskFunctions;

    @SerializedName("memory_management_functions")
    private List<String> memoryManagementFunctions;

    @SerializedName("string_manipulation_functions")
    private List<String> stringManipulationFunctions;

    @SerializedName("complexity_medium_threshold")
    private Integer complexityMediumThreshold;

    @SerializedName("complexity_high_threshold")
    private Integer complexityHighThreshold;

    /** Whether any syntax error fails the parse (default: false). */
    @SerializedName("strict_syntax")
    private Boolean strictSyntax;

    @SerializedName("enable_ast")
    private Boolean enableAst;

    @SerializedName("enable_cfg")
    private Boolean enableCfg;

    @SerializedName("enable_pdg")
    private Boolean enablePdg;

    /**
     * Applies the keys present in the file on top of the engine defaults.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public EngineConfig toEngineConfig() {
        EngineConfig defaults = EngineConfig.defaults();
        return EngineConfig.builder()
                .astTimeoutSeconds(or(astTimeoutSeconds, defaults.astTimeoutSeconds))
                .cfgTimeoutSeconds(or(cfgTimeoutSeconds, defaults.cfgTimeoutSeconds))
                .pdgTimeoutSeconds(or(pdgTimeoutSeconds, defaults.pdgTimeoutSeconds))
                .astMaxDepth(or(astMaxDepth, defaults.astMaxDepth))
                .errorMessageLength(or(errorMessageLength, defaults.errorMessageLength))
                .functionErrorMessageLength(or(functionErrorMessageLength, defaults.functionErrorMessageLength))
                .statementTextLength(or(statementTextLength, defaults.statementTextLength))
                .snippetTextLength(or(snippetTextLength, defaults.snippetTextLength))
                .operationTextLength(or(operationTextLength, defaults.operationTextLength))
                .highRiskFunctions(or(highRiskFunctions, defaults.highRiskFunctions))
                .memoryManagementFunctions(or(memoryManagementFunctions, defaults.memoryManagementFunctions))
                .stringManipulationFunctions(or(stringManipulationFunctions, defaults.stringManipulationFunctions))
                .complexityMediumThreshold(or(complexityMediumThreshold, defaults.complexityMediumThreshold))
                .complexityHighThreshold(or(complexityHighThreshold, defaults.complexityHighThreshold))
                .strictSyntax(or(strictSyntax, defaults.strictSyntax))
                .astEnabled(or(enableAst, defaults.astEnabled))
                .cfgEnabled(or(enableCfg, defaults.cfgEnabled))
                .pdgEnabled(or(enablePdg, defaults.pdgEnabled))
                .build();
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
