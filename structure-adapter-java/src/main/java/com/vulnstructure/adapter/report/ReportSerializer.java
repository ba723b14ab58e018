package com.vulnstructure.adapter.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import com.vulnstructure.engine.model.StructureModel.*;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes a combined analysis as a pretty-printed JSON report. Null fields are
 * written out so every report has the same keys.
 */
public class ReportSerializer {

    public static final String ENGINE_VERSION = "0.1.0";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes the report to {@code outputFile}, creating parent directories as needed.
     *
     * @param analysis   combined analysis of one unit
     * @param sourceFile path of the analysed file, recorded in the metadata block
     * @param outputFile report destination
     */
    public void write(StructuralAnalysis analysis, String sourceFile, Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + parent, e);
        }
        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            write(analysis, sourceFile, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report " + outputFile + ": " + e.getMessage(), e);
        }
    }

    /** Writes the report to an open writer (for example standard output); the writer is flushed, not closed. */
    public void write(StructuralAnalysis analysis, String sourceFile, Writer out) {
        try {
            GSON.toJson(toReport(analysis, sourceFile), out);
            out.write(System.lineSeparator());
            out.flush();
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report: " + e.getMessage(), e);
        }
    }

    public String toJson(StructuralAnalysis analysis, String sourceFile) {
        return GSON.toJson(toReport(analysis, sourceFile));
    }

    private static Report toReport(StructuralAnalysis analysis, String sourceFile) {
        Report report = new Report();
        report.metadata = new Metadata(sourceFile, ENGINE_VERSION, Instant.now().toString());
        report.astPatterns = analysis.astPatterns;
        report.cfgAnalysis = analysis.cfgAnalysis;
        report.pdgAnalysis = analysis.pdgAnalysis;
        report.extractionSuccess = analysis.extractionSuccess;
        return report;
    }

    private static class Report {
        @SerializedName("metadata")           Metadata metadata;
        @SerializedName("ast_patterns")       PatternSummary astPatterns;
        @SerializedName("cfg_analysis")       ControlFlowReport cfgAnalysis;
        @SerializedName("pdg_analysis")       DependenceReport pdgAnalysis;
        @SerializedName("extraction_success") ExtractionSuccess extractionSuccess;
    }

    private record Metadata(
            @SerializedName("source_file")    String sourceFile,
            @SerializedName("engine_version") String engineVersion,
            @SerializedName("timestamp")      String timestamp
    ) {}
}
