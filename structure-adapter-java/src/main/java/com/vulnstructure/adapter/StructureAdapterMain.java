package com.vulnstructure.adapter;

import com.vulnstructure.adapter.config.EngineConfigReader;
import com.vulnstructure.adapter.report.ReportSerializer;
import com.vulnstructure.engine.StructureEngine;
import com.vulnstructure.engine.config.EngineConfig;
import com.vulnstructure.engine.model.StructureModel.StructuralAnalysis;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: analyses one C source file.
 *
 * Usage:
 *   java -jar structure-adapter-java.jar analyze \
 *     --input  <file.c> \
 *     [--output <report.json>] \
 *     [--config <config.json>] \
 *     [--ast-timeout N] [--cfg-timeout N] [--pdg-timeout N]
 *
 * Without --output the report goes to standard output.
 */
public class StructureAdapterMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[structure-adapter] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar structure-adapter-java.jar analyze " +
                               "--input <file.c> [--output <report.json>] [--config <config.json>] " +
                               "[--ast-timeout N] [--cfg-timeout N] [--pdg-timeout N]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[structure-adapter] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String inputPath = null;
        String outputPath = null;
        String configPath = null;
        Integer astTimeout = null;
        Integer cfgTimeout = null;
        Integer pdgTimeout = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"       -> inputPath  = requireNext(args, i++, "--input");
                case "--output"      -> outputPath = requireNext(args, i++, "--output");
                case "--config"      -> configPath = requireNext(args, i++, "--config");
                case "--ast-timeout" -> astTimeout = seconds(requireNext(args, i++, "--ast-timeout"), "--ast-timeout");
                case "--cfg-timeout" -> cfgTimeout = seconds(requireNext(args, i++, "--cfg-timeout"), "--cfg-timeout");
                case "--pdg-timeout" -> pdgTimeout = seconds(requireNext(args, i++, "--pdg-timeout"), "--pdg-timeout");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (inputPath == null) throw new UsageException("--input is required");

        Path input = Paths.get(inputPath);

        // 1. Configuration
        EngineConfig config = EngineConfig.defaults();
        if (configPath != null) {
            System.err.println("[structure-adapter] Reading config: " + configPath);
            config = new EngineConfigReader().read(Paths.get(configPath));
        }

        // 2. Source
        System.err.println("[structure-adapter] Reading source: " + input);
        String code = readSource(input);

        // 3. Analysis
        StructuralAnalysis analysis = new StructureEngine(config).analyze(
                code, new StructureEngine.Timeouts(astTimeout, cfgTimeout, pdgTimeout));
        System.err.println("[structure-adapter] Analysis complete: ast=" + analysis.extractionSuccess.ast
                + ", cfg=" + analysis.extractionSuccess.cfg
                + ", pdg=" + analysis.extractionSuccess.pdg);

        // 4. Report
        ReportSerializer serializer = new ReportSerializer();
        if (outputPath != null) {
            Path output = Paths.get(outputPath);
            serializer.write(analysis, input.toString(), output);
            System.err.println("[structure-adapter] Report written: " + output);
        } else {
            serializer.write(analysis, input.toString(),
                    new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        }

        System.err.println("[structure-adapter] Done.");
    }

    // Undecodable bytes become replacement characters rather than failing the read.
    private static String readSource(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new UsageException("Input file not found: " + input);
        }
        try {
            return new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input " + input + ": " + e.getMessage(), e);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static int seconds(String value, String flag) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a whole number of seconds, got: " + value);
        }
        if (parsed <= 0) {
            throw new UsageException(flag + " must be positive, got: " + value);
        }
        return parsed;
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
