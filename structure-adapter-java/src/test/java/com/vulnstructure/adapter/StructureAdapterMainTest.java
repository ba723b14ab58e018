package com.vulnstructure.adapter;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class StructureAdapterMainTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/c-snippets");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(StructureAdapterMain.UsageException.class, () -> StructureAdapterMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"record"}));
    }

    @Test
    void missingInputFlagThrowsUsageException() {
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--output", "/tmp/report.json"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--input"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--foo", "bar"}));
    }

    @Test
    void nonPositiveTimeoutThrowsUsageException() {
        String input = FIXTURES.resolve("branch_and_loop.c").toString();
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--input", input, "--cfg-timeout", "0"}));
        assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--input", input, "--ast-timeout", "soon"}));
    }

    @Test
    void missingInputFileThrowsUsageException(@TempDir Path tmp) {
        String missing = tmp.resolve("absent.c").toString();
        Exception ex = assertThrows(StructureAdapterMain.UsageException.class,
                () -> StructureAdapterMain.run(new String[]{"analyze", "--input", missing}));
        assertTrue(ex.getMessage().contains("absent.c"));
    }

    @Test
    void writesReportForFixture(@TempDir Path tmp) throws IOException {
        Path output = tmp.resolve("reports/branch_and_loop.json");
        StructureAdapterMain.run(new String[]{
                "analyze",
                "--input", FIXTURES.resolve("branch_and_loop.c").toString(),
                "--output", output.toString(),
                "--pdg-timeout", "20"});

        assertTrue(Files.exists(output));
        JsonObject report = JsonParser.parseString(Files.readString(output)).getAsJsonObject();

        JsonObject metadata = report.getAsJsonObject("metadata");
        assertTrue(metadata.get("source_file").getAsString().endsWith("branch_and_loop.c"));
        assertFalse(metadata.get("timestamp").getAsString().isEmpty());

        JsonObject success = report.getAsJsonObject("extraction_success");
        assertTrue(success.get("ast").getAsBoolean());
        assertTrue(success.get("cfg").getAsBoolean());
        assertTrue(success.get("pdg").getAsBoolean());

        JsonObject compute = report.getAsJsonObject("cfg_analysis")
                .getAsJsonObject("functions").getAsJsonObject("compute");
        assertEquals(4, compute.get("complexity").getAsInt());
        assertEquals(4, compute.get("basic_blocks").getAsInt());
    }

    @Test
    void configFileSwitchesLayersOff(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("config.json");
        Files.writeString(config, "{ \"enable_cfg\": false, \"enable_pdg\": false }");
        Path output = tmp.resolve("report.json");

        StructureAdapterMain.run(new String[]{
                "analyze",
                "--input", FIXTURES.resolve("statements_only.c").toString(),
                "--config", config.toString(),
                "--output", output.toString()});

        JsonObject report = JsonParser.parseString(Files.readString(output)).getAsJsonObject();
        assertTrue(report.getAsJsonObject("extraction_success").get("ast").getAsBoolean());
        assertEquals("disabled", report.getAsJsonObject("cfg_analysis").get("error").getAsString());
        assertEquals("disabled", report.getAsJsonObject("pdg_analysis").get("error").getAsString());
        assertEquals(2, report.getAsJsonObject("ast_patterns").getAsJsonArray("calls").size());
    }
}
