package com.vulnstructure.adapter.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.vulnstructure.engine.config.EngineConfig;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class EngineConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads an engine configuration JSON file.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds an invalid value
     */
    public EngineConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            EngineConfigFile file = GSON.fromJson(reader, EngineConfigFile.class);
            if (file == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return file.toEngineConfig();
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Invalid config value in " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
