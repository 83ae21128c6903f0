package com.usageprofile.counter.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class CounterConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes counter-config.json from the given path.
     *
     * @throws ConfigException if the file is missing or malformed
     */
    public CounterConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            CounterConfig config = GSON.fromJson(reader, CounterConfig.class);
            if (config == null) {
                throw new ConfigException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        }
    }
}
