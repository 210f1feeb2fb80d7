package com.ttennebkram.imageparallel.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imageparallel.processing.strategies.StrategyType;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads and writes {@link RunConfiguration} as JSON.
 * Keys that are missing fall back to the defaults; unknown keys are ignored.
 *
 * <pre>
 * {
 *   "saveDirectory": "SavedImages",
 *   "logFile": "image_transformations_log.csv",
 *   "imageFormat": "bmp",
 *   "workerCount": 16,
 *   "shiftOffset": 50,
 *   "strategy": "CloneMergeParallel",
 *   "coverRemainder": false
 * }
 * </pre>
 */
public class RunConfigurationSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Load a configuration from a JSON file.
     *
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static RunConfiguration load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            return fromJson(root);
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Save a configuration to a JSON file, creating parent directories as needed.
     */
    public static void save(RunConfiguration config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(config), writer);
        }
    }

    public static JsonObject toJson(RunConfiguration config) {
        JsonObject json = new JsonObject();
        json.addProperty("saveDirectory", config.getSaveDirectory().toString());
        json.addProperty("logFile", config.getLogFile().toString());
        json.addProperty("imageFormat", config.getImageFormat());
        json.addProperty("workerCount", config.getWorkerCount());
        json.addProperty("shiftOffset", config.getShiftOffset());
        json.addProperty("strategy", config.getStrategy().getLabel());
        json.addProperty("coverRemainder", config.isCoverRemainder());
        return json;
    }

    /**
     * @throws IllegalArgumentException if a value is out of range or the strategy is unknown
     */
    public static RunConfiguration fromJson(JsonObject json) {
        RunConfiguration config = new RunConfiguration();
        config.setSaveDirectory(Paths.get(getJsonString(json, "saveDirectory", RunConfiguration.DEFAULT_SAVE_DIRECTORY)));
        config.setLogFile(Paths.get(getJsonString(json, "logFile", RunConfiguration.DEFAULT_LOG_FILE)));
        config.setImageFormat(getJsonString(json, "imageFormat", RunConfiguration.DEFAULT_IMAGE_FORMAT));
        config.setWorkerCount(getJsonInt(json, "workerCount", RunConfiguration.DEFAULT_WORKER_COUNT));
        config.setShiftOffset(getJsonInt(json, "shiftOffset", RunConfiguration.DEFAULT_SHIFT_OFFSET));
        config.setStrategy(StrategyType.fromLabel(
            getJsonString(json, "strategy", StrategyType.SEQUENTIAL.getLabel())));
        config.setCoverRemainder(getJsonBoolean(json, "coverRemainder", false));
        return config;
    }

    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    private static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsBoolean();
        }
        return defaultValue;
    }

    private static String getJsonString(JsonObject json, String key, String defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsString();
        }
        return defaultValue;
    }
}
