package com.scrapyard.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.scrapyard.navigation.Heuristic;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link NavigatorConfig} from JSON.
 *
 * <p>Keys use lower_underscore naming ({@code search_radius}, {@code max_search_iterations}).
 * Keys missing from the file keep their default values.
 */
@Slf4j
public class NavigatorConfigLoader {

    public static final String DEFAULT_RESOURCE = "/config/navigator.json";

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    /**
     * Load the bundled configuration.
     *
     * @return the loaded config
     * @throws IOException if the resource is missing or malformed
     */
    public static NavigatorConfig loadDefault() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    public static NavigatorConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream is = NavigatorConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                NavigatorConfig config = parse(reader);
                log.debug("Loaded navigator config from resource {}", resourcePath);
                return config;
            }
        }
    }

    public static NavigatorConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            NavigatorConfig config = parse(reader);
            log.debug("Loaded navigator config from {}", path);
            return config;
        }
    }

    /**
     * Parse JSON config, overlaying present keys on the defaults.
     *
     * @param reader JSON source
     * @return the config
     * @throws IOException if the JSON is malformed or a value is out of range
     */
    public static NavigatorConfig parse(Reader reader) throws IOException {
        ConfigFile file;
        try {
            file = GSON.fromJson(reader, ConfigFile.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed navigator config: " + e.getMessage(), e);
        }
        if (file == null) {
            return NavigatorConfig.defaults();
        }
        NavigatorConfig config = file.applyTo(NavigatorConfig.builder()).build();
        validate(config);
        return config;
    }

    private static void validate(NavigatorConfig config) throws IOException {
        if (config.getMaxSearchIterations() <= 0) {
            throw new IOException("max_search_iterations must be positive: " + config.getMaxSearchIterations());
        }
        if (config.getAgentSpeed() < 0 || config.getAgentCapacity() < 0) {
            throw new IOException("agent_speed and agent_capacity must not be negative");
        }
        if (config.getArrivalTolerance() <= 0) {
            throw new IOException("arrival_tolerance must be positive: " + config.getArrivalTolerance());
        }
    }

    /**
     * Raw JSON shape. Boxed fields so absent keys stay null.
     */
    private static class ConfigFile {
        Double searchRadius;
        Double actionRadius;
        Double arrivalTolerance;
        Double baseArrivalRadius;
        Double agentSpeed;
        Double agentCapacity;
        Integer maxSearchIterations;
        Heuristic heuristic;
        Boolean smoothPaths;
        Double powerCapacity;
        Double powerDrainPerSecond;
        Double lowPowerThreshold;
        Integer stallTickLimit;

        NavigatorConfig.NavigatorConfigBuilder applyTo(NavigatorConfig.NavigatorConfigBuilder builder) {
            if (searchRadius != null) builder.searchRadius(searchRadius);
            if (actionRadius != null) builder.actionRadius(actionRadius);
            if (arrivalTolerance != null) builder.arrivalTolerance(arrivalTolerance);
            if (baseArrivalRadius != null) builder.baseArrivalRadius(baseArrivalRadius);
            if (agentSpeed != null) builder.agentSpeed(agentSpeed);
            if (agentCapacity != null) builder.agentCapacity(agentCapacity);
            if (maxSearchIterations != null) builder.maxSearchIterations(maxSearchIterations);
            if (heuristic != null) builder.heuristic(heuristic);
            if (smoothPaths != null) builder.smoothPaths(smoothPaths);
            if (powerCapacity != null) builder.powerCapacity(powerCapacity);
            if (powerDrainPerSecond != null) builder.powerDrainPerSecond(powerDrainPerSecond);
            if (lowPowerThreshold != null) builder.lowPowerThreshold(lowPowerThreshold);
            if (stallTickLimit != null) builder.stallTickLimit(stallTickLimit);
            return builder;
        }
    }
}
