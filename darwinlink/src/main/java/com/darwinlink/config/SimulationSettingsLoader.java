package com.darwinlink.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link SimulationSettings}.
 *
 * Lookup order: explicit file, classpath resource darwin-simulation.json,
 * built-in defaults. Never returns null.
 */
public final class SimulationSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SimulationSettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    public static final String RESOURCE_NAME = "darwin-simulation.json";

    private SimulationSettingsLoader() {
    }

    /**
     * Load from the classpath resource, or defaults if it is missing or invalid.
     */
    public static SimulationSettings load() {
        try (InputStream in = SimulationSettingsLoader.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE_NAME);
                return SimulationSettings.defaults();
            }
            return validated(MAPPER.readValue(in, SimulationSettings.class), RESOURCE_NAME);
        } catch (IOException e) {
            log.error("Failed to read {}, using defaults: {}", RESOURCE_NAME, e.getMessage());
            return SimulationSettings.defaults();
        }
    }

    /**
     * Load from a file, falling back to {@link #load()} when the file does not exist.
     */
    public static SimulationSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            log.info("No simulation settings at {}, trying classpath", file);
            return load();
        }
        try {
            SimulationSettings settings = MAPPER.readValue(Files.readString(file), SimulationSettings.class);
            return validated(settings, file.toString());
        } catch (IOException e) {
            log.error("Failed to load simulation settings from {}, using defaults: {}", file, e.getMessage());
            return SimulationSettings.defaults();
        }
    }

    private static SimulationSettings validated(SimulationSettings settings, String source) {
        SimulationSettings merged = withDefaults(settings);
        if (!merged.isValid()) {
            log.warn("⚠️ Invalid simulation settings in {}, using defaults", source);
            return SimulationSettings.defaults();
        }
        log.info("✅ Loaded simulation settings from {}", source);
        return merged;
    }

    // Missing JSON properties bind as null
    private static SimulationSettings withDefaults(SimulationSettings s) {
        SimulationSettings d = SimulationSettings.defaults();
        return new SimulationSettings(
            s.accountCode() != null ? s.accountCode() : d.accountCode(),
            s.initialLiquidity() != null ? s.initialLiquidity() : d.initialLiquidity(),
            s.environment() != null ? s.environment() : d.environment(),
            s.release() != null ? s.release() : d.release(),
            s.orderIdPrefix() != null ? s.orderIdPrefix() : d.orderIdPrefix());
    }
}
