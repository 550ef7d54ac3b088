package com.darwinlink.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SimulationSettingsLoader.
 *
 * Tests:
 * - Classpath resource
 * - File with partial settings merged over defaults
 * - Missing, unreadable and invalid files fall back
 */
class SimulationSettingsLoaderTest {

    @TempDir
    Path dir;

    @Test
    void testLoadFromClasspath() {
        SimulationSettings settings = SimulationSettingsLoader.load();

        assertEquals("SIM1234", settings.accountCode());
        assertEquals(0, new BigDecimal("10000").compareTo(settings.initialLiquidity()));
        assertTrue(settings.isValid());
    }

    @Test
    void testPartialFileMergesDefaults() throws IOException {
        Path file = dir.resolve("sim.json");
        Files.writeString(file, "{\"initialLiquidity\": 25000.50, \"orderIdPrefix\": \"PAPER\", \"extra\": true}");

        SimulationSettings settings = SimulationSettingsLoader.load(file);

        assertEquals(0, new BigDecimal("25000.50").compareTo(settings.initialLiquidity()));
        assertEquals("PAPER", settings.orderIdPrefix());
        assertEquals("SIM1234", settings.accountCode(), "Unset fields keep defaults");
    }

    @Test
    void testMissingFileUsesClasspath() {
        SimulationSettings settings = SimulationSettingsLoader.load(dir.resolve("absent.json"));

        assertEquals(SimulationSettingsLoader.load(), settings);
    }

    @Test
    void testMalformedFileUsesDefaults() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertEquals(SimulationSettings.defaults(), SimulationSettingsLoader.load(file));
    }

    @Test
    void testInvalidValuesUseDefaults() throws IOException {
        Path file = dir.resolve("invalid.json");
        Files.writeString(file, "{\"orderIdPrefix\": \"S;M\", \"initialLiquidity\": 500}");

        assertEquals(SimulationSettings.defaults(), SimulationSettingsLoader.load(file));
    }

    @Test
    void testNegativeLiquidityIsInvalid() {
        SimulationSettings settings = new SimulationSettings("A1", new BigDecimal("-1"), "SIM", "R", "SIM");

        assertFalse(settings.isValid());
    }
}
