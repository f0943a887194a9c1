package com.scrapyard.config;

import com.scrapyard.navigation.Heuristic;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class NavigatorConfigLoaderTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testLoadDefaultResourceMatchesBuilderDefaults() throws IOException {
        NavigatorConfig loaded = NavigatorConfigLoader.loadDefault();
        assertEquals(NavigatorConfig.defaults(), loaded);
    }

    @Test
    public void testDefaults() {
        NavigatorConfig config = NavigatorConfig.defaults();
        assertEquals(1000, config.getMaxSearchIterations());
        assertEquals(Heuristic.OCTILE, config.getHeuristic());
        assertTrue(config.isSmoothPaths());
        assertEquals(100.0, config.getAgentCapacity(), 0.0);
    }

    @Test
    public void testPartialOverlayKeepsDefaults() throws IOException {
        NavigatorConfig config = NavigatorConfigLoader.parse(new StringReader(
                "{\"agent_speed\": 64, \"heuristic\": \"MANHATTAN\", \"smooth_paths\": false}"));

        assertEquals(64.0, config.getAgentSpeed(), 0.0);
        assertEquals(Heuristic.MANHATTAN, config.getHeuristic());
        assertFalse(config.isSmoothPaths());
        assertEquals("Absent keys keep their defaults",
                NavigatorConfig.defaults().getSearchRadius(), config.getSearchRadius(), 0.0);
    }

    @Test
    public void testEmptyDocumentGivesDefaults() throws IOException {
        assertEquals(NavigatorConfig.defaults(), NavigatorConfigLoader.parse(new StringReader("")));
    }

    @Test(expected = IOException.class)
    public void testMalformedJson() throws IOException {
        NavigatorConfigLoader.parse(new StringReader("{\"agent_speed\": "));
    }

    @Test(expected = IOException.class)
    public void testRejectsNonPositiveIterations() throws IOException {
        NavigatorConfigLoader.parse(new StringReader("{\"max_search_iterations\": 0}"));
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        NavigatorConfigLoader.loadFromResource("/config/does-not-exist.json");
    }

    @Test
    public void testLoadFromFile() throws IOException {
        Path file = temporaryFolder.newFile("navigator.json").toPath();
        Files.write(file, "{\"stall_tick_limit\": 5, \"low_power_threshold\": 50}".getBytes(StandardCharsets.UTF_8));

        NavigatorConfig config = NavigatorConfigLoader.loadFromFile(file);

        assertEquals(5, config.getStallTickLimit());
        assertEquals(50.0, config.getLowPowerThreshold(), 0.0);
    }
}
