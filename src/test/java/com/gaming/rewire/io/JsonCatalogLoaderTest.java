package com.gaming.rewire.io;

import com.gaming.rewire.engine.ConnectorOptions;
import com.gaming.rewire.engine.WorldGraph;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class JsonCatalogLoaderTest {

    @Test
    public void testLoadResource() {
        WorldDefinition def = JsonCatalogLoader.loadResource("catalogs/keys.json");
        assertEquals("keys", def.getName());
        assertEquals("start", def.getStart());
        assertEquals(5, def.getAreas().size());
        assertEquals("Great Hall", def.getAreas().get(1).getText());
        assertTrue(def.getAreas().get(3).isBoss());
        assertEquals(3, def.getEntrances().size());
        assertEquals("hall", def.getEntrances().get(0).getSideB().getArea());
        assertEquals(List.of("cellar"), def.getItems().get(0).getAreas());
        assertTrue(def.getConfig().containsKey("hard_mode"));
        assertNull(def.getConfig().get("hard_mode"));
    }

    @Test
    public void testLoadedCatalogCompiles() {
        WorldGraph graph = new WorldCompiler().compile(JsonCatalogLoader.loadResource("catalogs/keys.json"));
        assertEquals("keys", graph.name());
        assertEquals(5, graph.areas().size());
        assertTrue(graph.isItem("tower_key"));
        assertEquals("Great Hall", graph.area("hall").text());
        // three two-way entrances with four edges each, plus one world connection
        assertEquals(14, graph.edges().size());
    }

    @Test
    public void testLoadOptions() throws Exception {
        ConnectorOptions options;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("catalogs/options.json")) {
            options = JsonCatalogLoader.loadOptions(in, "options.json");
        }
        assertEquals(42L, options.getSeed());
        assertEquals("start", options.getStartArea());
        assertFalse(options.isCoreAware());
        assertEquals(250, options.getGeneralRetries());
        assertEquals(100, options.getCoreRetries());
        assertEquals(List.of("tower_key"), options.getEarlyCheckpointItems());
    }

    @Test
    public void testEmptyOptionsKeepDefaults() {
        ConnectorOptions options = JsonCatalogLoader.loadOptions(
                new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)), "empty");
        assertTrue(options.isCoreAware());
        assertEquals(100, options.getPeripheryRetries());
        assertNull(options.getEarlyCheckpoint());
    }

    @Test
    public void testRoundTripThroughJson() {
        WorldDefinition def = JsonCatalogLoader.loadResource("catalogs/minimal.json");
        String json = JsonCatalogLoader.toJson(def);
        WorldDefinition again = JsonCatalogLoader.load(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "round trip");
        assertEquals(def, again);
    }

    @Test
    public void testMissingResource() {
        try {
            JsonCatalogLoader.loadResource("catalogs/nope.json");
            fail("Expected UncheckedIOException");
        } catch (UncheckedIOException e) {
            assertTrue(e.getMessage().contains("catalogs/nope.json"));
        }
    }

    @Test
    public void testMissingFile() {
        try {
            JsonCatalogLoader.load(Path.of("does", "not", "exist.json"));
            fail("Expected UncheckedIOException");
        } catch (UncheckedIOException e) {
            assertTrue(e.getMessage().startsWith("Failed to read catalog"));
        }
    }

    @Test(expected = UncheckedIOException.class)
    public void testMalformedJson() {
        JsonCatalogLoader.load(new ByteArrayInputStream("{\"areas\": [".getBytes(StandardCharsets.UTF_8)), "bad");
    }
}
