package com.gaming.rewire;

import com.gaming.rewire.dsl.WorldBuilder;
import com.gaming.rewire.engine.ConnectionResult;
import com.gaming.rewire.engine.ConnectorOptions;
import com.gaming.rewire.io.JsonCatalogLoader;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.util.PhaseTimingListener;
import org.junit.Test;

import java.nio.file.Path;

import static org.junit.Assert.*;

public class GateRewireTest {

    @Test
    public void testConnectsCatalogFromPath() {
        GateRewire rewire = new GateRewire(Path.of("src", "test", "resources", "catalogs", "minimal.json"));

        ConnectionResult result = rewire.connect(3L);

        assertTrue(result.isSolved());
        Edge lift = rewire.getGraph().node("gate").to().stream()
                .filter(e -> "gate_lift".equals(e.name()))
                .findFirst().orElseThrow();
        assertEquals("keep", lift.to());
        assertTrue(result.check().reached("keep"));
    }

    @Test
    public void testRetriesUntilSolved() {
        GateRewire rewire = new GateRewire(JsonCatalogLoader.loadResource("catalogs/keys.json"));
        PhaseTimingListener timing = rewire.enablePhaseTiming();

        ConnectionResult result = rewire.connectWithRetries(ConnectorOptions.withSeed(100), 25);

        assertTrue(result.isSolved());
        assertTrue(result.check().unvisited().isEmpty());
        assertTrue(result.check().unvisitedItems().isEmpty());
        assertTrue(timing.nanosByPhase().containsKey("general"));
        assertTrue(rewire.explain().dumpConnections(result.check()).startsWith("Graph keys:"));
    }

    @Test
    public void testReportsLastFailure() {
        GateRewire rewire = new GateRewire(WorldBuilder.create("island")
                .area("start").area("island")
                .required("island")
                .deadEnd("well", "start")
                .start("start")
                .build());
        PhaseTimingListener timing = rewire.enablePhaseTiming();
        ConnectorOptions options = ConnectorOptions.withSeed(10);

        ConnectionResult result = rewire.connectWithRetries(options, 3);

        assertFalse(result.isSolved());
        assertEquals(12L, result.failure().seed());
        assertEquals(12L, options.getSeed());
        assertTrue(result.failure().unreachedAreas().contains("island"));
        assertTrue(timing.failed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveSeedCount() {
        new GateRewire(JsonCatalogLoader.loadResource("catalogs/minimal.json"))
                .connectWithRetries(ConnectorOptions.withSeed(1), 0);
    }
}
