package com.gaming.rewire;

import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.engine.ConnectionResult;
import com.gaming.rewire.engine.ConnectorOptions;
import com.gaming.rewire.engine.GraphConnector;
import com.gaming.rewire.engine.WorldGraph;
import com.gaming.rewire.io.JsonCatalogLoader;
import com.gaming.rewire.io.WorldCompiler;
import com.gaming.rewire.io.WorldDefinition;
import com.gaming.rewire.util.CompositeConnectionListener;
import com.gaming.rewire.util.GraphExplain;
import com.gaming.rewire.util.PhaseTimingListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * A high-level wrapper that loads a world catalog and rewires it.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading JSON catalogs with {@link JsonCatalogLoader}</li>
 * <li>Compiling them with {@link WorldCompiler}</li>
 * <li>Running {@link GraphConnector} with registered listeners</li>
 * <li>Retrying with successive seeds when a seed is unsolvable</li>
 * </ul>
 */
public class GateRewire {
    private static final Logger log = LogManager.getLogger(GateRewire.class);

    private final WorldGraph graph;
    private final CompositeConnectionListener compositeListener = new CompositeConnectionListener();

    /**
     * Creates a new GateRewire from a JSON catalog path string.
     *
     * @param jsonPath relative or absolute path to the catalog.
     */
    public GateRewire(String jsonPath) {
        this(Path.of(jsonPath));
    }

    public GateRewire(Path jsonPath) {
        this(JsonCatalogLoader.load(jsonPath));
    }

    public GateRewire(WorldDefinition def) {
        this(new WorldCompiler().compile(def));
    }

    public GateRewire(WorldGraph graph) {
        this.graph = graph;
    }

    /**
     * Registers a listener for every subsequent run. Adds to the existing
     * listeners rather than replacing them.
     */
    public void setListener(ConnectionListener listener) {
        compositeListener.addForComposite(listener);
    }

    /**
     * Enables per-phase timing. Use the returned listener to read the numbers.
     */
    public PhaseTimingListener enablePhaseTiming() {
        var timing = new PhaseTimingListener();
        compositeListener.addForComposite(timing);
        return timing;
    }

    public WorldGraph getGraph() {
        return graph;
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }

    public ConnectionResult connect(long seed) {
        return connect(ConnectorOptions.withSeed(seed));
    }

    public ConnectionResult connect(ConnectorOptions options) {
        GraphConnector connector = new GraphConnector(graph, options);
        if (compositeListener.size() > 0) {
            connector.addListener(compositeListener);
        }
        return connector.connect();
    }

    /**
     * Tries {@code options.seed}, then the following seeds, until one solves
     * or {@code maxSeeds} have been tried. A failed attempt leaves the graph as
     * it was, so each seed starts from the same state.
     *
     * @return the first solved result, or the last failure.
     */
    public ConnectionResult connectWithRetries(ConnectorOptions options, int maxSeeds) {
        if (maxSeeds < 1) {
            throw new IllegalArgumentException("maxSeeds must be positive: " + maxSeeds);
        }
        long first = options.getSeed();
        ConnectionResult result = null;
        for (int i = 0; i < maxSeeds; i++) {
            options.setSeed(first + i);
            result = connect(options);
            if (result.isSolved()) {
                if (i > 0) {
                    log.info("Seed {} solved after {} failed seeds", first + i, i);
                }
                return result;
            }
        }
        log.warn("No solution for seeds {} to {}", first, first + maxSeeds - 1);
        return result;
    }
}
