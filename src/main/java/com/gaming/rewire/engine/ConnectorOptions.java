package com.gaming.rewire.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of a connect run. Loadable from JSON; every field has a usable
 * default so an empty object is a valid configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ConnectorOptions {
    private long seed;

    /** Overrides the catalog's start area. */
    private String startArea;

    /**
     * Route mandatory areas first, then attach optional territory in cliques.
     * When off, every edge is matched at once and repaired without
     * distinction.
     */
    private boolean coreAware = true;

    /** Tag areas that make a poor start with {@code avoidstart}. */
    private boolean openStart;

    /** Allow repairs to break up paired (two-way) connections. */
    private boolean unconnected;

    /** Match paired edges between optional areas during the initial pass. */
    private boolean isolas;

    /** Keep vanilla connections between optional areas. */
    private boolean vanillaPeriphery;

    private int coreRetries = 100;
    private int peripheryRetries = 100;
    private int generalRetries = 100;

    /** Area to pull early in the final dependency order, if any. */
    private String earlyCheckpoint;

    /** Key items whose locations are pulled early along with the checkpoint. */
    private List<String> earlyCheckpointItems = new ArrayList<>();

    /** Log every swap and match at debug level. */
    private boolean explain;

    public static ConnectorOptions withSeed(long seed) {
        ConnectorOptions options = new ConnectorOptions();
        options.setSeed(seed);
        return options;
    }
}
