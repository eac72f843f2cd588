package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;

import java.util.Map;

/**
 * Outcome of {@link GraphConnector#connect()}: either a fully resolved graph
 * with its final reachability check and tier ranking, or the reason the seed
 * could not be solved. There is no partially successful state.
 */
public final class ConnectionResult {
    private final WorldGraph graph;
    private final CheckRecord check;
    private final Map<String, Integer> tiers;
    private final int attempts;
    private final UnsolvableSeed failure;

    private ConnectionResult(WorldGraph graph, CheckRecord check, Map<String, Integer> tiers, int attempts,
            UnsolvableSeed failure) {
        this.graph = graph;
        this.check = check;
        this.tiers = tiers;
        this.attempts = attempts;
        this.failure = failure;
    }

    public static ConnectionResult solved(WorldGraph graph, CheckRecord check, Map<String, Integer> tiers,
            int attempts) {
        return new ConnectionResult(graph, check, Map.copyOf(tiers), attempts, null);
    }

    public static ConnectionResult unsolvable(UnsolvableSeed failure) {
        return new ConnectionResult(null, null, Map.of(), 0, failure);
    }

    public boolean isSolved() {
        return failure == null;
    }

    /** The rewired graph. Only present when solved. */
    public WorldGraph graph() {
        return graph;
    }

    /** Final reachability check of the rewired graph. Only present when solved. */
    public CheckRecord check() {
        return check;
    }

    /** Per-area tiers for downstream difficulty calibration. Empty when unsolved. */
    public Map<String, Integer> tiers() {
        return tiers;
    }

    /** Total repair attempts across all phases. */
    public int attempts() {
        return attempts;
    }

    public UnsolvableSeed failure() {
        return failure;
    }

    /**
     * Returns the graph, or raises the failure as an
     * {@link UnsolvableSeedException}.
     */
    public WorldGraph orElseThrow() {
        if (failure != null) {
            throw new UnsolvableSeedException(failure);
        }
        return graph;
    }

    @Override
    public String toString() {
        return isSolved()
                ? "ConnectionResult[solved, attempts=" + attempts + "]"
                : "ConnectionResult[unsolvable, " + failure.describe() + "]";
    }
}
