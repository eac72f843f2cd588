package com.gaming.rewire.api;

import com.gaming.rewire.engine.WorldGraph;

/**
 * Evaluates which areas can be reached from a start area under the gating
 * logic of the current links.
 *
 * The connector treats implementations as a black box and re-runs them from
 * scratch on every repair iteration, so a call must not mutate the graph.
 */
@FunctionalInterface
public interface ReachabilityChecker {

    /**
     * @param graph the graph in its current link state.
     * @param start name of the start area.
     * @param mode  traversal mode.
     * @return the reached areas with distances, ancestor sets and in-edges,
     *         plus the unreached areas and items.
     */
    CheckRecord check(WorldGraph graph, String start, CheckMode mode);
}
