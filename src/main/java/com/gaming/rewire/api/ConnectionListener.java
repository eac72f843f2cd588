package com.gaming.rewire.api;

import com.gaming.rewire.engine.UnsolvableSeed;
import com.gaming.rewire.node.Edge;

/**
 * Observability interface for monitoring a connect run.
 *
 * Implementations can be registered with the GraphConnector to receive
 * callbacks as the run moves through its phases. This is the primary
 * mechanism for:
 *
 * - Debugging: tracing which edges the repair loop swapped and why.
 * - Profiling: measuring how long each phase takes.
 * - Reporting: surfacing an unsolvable seed to a caller that wants to retry.
 *
 * Callbacks run synchronously on the connecting thread, between graph
 * mutations. They must not mutate the graph.
 */
public interface ConnectionListener {

    /**
     * Called when a phase begins.
     *
     * @param phase Short phase name, e.g. "main", "periphery-initial", "general".
     */
    void onPhaseStart(String phase);

    /**
     * Called after the repair loop swapped one edge.
     *
     * @param phase     Current phase name.
     * @param attempt   1-based attempt counter within the phase.
     * @param redundant The reachable exit that was sacrificed.
     * @param unreached The entrance into unreached territory it now leads to.
     */
    void onSwap(String phase, int attempt, Edge redundant, Edge unreached);

    /**
     * Called when a phase completes successfully.
     *
     * @param phase    Phase name.
     * @param attempts Number of repair attempts used (0 for phases without a loop).
     */
    void onPhaseEnd(String phase, int attempts);

    /**
     * Called once when the run gives up.
     *
     * @param reason Diagnostic state of the failed run.
     */
    void onUnsolvable(UnsolvableSeed reason);
}
