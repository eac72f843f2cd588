package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckMode;
import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.api.ReachabilityChecker;
import com.gaming.rewire.node.EdgePair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Check-then-swap loop shared by the repair phases. Each attempt runs the
 * reachability checker, and while areas in scope remain unreached, swaps one
 * edge towards them.
 */
final class RepairLoop {
    private static final Logger log = LogManager.getLogger(RepairLoop.class);

    private final WorldGraph graph;
    private final ReachabilityChecker checker;
    private final String start;
    private final EdgeRepairer repairer;
    private final ConnectionListener listener;
    private final long seed;
    private final boolean unconnected;
    private int totalAttempts;

    RepairLoop(WorldGraph graph, ReachabilityChecker checker, String start, EdgeRepairer repairer,
            ConnectionListener listener, long seed, boolean unconnected) {
        this.graph = graph;
        this.checker = checker;
        this.start = start;
        this.repairer = repairer;
        this.listener = listener;
        this.seed = seed;
        this.unconnected = unconnected;
    }

    /**
     * @param phase      phase name for logs and listener callbacks.
     * @param maxTries   attempt budget.
     * @param mode       checker mode.
     * @param scope      areas that must become reachable, or null for all.
     * @param selection  core side the swapped edges must be on.
     * @param pairedOnly when true, only two-way edges are swapped for the
     *                   whole phase; otherwise the loop starts paired (unless
     *                   unconnected edges are allowed) and falls back to
     *                   unpaired edges when no paired entrance is left.
     * @param tried      areas already targeted, or null.
     * @param onComplete given the complete check once everything in scope is
     *                   reached; returns true if it changed the graph and the
     *                   loop should go on. May be null.
     * @return the last check.
     */
    CheckRecord run(String phase, int maxTries, CheckMode mode, Set<String> scope, CoreSelection selection,
            boolean pairedOnly, Set<String> tried, Predicate<CheckRecord> onComplete) {
        listener.onPhaseStart(phase);
        boolean paired = pairedOnly || !unconnected;
        int tries = 0;
        CheckRecord check = null;
        List<String> unvisited = List.of();
        while (tries++ < maxTries) {
            check = checker.check(graph, start, mode);
            unvisited = new ArrayList<>();
            for (String area : check.unvisited()) {
                if (scope == null || scope.contains(area)) {
                    unvisited.add(area);
                }
            }
            if (unvisited.isEmpty()) {
                if (onComplete != null && onComplete.test(check)) {
                    continue;
                }
                break;
            }
            EdgePair swap = repairer.swapUnreachableEdge(check, unvisited, tries, paired, selection, tried);
            if (swap != null) {
                listener.onSwap(phase, tries, swap.exit(), swap.entrance());
            }
            if (!pairedOnly) {
                paired = swap != null && !unconnected;
            }
        }
        int used = Math.min(tries, maxTries);
        totalAttempts += used;
        if (!unvisited.isEmpty()) {
            throw new UnsolvableSeedException("Couldn't solve seed " + seed + " - try a different one", unvisited,
                    new ArrayList<>(check.unvisitedItems()));
        }
        log.info("{} fixup done in {} tries", phase, used);
        listener.onPhaseEnd(phase, used);
        return check;
    }

    int totalAttempts() {
        return totalAttempts;
    }
}
