package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.Expr;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.node.EdgePair;
import com.gaming.rewire.util.Shuffles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * One step of the repair loop: picks an entrance into unreached territory and
 * a redundant exit from reached territory, and swaps their destinations.
 *
 * A redundant exit is one whose target area has a cheaper way in, so
 * rerouting it costs the reached graph as little as possible.
 */
public final class EdgeRepairer {
    private static final Logger log = LogManager.getLogger(EdgeRepairer.class);

    /** Up to this many reached areas, the start is considered cramped. */
    static final int SMALL_START = 4;
    /** Attempts after which previously tried areas are deprioritized. */
    static final int TRIED_AFTER = 100;

    private final WorldGraph graph;
    private final Random random;
    private final String start;
    private final boolean explain;

    public EdgeRepairer(WorldGraph graph, Random random, String start, boolean explain) {
        this.graph = graph;
        this.random = random;
        this.start = start;
        this.explain = explain;
    }

    /**
     * Swaps one reached exit onto an entrance of an unreached area.
     *
     * @param check      the latest reachability check.
     * @param unvisited  unreached areas of interest. Reordered in place.
     * @param tries      1-based attempt number.
     * @param pairedOnly whether only two-way edges may be swapped.
     * @param selection  which side of the core split edges must be on.
     * @param tried      areas already targeted, or null to not track them.
     * @return the swapped (redundant exit, unreached entrance), or null when
     *         {@code pairedOnly} and no paired entrance into unreached
     *         territory exists. The caller should retry with unpaired edges.
     * @throws UnsolvableSeedException when no swap is possible.
     */
    public EdgePair swapUnreachableEdge(CheckRecord check, List<String> unvisited, int tries, boolean pairedOnly,
            CoreSelection selection, Set<String> tried) {
        Shuffles.shuffle(random, unvisited);
        if (tries > TRIED_AFTER && tried != null) {
            unvisited.sort(Comparator.comparingInt(a -> tried.contains(a) ? 1 : 0));
        }
        long reachedCount = check.records().keySet().stream().filter(a -> !graph.area(a).isExcluded()).count();
        boolean smallStart = reachedCount <= SMALL_START;

        prioritizePrerequisites(unvisited, pairedOnly, selection);

        Edge unreached = null;
        boolean unconditional = false;
        for (String area : unvisited) {
            for (Edge e : graph.node(area).from()) {
                if (smallStart && sideTag(e, "avoidstart")) {
                    continue;
                }
                if (!e.isLinked() || !isEdgeEligible(e, pairedOnly, selection)) {
                    continue;
                }
                if (e.linkedExpr() == null) {
                    unreached = e;
                    unconditional = true;
                    break;
                }
                if (unreached == null) {
                    unreached = e;
                }
            }
            if (unconditional) {
                break;
            }
        }
        if (unreached == null) {
            if (pairedOnly) {
                return null;
            }
            throw new UnsolvableSeedException("Could not find edge into unreachable areas " + unvisited
                    + " starting from " + start + " (missing items: " + check.unvisitedItems() + ")",
                    new ArrayList<>(unvisited), new ArrayList<>(check.unvisitedItems()));
        }

        Edge redundant = null;
        double redundantCost = 0;
        Edge fallback = null;
        int fallbackIn = 0;
        List<NodeRecord> byDist = new ArrayList<>(check.records().values());
        byDist.sort(Comparator.comparingDouble(NodeRecord::dist));
        for (NodeRecord record : byDist) {
            Map.Entry<Edge, Double> last = null;
            Map.Entry<Edge, Double> first = null;
            for (Map.Entry<Edge, Double> in : record.inEdges().entrySet()) {
                if (first == null) {
                    first = in;
                }
                if (isEdgeEligible(in.getKey(), pairedOnly, selection)
                        && areEdgesCompatible(in.getKey(), unreached, selection)) {
                    last = in;
                }
            }
            if (last == null) {
                continue;
            }
            int count = graph.node(record.area()).from().size();
            if (count > fallbackIn) {
                fallback = last.getKey();
                fallbackIn = count;
            }
            if (first.getKey() != last.getKey()) {
                if (explain) {
                    log.debug("  Min {}, Max editable {} in {}", first.getValue(), last.getValue(), last.getKey());
                }
                if (last.getValue() >= redundantCost) {
                    redundant = last.getKey();
                    redundantCost = last.getValue();
                }
            }
        }
        if (redundant == null) {
            if (fallback != null) {
                if (explain) {
                    log.debug("Picking non-redundant edge, but last reachable");
                }
                redundant = fallback;
            } else {
                for (String area : check.records().keySet()) {
                    for (Edge e : graph.node(area).to()) {
                        if (e.isLinked() && isEdgeEligible(e, pairedOnly, selection)
                                && areEdgesCompatible(e, unreached, selection)) {
                            redundant = e;
                        }
                    }
                }
                if (redundant == null) {
                    throw new UnsolvableSeedException("No swappable edge found to inaccessible areas " + unvisited,
                            new ArrayList<>(unvisited), new ArrayList<>(check.unvisitedItems()));
                }
                if (explain) {
                    log.debug("Picking any edge whatsoever to {}", unreached);
                }
            }
        }
        if (explain) {
            log.debug("Swap unreached: {}", unreached);
            log.debug("Swap redundant: {}", redundant);
            log.debug("Candidates: {}", unvisited.subList(0, Math.min(7, unvisited.size())));
        }
        if (tried != null) {
            tried.add(unreached.to());
        }
        graph.swapConnectedEdges(redundant, unreached);
        return new EdgePair(redundant, unreached);
    }

    /**
     * Moves areas that gate conditional entrances into unreached territory to
     * the front, so their prerequisites are connected first. An entrance gated
     * on its own endpoints contributes nothing.
     */
    private void prioritizePrerequisites(List<String> unvisited, boolean pairedOnly, CoreSelection selection) {
        Set<String> prerequisites = new LinkedHashSet<>();
        for (String area : unvisited) {
            for (Edge e : graph.node(area).from()) {
                if (!isEdgeEligible(e, pairedOnly, selection) || e.linkedExpr() == null) {
                    continue;
                }
                Expr expr = graph.resolve(e.linkedExpr());
                boolean selfGated = false;
                List<String> needed = new ArrayList<>();
                for (String var : expr.freeVars()) {
                    if (graph.hasArea(var)) {
                        if (var.equals(e.from()) || var.equals(e.to())) {
                            selfGated = true;
                        }
                        needed.add(var);
                    } else if (graph.isItem(var)) {
                        needed.addAll(graph.itemAreas().get(var));
                    }
                }
                needed.retainAll(unvisited);
                if (!needed.isEmpty() && !selfGated) {
                    prerequisites.addAll(needed);
                }
            }
        }
        if (prerequisites.isEmpty()) {
            return;
        }
        List<String> reordered = new ArrayList<>(prerequisites);
        for (String area : unvisited) {
            if (!prerequisites.contains(area)) {
                reordered.add(area);
            }
        }
        unvisited.clear();
        unvisited.addAll(reordered);
    }

    static boolean isEdgeEligible(Edge e, boolean pairedOnly, CoreSelection selection) {
        if (e.isFixed() || (e.pair() != null) != pairedOnly) {
            return false;
        }
        if (selection == CoreSelection.CORE_ONLY && !e.side().isCore()) {
            return false;
        }
        return selection != CoreSelection.PERIPHERY_ONLY || !e.side().isCore();
    }

    private boolean areEdgesCompatible(Edge edge, Edge found, CoreSelection selection) {
        if (sideTag(edge, "start") && sideTag(found, "avoidstart")) {
            return false;
        }
        if (selection != CoreSelection.PERIPHERY_ONLY) {
            return true;
        }
        boolean pseudo = found.side().isPseudoCore() || (found.link() != null && found.link().side().isPseudoCore());
        if (pseudo) {
            return !graph.area(edge.from()).isCore() && !graph.area(edge.to()).isCore();
        }
        return true;
    }

    static boolean sideTag(Edge e, String tag) {
        return e.side().hasTag(tag) || (e.link() != null && e.link().side().hasTag(tag));
    }
}
