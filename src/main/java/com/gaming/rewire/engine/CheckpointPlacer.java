package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.Edge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Pulls a designated checkpoint area (and the areas holding items needed to
 * make use of it) early in the final dependency order, by swapping its
 * incoming connections with those of an early area that has the same number
 * of randomized entrances.
 *
 * Areas within the first 15% of the non-trivial dependency order count as
 * early enough and are left alone.
 */
public final class CheckpointPlacer {
    private static final Logger log = LogManager.getLogger(CheckpointPlacer.class);

    static final int REASONABLE_PERCENT = 15;

    private final WorldGraph graph;
    private final String start;
    private final String checkpoint;
    private final List<String> checkpointItems;
    private final boolean unconnected;
    private final boolean explain;

    public CheckpointPlacer(WorldGraph graph, String start, String checkpoint, List<String> checkpointItems,
            boolean unconnected, boolean explain) {
        this.graph = graph;
        this.start = start;
        this.checkpoint = checkpoint;
        this.checkpointItems = checkpointItems == null ? List.of() : checkpointItems;
        this.unconnected = unconnected;
        this.explain = explain;
    }

    /**
     * Runs one placement pass over a complete check.
     *
     * @param triedSwaps area pairs swapped by earlier passes, as sorted
     *                   "a,b" keys. Updated in place.
     * @return true if any areas were swapped, so the graph must be rechecked.
     */
    public boolean moveEarlier(CheckRecord check, List<String> triedSwaps) {
        return new Pass(check, triedSwaps).run();
    }

    private final class Pass {
        private final CheckRecord check;
        private final List<String> triedSwaps;
        private final List<String> order;
        private final Map<String, Integer> areaIndex = new HashMap<>();
        private final Map<String, Integer> randomIn = new HashMap<>();
        private final Map<Integer, List<String>> byRandomIn = new HashMap<>();
        private final int reasonableIndex;
        private boolean didSwap;

        Pass(CheckRecord check, List<String> triedSwaps) {
            this.check = check;
            this.triedSwaps = triedSwaps;
            this.order = check.records().values().stream()
                    .sorted(Comparator.comparingDouble(NodeRecord::dist))
                    .map(NodeRecord::area)
                    .collect(Collectors.toList());
            for (int i = 0; i < order.size(); i++) {
                areaIndex.put(order.get(i), i);
            }
            List<String> nonTrivial = order.stream().filter(a -> !graph.area(a).hasTag("trivial"))
                    .collect(Collectors.toList());
            int cutoff = nonTrivial.size() * REASONABLE_PERCENT / 100;
            String last = cutoff < nonTrivial.size() ? nonTrivial.get(cutoff) : null;
            this.reasonableIndex = last == null ? order.size() : order.indexOf(last);
            for (String area : order) {
                int count = 0;
                for (Edge e : graph.node(area).from()) {
                    if (!e.isFixed() && (unconnected || e.pair() != null)) {
                        count++;
                    }
                }
                randomIn.put(area, count);
                byRandomIn.computeIfAbsent(count, k -> new ArrayList<>()).add(area);
            }
            if (explain) {
                log.debug("Placing {}; last reasonable area {} at index {}", checkpoint, last, reasonableIndex);
            }
        }

        boolean run() {
            if (!areaIndex.containsKey(checkpoint)) {
                return false;
            }
            boolean placed = tryPlace(checkpoint, true, null);
            List<String> accessible = new ArrayList<>();
            accessible.add(start);
            if (placed) {
                accessible.add(checkpoint);
            }
            List<String> items = new ArrayList<>(checkpointItems);
            List<String> expandedItems = new ArrayList<>();
            List<String> areas = new ArrayList<>();
            boolean changed;
            do {
                for (String item : new ArrayList<>(items)) {
                    if (!expandedItems.contains(item)) {
                        expandedItems.add(item);
                        for (String location : graph.itemAreas().getOrDefault(item, List.of())) {
                            if (!areas.contains(location)) {
                                areas.add(location);
                            }
                        }
                    }
                }
                changed = false;
                for (String area : new ArrayList<>(areas)) {
                    if (randomIn.getOrDefault(area, 0) > 0) {
                        continue;
                    }
                    // Behind fixed entrances only: what lies before them must come early instead
                    Map<String, List<String>> fixedIn = fixedIn(area);
                    if (fixedIn.isEmpty()) {
                        continue;
                    }
                    String pred = fixedIn.keySet().stream()
                            .min(Comparator.comparingInt(a -> fixedIn.get(a).size())).orElseThrow();
                    if (!areas.contains(pred) && !accessible.contains(pred)) {
                        areas.add(pred);
                        changed = true;
                    }
                    for (String var : fixedIn.get(pred)) {
                        if (graph.isItem(var) && !items.contains(var)) {
                            items.add(var);
                            changed = true;
                        } else if (graph.hasArea(var) && !areas.contains(var)) {
                            areas.add(var);
                            changed = true;
                        }
                    }
                }
            } while (changed);
            List<String> adjustable = areas.stream()
                    .filter(a -> !accessible.contains(a) && randomIn.getOrDefault(a, 0) > 0)
                    .collect(Collectors.toList());
            if (!placed) {
                adjustable.add(0, checkpoint);
            }
            for (String area : adjustable) {
                tryPlace(area, false, accessible);
                accessible.add(area);
            }
            return didSwap;
        }

        private Map<String, List<String>> fixedIn(String area) {
            Map<String, List<String>> fixedIn = new LinkedHashMap<>();
            for (Edge e : graph.node(area).from()) {
                if (e.isFixed() && e.from() != null) {
                    fixedIn.put(e.from(), e.linkedExpr() == null ? List.of() : new ArrayList<>(e.linkedExpr().freeVars()));
                }
            }
            return fixedIn;
        }

        private boolean tryPlace(String subst, boolean reasonableOnly, List<String> root) {
            Integer index = areaIndex.get(subst);
            if (index == null) {
                return false;
            }
            if (index <= reasonableIndex) {
                return true;
            }
            List<String> candidates = new ArrayList<>(byRandomIn.get(randomIn.get(subst)));
            candidates.remove(subst);
            if (root != null) {
                candidates.removeIf(c -> root.contains(c) && areaIndex.get(c) < index);
            }
            candidates.removeIf(c -> triedSwaps.contains(swapKey(subst, c)));
            candidates.removeIf(c -> check.record(c).inEdges().keySet().stream().allMatch(Edge::isFixed));
            if (explain) {
                log.debug("Candidates for {} ({}): {}", subst, index, candidates);
            }
            if (candidates.isEmpty()) {
                return false;
            }
            long reasonable = candidates.stream().filter(c -> areaIndex.get(c) <= reasonableIndex).count();
            if (reasonable == 0 && reasonableOnly) {
                return false;
            }
            String choice = reasonable > 1 && areaIndex.get(candidates.get(0)) <= 1 ? candidates.get(1) : candidates.get(0);
            log.info("Moving {} earlier by swapping with {}", subst, choice);
            graph.swapConnectedAreas(subst, choice);
            triedSwaps.add(swapKey(subst, choice));
            didSwap = true;
            return true;
        }
    }

    static String swapKey(String a, String b) {
        return String.join(",", new TreeSet<>(List.of(a, b)));
    }
}
