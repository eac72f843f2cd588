package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matches the remaining one-way exits to one-way entrances by deferred
 * acceptance over component rankings, so each warp lands somewhere that is
 * already naturally reachable from its origin.
 *
 * Matches that would still jump far ahead are redirected to a reasonable
 * target, duplicating the entrance if it is already taken. After a redirect
 * the graph is no longer a pure bijection and later checks must run in
 * forward mode.
 */
public final class StableMatcher {
    private static final Logger log = LogManager.getLogger(StableMatcher.class);

    static final int REASONABLE_RANK = 980;
    static final int SAME_NAME_CAP = ComponentAnalyzer.MAX_RANK - 5;
    static final double MAX_DIST_GAIN = 10;

    private final WorldGraph graph;
    private final ComponentAnalyzer components;
    private final boolean explain;

    public StableMatcher(WorldGraph graph, ComponentAnalyzer components, boolean explain) {
        this.graph = graph;
        this.components = components;
        this.explain = explain;
    }

    private record Match(Edge exit, Edge entrance) {
    }

    /**
     * Connects every dangling unpaired edge.
     *
     * @return true if some exit was redirected, so forward mode is needed.
     */
    public boolean match(CheckRecord check) {
        List<Edge> exits = new ArrayList<>();
        List<Edge> entrances = new ArrayList<>();
        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.to()) {
                if (e.to() == null && e.pair() == null) {
                    exits.add(e);
                }
            }
        }
        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.from()) {
                if (e.from() == null && e.pair() == null) {
                    entrances.add(e);
                }
            }
        }
        if (exits.size() != entrances.size()) {
            throw new IllegalStateException("Internal error: mismatched remaining warps " + exits.size() + " -> "
                    + entrances.size());
        }
        if (exits.isEmpty()) {
            return false;
        }

        Map<Match, Integer> rank = new HashMap<>();
        for (Edge exit : exits) {
            for (Edge entrance : entrances) {
                int r = components.getRanking(check, exit.from(), entrance.to());
                if (Objects.equals(exit.name(), entrance.name()) && r > SAME_NAME_CAP) {
                    r = SAME_NAME_CAP;
                }
                rank.put(new Match(exit, entrance), r);
            }
        }

        // Each exit's proposals, best last so they can be popped
        Map<Edge, List<Edge>> proposals = new HashMap<>();
        for (Edge exit : exits) {
            List<Edge> options = new ArrayList<>(entrances);
            options.sort(Comparator.comparingInt(en -> rank.get(new Match(exit, en))));
            proposals.put(exit, options);
        }
        Map<Edge, Edge> held = new LinkedHashMap<>();
        Map<Edge, Edge> engaged = new HashMap<>();
        while (engaged.size() < exits.size()) {
            Edge exit = exits.stream().filter(e -> !engaged.containsKey(e)).findFirst().orElse(null);
            List<Edge> options = exit == null ? null : proposals.get(exit);
            if (options == null || options.isEmpty()) {
                throw new IllegalStateException("Internal error: Gale-Shapley bad state");
            }
            Edge entrance = options.remove(options.size() - 1);
            Edge current = held.get(entrance);
            if (current != null) {
                if (rank.get(new Match(exit, entrance)) <= rank.get(new Match(current, entrance))) {
                    continue;
                }
                engaged.remove(current);
            }
            held.put(entrance, exit);
            engaged.put(exit, entrance);
        }

        Map<Edge, List<Edge>> redirects = new LinkedHashMap<>();
        for (Edge exit : exits) {
            Edge entrance = engaged.get(exit);
            int r = rank.get(new Match(exit, entrance));
            double gain = 0;
            NodeRecord fromRecord = check.record(exit.from());
            NodeRecord toRecord = check.record(entrance.to());
            if (fromRecord != null && toRecord != null) {
                gain = toRecord.dist() - fromRecord.dist();
            }
            if (explain) {
                log.debug("gale {} -> {}, rank {}, gain {}", exit, entrance, r, gain);
            }
            if (r > REASONABLE_RANK && gain < MAX_DIST_GAIN) {
                graph.connect(exit, entrance);
                continue;
            }
            List<Edge> reasonable = new ArrayList<>();
            for (Edge candidate : entrances) {
                if (rank.get(new Match(exit, candidate)) > REASONABLE_RANK) {
                    reasonable.add(candidate);
                }
            }
            if (reasonable.isEmpty()) {
                throw new IllegalStateException("No reasonable targets for " + exit + " -> " + entrance);
            }
            reasonable.sort(Comparator.comparingInt((Edge en) -> rank.get(new Match(exit, en))).reversed());
            redirects.put(exit, reasonable);
        }
        if (redirects.isEmpty()) {
            log.info("Stable matching connected {} warps", exits.size());
            return false;
        }

        List<Map.Entry<Edge, List<Edge>>> ordered = new ArrayList<>(redirects.entrySet());
        ordered.sort(Comparator.comparingInt(en -> en.getValue().size()));
        Set<Edge> duplicatedTargets = new HashSet<>();
        for (Map.Entry<Edge, List<Edge>> entry : ordered) {
            Edge exit = entry.getKey();
            Edge target = entry.getValue().stream().filter(e -> !duplicatedTargets.contains(e)).findFirst()
                    .orElse(entry.getValue().get(0));
            duplicatedTargets.add(target);
            if (explain) {
                log.debug("dupe {} -> {}", exit, target);
            }
            if (target.isLinked()) {
                target = graph.duplicateEntrance(target);
            }
            graph.connect(exit, target);
        }
        // Entrances that lost their proposer to a redirect stay unlinked for good. Fixed keeps them
        // out of later area swaps, which only exchange linked entrances.
        for (Edge entrance : entrances) {
            if (!entrance.isLinked()) {
                entrance.setFixed(true);
                if (explain) {
                    log.debug("Leaving {} unlinked", entrance);
                }
            }
        }
        log.info("Stable matching connected {} warps, {} redirected", exits.size(), redirects.size());
        return true;
    }
}
