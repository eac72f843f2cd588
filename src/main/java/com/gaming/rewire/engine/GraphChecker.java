package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckMode;
import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.Expr;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.api.ReachabilityChecker;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.Edge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Default {@link ReachabilityChecker}: a Dijkstra-style traversal over linked
 * exits where a conditional edge only opens once the areas and items its
 * linked expression names have been reached.
 *
 * Distances are monotone: an edge that unlocks at time {@code t} delivers the
 * player at {@code max(sourceDist, t) + cost(target)}.
 */
public final class GraphChecker implements ReachabilityChecker {

    @Override
    public CheckRecord check(WorldGraph graph, String start, CheckMode mode) {
        return new Traversal(graph, mode).run(start);
    }

    private record Step(double dist, long seq, String area, Set<String> visited)
            implements Comparable<Step> {
        @Override
        public int compareTo(Step o) {
            int c = Double.compare(dist, o.dist);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }

    private static final class Traversal {
        private final WorldGraph graph;
        private final CheckMode mode;
        // Finalized areas in reach order
        private final Map<String, Double> dist = new LinkedHashMap<>();
        private final Map<String, Set<String>> visited = new HashMap<>();
        private final PriorityQueue<Step> queue = new PriorityQueue<>();
        private final Set<Edge> blocked = new LinkedHashSet<>();
        private long seq;

        Traversal(WorldGraph graph, CheckMode mode) {
            this.graph = graph;
            this.mode = mode;
        }

        CheckRecord run(String start) {
            graph.area(start);
            queue.add(new Step(0, seq++, start, Set.of(start)));
            while (!queue.isEmpty()) {
                Step step = queue.poll();
                if (dist.containsKey(step.area())) {
                    continue;
                }
                dist.put(step.area(), step.dist());
                visited.put(step.area(), step.visited());
                for (Edge e : graph.node(step.area()).to()) {
                    relax(e);
                }
                retryBlocked();
            }
            if (mode != CheckMode.PARTIAL) {
                relaxUntilStable();
            }
            return buildRecord();
        }

        private void relax(Edge e) {
            if (!e.isLinked() || e.to() == null) {
                return;
            }
            Candidate c = evaluate(e);
            if (c == null) {
                blocked.add(e);
                return;
            }
            if (dist.containsKey(e.to())) {
                return;
            }
            queue.add(new Step(c.dist, seq++, e.to(), c.visited));
        }

        private void retryBlocked() {
            List<Edge> ready = new ArrayList<>();
            for (Edge e : blocked) {
                if (evaluate(e) != null) {
                    ready.add(e);
                }
            }
            for (Edge e : ready) {
                blocked.remove(e);
                relax(e);
            }
        }

        /** Repeats relaxation over every usable edge until no distance improves. */
        private void relaxUntilStable() {
            boolean changed = true;
            int passes = 0;
            while (changed && passes++ <= dist.size()) {
                changed = false;
                for (String area : new ArrayList<>(dist.keySet())) {
                    for (Edge e : graph.node(area).to()) {
                        if (!e.isLinked() || !dist.containsKey(e.to())) {
                            continue;
                        }
                        Candidate c = evaluate(e);
                        if (c != null && c.dist < dist.get(e.to())) {
                            dist.put(e.to(), c.dist);
                            visited.put(e.to(), c.visited);
                            changed = true;
                        }
                    }
                }
            }
        }

        private record Candidate(double dist, Set<String> visited) {
        }

        /** Entry distance and ancestor set through {@code e}, or null while its gate is closed. */
        private Candidate evaluate(Edge e) {
            Double src = dist.get(e.from());
            if (src == null) {
                return null;
            }
            Expr expr = graph.resolve(e.linkedExpr());
            Expr.Unlock unlock = expr == null ? Expr.Unlock.ALWAYS : expr.unlock(this::readyAt);
            if (!unlock.satisfiable()) {
                return null;
            }
            double d = Math.max(src, unlock.at()) + graph.node(e.to()).cost();
            Set<String> vis = new LinkedHashSet<>(visited.get(e.from()));
            for (String var : unlock.vars()) {
                vis.addAll(visitedOf(var));
            }
            vis.add(e.to());
            return new Candidate(d, vis);
        }

        private double readyAt(String var) {
            Double d = dist.get(var);
            if (d != null) {
                return d;
            }
            List<String> locations = graph.itemAreas().get(var);
            if (locations == null) {
                return Double.POSITIVE_INFINITY;
            }
            double best = Double.POSITIVE_INFINITY;
            for (String location : locations) {
                Double at = dist.get(location);
                if (at != null && at < best) {
                    best = at;
                }
            }
            return best;
        }

        private Set<String> visitedOf(String var) {
            Set<String> vis = visited.get(var);
            if (vis != null) {
                return vis;
            }
            String best = null;
            for (String location : graph.itemAreas().getOrDefault(var, List.of())) {
                if (dist.containsKey(location) && (best == null || dist.get(location) < dist.get(best))) {
                    best = location;
                }
            }
            return best == null ? Set.of() : visited.get(best);
        }

        private CheckRecord buildRecord() {
            Map<String, Map<Edge, Double>> inEdges = allInEdges();
            Map<String, NodeRecord> records = new LinkedHashMap<>();
            for (Map.Entry<String, Double> entry : dist.entrySet()) {
                String area = entry.getKey();
                records.put(area, new NodeRecord(area, entry.getValue(), visited.get(area),
                        sorted(inEdges.getOrDefault(area, Map.of()))));
            }
            Set<String> unvisited = new LinkedHashSet<>();
            for (Area area : graph.areas()) {
                if (!dist.containsKey(area.name())) {
                    unvisited.add(area.name());
                }
            }
            Set<String> unvisitedItems = new LinkedHashSet<>();
            for (Map.Entry<String, List<String>> item : graph.itemAreas().entrySet()) {
                if (item.getValue().stream().noneMatch(dist::containsKey)) {
                    unvisitedItems.add(item.getKey());
                }
            }
            return new CheckRecord(unvisited, records, unvisitedItems);
        }

        /** Every usable linked edge between reached areas, keyed by target. */
        private Map<String, Map<Edge, Double>> allInEdges() {
            Map<String, Map<Edge, Double>> in = new HashMap<>();
            for (String area : dist.keySet()) {
                for (Edge e : graph.node(area).to()) {
                    if (!e.isLinked() || !dist.containsKey(e.to())) {
                        continue;
                    }
                    if (mode == CheckMode.FULL_FORWARD && dist.get(area) > dist.get(e.to())) {
                        continue;
                    }
                    Candidate c = evaluate(e);
                    if (c != null) {
                        in.computeIfAbsent(e.to(), k -> new LinkedHashMap<>()).put(e, c.dist);
                    }
                }
            }
            return in;
        }

        private static Map<Edge, Double> sorted(Map<Edge, Double> in) {
            List<Map.Entry<Edge, Double>> entries = new ArrayList<>(in.entrySet());
            entries.sort(Map.Entry.<Edge, Double>comparingByValue().thenComparingInt(en -> en.getKey().id()));
            Map<Edge, Double> out = new LinkedHashMap<>();
            for (Map.Entry<Edge, Double> en : entries) {
                out.put(en.getKey(), en.getValue());
            }
            return out;
        }
    }
}
