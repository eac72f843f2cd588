package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Strongly connected components of the core graph and their dominance
 * relation, used to rank how naturally one area leads to another.
 *
 * Components are built over traversable edges only: linked, unconditional
 * and not leaving a boss area. Each component is named by its root area.
 * Pseudo-core areas join the component of the core area they lead into.
 */
public final class ComponentAnalyzer {
    public static final int MAX_RANK = 1000;

    private final WorldGraph graph;
    private final CoreClassifier.CoreClassification classification;
    private final Map<String, String> rootComponents = new LinkedHashMap<>();
    private final Map<String, Set<String>> rootPreds = new LinkedHashMap<>();
    private final Map<String, Set<String>> dominators = new HashMap<>();
    private final SortedMap<String, List<String>> components = new TreeMap<>();

    public ComponentAnalyzer(WorldGraph graph, CoreClassifier.CoreClassification classification) {
        this.graph = graph;
        this.classification = classification;
    }

    /** Computes components and dominators from the state captured by {@code check}. */
    public void analyze(CheckRecord check) {
        List<String> ordering = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (AreaNode node : graph.nodes()) {
            strongVisit(node.area(), seen, ordering);
        }
        Collections.reverse(ordering);
        for (String area : ordering) {
            strongAssign(area, area);
        }
        for (Map.Entry<String, String> entry : classification.pseudoCore().entrySet()) {
            String root = rootComponents.get(entry.getValue());
            if (root == null) {
                throw new IllegalStateException("No component for core area " + entry.getValue());
            }
            rootComponents.put(entry.getKey(), root);
        }

        for (String area : rootComponents.keySet()) {
            NodeRecord record = check.record(area);
            if (record == null) {
                continue;
            }
            for (Edge in : record.inEdges().keySet()) {
                if (record.visited().contains(in.from())) {
                    rootPreds.computeIfAbsent(area, k -> new LinkedHashSet<>()).add(in.from());
                }
            }
        }
        for (String area : rootPreds.keySet()) {
            domVisit(area);
        }

        for (Map.Entry<String, String> entry : rootComponents.entrySet()) {
            components.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(entry.getKey());
        }
    }

    private boolean isTraversable(Edge e) {
        return e.isLinked() && e.linkedExpr() == null && !graph.area(e.from()).isBoss();
    }

    /** Post-order over traversable exits, core areas only. */
    private void strongVisit(String start, Set<String> seen, List<String> ordering) {
        if (!classification.isCore(start) || !seen.add(start)) {
            return;
        }
        Deque<String> areas = new ArrayDeque<>();
        Deque<int[]> cursors = new ArrayDeque<>();
        areas.push(start);
        cursors.push(new int[] {0});
        while (!areas.isEmpty()) {
            List<Edge> to = graph.node(areas.peek()).to();
            int[] cursor = cursors.peek();
            String next = null;
            while (cursor[0] < to.size() && next == null) {
                Edge e = to.get(cursor[0]++);
                if (isTraversable(e) && classification.isCore(e.to()) && seen.add(e.to())) {
                    next = e.to();
                }
            }
            if (next != null) {
                areas.push(next);
                cursors.push(new int[] {0});
            } else {
                ordering.add(areas.pop());
                cursors.pop();
            }
        }
    }

    /** Assigns {@code root} to every unassigned core area reaching {@code start} backwards. */
    private void strongAssign(String start, String root) {
        Deque<String> work = new ArrayDeque<>();
        work.push(start);
        while (!work.isEmpty()) {
            String area = work.pop();
            if (!classification.isCore(area) || rootComponents.containsKey(area)) {
                continue;
            }
            rootComponents.put(area, root);
            for (Edge e : graph.node(area).from()) {
                if (isTraversable(e)) {
                    work.push(e.from());
                }
            }
        }
    }

    private Set<String> domVisit(String area) {
        Set<String> known = dominators.get(area);
        if (known != null) {
            return known;
        }
        // Provisional answer breaks cycles
        dominators.put(area, Set.of(area));
        Set<String> preds = rootPreds.get(area);
        if (preds != null) {
            Set<String> common = null;
            for (String pred : preds) {
                if (common == null) {
                    common = new LinkedHashSet<>(domVisit(pred));
                } else {
                    common.retainAll(domVisit(pred));
                }
            }
            if (common != null) {
                common.add(area);
                dominators.put(area, common);
            }
        }
        return dominators.get(area);
    }

    /** Root-named components with their member areas, ordered by root name. */
    public SortedMap<String, List<String>> components() {
        return Collections.unmodifiableSortedMap(components);
    }

    public String rootOf(String area) {
        return rootComponents.get(area);
    }

    public Set<String> dominatorsOf(String area) {
        return dominators.getOrDefault(area, Set.of());
    }

    /**
     * Component of {@code area}. Reached areas outside the core graph take the
     * component of the nearest ancestor that has one, and the answer is cached.
     */
    public String getScc(CheckRecord check, String area) {
        if (!check.reached(area)) {
            return area;
        }
        String root = rootComponents.get(area);
        if (root != null) {
            return root;
        }
        List<Edge> path = AncestorPaths.find(check, area, rootComponents::containsKey, true);
        if (path == null) {
            throw new IllegalStateException("Internal error: can't find connected component for area " + area);
        }
        root = path.isEmpty() ? area : path.get(0).from();
        rootComponents.put(area, root);
        return root;
    }

    /**
     * How natural it is for an exit out of {@code from} to lead into
     * {@code to}, up to {@link #MAX_RANK}. Same component ranks highest,
     * then dominance, then ancestry, then unconditional ancestor paths by
     * length; negative ranks only exist through conditional paths.
     */
    public int getRanking(CheckRecord check, String from, String to) {
        if (!check.reached(to)) {
            return MAX_RANK - 6;
        }
        int rank = -1;
        String sccFrom = getScc(check, from);
        String sccTo = getScc(check, to);
        NodeRecord fromRecord = check.record(from);
        Set<String> dominating = dominators.get(sccFrom);
        if (sccFrom.equals(sccTo)) {
            rank = MAX_RANK - 1;
        } else if (dominating != null && dominating.contains(sccTo)) {
            rank = MAX_RANK - 2;
        } else if (fromRecord != null && fromRecord.visited().stream().anyMatch(v -> getScc(check, v).equals(sccTo))) {
            rank = MAX_RANK - 3;
        } else if (fromRecord != null) {
            List<Edge> path = AncestorPaths.find(check, to, fromRecord.visited()::contains, false);
            if (path != null) {
                long bossHops = path.stream().filter(e -> graph.area(e.from()).isBoss()).count();
                rank = MAX_RANK - 10 - path.size() - 10 * (int) bossHops;
            }
        }
        if (rank > 0) {
            return rank;
        }
        if (fromRecord == null) {
            return -1000;
        }
        List<Edge> path = AncestorPaths.find(check, to, fromRecord.visited()::contains, true);
        if (path == null) {
            return -1000;
        }
        return -10 - (int) path.stream()
                .filter(e -> e.linkedExpr() != null || graph.area(e.from()).isBoss()).count();
    }
}
