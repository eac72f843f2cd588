package com.gaming.rewire.engine;

import com.gaming.rewire.api.Expr;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits the areas of a graph into core (mandatory) and periphery.
 *
 * An area is core when one of its edges is core, when it is required, or when
 * a core area leads into it through world connections. Non-core areas with a
 * world connection into core become pseudo-core: they border mandatory
 * territory and their exits are tracked separately during periphery
 * attachment.
 */
public final class CoreClassifier {
    private static final Logger log = LogManager.getLogger(CoreClassifier.class);

    private final WorldGraph graph;

    public CoreClassifier(WorldGraph graph) {
        this.graph = graph;
    }

    /**
     * @param coreAreas  Mandatory areas, in graph order.
     * @param pseudoCore Non-core area to the core area its world edge leads into.
     */
    public record CoreClassification(Set<String> coreAreas, Map<String, String> pseudoCore) {
        public CoreClassification {
            coreAreas = Collections.unmodifiableSet(coreAreas);
            pseudoCore = Collections.unmodifiableMap(pseudoCore);
        }

        public boolean isCore(String area) {
            return coreAreas.contains(area);
        }

        /** Core areas plus the pseudo-core ones. */
        public Set<String> expandedCore() {
            Set<String> expanded = new LinkedHashSet<>(coreAreas);
            expanded.addAll(pseudoCore.keySet());
            return expanded;
        }
    }

    public CoreClassification classify() {
        promoteKeyItemAreas();

        Map<String, Boolean> core = new HashMap<>();
        for (AreaNode node : graph.nodes()) {
            if (graph.area(node.area()).isRequired() || hasCoreSide(node.to()) || hasCoreSide(node.from())) {
                core.put(node.area(), true);
            }
        }
        for (AreaNode node : graph.nodes()) {
            calcCore(node.area(), core);
        }

        Set<String> coreAreas = new LinkedHashSet<>();
        for (AreaNode node : graph.nodes()) {
            if (Boolean.TRUE.equals(core.get(node.area()))) {
                coreAreas.add(node.area());
            }
        }

        Map<String, String> pseudoCore = new LinkedHashMap<>();
        for (AreaNode node : graph.nodes()) {
            if (!coreAreas.contains(node.area())) {
                continue;
            }
            graph.area(node.area()).setCore(true);
            for (Edge in : node.from()) {
                if (coreAreas.contains(in.from()) || !in.isWorld() || in.from() == null) {
                    continue;
                }
                pseudoCore.put(in.from(), in.to());
                for (Edge out : graph.node(in.from()).to()) {
                    if (!coreAreas.contains(out.to())) {
                        out.side().setPseudoCore(true);
                    }
                }
            }
        }

        for (AreaNode node : graph.nodes()) {
            if (!graph.area(node.area()).hasTag("overworld")) {
                continue;
            }
            for (Edge in : node.from()) {
                if (in.isWorld() && in.from() != null && !graph.area(in.from()).hasTag("overworld")) {
                    graph.area(in.from()).addTag("overworld_adjacent");
                }
            }
        }
        log.info("Classified {} of {} areas as core, {} pseudo-core", coreAreas.size(), graph.areas().size(),
                pseudoCore.size());
        return new CoreClassification(coreAreas, pseudoCore);
    }

    private static boolean hasCoreSide(List<Edge> edges) {
        for (Edge e : edges) {
            if (e.side().isCore()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves whether {@code start} is core: it is if any area leading into it
     * through a world connection not tagged {@code openonly} is core. Areas on
     * the current path count as non-core, which breaks cycles.
     */
    private void calcCore(String start, Map<String, Boolean> core) {
        if (core.containsKey(start)) {
            return;
        }
        // Iterative post-order: a frame is an area and the index of its next in-edge.
        Deque<String> areas = new ArrayDeque<>();
        Deque<int[]> cursors = new ArrayDeque<>();
        core.put(start, false);
        areas.push(start);
        cursors.push(new int[] {0});
        while (!areas.isEmpty()) {
            String area = areas.peek();
            int[] cursor = cursors.peek();
            List<Edge> from = graph.node(area).from();
            boolean descended = false;
            while (cursor[0] < from.size()) {
                Edge e = from.get(cursor[0]++);
                if (!e.isWorld() || e.side().hasTag("openonly") || e.from() == null) {
                    continue;
                }
                Boolean known = core.get(e.from());
                if (known == null) {
                    core.put(e.from(), false);
                    areas.push(e.from());
                    cursors.push(new int[] {0});
                    cursor[0]--;
                    descended = true;
                    break;
                }
                if (known) {
                    core.put(area, true);
                    cursor[0] = from.size();
                }
            }
            if (!descended) {
                areas.pop();
                cursors.pop();
            }
        }
    }

    /**
     * Areas holding key items referenced by core gates must be reachable
     * through core routing, so each such area gets a core entrance if it has
     * none.
     */
    private void promoteKeyItemAreas() {
        Set<String> needed = new LinkedHashSet<>();
        for (Edge e : graph.edges()) {
            Expr expr = graph.resolve(e.expr());
            if (expr == null || !e.side().isCore()) {
                continue;
            }
            for (String var : expr.freeVars()) {
                if (graph.isItem(var)) {
                    needed.add(var);
                }
            }
        }
        for (String item : needed) {
            for (String area : graph.itemAreas().get(item)) {
                Area a = graph.area(area);
                if (!a.isExcluded()) {
                    graph.makeCore(area, false);
                }
            }
        }
    }

    /**
     * Tags {@code avoidstart} on areas that make a poor start: bosses, and areas
     * whose cluster of simply world-connected areas offers fewer than two simple
     * randomizable exits or is entirely trivial. The tag is copied onto the
     * sides of edges in those areas.
     */
    public void tagOpenStart() {
        Map<String, Integer> directExits = new HashMap<>();
        for (AreaNode node : graph.nodes()) {
            if (!graph.area(node.area()).isBoss()) {
                int count = 0;
                for (Edge e : node.to()) {
                    if (!e.isWorld() && isSimpleExit(e)) {
                        count++;
                    }
                }
                directExits.put(node.area(), count);
            }
        }
        int tagged = 0;
        for (AreaNode node : graph.nodes()) {
            Area area = graph.area(node.area());
            if (!area.isBoss()) {
                Set<String> cluster = simpleCluster(node.area());
                boolean allTrivial = cluster.stream().allMatch(a -> graph.area(a).hasTag("trivial"));
                int exits = cluster.stream().mapToInt(a -> directExits.getOrDefault(a, 0)).sum();
                if (!allTrivial && exits >= 2) {
                    continue;
                }
            }
            area.addTag("avoidstart");
            tagged++;
        }
        for (Edge e : graph.edges()) {
            if (graph.area(e.side().getArea()).hasTag("avoidstart") && !e.side().hasTag("avoidstart")) {
                e.side().addTag("avoidstart");
            }
        }
        log.info("Tagged {} areas to avoid as start", tagged);
    }

    private Set<String> simpleCluster(String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(start);
        while (!work.isEmpty()) {
            String area = work.pop();
            if (!visited.add(area)) {
                continue;
            }
            for (Edge e : graph.node(area).to()) {
                if (e.isWorld() && isSimpleExit(e) && e.to() != null && !visited.contains(e.to())) {
                    work.push(e.to());
                }
            }
        }
        return visited;
    }

    static boolean isSimpleExit(Edge e) {
        return e.expr() == null || e.expr().toString().equals(e.from());
    }
}
