package com.gaming.rewire.engine;

import com.gaming.rewire.api.Expr;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.node.EdgeArena;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable capture of a graph's mutable state: every edge's link, endpoints,
 * linked expression and fixed flag, side core flags and area core flags.
 * Taken before a connect run so an unsolvable seed leaves the graph as it was.
 */
public final class GraphSnapshot {
    private final int edgeCount;
    private final int[] links;
    private final String[] from;
    private final String[] to;
    private final Expr[] linkedExprs;
    private final boolean[] fixed;
    private final boolean[] sideCore;
    private final boolean[] sidePseudoCore;
    private final Map<String, Boolean> areaCore;

    private GraphSnapshot(int edgeCount) {
        this.edgeCount = edgeCount;
        this.links = new int[edgeCount];
        this.from = new String[edgeCount];
        this.to = new String[edgeCount];
        this.linkedExprs = new Expr[edgeCount];
        this.fixed = new boolean[edgeCount];
        this.sideCore = new boolean[edgeCount];
        this.sidePseudoCore = new boolean[edgeCount];
        this.areaCore = new LinkedHashMap<>();
    }

    static GraphSnapshot capture(WorldGraph graph) {
        List<Edge> edges = graph.edges();
        GraphSnapshot snapshot = new GraphSnapshot(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            Edge e = edges.get(i);
            Edge link = e.link();
            snapshot.links[i] = link == null ? -1 : link.id();
            snapshot.from[i] = e.from();
            snapshot.to[i] = e.to();
            snapshot.linkedExprs[i] = e.linkedExpr();
            snapshot.fixed[i] = e.isFixed();
            snapshot.sideCore[i] = e.side().isCore();
            snapshot.sidePseudoCore[i] = e.side().isPseudoCore();
        }
        for (Area area : graph.areas()) {
            snapshot.areaCore.put(area.name(), area.isCore());
        }
        return snapshot;
    }

    void restoreInto(WorldGraph graph) {
        EdgeArena arena = graph.arena();
        if (arena.size() < edgeCount) {
            throw new IllegalStateException("Snapshot of " + edgeCount + " edges does not belong to " + graph);
        }
        for (AreaNode node : graph.nodes()) {
            node.from().removeIf(e -> e.id() >= edgeCount);
            node.to().removeIf(e -> e.id() >= edgeCount);
        }
        arena.truncate(edgeCount);
        // Sides are shared between edges, so restore them first and let
        // later edges of the same side write the same captured value.
        for (int i = 0; i < edgeCount; i++) {
            Edge e = arena.get(i);
            e.side().setCore(sideCore[i]);
            e.side().setPseudoCore(sidePseudoCore[i]);
        }
        for (int i = 0; i < edgeCount; i++) {
            Edge e = arena.get(i);
            e.setLink(arena.get(links[i]));
            e.setFrom(from[i]);
            e.setTo(to[i]);
            e.setLinkedExpr(linkedExprs[i]);
            e.setFixed(fixed[i]);
        }
        for (Map.Entry<String, Boolean> entry : areaCore.entrySet()) {
            graph.area(entry.getKey()).setCore(entry.getValue());
        }
    }

    public int edgeCount() {
        return edgeCount;
    }
}
