package com.gaming.rewire.util;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.engine.WorldGraph;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;

import java.util.Map;

/**
 * Diagnostic utility for inspecting the link state of a graph.
 *
 * <p>
 * Generates human-readable text for single areas, swaps and whole graphs.
 * Intended for debug logging and failure reports; it allocates freely.
 */
public final class GraphExplain {
    private final WorldGraph graph;

    public GraphExplain(WorldGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the flags and edges of a single area.
     */
    public String explainArea(String areaName) {
        Area area = graph.area(areaName);
        AreaNode node = graph.node(areaName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Area: ").append(area.name());
        if (!area.text().equals(area.name()))
            sb.append(" (").append(area.text()).append(')');
        sb.append('\n')
                .append("  Core: ").append(area.isCore())
                .append(", Excluded: ").append(area.isExcluded())
                .append(", Boss: ").append(area.isBoss())
                .append(", Cost: ").append(area.cost()).append('\n');
        if (!area.tags().isEmpty())
            sb.append("  Tags: ").append(String.join(" ", area.tags())).append('\n');
        sb.append("  Exits (").append(node.to().size()).append("):\n");
        for (Edge e : node.to())
            sb.append("    ").append(describeEdge(e)).append('\n');
        sb.append("  Entrances (").append(node.from().size()).append("):\n");
        for (Edge e : node.from())
            sb.append("    ").append(describeEdge(e)).append('\n');
        return sb.toString();
    }

    /**
     * One line per edge: direction, endpoints, flags and effective condition.
     */
    public static String describeEdge(Edge e) {
        StringBuilder sb = new StringBuilder(96);
        sb.append(e.from() == null ? "?" : e.from())
                .append(" -> ")
                .append(e.to() == null ? "?" : e.to());
        if (e.name() != null)
            sb.append(" via ").append(e.name());
        if (e.isFixed())
            sb.append(" [fixed]");
        if (e.pair() != null)
            sb.append(" [paired]");
        if (e.linkedExpr() != null)
            sb.append(" if ").append(e.linkedExpr());
        return sb.toString();
    }

    public static String describeSwap(Edge redundant, Edge unreached) {
        return "rerouted " + describeEdge(redundant) + " onto entrance of " + unreached.to();
    }

    /**
     * Summary of one reachability check.
     */
    public String explainCheck(CheckRecord check) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Reached ").append(check.records().size()).append('/').append(graph.areas().size())
                .append(" areas");
        if (!check.unvisited().isEmpty())
            sb.append("; unreached: ").append(String.join(", ", check.unvisited()));
        if (!check.unvisitedItems().isEmpty())
            sb.append("; missing items: ").append(String.join(", ", check.unvisitedItems()));
        return sb.toString();
    }

    /**
     * Dumps every randomized link in area order, with the distance of the
     * destination when a check is given. Fixed links are skipped.
     */
    public String dumpConnections(CheckRecord check) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(":\n");
        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.to()) {
                if (e.isFixed() || !e.isLinked())
                    continue;
                sb.append("  ").append(describeEdge(e));
                if (check != null) {
                    NodeRecord rec = check.record(e.to());
                    if (rec != null)
                        sb.append(" (dist ").append(rec.dist()).append(')');
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Tier listing in the order the map iterates.
     */
    public static String dumpTiers(Map<String, Integer> tiers) {
        StringBuilder sb = new StringBuilder(512);
        for (Map.Entry<String, Integer> entry : tiers.entrySet())
            sb.append("  ").append(entry.getKey()).append(": tier ").append(entry.getValue()).append('\n');
        return sb.toString();
    }
}
