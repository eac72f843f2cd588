package com.gaming.rewire.api;

import com.gaming.rewire.node.Edge;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * What a reachability check learned about one reached area.
 *
 * {@code visited} holds every area that had to be reached before this one,
 * including itself. {@code inEdges} maps each usable incoming EXIT edge (the
 * edge in its source area's outgoing list) to the distance at which it
 * delivers the player here, in ascending cost order.
 */
public final class NodeRecord {
    private final String area;
    private final double dist;
    private final Set<String> visited;
    private final Map<Edge, Double> inEdges;

    public NodeRecord(String area, double dist, Set<String> visited, Map<Edge, Double> inEdges) {
        this.area = area;
        this.dist = dist;
        this.visited = Collections.unmodifiableSet(visited);
        this.inEdges = Collections.unmodifiableMap(inEdges);
    }

    public String area() {
        return area;
    }

    public double dist() {
        return dist;
    }

    public Set<String> visited() {
        return visited;
    }

    public Map<Edge, Double> inEdges() {
        return inEdges;
    }

    @Override
    public String toString() {
        return "NodeRecord[" + area + ", dist=" + dist + ", visited=" + visited.size() + ", in=" + inEdges.size() + "]";
    }
}
