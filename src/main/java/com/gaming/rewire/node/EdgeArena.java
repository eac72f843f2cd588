package com.gaming.rewire.node;

import com.gaming.rewire.api.EdgeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns every {@link Edge} of one graph. Edge ids are dense indexes into this
 * arena and stay stable for the lifetime of the graph.
 */
public final class EdgeArena {
    private final List<Edge> edges = new ArrayList<>();

    public Edge create(EdgeType type, Side side, String name, String text, boolean fixed) {
        Edge edge = new Edge(this, edges.size(), type, side, name, text, fixed);
        edges.add(edge);
        return edge;
    }

    /** Resolves an id, returning null for the "no edge" id. */
    public Edge get(int id) {
        return id == Edge.NONE ? null : edges.get(id);
    }

    public int size() {
        return edges.size();
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /** Drops edges created after the arena had {@code size} entries. */
    public void truncate(int size) {
        if (size > edges.size()) {
            throw new IllegalArgumentException("Cannot grow arena from " + edges.size() + " to " + size);
        }
        edges.subList(size, edges.size()).clear();
    }
}
