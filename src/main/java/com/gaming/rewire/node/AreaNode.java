package com.gaming.rewire.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-area bucket of edges. {@link #to()} holds the outgoing EXIT edges and
 * {@link #from()} the incoming ENTRANCE edges. One node exists per area for the
 * lifetime of the graph; its lists only grow, except when a snapshot restore
 * drops duplicated entrances.
 */
public final class AreaNode {
    private final String area;
    private final int cost;
    private final List<Edge> to = new ArrayList<>();
    private final List<Edge> from = new ArrayList<>();

    public AreaNode(String area, int cost) {
        this.area = area;
        this.cost = cost;
    }

    public String area() {
        return area;
    }

    public int cost() {
        return cost;
    }

    public List<Edge> to() {
        return to;
    }

    public List<Edge> from() {
        return from;
    }

    @Override
    public String toString() {
        return "AreaNode[" + area + ", to=" + to.size() + ", from=" + from.size() + "]";
    }
}
