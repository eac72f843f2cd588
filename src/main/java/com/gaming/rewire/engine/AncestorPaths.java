package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.Edge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Breadth-first search backwards through the in-edges of a reachability
 * check.
 */
public final class AncestorPaths {

    private AncestorPaths() {
    }

    private record Step(Edge edge, String child) {
    }

    /**
     * Finds the shortest chain of recorded in-edges leading from an area that
     * satisfies {@code isRoot} to {@code start}.
     *
     * @param allowConds whether conditional edges may be followed. When false,
     *                   only unconditional edges and edges gated on their own
     *                   source area are used.
     * @return the edges from the root towards {@code start}, so the first edge's
     *         source is the root; empty if {@code start} is itself a root; null
     *         if {@code start} is unreached or no root is found.
     */
    public static List<Edge> find(CheckRecord check, String start, Predicate<String> isRoot, boolean allowConds) {
        if (!check.reached(start)) {
            return null;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        Map<String, Step> parent = new HashMap<>();
        while (!queue.isEmpty()) {
            String area = queue.poll();
            if (isRoot.test(area)) {
                List<Edge> path = new ArrayList<>();
                while (parent.containsKey(area) && !area.equals(start)) {
                    Step step = parent.get(area);
                    if (path.contains(step.edge())) {
                        break;
                    }
                    path.add(step.edge());
                    area = step.child();
                }
                return path;
            }
            NodeRecord record = check.record(area);
            if (record == null) {
                continue;
            }
            for (Edge in : record.inEdges().keySet()) {
                String pred = in.from();
                if (!allowConds && in.linkedExpr() != null && !in.linkedExpr().toString().equals(pred)) {
                    continue;
                }
                if (!parent.containsKey(pred)) {
                    parent.put(pred, new Step(in, area));
                    queue.add(pred);
                }
            }
        }
        return null;
    }
}
