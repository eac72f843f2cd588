package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.NodeRecord;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.Edge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assigns each area a difficulty tier from its place in the final dependency
 * order, for downstream scaling.
 *
 * Major bosses anchor the curve between {@link #FIRST_BOSS_TIER} and
 * {@link #LAST_BOSS_TIER}; the areas on the way to each anchor are
 * interpolated by distance, and everything else inherits from the
 * farthest tiered area it depends on.
 */
public final class AreaTierRanker {
    private static final Logger log = LogManager.getLogger(AreaTierRanker.class);

    static final int START_TIER = 1;
    static final int FIRST_BOSS_TIER = 3;
    static final int LAST_BOSS_TIER = 20;

    private final WorldGraph graph;

    public AreaTierRanker(WorldGraph graph) {
        this.graph = graph;
    }

    public Map<String, Integer> rank(CheckRecord check, String start) {
        Map<String, Integer> tiers = new LinkedHashMap<>();
        List<NodeRecord> byDist = check.records().values().stream()
                .sorted(Comparator.comparingDouble(NodeRecord::dist))
                .collect(Collectors.toList());

        tiers.put(start, START_TIER);
        List<NodeRecord> bosses = byDist.stream()
                .filter(r -> graph.isMajorScalingBoss(graph.area(r.area())))
                .collect(Collectors.toList());
        for (int i = 0; i < bosses.size(); i++) {
            tiers.put(bosses.get(i).area(), bossTier(i, bosses.size()));
        }

        for (NodeRecord rec : byDist) {
            Integer destTier = tiers.get(rec.area());
            if (destTier == null || graph.area(rec.area()).isExcluded()) {
                continue;
            }
            List<Edge> path = AncestorPaths.find(check, rec.area(), a -> !a.equals(rec.area())
                    && tiers.containsKey(a) && tiers.get(a) <= destTier, true);
            if (path == null || path.size() <= 1) {
                continue;
            }
            List<String> steps = path.stream().map(Edge::from).collect(Collectors.toList());
            int rootTier = tiers.get(steps.get(0));
            if (rootTier + 1 >= destTier) {
                for (String step : steps) {
                    tiers.put(step, rootTier);
                }
                continue;
            }
            int topTier = destTier - 1;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (String step : steps) {
                double dist = check.record(step).dist();
                min = Math.min(min, dist);
                max = Math.max(max, dist);
            }
            if (min == max) {
                max = Double.POSITIVE_INFINITY;
            }
            for (String step : steps) {
                double dist = check.record(step).dist();
                double ratio = (dist - min) / (max - min);
                if (ratio < 0 || ratio > 1) {
                    throw new IllegalStateException("Internal error: bad ratio math " + min + " " + dist + " " + max);
                }
                tiers.put(step, (int) Math.round(rootTier + ratio * (topTier - rootTier)));
            }
        }

        for (NodeRecord rec : byDist) {
            if (tiers.containsKey(rec.area()) || graph.area(rec.area()).isExcluded()) {
                continue;
            }
            List<Edge> path = AncestorPaths.find(check, rec.area(), tiers::containsKey, true);
            if (path == null || path.isEmpty()) {
                throw new IllegalStateException("Internal error: couldn't find ancestor of " + rec.area()
                        + " with tiered path");
            }
            String farthest = rec.visited().stream()
                    .filter(tiers::containsKey)
                    .max(Comparator.comparingDouble(a -> check.record(a).dist()))
                    .orElse(path.get(0).from());
            int tier = tiers.get(farthest);
            List<String> onPath = new ArrayList<>();
            for (Edge e : path) {
                onPath.add(e.to());
            }
            for (String area : onPath) {
                tiers.putIfAbsent(area, tier);
            }
        }

        for (Area area : graph.areas()) {
            if (tiers.containsKey(area.name()) || area.openArea() == null) {
                continue;
            }
            Integer open = tiers.get(area.openArea());
            if (open != null) {
                tiers.put(area.name(), open);
            }
        }
        log.info("Assigned tiers to {} areas ({} anchored by bosses)", tiers.size(), bosses.size());
        return tiers;
    }

    /** Tier of the {@code index}-th of {@code count} major bosses, in distance order. */
    static int bossTier(int index, int count) {
        if (count <= 1) {
            return FIRST_BOSS_TIER;
        }
        double ratio = (double) index / (count - 1);
        return (int) Math.round(FIRST_BOSS_TIER + ratio * (LAST_BOSS_TIER - FIRST_BOSS_TIER));
    }
}
