package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckMode;
import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.dsl.WorldBuilder;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class AreaTierRankerTest {

    private static Map<String, Integer> rank(WorldGraph graph) {
        new CoreClassifier(graph).classify();
        CheckRecord check = new GraphChecker().check(graph, "start", CheckMode.FULL);
        return new AreaTierRanker(graph).rank(check, "start");
    }

    @Test
    public void testBossTierCurve() {
        assertEquals(3, AreaTierRanker.bossTier(0, 1));
        assertEquals(3, AreaTierRanker.bossTier(0, 4));
        assertEquals(20, AreaTierRanker.bossTier(1, 2));
        assertEquals(20, AreaTierRanker.bossTier(3, 4));
        // 3 + 0.5 * 17 = 11.5
        assertEquals(12, AreaTierRanker.bossTier(1, 3));
    }

    @Test
    public void testSingleBossInterpolatesPath() {
        WorldGraph graph = WorldBuilder.create("chain")
                .area("start").area("a").area("b").area("keep").area("vault")
                .required("start").boss("keep").excluded("vault")
                .world("start", "a")
                .world("a", "b")
                .world("b", "keep")
                .world("b", "vault")
                .start("start")
                .build();

        Map<String, Integer> tiers = rank(graph);

        assertEquals(Integer.valueOf(1), tiers.get("start"));
        assertEquals(Integer.valueOf(2), tiers.get("a"));
        assertEquals(Integer.valueOf(2), tiers.get("b"));
        assertEquals(Integer.valueOf(3), tiers.get("keep"));
        assertFalse(tiers.containsKey("vault"));
    }

    @Test
    public void testLaterBossAnchorsTopTier() {
        WorldGraph graph = WorldBuilder.create("two_bosses")
                .area("start").area("a").area("crypt").area("b").area("dungeon")
                .required("start").boss("crypt").boss("dungeon")
                .world("start", "a")
                .world("a", "crypt")
                .world("crypt", "b")
                .world("b", "dungeon")
                .start("start")
                .build();

        Map<String, Integer> tiers = rank(graph);

        assertEquals(Integer.valueOf(3), tiers.get("crypt"));
        assertEquals(Integer.valueOf(20), tiers.get("dungeon"));
        assertEquals(Integer.valueOf(2), tiers.get("a"));
        assertEquals(Integer.valueOf(19), tiers.get("b"));
    }

    @Test
    public void testMinorBossIsNotAnAnchor() {
        WorldGraph graph = WorldBuilder.create("minor")
                .area("start").area("den", "minor")
                .required("start").boss("den")
                .world("start", "den")
                .start("start")
                .build();

        Map<String, Integer> tiers = rank(graph);

        // Inherits from start instead of anchoring at the first boss tier
        assertEquals(Integer.valueOf(1), tiers.get("den"));
    }
}
