package com.gaming.rewire.engine;

import com.gaming.rewire.dsl.WorldBuilder;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class EdgeMatcherTest {

    private static WorldGraph castle() {
        return WorldBuilder.create("castle")
                .area("start").area("hall").area("cellar").area("tower").area("garden")
                .entrance("front_door", "start", "hall")
                .entrance("cellar_stairs", "hall", "cellar")
                .entrance("tower_stairs", "hall", "tower")
                .entrance("garden_gate", "hall", "garden", "optional")
                .warp("chute", "tower", "cellar", "unique")
                .start("start")
                .build();
    }

    private static List<Integer> links(WorldGraph graph) {
        List<Integer> out = new ArrayList<>();
        for (Edge e : graph.edges()) {
            out.add(e.link() == null ? -1 : e.link().id());
        }
        return out;
    }

    private static void assertPairsConsistent(WorldGraph graph) {
        for (Edge e : graph.edges()) {
            if (!e.isExit() || !e.isLinked()) {
                continue;
            }
            Edge entrance = e.link();
            if (e.pair() != null && entrance.pair() != null && entrance != e.pair()) {
                assertSame("return trip of " + e, entrance.pair(), e.pair().link());
            }
        }
    }

    @Test
    public void testMatchEverythingWithoutCoreAwareness() {
        WorldGraph graph = castle();
        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        new EdgeMatcher(graph, new Random(7), false).matchInitial(c, false, false);

        for (Edge e : graph.edges()) {
            assertTrue(e + " left dangling", e.isLinked());
        }
        assertPairsConsistent(graph);
        // the one-way warp can only go to the one-way landing
        Edge chute = graph.node("tower").to().stream().filter(e -> e.pair() == null).findFirst().orElseThrow();
        assertEquals("cellar", chute.to());
    }

    @Test
    public void testCoreAwareLeavesOptionalEdges() {
        WorldGraph graph = castle();
        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        new EdgeMatcher(graph, new Random(7), false).matchInitial(c, true, false);

        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.to()) {
                assertEquals(e.toString(), e.side().isCore(), e.isLinked());
            }
        }
        assertPairsConsistent(graph);
    }

    @Test
    public void testSameSeedSameMatching() {
        WorldGraph first = castle();
        WorldGraph second = castle();
        new EdgeMatcher(first, new Random(99), false)
                .matchInitial(new CoreClassifier(first).classify(), false, false);
        new EdgeMatcher(second, new Random(99), false)
                .matchInitial(new CoreClassifier(second).classify(), false, false);
        assertEquals(links(first), links(second));
    }

    @Test
    public void testSurplusCoreLandingIsDemoted() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("pit")
                .warp("drop", "start", "pit", "unique")
                .warp("fall", "start", "pit", "unique")
                .sideTag("fall", "start", "optional")
                .build();
        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        new EdgeMatcher(graph, new Random(1), false).matchInitial(c, true, false);

        List<Edge> landings = graph.node("pit").from();
        long linked = landings.stream().filter(Edge::isLinked).count();
        long core = landings.stream().filter(e -> e.side().isCore()).count();
        assertEquals(1, linked);
        assertEquals(1, core);
        Edge drop = graph.node("start").to().stream().filter(e -> "drop".equals(e.name())).findFirst().orElseThrow();
        assertTrue(drop.isLinked());
    }

    @Test
    public void testMissingCoreLandingIsRejected() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("pit")
                .warp("drop", "start", "pit", "unique")
                .sideTag("drop", "pit", "optional")
                .build();
        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();
        try {
            new EdgeMatcher(graph, new Random(1), false).matchInitial(c, true, false);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("insufficient"));
        }
    }

    @Test
    public void testLastPairedExitLinksToItself() {
        WorldGraph graph = WorldBuilder.create("w").area("start").deadEnd("well", "start").build();
        Edge exit = graph.node("start").to().get(0);

        new EdgeMatcher(graph, new Random(3), false).connectEdges(List.of(exit),
                List.of(graph.node("start").from().get(0)), "test");

        assertSame(exit.pair(), exit.link());
    }
}
