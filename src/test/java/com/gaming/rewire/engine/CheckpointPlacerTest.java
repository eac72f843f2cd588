package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckMode;
import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.dsl.WorldBuilder;
import com.gaming.rewire.node.Edge;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CheckpointPlacerTest {

    @Test
    public void testUnreachedCheckpointIsLeftAlone() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall").area("island")
                .world("start", "hall")
                .start("start")
                .build();
        CheckRecord check = new GraphChecker().check(graph, "start", CheckMode.FULL);
        List<String> tried = new ArrayList<>();

        CheckpointPlacer placer = new CheckpointPlacer(graph, "start", "island", null, false, false);

        assertFalse(placer.moveEarlier(check, tried));
        assertTrue(tried.isEmpty());
    }

    @Test
    public void testEarlyCheckpointNeedsNoSwap() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall").area("cellar")
                .world("start", "hall")
                .world("hall", "cellar")
                .start("start")
                .build();
        CheckRecord check = new GraphChecker().check(graph, "start", CheckMode.FULL);
        List<String> tried = new ArrayList<>();

        CheckpointPlacer placer = new CheckpointPlacer(graph, "start", "start", List.of(), false, true);

        assertFalse(placer.moveEarlier(check, tried));
        assertTrue(tried.isEmpty());
        assertEquals("hall", graph.node("start").to().get(0).to());
    }

    /*
     * start -[w1]-> a -> b -> c -> d -> e -[w2]-> cp -> b
     * Only a and cp have a randomizable entrance, and a sits at the early cutoff.
     */
    private static WorldGraph lateCheckpoint() {
        WorldGraph graph = WorldBuilder.create("late")
                .area("start").area("a").area("b").area("c").area("d").area("e").area("cp")
                .warp("w1", "start", "a", "unique")
                .warp("w2", "e", "cp", "unique")
                .world("a", "b")
                .world("b", "c")
                .world("c", "d")
                .world("d", "e")
                .world("cp", "b")
                .start("start")
                .build();
        for (Edge exit : graph.edges()) {
            if (exit.isExit() && !exit.isLinked() && exit.fixedLink() != null) {
                graph.connect(exit, exit.fixedLink());
            }
        }
        return graph;
    }

    @Test
    public void testLateCheckpointSwapsWithEarlyArea() {
        WorldGraph graph = lateCheckpoint();
        GraphChecker checker = new GraphChecker();
        CheckRecord before = checker.check(graph, "start", CheckMode.FULL);
        assertEquals(6.0, before.record("cp").dist(), 0.0);
        List<String> tried = new ArrayList<>();

        CheckpointPlacer placer = new CheckpointPlacer(graph, "start", "cp", List.of(), true, false);

        assertTrue(placer.moveEarlier(before, tried));
        assertEquals(List.of("a,cp"), tried);

        CheckRecord after = checker.check(graph, "start", CheckMode.FULL);
        assertTrue(after.unvisited().isEmpty());
        assertEquals(1.0, after.record("cp").dist(), 0.0);
        assertTrue(after.record("cp").dist() < before.record("cp").dist());
        // The early area now takes the late landing
        assertEquals(6.0, after.record("a").dist(), 0.0);

        // Already early on the next pass
        assertFalse(placer.moveEarlier(after, tried));
        assertEquals(1, tried.size());
    }

    @Test
    public void testSwapKeyIsOrderIndependent() {
        assertEquals("cellar,hall", CheckpointPlacer.swapKey("hall", "cellar"));
        assertEquals(CheckpointPlacer.swapKey("a", "b"), CheckpointPlacer.swapKey("b", "a"));
    }
}
