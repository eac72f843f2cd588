package com.gaming.rewire.engine;

import com.gaming.rewire.dsl.WorldBuilder;
import com.gaming.rewire.node.Edge;
import org.junit.Test;

import static org.junit.Assert.*;

public class CoreClassifierTest {

    @Test
    public void testCoreSidesAndRequiredAreas() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall").area("garden").area("shrine")
                .entrance("front_door", "start", "hall")
                .entrance("garden_gate", "hall", "garden", "optional")
                .required("shrine")
                .build();

        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        assertTrue(c.isCore("start"));
        assertTrue(c.isCore("hall"));
        assertTrue(c.isCore("shrine"));
        assertFalse(c.isCore("garden"));
        assertTrue(graph.area("hall").isCore());
        assertFalse(graph.area("garden").isCore());
    }

    @Test
    public void testWorldSuccessorOfCoreIsCore() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall").area("balcony").area("ledge")
                .entrance("front_door", "start", "hall")
                .world("hall", "balcony")
                .world("hall", "ledge", null, "openonly")
                .build();

        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        assertTrue(c.isCore("balcony"));
        assertFalse(c.isCore("ledge"));
    }

    @Test
    public void testPseudoCore() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall").area("orchard").area("pond")
                .entrance("front_door", "start", "hall")
                .world("orchard", "hall")
                .entrance("pond_path", "orchard", "pond", "optional")
                .build();

        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        assertFalse(c.isCore("orchard"));
        assertEquals("hall", c.pseudoCore().get("orchard"));
        assertTrue(c.expandedCore().contains("orchard"));
        Edge toPond = graph.node("orchard").to().stream().filter(e -> "pond_path".equals(e.name()))
                .findFirst().orElseThrow();
        assertTrue(toPond.side().isPseudoCore());
    }

    @Test
    public void testKeyItemAreaGetsCoreEntrance() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hub").area("den").area("lair")
                .item("claw", "den")
                .entrance("hub_door", "start", "hub")
                .entrance("den_path", "hub", "den", "optional")
                .entrance("lair_door", "hub", "lair")
                .condition("lair_door", "lair", "claw")
                .build();

        CoreClassifier.CoreClassification c = new CoreClassifier(graph).classify();

        assertTrue(c.isCore("den"));
        Edge denEntrance = graph.node("den").from().get(0);
        assertTrue(denEntrance.side().isCore());
    }

    @Test
    public void testOpenStartTagsPoorStarts() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hub").area("closet").area("boss_room")
                .boss("boss_room")
                .entrance("a", "start", "hub")
                .entrance("b", "hub", "boss_room")
                .entrance("c", "hub", "closet")
                .build();
        CoreClassifier classifier = new CoreClassifier(graph);
        classifier.classify();

        classifier.tagOpenStart();

        assertTrue(graph.area("boss_room").hasTag("avoidstart"));
        assertTrue(graph.area("closet").hasTag("avoidstart"));
        assertFalse(graph.area("hub").hasTag("avoidstart"));
        assertTrue(graph.node("closet").to().get(0).side().hasTag("avoidstart"));
    }
}
