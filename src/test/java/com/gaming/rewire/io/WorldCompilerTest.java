package com.gaming.rewire.io;

import com.gaming.rewire.api.Expr;
import com.gaming.rewire.dsl.WorldBuilder;
import com.gaming.rewire.engine.WorldGraph;
import com.gaming.rewire.node.Edge;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class WorldCompilerTest {

    private static Edge exitNamed(WorldGraph graph, String area, String name) {
        return graph.node(area).to().stream().filter(e -> name.equals(e.name())).findFirst()
                .orElseThrow(() -> new AssertionError("No exit " + name + " in " + area));
    }

    private static Edge entranceNamed(WorldGraph graph, String area, String name) {
        return graph.node(area).from().stream().filter(e -> name.equals(e.name())).findFirst()
                .orElseThrow(() -> new AssertionError("No entrance " + name + " in " + area));
    }

    private static void assertRejected(WorldBuilder builder, String messagePart) {
        try {
            builder.build();
            fail("Expected IllegalArgumentException containing: " + messagePart);
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(messagePart));
        }
    }

    @Test
    public void testWorldConnectionIsLinkedAndFixed() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("yard")
                .item("lantern", "yard")
                .world("start", "yard", "lantern")
                .start("start")
                .build();

        Edge exit = graph.node("start").to().get(0);
        Edge entrance = graph.node("yard").from().get(0);
        assertTrue(exit.isWorld());
        assertTrue(exit.isFixed());
        assertFalse(exit.side().isCore());
        assertSame(entrance, exit.link());
        assertEquals("yard", exit.to());
        assertEquals("start", entrance.from());
        assertEquals(Expr.named("lantern"), exit.linkedExpr());
        assertEquals("start", graph.start());
    }

    @Test
    public void testShortcutOpensFromFarSide() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("ledge")
                .world("start", "ledge", null, "shortcut")
                .build();

        Edge exit = graph.node("start").to().get(0);
        // The shortcut keeps paired halves so the way back exists too
        assertNotNull(exit.pair());
        assertEquals("ledge", exit.to());
        assertEquals(Expr.named("start"), exit.linkedExpr());
    }

    @Test
    public void testTwoWayEntranceStaysUnlinkedWithVanillaPartners() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("start").area("hall")
                .entrance("front_door", "start", "hall")
                .build();

        Edge startExit = exitNamed(graph, "start", "front_door");
        Edge hallEntrance = entranceNamed(graph, "hall", "front_door");
        Edge hallExit = exitNamed(graph, "hall", "front_door");
        Edge startEntrance = entranceNamed(graph, "start", "front_door");

        assertFalse(startExit.isLinked());
        assertFalse(startExit.isFixed());
        assertTrue(startExit.side().isCore());
        assertSame(startEntrance, startExit.pair());
        assertSame(hallEntrance, startExit.fixedLink());
        assertSame(startExit, hallEntrance.fixedLink());
        assertSame(startEntrance, hallExit.fixedLink());
    }

    @Test
    public void testFixedTagsLinkImmediately() {
        for (String tag : List.of("norandom", "door", "trivial")) {
            WorldBuilder builder = WorldBuilder.create("w").area("a").area("b");
            if (tag.equals("door")) {
                builder.door("gate", "a", "b", null);
            } else {
                builder.entrance("gate", "a", "b", tag);
            }
            WorldGraph graph = builder.build();
            Edge bExit = exitNamed(graph, "b", "gate");
            assertTrue(tag, bExit.isFixed());
            assertTrue(tag, bExit.isLinked());
            assertEquals(tag, "a", bExit.to());
            assertEquals(tag, "b", exitNamed(graph, "a", "gate").to());
        }
    }

    @Test
    public void testOptionalSideIsNotCore() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .entrance("path", "a", "b")
                .sideTag("path", "b", "optional")
                .build();
        assertTrue(exitNamed(graph, "a", "path").side().isCore());
        assertFalse(exitNamed(graph, "b", "path").side().isCore());
    }

    @Test
    public void testExcludedAreaIsOptional() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("vault")
                .excluded("vault")
                .entrance("vault_door", "a", "vault")
                .build();
        assertTrue(graph.area("vault").isExcluded());
        assertTrue(graph.area("vault").hasTag("optional"));
        assertTrue(exitNamed(graph, "vault", "vault_door").side().isExcluded());
        assertFalse(exitNamed(graph, "a", "vault_door").side().isExcluded());
    }

    @Test
    public void testDoorConditionAndOneSidedOpening() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .item("crest", "a")
                .door("gate", "a", "b", "crest")
                .sideTag("gate", "b", "dnofts")
                .build();
        Edge aExit = exitNamed(graph, "a", "gate");
        Edge bExit = exitNamed(graph, "b", "gate");
        assertTrue(aExit.isWorld());
        assertEquals(Expr.named("crest"), aExit.side().getExpr());
        // Opening from b additionally needs a reached
        assertEquals(Expr.and(List.of(Expr.named("crest"), Expr.named("a"))), bExit.side().getExpr());
    }

    @Test
    public void testDeadEndGetsPairedEdges() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a")
                .deadEnd("well", "a")
                .build();
        Edge exit = exitNamed(graph, "a", "well");
        assertNotNull(exit.pair());
        assertNull(exit.fixedLink());
        assertFalse(exit.isLinked());
    }

    @Test
    public void testBidirectionalWarpsArePairedAcross() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .warp("up", "a", "b")
                .warp("down", "b", "a")
                .build();
        Edge up = exitNamed(graph, "a", "up");
        Edge down = exitNamed(graph, "b", "down");
        assertSame(entranceNamed(graph, "a", "down"), up.pair());
        assertSame(entranceNamed(graph, "b", "up"), down.pair());
        assertSame(entranceNamed(graph, "b", "up"), up.fixedLink());
    }

    @Test
    public void testUniqueAndSelfWarps() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .warp("chute", "a", "b", "unique")
                .warp("mirror", "b", "b", "selfwarp")
                .build();
        assertNull(exitNamed(graph, "a", "chute").pair());
        Edge mirror = exitNamed(graph, "b", "mirror");
        assertSame(entranceNamed(graph, "b", "mirror"), mirror.pair());
    }

    @Test
    public void testFixedWarpIsLinked() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .warp("lift", "a", "b", "unique")
                .fixed("lift")
                .build();
        Edge lift = exitNamed(graph, "a", "lift");
        assertTrue(lift.isFixed());
        assertEquals("b", lift.to());
    }

    @Test
    public void testUnusedEntranceSkipped() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .entrance("rubble", "a", "b", "unused")
                .build();
        assertTrue(graph.node("a").to().isEmpty());
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    public void testConfigDefaultsToTrue() {
        WorldGraph graph = WorldBuilder.create("w")
                .area("a").area("b")
                .config("glitches", null)
                .world("a", "b", "glitches")
                .build();
        assertEquals(Expr.TRUE, graph.configExprs().get("glitches"));
        assertTrue(graph.resolve(Expr.named("glitches")).isTrue());
    }

    @Test
    public void testDefaultGraphName() {
        WorldDefinition def = new WorldDefinition();
        WorldDefinition.AreaDef area = new WorldDefinition.AreaDef();
        area.setName("only");
        def.getAreas().add(area);
        assertEquals("world", new WorldCompiler().compile(def).name());
    }

    @Test
    public void testUnknownAreaRejected() {
        assertRejected(WorldBuilder.create("w").area("a").entrance("gate", "a", "nowhere"),
                "Unknown area nowhere");
    }

    @Test
    public void testUnknownVariableRejected() {
        assertRejected(WorldBuilder.create("w").area("a").area("b").world("a", "b", "AND a mystery"),
                "Unknown variable mystery");
    }

    @Test
    public void testDuplicateEntranceRejected() {
        WorldDefinition def = WorldBuilder.create("w").area("a").area("b")
                .entrance("gate", "a", "b").definition();
        def.getEntrances().add(def.getEntrances().get(0));
        try {
            new WorldCompiler().compile(def);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Duplicate entrance gate", e.getMessage());
        }
    }

    @Test
    public void testOneSidedDoorRejected() {
        WorldBuilder builder = WorldBuilder.create("w").area("a").deadEnd("hatch", "a", "door");
        assertRejected(builder, "hatch has one-sided door");
    }

    @Test
    public void testDoorWithSideConditionRejected() {
        WorldBuilder builder = WorldBuilder.create("w").area("a").area("b")
                .door("gate", "a", "b", null)
                .condition("gate", "b", "a");
        assertRejected(builder, "together for gate");
    }

    @Test
    public void testLoneWarpMustBeUnique() {
        assertRejected(WorldBuilder.create("w").area("a").area("b").warp("up", "a", "b"),
                "Bidirectional warp expected");
    }

    @Test
    public void testWarpsInSameDirectionRejected() {
        WorldBuilder builder = WorldBuilder.create("w").area("a").area("b")
                .warp("up", "a", "b")
                .warp("up2", "a", "b");
        assertRejected(builder, "are not opposite directions");
    }
}
