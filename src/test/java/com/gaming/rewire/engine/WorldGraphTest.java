package com.gaming.rewire.engine;

import com.gaming.rewire.api.Expr;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.node.EdgePair;
import com.gaming.rewire.node.EdgeSource;
import com.gaming.rewire.node.Side;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class WorldGraphTest {

    private WorldGraph graph;

    @Before
    public void setUp() {
        graph = new WorldGraph("test");
        for (String name : List.of("a", "b", "c", "d")) {
            graph.addArea(new Area(name, null, List.of(), false, false, null, null));
        }
    }

    private EdgePair door(String area, String name) {
        return graph.addPairedEdges(new Side(area, name), new EdgeSource(name, name, false));
    }

    private static void assertLinked(Edge exit, Edge entrance) {
        assertSame(entrance, exit.link());
        assertSame(exit, entrance.link());
        assertEquals(entrance.to(), exit.to());
        assertEquals(exit.from(), entrance.from());
    }

    @Test
    public void testConnectCompletesReturnDirection() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");

        graph.connect(a.exit(), b.entrance());

        assertLinked(a.exit(), b.entrance());
        assertLinked(b.exit(), a.entrance());
        assertEquals("a", b.exit().to());
    }

    @Test
    public void testConnectIgnoringPair() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");

        graph.connect(a.exit(), b.entrance(), true);

        assertLinked(a.exit(), b.entrance());
        assertFalse(b.exit().isLinked());
        assertNull(b.exit().to());
    }

    @Test
    public void testSelfLinkedPair() {
        EdgePair a = door("a", "well");
        graph.connect(a.exit(), a.entrance());
        assertLinked(a.exit(), a.entrance());
        assertEquals("a", a.exit().to());
    }

    @Test
    public void testConnectAlreadyLinkedFails() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        EdgePair c = door("c", "c");
        graph.connect(a.exit(), b.entrance());
        try {
            graph.connect(a.exit(), c.entrance());
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().startsWith("Already matched"));
        }
    }

    @Test
    public void testDisconnectRoundTrip() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        graph.connect(a.exit(), b.entrance());

        graph.disconnect(a.exit());

        for (Edge e : List.of(a.exit(), a.entrance(), b.exit(), b.entrance())) {
            assertFalse(e + " still linked", e.isLinked());
        }
        assertNull(a.exit().to());
        assertNull(b.entrance().from());
        assertNull(b.exit().to());
        assertNull(a.entrance().from());
        assertEquals("a", a.exit().from());
        assertEquals("b", b.entrance().to());

        graph.connect(a.exit(), b.entrance());
        assertLinked(b.exit(), a.entrance());
    }

    @Test(expected = IllegalStateException.class)
    public void testDisconnectUnlinkedFails() {
        graph.disconnect(door("a", "x").exit());
    }

    @Test
    public void testSwapConnectedEdgesFourWay() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        EdgePair c = door("c", "cd");
        EdgePair d = door("d", "cd");
        graph.connect(a.exit(), b.entrance());
        graph.connect(c.exit(), d.entrance());

        // a should now lead to d, and c to b
        graph.swapConnectedEdges(a.exit(), d.entrance());

        assertLinked(a.exit(), d.entrance());
        assertLinked(d.exit(), a.entrance());
        assertLinked(c.exit(), b.entrance());
        assertLinked(b.exit(), c.entrance());
    }

    @Test
    public void testSwapOntoSelfLinkedEntrance() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        EdgePair c = door("c", "well");
        graph.connect(a.exit(), b.entrance());
        graph.connect(c.exit(), c.entrance());

        graph.swapConnectedEdges(a.exit(), c.entrance());

        assertLinked(a.exit(), c.entrance());
        assertLinked(c.exit(), a.entrance());
        // b's door is left to loop back on itself
        assertLinked(b.exit(), b.entrance());
    }

    @Test
    public void testSwapUnlinkedFails() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        try {
            graph.swapConnectedEdges(a.exit(), b.entrance());
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("unlinked"));
        }
    }

    @Test
    public void testSwapConnectedAreas() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        EdgePair c = door("c", "cd");
        EdgePair d = door("d", "cd");
        graph.connect(a.exit(), b.entrance());
        graph.connect(c.exit(), d.entrance());

        graph.swapConnectedAreas("b", "d");

        assertEquals("d", a.exit().to());
        assertEquals("b", c.exit().to());
    }

    @Test
    public void testLinkedExpressionCombinesBothSides() {
        Side gated = new Side("a", "gate");
        gated.setExpr(Expr.named("c"));
        Side plain = new Side("b", "gate");
        plain.setExpr(Expr.named("d"));
        Edge exit = graph.addEdge(gated, new EdgeSource("gate", "gate", false), true);
        Edge entrance = graph.addEdge(plain, new EdgeSource("gate", "gate", false), false);

        graph.connect(exit, entrance);

        assertEquals(Expr.and(List.of(Expr.named("c"), Expr.named("d"))), exit.linkedExpr());
        assertSame(exit.linkedExpr(), entrance.linkedExpr());
    }

    @Test
    public void testCombineExprs() {
        Expr x = Expr.named("x");
        Expr y = Expr.named("y");
        assertNull(WorldGraph.combineExprs(null, null));
        assertEquals(x, WorldGraph.combineExprs(x, null));
        assertEquals(y, WorldGraph.combineExprs(null, y));
        assertEquals(x, WorldGraph.combineExprs(Expr.named("x"), x));
        assertEquals("(y AND x)", WorldGraph.combineExprs(x, y).toString());
    }

    @Test
    public void testDuplicateEntrance() {
        EdgePair b = door("b", "ab");
        Edge copy = graph.duplicateEntrance(b.entrance());
        assertNotSame(b.entrance(), copy);
        assertEquals("b", copy.to());
        assertNull(copy.pair());
        assertEquals(2, graph.node("b").from().size());
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicateExitFails() {
        graph.duplicateEntrance(door("b", "ab").exit());
    }

    @Test
    public void testEdgesFromOtherGraphRejected() {
        WorldGraph other = new WorldGraph("other");
        other.addArea(new Area("a", null, List.of(), false, false, null, null));
        Edge foreign = other.addPairedEdges(new Side("a", "x"), null).entrance();
        Edge exit = door("a", "ab").exit();
        try {
            graph.connect(exit, foreign);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("another graph"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownAreaRejected() {
        graph.area("nowhere");
    }

    @Test
    public void testWorldConnections() {
        Side ab = new Side("a", null);
        ab.setWorld(true);
        Side bIn = new Side("b", null);
        Side bc = new Side("b", null);
        Side cIn = new Side("c", null);
        graph.connect(graph.addEdge(ab, null, true), graph.addEdge(bIn, null, false));
        graph.connect(graph.addEdge(bc, null, true), graph.addEdge(cIn, null, false));
        EdgePair named = door("c", "cd");
        graph.connect(named.exit(), door("d", "cd").entrance());

        assertEquals(List.of("a", "b", "c"), List.copyOf(graph.getWorldConnections("a")));
    }

    @Test
    public void testSnapshotRestoresLinksAndFlags() {
        EdgePair a = door("a", "ab");
        EdgePair b = door("b", "ab");
        EdgePair c = door("c", "cd");
        EdgePair d = door("d", "cd");
        graph.connect(a.exit(), b.entrance());
        GraphSnapshot snapshot = graph.snapshot();
        int edges = graph.edges().size();

        graph.connect(c.exit(), d.entrance());
        graph.swapConnectedEdges(a.exit(), d.entrance());
        a.exit().setFixed(true);
        a.exit().side().setCore(false);
        graph.area("a").setCore(true);
        graph.duplicateEntrance(b.entrance());

        graph.restore(snapshot);

        assertEquals(edges, graph.edges().size());
        assertEquals(1, graph.node("b").from().size());
        assertLinked(a.exit(), b.entrance());
        assertLinked(b.exit(), a.entrance());
        assertFalse(c.exit().isLinked());
        assertNull(c.exit().to());
        assertNull(d.entrance().from());
        assertFalse(a.exit().isFixed());
        assertTrue(a.exit().side().isCore());
        assertFalse(graph.area("a").isCore());
    }
}
