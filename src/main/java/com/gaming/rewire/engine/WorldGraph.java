package com.gaming.rewire.engine;

import com.gaming.rewire.api.EdgeType;
import com.gaming.rewire.api.Expr;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.node.EdgeArena;
import com.gaming.rewire.node.EdgePair;
import com.gaming.rewire.node.EdgeSource;
import com.gaming.rewire.node.Side;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The traversal graph of a world: areas, their edge buckets and the arena
 * owning every edge, plus the key item locations and config expressions the
 * gating logic refers to.
 *
 * This class holds the mutation primitives of randomization. Every primitive
 * keeps the graph consistent:
 * 1. Pair and Link partners always have opposite types.
 * 2. Links are symmetric.
 * 3. An edge's own endpoint never changes; the opposite endpoint and the
 * linked expression are only set while linked.
 *
 * Not thread-safe. A graph is built once and then mutated by a single
 * connect run at a time.
 */
public final class WorldGraph {
    private static final Logger log = LogManager.getLogger(WorldGraph.class);

    private final String name;
    private final Map<String, Area> areas = new LinkedHashMap<>();
    private final Map<String, AreaNode> nodes = new LinkedHashMap<>();
    private final EdgeArena arena = new EdgeArena();
    private final Map<String, List<String>> itemAreas = new LinkedHashMap<>();
    private final Map<String, Expr> configExprs = new LinkedHashMap<>();
    private final Map<Expr, Expr> resolved = new HashMap<>();
    private String start;

    public WorldGraph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    // ── Areas, items, config ─────────────────────────────────────

    public Area addArea(Area area) {
        if (areas.containsKey(area.name())) {
            throw new IllegalArgumentException("Duplicate area " + area.name());
        }
        areas.put(area.name(), area);
        nodes.put(area.name(), new AreaNode(area.name(), area.cost()));
        return area;
    }

    public boolean hasArea(String area) {
        return areas.containsKey(area);
    }

    /**
     * @return the area, never null.
     * @throws IllegalArgumentException for an unknown name.
     */
    public Area area(String area) {
        Area a = areas.get(area);
        if (a == null) {
            throw new IllegalArgumentException("Unknown area: " + area);
        }
        return a;
    }

    /**
     * @return the area's edge bucket, never null.
     * @throws IllegalArgumentException for an unknown name.
     */
    public AreaNode node(String area) {
        AreaNode node = nodes.get(area);
        if (node == null) {
            throw new IllegalArgumentException("Unknown area: " + area);
        }
        return node;
    }

    public Collection<Area> areas() {
        return Collections.unmodifiableCollection(areas.values());
    }

    public Collection<AreaNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public EdgeArena arena() {
        return arena;
    }

    public List<Edge> edges() {
        return arena.edges();
    }

    public void addItem(String item, List<String> locations) {
        if (itemAreas.containsKey(item)) {
            throw new IllegalArgumentException("Duplicate item " + item);
        }
        for (String location : locations) {
            area(location);
        }
        itemAreas.put(item, List.copyOf(locations));
        resolved.clear();
    }

    public Map<String, List<String>> itemAreas() {
        return Collections.unmodifiableMap(itemAreas);
    }

    public boolean isItem(String name) {
        return itemAreas.containsKey(name);
    }

    public void setConfigExpr(String name, Expr expr) {
        configExprs.put(name, expr);
        resolved.clear();
    }

    public Map<String, Expr> configExprs() {
        return Collections.unmodifiableMap(configExprs);
    }

    /**
     * Substitutes config expressions into {@code expr} and simplifies the
     * result. Results are cached until the config changes.
     */
    public Expr resolve(Expr expr) {
        if (expr == null) {
            return null;
        }
        return resolved.computeIfAbsent(expr, e -> e.substitute(configExprs).simplify());
    }

    public String start() {
        return start;
    }

    public void setStart(String start) {
        area(start);
        this.start = start;
    }

    // ── Edge construction ────────────────────────────────────────

    /**
     * Creates one edge for {@code side} and appends it to the outgoing or
     * incoming list of the side's area.
     *
     * @param side   The side descriptor (area, condition, tags).
     * @param source The originating connection, or null for a world edge.
     * @param isExit Whether to create the EXIT or the ENTRANCE half.
     */
    public Edge addEdge(Side side, EdgeSource source, boolean isExit) {
        String text;
        if (side.getText() != null && !side.getText().isEmpty()) {
            text = side.getText();
        } else if (source != null) {
            text = source.text();
        } else {
            text = side.hasTag("hard") ? "hard skip" : "in map";
        }
        boolean fixed = source == null || source.fixed();
        String edgeName = source == null ? null : source.name();
        AreaNode node = node(side.getArea());
        Edge edge = arena.create(isExit ? EdgeType.EXIT : EdgeType.ENTRANCE, side, edgeName, text, fixed);
        if (isExit) {
            node.to().add(edge);
        } else {
            node.from().add(edge);
        }
        return edge;
    }

    /** Creates both halves of {@code side} and makes them mutual pairs. */
    public EdgePair addPairedEdges(Side side, EdgeSource source) {
        Edge exit = addEdge(side, source, true);
        Edge entrance = addEdge(side, source, false);
        exit.setPair(entrance);
        entrance.setPair(exit);
        return new EdgePair(exit, entrance);
    }

    /**
     * Adds one more unlinked entrance into the same area as {@code entrance},
     * so a second origin can lead there.
     */
    public Edge duplicateEntrance(Edge entrance) {
        if (entrance.type() != EdgeType.ENTRANCE) {
            throw new IllegalStateException("Invalid " + entrance);
        }
        Edge copy = arena.create(EdgeType.ENTRANCE, entrance.side(), entrance.name(), entrance.text(),
                entrance.isFixed());
        node(entrance.to()).from().add(copy);
        return copy;
    }

    // ── Mutation primitives ──────────────────────────────────────

    public void connect(Edge exit, Edge entrance) {
        connect(exit, entrance, false);
    }

    /**
     * Links {@code exit} to {@code entrance}. Unless {@code ignorePair}, the
     * return direction is completed too: each pair partner receives the
     * opposite endpoint, and when both partners exist they are linked to each
     * other.
     */
    public void connect(Edge exit, Edge entrance, boolean ignorePair) {
        if (exit.to() != null || entrance.from() != null || exit.isLinked() || entrance.isLinked()) {
            throw new IllegalStateException("Already matched: " + exit + " (needs no To) --> " + entrance
                    + " (needs no From) with links " + exit.link() + ", " + entrance.link());
        }
        exit.setTo(entrance.to());
        entrance.setFrom(exit.from());
        entrance.setLink(exit);
        exit.setLink(entrance);
        Expr linked = combineExprs(entrance.expr(), exit.expr());
        exit.setLinkedExpr(linked);
        entrance.setLinkedExpr(linked);
        if (exit == entrance.pair() || ignorePair) {
            return;
        }
        Edge exitPair = exit.pair();
        Edge entrancePair = entrance.pair();
        if (exitPair != null) {
            exitPair.setFrom(exit.to());
        }
        if (entrancePair != null) {
            entrancePair.setTo(entrance.from());
        }
        if (exitPair != null && entrancePair != null) {
            exitPair.setLink(entrancePair);
            entrancePair.setLink(exitPair);
            Expr pairLinked = combineExprs(exitPair.expr(), entrancePair.expr());
            exitPair.setLinkedExpr(pairLinked);
            entrancePair.setLinkedExpr(pairLinked);
        }
    }

    /**
     * Both conditions must hold to cross a link. A missing side passes the
     * other through, and textually equal conditions are not doubled up.
     */
    static Expr combineExprs(Expr entranceExpr, Expr exitExpr) {
        if (entranceExpr == null) {
            return exitExpr;
        }
        if (exitExpr == null) {
            return entranceExpr;
        }
        if (exitExpr.toString().equals(entranceExpr.toString())) {
            return exitExpr;
        }
        return Expr.and(List.of(exitExpr, entranceExpr)).simplify();
    }

    public void disconnect(Edge exit) {
        disconnect(exit, false);
    }

    /**
     * Clears the link of {@code exit} (either type works) and, unless
     * {@code ignorePair}, the mirrored link between the two pair partners.
     */
    public void disconnect(Edge exit, boolean ignorePair) {
        Edge link = exit.link();
        if (link == null) {
            throw new IllegalStateException("Can't disconnect " + exit + (ignorePair ? " as pair" : ""));
        }
        exit.setLink(null);
        link.setLink(null);
        if (exit.isExit()) {
            exit.setTo(null);
            link.setFrom(null);
        } else {
            exit.setFrom(null);
            link.setTo(null);
        }
        exit.setLinkedExpr(null);
        link.setLinkedExpr(null);
        Edge exitPair = exit.pair();
        Edge linkPair = link.pair();
        if (ignorePair) {
            return;
        }
        if (exitPair != null && linkPair != null && exitPair != link && linkPair.isLinked()) {
            disconnect(linkPair, true);
            return;
        }
        if (exitPair != null && exitPair != link) {
            clearDangling(exitPair);
        }
        if (linkPair != null && linkPair != exit) {
            clearDangling(linkPair);
        }
    }

    /** Clears the propagated endpoint of an unlinked pair partner. */
    private static void clearDangling(Edge edge) {
        if (edge.isLinked()) {
            return;
        }
        if (edge.isExit()) {
            edge.setTo(null);
        } else {
            edge.setFrom(null);
        }
    }

    /**
     * Reroutes {@code oldExitEdge} to {@code newEntranceEdge}. Whatever each of
     * them was linked to is reconnected to the other's former partner; when one
     * of them was linked to its own pair, a pair partner is self-linked instead
     * so no edge is left half-linked.
     *
     * @throws UnsolvableSeedException when no pair partner exists to self-link.
     */
    public void swapConnectedEdges(Edge oldExitEdge, Edge newEntranceEdge) {
        Edge link = newEntranceEdge.link();
        Edge link2 = oldExitEdge.link();
        if (link == null || link2 == null) {
            throw new IllegalStateException("Cannot swap unlinked edges " + oldExitEdge + " and " + newEntranceEdge);
        }
        disconnect(link);
        disconnect(oldExitEdge);
        if (newEntranceEdge == link.pair() && link2 == oldExitEdge.pair()) {
            connect(oldExitEdge, newEntranceEdge);
        } else if (newEntranceEdge == link.pair()) {
            if (link2.pair() != null) {
                connect(link2.pair(), link2);
                connect(oldExitEdge, newEntranceEdge);
                return;
            }
            if (oldExitEdge.pair() == null) {
                throw new UnsolvableSeedException("Bad seed: Can't find edge to self-link to reach " + newEntranceEdge);
            }
            connect(oldExitEdge, oldExitEdge.pair());
            connect(link, link2);
        } else if (link2 == oldExitEdge.pair()) {
            if (newEntranceEdge.pair() != null) {
                connect(newEntranceEdge.pair(), newEntranceEdge);
                connect(link, link2);
                return;
            }
            if (link.pair() == null) {
                throw new UnsolvableSeedException("Bad seed: Can't find edge to self-link to reach " + newEntranceEdge);
            }
            connect(link, link.pair());
            connect(oldExitEdge, newEntranceEdge);
        } else {
            connect(oldExitEdge, newEntranceEdge);
            connect(link, link2);
        }
    }

    /**
     * Exchanges the randomizable incoming connections of two areas, unpaired
     * entrances first, then paired ones. The second area's list is walked in
     * reverse so repeated swaps do not cancel out.
     */
    public void swapConnectedAreas(String name1, String name2) {
        AreaNode node1 = node(name1);
        AreaNode node2 = node(name2);
        for (int i = 0; i <= 1; i++) {
            boolean unpaired = i == 0;
            List<Edge> list1 = new ArrayList<>();
            for (Edge e : node1.from()) {
                if (!e.isFixed() && (e.pair() == null) == unpaired) {
                    list1.add(e);
                }
            }
            List<Edge> list2 = new ArrayList<>();
            for (Edge e : node2.from()) {
                if (!e.isFixed() && (e.pair() == null) == unpaired) {
                    list2.add(e);
                }
            }
            Collections.reverse(list2);
            for (int j = 0; j < Math.min(list1.size(), list2.size()); j++) {
                swapConnectedEdges(list1.get(j).link(), list2.get(j));
            }
        }
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * Makes sure an area holding a key item can be routed to: if none of the
     * non-world entrances into it (or into the areas leading to it through
     * world connections) is core, one is promoted.
     *
     * @return true if an entrance was (or, with {@code dryRun}, would be) promoted.
     */
    public boolean makeCore(String area, boolean dryRun) {
        Set<String> inward = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(area);
        while (!work.isEmpty()) {
            String a = work.pop();
            if (!inward.add(a)) {
                continue;
            }
            for (Edge e : node(a).from()) {
                if (e.isWorld() && e.from() != null) {
                    work.push(e.from());
                }
            }
        }
        List<Edge> candidates = new ArrayList<>();
        for (String a : inward) {
            for (Edge e : node(a).from()) {
                if (!e.isWorld()) {
                    candidates.add(e);
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException(
                    "Bad item placements. Can't make required area accessible in routing (" + String.join(", ", inward) + ")");
        }
        for (Edge e : candidates) {
            if (e.side().isCore()) {
                return false;
            }
        }
        Edge select = candidates.get(0);
        for (Edge e : candidates) {
            if (e.pair() != null) {
                select = e;
                break;
            }
        }
        if (dryRun) {
            log.info("Found key item in unselected area {}", area(area).text());
            return true;
        }
        log.info("Found key item in unselected area {}, so routing in an entrance ({})", area(area).text(),
                select.side().getText());
        select.side().setCore(true);
        return true;
    }

    /** Areas reachable from {@code from} through world (unnamed) exits alone. */
    public Set<String> getWorldConnections(String from) {
        Set<String> ret = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(from);
        while (!work.isEmpty()) {
            String a = work.pop();
            if (!ret.add(a)) {
                continue;
            }
            for (Edge e : node(a).to()) {
                if (e.name() == null && e.to() != null) {
                    work.push(e.to());
                }
            }
        }
        return ret;
    }

    /** Mandatory boss that anchors the difficulty curve. */
    public boolean isMajorScalingBoss(Area area) {
        return area.isBoss() && area.isCore() && !area.isExcluded()
                && !area.hasTag("final") && !area.hasTag("optional")
                && !area.hasTag("minidungeon") && !area.hasTag("minor");
    }

    // ── Snapshots ────────────────────────────────────────────────

    /** Captures the current link state so it can be restored later. */
    public GraphSnapshot snapshot() {
        return GraphSnapshot.capture(this);
    }

    /**
     * Rolls links, fixed flags and core flags back to {@code snapshot} and
     * drops edges created since (duplicated entrances).
     */
    public void restore(GraphSnapshot snapshot) {
        snapshot.restoreInto(this);
    }

    @Override
    public String toString() {
        return "WorldGraph[" + name + ", areas=" + areas.size() + ", edges=" + arena.size() + "]";
    }
}
