package com.gaming.rewire.io;

import com.gaming.rewire.api.Expr;
import com.gaming.rewire.engine.WorldGraph;
import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.Connection;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.node.EdgePair;
import com.gaming.rewire.node.EdgeSource;
import com.gaming.rewire.node.Side;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a {@link WorldDefinition} into a {@link WorldGraph} ready to be
 * connected.
 *
 * <p>
 * World connections are linked immediately. Entrances and warps become
 * unlinked edges remembering their vanilla partner as fixed link, except
 * fixed ones, which are linked right away. Every name referenced by a
 * condition must be an area, an item or a config variable.
 */
public final class WorldCompiler {
    private static final Logger log = LogManager.getLogger(WorldCompiler.class);

    private static final Set<String> FIXED_TAGS = Set.of("norandom", "door", "trivial");

    private WorldGraph graph;
    private WorldDefinition def;
    private final Set<String> known = new HashSet<>();

    /**
     * @throws IllegalArgumentException for any inconsistency in the catalog.
     */
    public WorldGraph compile(WorldDefinition def) {
        this.def = def;
        this.graph = new WorldGraph(def.getName() == null ? "world" : def.getName());
        known.clear();

        addAreas();
        addItemsAndConfig();
        addWorldConnections();
        Set<String> ids = new HashSet<>();
        addWarps(ids);
        addEntrances(ids);
        if (def.getStart() != null) {
            graph.setStart(def.getStart());
        }
        log.info("Compiled {}: {} areas, {} edges", graph.name(), graph.areas().size(), graph.edges().size());
        return graph;
    }

    private void addAreas() {
        for (WorldDefinition.AreaDef a : def.getAreas()) {
            if (a.getName() == null) {
                throw new IllegalArgumentException("Area without name in " + graph.name());
            }
            List<String> tags = new ArrayList<>(a.getTags());
            if (a.isExcluded() && !tags.contains("optional")) {
                tags.add("optional");
            }
            Area area = graph.addArea(new Area(a.getName(), a.getText(), tags, a.isBoss(), a.isRequired(),
                    a.getOpenArea(), a.getCost()));
            area.setExcluded(a.isExcluded());
            known.add(a.getName());
        }
        for (WorldDefinition.AreaDef a : def.getAreas()) {
            if (a.getOpenArea() != null) {
                requireArea(a.getOpenArea(), "open area of " + a.getName());
            }
        }
    }

    private void addItemsAndConfig() {
        for (WorldDefinition.ItemDef item : def.getItems()) {
            for (String location : item.getAreas()) {
                requireArea(location, "location of item " + item.getName());
            }
            graph.addItem(item.getName(), item.getAreas());
            known.add(item.getName());
        }
        known.addAll(def.getConfig().keySet());
        for (Map.Entry<String, String> entry : def.getConfig().entrySet()) {
            Expr expr = cond(entry.getValue(), "config " + entry.getKey());
            graph.setConfigExpr(entry.getKey(), expr == null ? Expr.TRUE : expr);
        }
    }

    private void addWorldConnections() {
        for (WorldDefinition.AreaDef a : def.getAreas()) {
            for (WorldDefinition.ConnectionDef c : a.getTo()) {
                requireArea(c.getArea(), "world connection from " + a.getName());
                Expr expr = cond(c.getCond(), "world connection " + a.getName() + " -> " + c.getArea());
                Side exitSide = worldSide(a.getName(), c.getText(), c.getTags());
                Side entranceSide = worldSide(c.getArea(), c.getText(), c.getTags());
                if (c.getTags().contains("shortcut")) {
                    // Only opens from the far side
                    Expr opened = Expr.named(a.getName());
                    if (expr != null) {
                        opened = Expr.and(List.of(opened, expr)).simplify();
                    }
                    entranceSide.setExpr(opened);
                    Edge exit = graph.addPairedEdges(exitSide, null).exit();
                    Edge entrance = graph.addPairedEdges(entranceSide, null).entrance();
                    graph.connect(exit, entrance);
                } else {
                    exitSide.setExpr(expr);
                    graph.connect(graph.addEdge(exitSide, null, true), graph.addEdge(entranceSide, null, false));
                }
            }
        }
    }

    private Side worldSide(String area, String text, List<String> tags) {
        Side side = new Side(area, text, tags);
        side.setWorld(true);
        side.setCore(false);
        side.setExcluded(graph.area(area).isExcluded());
        return side;
    }

    private void addWarps(Set<String> ids) {
        Map<Connection, List<EdgePair>> bidirectional = new LinkedHashMap<>();
        for (WorldDefinition.EntranceDef w : def.getWarps()) {
            checkId(w, ids);
            if (w.getTags().contains("unused")) {
                continue;
            }
            WorldDefinition.SideDef bDef = w.getSideB();
            if (bDef == null && w.getTags().contains("selfwarp")) {
                bDef = w.getSideA();
            }
            if (w.getSideA() == null || bDef == null) {
                throw new IllegalArgumentException("Warp " + w.getName() + " needs both sides");
            }
            EdgeSource source = source(w);
            Edge exit = graph.addEdge(side(w, w.getSideA()), source, true);
            Edge entrance = graph.addEdge(side(w, bDef), source, false);
            exit.setFixedLink(entrance);
            entrance.setFixedLink(exit);
            if (source.fixed()) {
                graph.connect(exit, entrance);
            } else if (w.getTags().contains("selfwarp")) {
                exit.setPair(entrance);
                entrance.setPair(exit);
            } else if (!w.getTags().contains("unique")) {
                Connection key = w.getPairWith() == null
                        ? Connection.of(w.getSideA().getArea(), bDef.getArea())
                        : Connection.of(w.getName(), w.getPairWith());
                bidirectional.computeIfAbsent(key, k -> new ArrayList<>()).add(new EdgePair(exit, entrance));
            }
        }
        for (Map.Entry<Connection, List<EdgePair>> entry : bidirectional.entrySet()) {
            List<EdgePair> group = entry.getValue();
            if (group.size() != 2) {
                throw new IllegalArgumentException("Bidirectional warp expected for " + entry.getKey()
                        + " - non-bidirectional should be marked unique");
            }
            EdgePair first = group.get(0);
            EdgePair second = group.get(1);
            if (!first.exit().from().equals(second.entrance().to())
                    || !second.exit().from().equals(first.entrance().to())) {
                throw new IllegalArgumentException("Warps " + first.exit() + " and " + second.exit()
                        + " are not opposite directions of " + entry.getKey());
            }
            first.exit().setPair(second.entrance());
            second.entrance().setPair(first.exit());
            second.exit().setPair(first.entrance());
            first.entrance().setPair(second.exit());
        }
    }

    private void addEntrances(Set<String> ids) {
        Set<Connection> doors = new HashSet<>();
        for (WorldDefinition.EntranceDef e : def.getEntrances()) {
            checkId(e, ids);
            if (e.getTags().contains("unused")) {
                continue;
            }
            List<WorldDefinition.SideDef> sides = new ArrayList<>();
            for (WorldDefinition.SideDef s : new WorldDefinition.SideDef[] { e.getSideA(), e.getSideB() }) {
                if (s != null && !s.getTags().contains("unused")) {
                    sides.add(s);
                }
            }
            boolean door = e.getTags().contains("door");
            EdgeSource source = source(e);
            if (sides.isEmpty()) {
                throw new IllegalArgumentException("Entrance " + e.getName() + " has no sides");
            }
            if (sides.size() == 1) {
                if (door) {
                    throw new IllegalArgumentException(e.getName() + " has one-sided door");
                }
                graph.addPairedEdges(side(e, sides.get(0)), source);
                continue;
            }
            Side a = side(e, sides.get(0));
            Side b = side(e, sides.get(1));
            if (door) {
                if (!doors.add(Connection.of(a.getArea(), b.getArea()))) {
                    continue;
                }
                Expr doorCond = cond(e.getDoorCond(), "door " + e.getName());
                if (a.getExpr() != null || b.getExpr() != null) {
                    throw new IllegalArgumentException("Door cond " + doorCond + " and cond " + a.getExpr() + " "
                            + b.getExpr() + " together for " + e.getName());
                }
                a.setWorld(true);
                b.setWorld(true);
                a.setCore(false);
                b.setCore(false);
                a.setExpr(doorSideExpr(a, doorCond, b.getArea()));
                b.setExpr(doorSideExpr(b, doorCond, a.getArea()));
                Edge exit = graph.addPairedEdges(a, source).exit();
                Edge entrance = graph.addPairedEdges(b, source).entrance();
                graph.connect(exit, entrance);
                continue;
            }
            EdgePair bEdges = graph.addPairedEdges(b, source);
            EdgePair aEdges = graph.addPairedEdges(a, source);
            bEdges.exit().setFixedLink(aEdges.entrance());
            aEdges.entrance().setFixedLink(bEdges.exit());
            bEdges.entrance().setFixedLink(aEdges.exit());
            aEdges.exit().setFixedLink(bEdges.entrance());
            if (source.fixed()) {
                graph.connect(bEdges.exit(), aEdges.entrance());
            }
        }
    }

    /** A door side tagged {@code dnofts} can only be opened from the other side. */
    private static Expr doorSideExpr(Side side, Expr doorCond, String otherArea) {
        if (!side.hasTag("dnofts")) {
            return doorCond;
        }
        Expr other = Expr.named(otherArea);
        return doorCond == null ? other : Expr.and(List.of(doorCond, other)).simplify();
    }

    private Side side(WorldDefinition.EntranceDef e, WorldDefinition.SideDef s) {
        requireArea(s.getArea(), "side of " + e.getName());
        Side side = new Side(s.getArea(), s.getText(), s.getTags());
        side.setExpr(cond(s.getCond(), "side of " + e.getName() + " in " + s.getArea()));
        side.setCore(!e.getTags().contains("optional") && !s.getTags().contains("optional"));
        side.setExcluded(graph.area(s.getArea()).isExcluded());
        return side;
    }

    private static EdgeSource source(WorldDefinition.EntranceDef e) {
        boolean fixed = e.isFixed() || e.getTags().stream().anyMatch(FIXED_TAGS::contains);
        return new EdgeSource(e.getName(), e.getText() == null ? e.getName() : e.getText(), fixed);
    }

    private void checkId(WorldDefinition.EntranceDef e, Set<String> ids) {
        if (e.getName() == null) {
            throw new IllegalArgumentException("Entrance without name in " + graph.name());
        }
        if (!ids.add(e.getName())) {
            throw new IllegalArgumentException("Duplicate entrance " + e.getName());
        }
    }

    private void requireArea(String area, String context) {
        if (area == null || !graph.hasArea(area)) {
            throw new IllegalArgumentException("Unknown area " + area + " in " + context);
        }
    }

    private Expr cond(String text, String context) {
        Expr expr = ExprParser.parse(text);
        if (expr == null) {
            return null;
        }
        for (String var : expr.freeVars()) {
            if (!known.contains(var)) {
                throw new IllegalArgumentException("Unknown variable " + var + " in condition of " + context);
            }
        }
        return expr;
    }
}
