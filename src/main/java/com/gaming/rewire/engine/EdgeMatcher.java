package com.gaming.rewire.engine;

import com.gaming.rewire.node.Area;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.util.Shuffles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Randomized initial matching of dangling exits to dangling entrances.
 *
 * Paired and unpaired edges are matched in separate silos, so two-way
 * connections only ever meet two-way connections. Matching a paired exit also
 * consumes the return direction through pair propagation.
 */
public final class EdgeMatcher {
    private static final Logger log = LogManager.getLogger(EdgeMatcher.class);

    static final int LOW_CONNECTION = 3;
    static final int HIGH_CONNECTION = 4;

    private final WorldGraph graph;
    private final Random random;
    private final boolean explain;

    public EdgeMatcher(WorldGraph graph, Random random, boolean explain) {
        this.graph = graph;
        this.random = random;
        this.explain = explain;
    }

    /**
     * Connects every dangling edge. With {@code coreAware}, only core edges are
     * matched here (plus, with {@code isolas}, paired edges between periphery
     * areas); the rest is left for periphery attachment.
     */
    public void matchInitial(CoreClassifier.CoreClassification classification, boolean coreAware, boolean isolas) {
        List<Edge> entrances = new ArrayList<>();
        List<Edge> exits = new ArrayList<>();
        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.from()) {
                if (e.from() == null) {
                    entrances.add(e);
                }
            }
        }
        for (AreaNode node : graph.nodes()) {
            for (Edge e : node.to()) {
                if (e.to() == null) {
                    exits.add(e);
                }
            }
        }
        Shuffles.shuffle(random, entrances);
        Shuffles.shuffle(random, exits);
        if (!coreAware) {
            connectEdges(exits, entrances, null);
            return;
        }

        entrances.sort(Comparator.comparingInt(this::entranceOrder));
        exits.sort(Comparator.comparingInt(this::exitOrder));

        long coreEntrances = entrances.stream().filter(e -> e.side().isCore() && e.pair() == null).count();
        long coreExits = exits.stream().filter(e -> e.side().isCore() && e.pair() == null).count();
        if (coreEntrances < coreExits) {
            throw new IllegalStateException("Unexpected routing issue, insufficient " + coreEntrances
                    + " warp destinations for " + coreExits + " origins");
        }
        while (coreEntrances > coreExits) {
            Edge demote = findDuplicateCoreEntrance(entrances);
            if (demote == null) {
                throw new IllegalStateException("Routing issue trying to add connections: no destination with "
                        + "several core entrances can be made optional");
            }
            demote.side().setCore(false);
            entrances.remove(demote);
            coreEntrances--;
        }

        Edge startExit = exits.stream().filter(e -> e.side().hasTag("start")).findFirst().orElse(null);
        Edge startEntrance = entrances.stream()
                .filter(e -> e.side().isCore() && !e.side().hasTag("start") && !e.side().hasTag("avoidstart"))
                .findFirst().orElse(null);
        if (startExit != null && startEntrance != null) {
            exits.remove(startExit);
            exits.add(0, startExit);
            entrances.remove(startEntrance);
            entrances.add(0, startEntrance);
        }

        connectEdges(
                exits.stream().filter(e -> e.side().isCore()).collect(Collectors.toList()),
                entrances.stream().filter(e -> e.side().isCore()).collect(Collectors.toList()),
                "main");

        if (isolas) {
            List<Edge> peripheryExits = exits.stream()
                    .filter(e -> e.to() == null && e.pair() != null && !classification.isCore(e.from()))
                    .collect(Collectors.toList());
            List<Edge> peripheryEntrances = entrances.stream()
                    .filter(e -> e.from() == null && e.pair() != null && !classification.isCore(e.to()))
                    .collect(Collectors.toList());
            connectEdges(peripheryExits, peripheryEntrances, "periphery");
        }
    }

    /** Highlighted destinations last, poorly connected ones first. */
    private int entranceOrder(Edge e) {
        Area area = graph.area(e.to());
        if (area.hasTag("highlight")) {
            return 2;
        }
        AreaNode node = graph.node(e.to());
        boolean low = node.from().size() <= LOW_CONNECTION && node.to().size() < HIGH_CONNECTION;
        return low ? 0 : 1;
    }

    /** Unconditional exits out of well connected areas first. */
    private int exitOrder(Edge e) {
        boolean high = graph.node(e.from()).to().size() >= HIGH_CONNECTION;
        return high && CoreClassifier.isSimpleExit(e) ? 0 : 1;
    }

    /** First unpaired core entrance into an area that has more than one core entrance. */
    private static Edge findDuplicateCoreEntrance(List<Edge> entrances) {
        Map<String, List<Edge>> byArea = new LinkedHashMap<>();
        for (Edge e : entrances) {
            if (e.side().isCore()) {
                byArea.computeIfAbsent(e.to(), k -> new ArrayList<>()).add(e);
            }
        }
        for (List<Edge> group : byArea.values()) {
            if (group.size() <= 1) {
                continue;
            }
            for (Edge e : group) {
                if (e.pair() == null) {
                    return e;
                }
            }
        }
        return null;
    }

    /**
     * Matches {@code exits} against {@code entrances}, paired silo first. Each
     * exit takes the first remaining entrance of its silo, avoiding
     * overworld-to-overworld links while an alternative exists. A paired exit
     * whose only remaining option is its own pair links back to itself.
     */
    public void connectEdges(List<Edge> exits, List<Edge> entrances, String desc) {
        String label = desc == null ? "" : desc + " ";
        for (int silo = 0; silo <= 1; silo++) {
            boolean paired = silo == 0;
            List<Edge> tos = exits.stream().filter(e -> (e.pair() != null) == paired).collect(Collectors.toList());
            List<Edge> froms = entrances.stream().filter(e -> (e.pair() != null) == paired)
                    .collect(Collectors.toList());
            if (tos.isEmpty() && froms.isEmpty()) {
                continue;
            }
            log.info("Connecting {} {}edges: {} outgoing, {} incoming", paired ? "paired" : "unpaired", label,
                    tos.size(), froms.size());
            while (!tos.isEmpty()) {
                Edge exit = tos.remove(0);
                if (exit.to() != null) {
                    throw new IllegalStateException("Connected edge still left: " + exit);
                }
                froms.remove(exit.pair());
                boolean overworld = isOverworldish(exit.from());
                Edge entrance;
                if (froms.isEmpty()) {
                    if (exit.pair() == null) {
                        throw new IllegalStateException("Ran out of eligible edges for " + exit);
                    }
                    entrance = exit.pair();
                } else {
                    int chosen = -1;
                    for (int i = 0; i < froms.size(); i++) {
                        Edge candidate = froms.get(i);
                        if (candidate.from() != null) {
                            throw new IllegalStateException("Connected edge still left: " + candidate);
                        }
                        if (candidate == exit.pair() || (exit.pair() == null) != (candidate.pair() == null)) {
                            continue;
                        }
                        if (!(overworld && isOverworldish(candidate.to()))) {
                            chosen = i;
                            break;
                        }
                        if (chosen == -1) {
                            chosen = i;
                        }
                    }
                    if (chosen == -1) {
                        tos.add(0, exit);
                        break;
                    }
                    entrance = froms.remove(chosen);
                    tos.remove(entrance.pair());
                }
                if (exit.isFixed() || entrance.isFixed()) {
                    throw new IllegalStateException("Internal error: found fixed edges in randomization " + exit
                            + " and " + entrance);
                }
                if (explain) {
                    log.debug("{} -> {} [{}, {}]", exit, entrance, tos.size(), froms.size());
                }
                graph.connect(exit, entrance);
            }
            if (!tos.isEmpty() || !froms.isEmpty()) {
                throw new IllegalStateException("Internal error: unconnected edges after randomization:\nFrom edges: "
                        + tos + "\nTo edges: " + froms);
            }
        }
    }

    private boolean isOverworldish(String area) {
        Area a = graph.area(area);
        return a.hasTag("overworld") || a.hasTag("overworld_adjacent");
    }
}
