package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.util.Shuffles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Attaches optional territory to the routed core.
 *
 * Free two-way exits of the core are first matched at random into optional
 * areas. Optional areas reachable from core through chains of two-way or world
 * connections are then grouped into cliques: optional regions that lead back
 * into core in more than one place. Each clique is cut loose and re-attached
 * as a whole to a single core component, so entering optional territory from
 * one part of the core does not silently bridge to a distant part.
 */
public final class PeripheryAttacher {
    private static final Logger log = LogManager.getLogger(PeripheryAttacher.class);

    private final WorldGraph graph;
    private final CoreClassifier.CoreClassification classification;
    private final ComponentAnalyzer components;
    private final EdgeMatcher matcher;
    private final Random random;
    private final boolean explain;

    private final Set<String> expandedCore;
    private final Set<String> pairedPeriphery;
    private final Set<Edge> nonEntrancePseudoCore = new LinkedHashSet<>();
    private final Set<Edge> peripheryExits = new LinkedHashSet<>();
    private final List<Edge> outboundDetached = new ArrayList<>();
    private final List<Edge> inboundDetached = new ArrayList<>();
    private final Set<Edge> connectedToClique = new HashSet<>();

    public PeripheryAttacher(WorldGraph graph, CoreClassifier.CoreClassification classification,
            ComponentAnalyzer components, EdgeMatcher matcher, Random random, boolean explain) {
        this.graph = graph;
        this.classification = classification;
        this.components = components;
        this.matcher = matcher;
        this.random = random;
        this.explain = explain;
        this.expandedCore = classification.expandedCore();
        this.pairedPeriphery = new LinkedHashSet<>(classification.coreAreas());
    }

    /**
     * Runs the attachment.
     *
     * @param repair paired-only repair pass, given a phase name and the areas
     *               that must be reached; returns its final check.
     * @return the check after the final repair pass.
     */
    public CheckRecord attach(BiFunction<String, Set<String>, CheckRecord> repair) {
        SortedMap<String, List<Edge>> componentExits = connectBoundary();
        repair.apply("periphery-initial", pairedPeriphery);

        List<List<Edge>> cliques = detachCliques();
        attachCliques(cliques, componentExits);

        if (outboundDetached.size() != inboundDetached.size()) {
            throw new IllegalStateException("Internal error: mismatched clique edge counts, outbound "
                    + outboundDetached.size() + " -> inbound " + inboundDetached.size());
        }
        for (int i = 0; i < outboundDetached.size(); i++) {
            graph.connect(outboundDetached.get(i), inboundDetached.get(i));
        }
        return repair.apply("periphery-fixup", pairedPeriphery);
    }

    /** Areas whose paired edges the periphery repair passes must route. */
    public Set<String> pairedPeriphery() {
        return pairedPeriphery;
    }

    /**
     * Matches the dangling paired exits of expanded core into dangling paired
     * entrances of optional areas, then pairs up the optional leftovers.
     *
     * @return the dangling core exits, grouped by component root.
     */
    private SortedMap<String, List<Edge>> connectBoundary() {
        List<Edge> coreExits = new ArrayList<>();
        List<Edge> entrances = new ArrayList<>();
        List<Edge> lateEntrances = new ArrayList<>();
        SortedMap<String, List<Edge>> componentExits = new TreeMap<>();
        for (AreaNode node : graph.nodes()) {
            String area = node.area();
            if (graph.area(area).isExcluded()) {
                continue;
            }
            if (expandedCore.contains(area)) {
                List<Edge> exits = node.to().stream().filter(e -> e.pair() != null && e.to() == null)
                        .collect(Collectors.toList());
                coreExits.addAll(exits);
                String root = components.rootOf(area);
                if (root == null) {
                    throw new IllegalStateException("Internal error: no component for core area " + area);
                }
                componentExits.computeIfAbsent(root, k -> new ArrayList<>()).addAll(exits);
                if (!classification.isCore(area) && !exits.isEmpty()) {
                    pairedPeriphery.add(area);
                }
                continue;
            }
            List<Edge> dangling = node.from().stream().filter(e -> e.pair() != null && e.from() == null)
                    .collect(Collectors.toList());
            // Areas entered one way through the world are better attached last
            boolean oneWay = node.from().stream().anyMatch(in -> in.isWorld()
                    && node.to().stream().noneMatch(out -> in.from() != null && in.from().equals(out.to())));
            if (oneWay) {
                lateEntrances.addAll(dangling);
            } else {
                entrances.addAll(dangling);
            }
            if (!dangling.isEmpty()) {
                pairedPeriphery.add(area);
            }
        }
        Shuffles.shuffle(random, entrances);
        entrances.addAll(lateEntrances);
        Shuffles.shuffle(random, coreExits);
        if (coreExits.size() > entrances.size()) {
            throw new IllegalStateException("Internal error: more unattached gates found in required areas ("
                    + coreExits.size() + ") than optional areas (" + entrances.size() + ")");
        }
        int matched = coreExits.size();
        for (int i = 0; i < matched; i++) {
            if (explain) {
                log.debug("Random connect outbound {} -> inbound {}", coreExits.get(i), entrances.get(i));
            }
            graph.connect(coreExits.get(i), entrances.get(i));
        }
        if (entrances.size() > matched) {
            List<Edge> leftover = new ArrayList<>(entrances.subList(matched, entrances.size()));
            List<Edge> leftoverExits = leftover.stream().map(Edge::pair).collect(Collectors.toList());
            Shuffles.shuffle(random, leftover);
            Shuffles.shuffle(random, leftoverExits);
            matcher.connectEdges(leftoverExits, leftover, "non-main");
        }
        return componentExits;
    }

    /**
     * Groups the core entrances reachable from each boundary crossing into
     * cliques and disconnects every clique of more than one edge.
     */
    private List<List<Edge>> detachCliques() {
        Map<Edge, List<Edge>> crossings = new LinkedHashMap<>();
        for (AreaNode node : graph.nodes()) {
            if (!expandedCore.contains(node.area())) {
                continue;
            }
            Set<String> visited = new HashSet<>();
            for (Edge out : node.to()) {
                if (out.to() == null || expandedCore.contains(out.to()) || out.pair() == null) {
                    continue;
                }
                Edge back = out.link().pair();
                if (back == null) {
                    continue;
                }
                List<Edge> coreEdges = new ArrayList<>();
                crossVisit(back, out, visited, coreEdges);
                crossings.put(back, coreEdges);
            }
        }

        Map<Edge, Set<Edge>> edgeEdges = new LinkedHashMap<>();
        for (List<Edge> group : crossings.values()) {
            for (Edge e : group) {
                edgeEdges.computeIfAbsent(e, k -> new LinkedHashSet<>()).addAll(group);
            }
        }

        Set<Edge> globalEdges = new HashSet<>();
        List<List<Edge>> cliques = new ArrayList<>();
        for (Edge key : edgeEdges.keySet()) {
            if (globalEdges.contains(key)) {
                continue;
            }
            List<Edge> clique = collectClique(key, edgeEdges, globalEdges);
            List<Edge> entrances = clique.stream().map(Edge::pair).filter(e -> e != null && !e.isFixed())
                    .collect(Collectors.toList());
            if (entrances.isEmpty() || clique.size() <= 1) {
                continue;
            }
            cliques.add(entrances);
            for (Edge entrance : entrances) {
                Edge coreExit = entrance.link();
                if (coreExit == null) {
                    throw new IllegalStateException("Internal error: clique entrance " + entrance + " is not linked");
                }
                outboundDetached.add(coreExit);
                graph.disconnect(coreExit);
            }
        }
        log.info("Detached {} periphery cliques", cliques.size());
        return cliques;
    }

    /** An optional area being walked by {@link #crossVisit}, with its exit cursor. */
    private static final class CrossFrame {
        private final String area;
        private Edge startEdge;
        private int cursor;

        CrossFrame(String area, Edge startEdge) {
            this.area = area;
            this.startEdge = startEdge;
        }
    }

    /**
     * Follows two-way and world exits out of optional territory until core is
     * re-entered, collecting the re-entering edges. {@code startEdge} is the
     * way back through the crossing itself; it stops being tracked once a
     * conditional hop is taken.
     */
    private void crossVisit(Edge startEdge, Edge edge, Set<String> visited, List<Edge> coreEdges) {
        Deque<CrossFrame> frames = new ArrayDeque<>();
        CrossFrame first = enterCross(startEdge, edge, visited, coreEdges);
        if (first != null) {
            frames.push(first);
        }
        while (!frames.isEmpty()) {
            CrossFrame frame = frames.peek();
            List<Edge> exits = graph.node(frame.area).to();
            CrossFrame child = null;
            while (frame.cursor < exits.size() && child == null) {
                Edge next = exits.get(frame.cursor++);
                if (next.to() == null || (next.pair() == null && !next.isWorld())) {
                    continue;
                }
                if (next.linkedExpr() != null && !next.linkedExpr().toString().equals(frame.area)) {
                    frame.startEdge = null;
                }
                child = enterCross(frame.startEdge, next, visited, coreEdges);
            }
            if (child != null) {
                frames.push(child);
            } else {
                frames.pop();
            }
        }
    }

    /** Records a crossing back into core; returns the frame to walk when {@code edge} leads somewhere new. */
    private CrossFrame enterCross(Edge startEdge, Edge edge, Set<String> visited, List<Edge> coreEdges) {
        String to = edge.to();
        boolean seen = !visited.add(to);
        if (expandedCore.contains(to)) {
            coreEdges.add(edge);
            if (classification.pseudoCore().containsKey(to)) {
                Edge pair = edge.link().pair();
                if (pair == null) {
                    throw new IllegalStateException("No pair for expanded core " + to + " edge " + edge + " -> "
                            + edge.link());
                }
                nonEntrancePseudoCore.add(pair);
            }
            if (startEdge != null && edge != startEdge) {
                peripheryExits.add(edge);
            }
            return null;
        }
        return seen ? null : new CrossFrame(to, startEdge);
    }

    private static List<Edge> collectClique(Edge start, Map<Edge, Set<Edge>> edgeEdges, Set<Edge> globalEdges) {
        List<Edge> clique = new ArrayList<>();
        Deque<Edge> work = new ArrayDeque<>();
        work.push(start);
        while (!work.isEmpty()) {
            Edge e = work.pop();
            if (!globalEdges.add(e)) {
                continue;
            }
            clique.add(e);
            List<Edge> next = new ArrayList<>(edgeEdges.getOrDefault(e, Set.of()));
            for (int i = next.size() - 1; i >= 0; i--) {
                work.push(next.get(i));
            }
        }
        return clique;
    }

    private void attachCliques(List<List<Edge>> cliques, SortedMap<String, List<Edge>> componentExits) {
        List<List<Edge>> groups = componentExits.values().stream().filter(g -> g.size() > 1)
                .collect(Collectors.toList());
        Shuffles.shuffle(random, groups);
        groups.sort(Comparator.comparingInt(g -> g.stream().anyMatch(nonEntrancePseudoCore::contains) ? 0 : 1));

        List<List<Edge>> bySize = new ArrayList<>(cliques);
        bySize.sort(Comparator.comparingInt((List<Edge> c) -> c.size()).reversed());
        for (List<Edge> clique : bySize) {
            if (explain) {
                log.debug("Clique counts: outbound {}, misc inbound {}, clique {}", outboundDetached.size(),
                        inboundDetached.size(), clique.size());
            }
            List<Edge> used = null;
            for (List<Edge> group : groups) {
                List<Edge> candidates = group.stream()
                        .filter(e -> !connectedToClique.contains(e) && !isSelfLinked(e))
                        .collect(Collectors.toList());
                if (candidates.size() >= clique.size()) {
                    connectAllToClique(clique, candidates);
                    used = group;
                    break;
                }
            }
            if (used != null) {
                if (used.stream().noneMatch(nonEntrancePseudoCore::contains) && groups.remove(used)) {
                    groups.add(used);
                }
                continue;
            }
            List<List<String>> areaLists = new ArrayList<>(components.components().values());
            Shuffles.shuffle(random, areaLists);
            Set<String> handleFirst = nonEntrancePseudoCore.stream().map(Edge::from).collect(Collectors.toSet());
            areaLists.sort(Comparator.comparingInt(l -> l.stream().anyMatch(handleFirst::contains) ? 0 : 1));
            for (List<String> areas : areaLists) {
                List<Edge> candidates = new ArrayList<>();
                for (String area : areas) {
                    for (Edge e : graph.node(area).to()) {
                        if (!connectedToClique.contains(e) && e.pair() != null && !e.side().isCore()
                                && !isSelfLinked(e)) {
                            candidates.add(e);
                        }
                    }
                }
                if (candidates.size() >= clique.size()) {
                    connectAllToClique(clique, candidates);
                    used = candidates;
                    break;
                }
            }
            if (used == null) {
                throw new UnsolvableSeedException("Unsolvable seed: no core areas found for periphery clique "
                        + clique.stream().map(Edge::toString).collect(Collectors.joining(" ")));
            }
        }
    }

    private static boolean isSelfLinked(Edge e) {
        return e.pair() != null && e.pair().link() == e;
    }

    private void connectAllToClique(List<Edge> clique, List<Edge> candidates) {
        Shuffles.shuffle(random, candidates);
        Shuffles.shuffle(random, clique);
        if (candidates.stream().anyMatch(nonEntrancePseudoCore::contains)) {
            candidates.sort(Comparator.comparingInt(e -> nonEntrancePseudoCore.contains(e) ? 0 : 1));
            int lastUsed = clique.size() - 1;
            if (nonEntrancePseudoCore.contains(candidates.get(lastUsed))) {
                int plain = indexOfPlain(candidates);
                if (plain >= 0) {
                    Edge tmp = candidates.get(lastUsed);
                    candidates.set(lastUsed, candidates.get(plain));
                    candidates.set(plain, tmp);
                }
            }
            clique.sort(Comparator.comparingInt(e -> peripheryExits.contains(e.pair()) ? 0 : 1));
            // Make sure some unconditional clique entrance is reached from a plain core exit
            List<Integer> unconditional = new ArrayList<>();
            for (int i = 0; i < clique.size(); i++) {
                if (clique.get(i).expr() == null) {
                    unconditional.add(i);
                }
            }
            boolean covered = false;
            for (int i : unconditional) {
                if (!nonEntrancePseudoCore.contains(candidates.get(i))) {
                    covered = true;
                    break;
                }
            }
            if (!covered && !unconditional.isEmpty()) {
                int plain = indexOfPlain(candidates);
                int target = unconditional.get(0);
                if (plain >= 0 && plain < clique.size()) {
                    Edge tmp = clique.get(target);
                    clique.set(target, clique.get(plain));
                    clique.set(plain, tmp);
                }
            }
        }
        for (int i = 0; i < clique.size(); i++) {
            connectToClique(candidates.get(i), clique.get(i));
        }
    }

    private int indexOfPlain(List<Edge> candidates) {
        for (int i = 0; i < candidates.size(); i++) {
            if (!nonEntrancePseudoCore.contains(candidates.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private void connectToClique(Edge coreExit, Edge cliqueEntrance) {
        if (explain) {
            log.debug("core {} ---> clique {}", coreExit, cliqueEntrance);
        }
        Edge link = coreExit.link();
        if (link == null) {
            outboundDetached.remove(coreExit);
        } else {
            if (coreExit == link.pair()) {
                throw new UnsolvableSeedException("Case not handled: chosen core exit " + coreExit
                        + " is a self-exit. Try a different seed.");
            }
            inboundDetached.add(link);
            graph.disconnect(coreExit);
        }
        graph.connect(coreExit, cliqueEntrance);
        connectedToClique.add(coreExit);
        nonEntrancePseudoCore.remove(coreExit);
    }
}
