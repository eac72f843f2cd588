package com.gaming.rewire.engine;

import com.gaming.rewire.api.CheckMode;
import com.gaming.rewire.api.CheckRecord;
import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.api.ReachabilityChecker;
import com.gaming.rewire.node.AreaNode;
import com.gaming.rewire.node.Edge;
import com.gaming.rewire.util.CompositeConnectionListener;
import com.gaming.rewire.util.GraphExplain;
import com.gaming.rewire.util.LoggingConnectionListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Randomizes the connections of a {@link WorldGraph} so that every area is
 * reachable from the start under the gating logic.
 *
 * <p>
 * A run goes through fixed phases:
 * <ol>
 * <li>Classification of mandatory and optional areas, and propagation of the
 * connections that stay vanilla.</li>
 * <li>Initial random matching.</li>
 * <li>"main": repair of the mandatory areas only.</li>
 * <li>"periphery-initial" and "periphery-fixup": attachment of optional
 * territory in cliques.</li>
 * <li>"stable": matching of the leftover one-way warps.</li>
 * <li>"general": repair of everything, with the optional checkpoint
 * placement pass once complete.</li>
 * </ol>
 * Steps 3 to 5 only run in core-aware mode.
 *
 * <p>
 * All randomness comes from one {@link Random} seeded from the options, so the
 * same graph and seed always give the same links. A failed run restores the
 * graph to its state before {@link #connect()}.
 */
public final class GraphConnector {
    private static final Logger log = LogManager.getLogger(GraphConnector.class);

    private final WorldGraph graph;
    private final ConnectorOptions options;
    private final ReachabilityChecker checker;
    private final CompositeConnectionListener listeners = new CompositeConnectionListener();
    private String phase;

    public GraphConnector(WorldGraph graph, ConnectorOptions options) {
        this(graph, options, new GraphChecker());
    }

    public GraphConnector(WorldGraph graph, ConnectorOptions options, ReachabilityChecker checker) {
        this.graph = graph;
        this.options = options;
        this.checker = checker;
        if (options.isExplain()) {
            listeners.addForComposite(new LoggingConnectionListener());
        }
    }

    public GraphConnector addListener(ConnectionListener listener) {
        listeners.addForComposite(listener);
        return this;
    }

    /**
     * Runs all phases.
     *
     * @return the solved result, or an unsolvable one naming the phase that
     *         ran out of options. Configuration errors and internal invariant
     *         violations are thrown instead.
     */
    public ConnectionResult connect() {
        String start = options.getStartArea() != null ? options.getStartArea() : graph.start();
        if (start == null) {
            throw new IllegalArgumentException("No start area configured for " + graph.name());
        }
        graph.area(start);
        GraphSnapshot snapshot = graph.snapshot();
        long seed = options.getSeed();
        try {
            return run(start, seed);
        } catch (UnsolvableSeedException e) {
            graph.restore(snapshot);
            UnsolvableSeed reason = e.reason();
            String message = reason.message();
            String prefix = "Couldn't solve seed " + seed + " - try a different one";
            if (!message.startsWith(prefix)) {
                message = prefix + ": " + message;
            }
            UnsolvableSeed failure = new UnsolvableSeed(seed, phase, reason.unreachedAreas(),
                    reason.missingItems(), message);
            log.warn("Seed {} unsolvable in phase {}: {}", seed, phase, failure.describe());
            if (options.isExplain()) {
                GraphExplain explain = new GraphExplain(graph);
                for (String area : failure.unreachedAreas()) {
                    log.debug("{}", explain.explainArea(area));
                }
            }
            listeners.onUnsolvable(failure);
            return ConnectionResult.unsolvable(failure);
        }
    }

    /**
     * Like {@link #connect()}, but raises an unsolvable result as
     * {@link UnsolvableSeedException}.
     */
    public WorldGraph connectOrThrow() {
        return connect().orElseThrow();
    }

    private ConnectionResult run(String start, long seed) {
        Random random = new Random(seed);
        boolean explain = options.isExplain();

        phase = "classify";
        CoreClassifier classifier = new CoreClassifier(graph);
        CoreClassifier.CoreClassification classification = classifier.classify();
        if (options.isOpenStart()) {
            classifier.tagOpenStart();
        }
        propagateFixedLinks();

        phase = "matching";
        listeners.onPhaseStart(phase);
        EdgeMatcher matcher = new EdgeMatcher(graph, random, explain);
        matcher.matchInitial(classification, options.isCoreAware(), options.isIsolas());
        listeners.onPhaseEnd(phase, 0);

        EdgeRepairer repairer = new EdgeRepairer(graph, random, start, explain);
        RepairLoop loop = new RepairLoop(graph, checker, start, repairer, listeners, seed, options.isUnconnected());
        boolean forward = false;
        if (options.isCoreAware()) {
            phase = "main";
            CheckRecord check = loop.run(phase, options.getCoreRetries(), CheckMode.PARTIAL,
                    classification.coreAreas(), CoreSelection.CORE_ONLY, false, new HashSet<>(), null);

            ComponentAnalyzer components = new ComponentAnalyzer(graph, classification);
            components.analyze(check);
            PeripheryAttacher attacher = new PeripheryAttacher(graph, classification, components, matcher, random,
                    explain);
            check = attacher.attach((name, scope) -> {
                phase = name;
                return loop.run(name, options.getPeripheryRetries(), CheckMode.PARTIAL, scope,
                        CoreSelection.PERIPHERY_ONLY, true, null, null);
            });

            phase = "stable";
            listeners.onPhaseStart(phase);
            check = checker.check(graph, start, CheckMode.FULL);
            forward = new StableMatcher(graph, components, explain).match(check);
            listeners.onPhaseEnd(phase, 0);
        }

        CheckMode mode = forward ? CheckMode.FULL_FORWARD : CheckMode.FULL;
        phase = "general";
        List<String> triedSwaps = new ArrayList<>();
        CheckpointPlacer placer = options.getEarlyCheckpoint() == null ? null
                : new CheckpointPlacer(graph, start, options.getEarlyCheckpoint(),
                        options.getEarlyCheckpointItems(), options.isUnconnected(), explain);
        CheckRecord check = loop.run(phase, options.getGeneralRetries(), mode, null,
                options.isCoreAware() ? CoreSelection.PERIPHERY_ONLY : CoreSelection.NONE, false, new HashSet<>(),
                placer == null ? null : complete -> placer.moveEarlier(complete, triedSwaps));

        phase = "tiers";
        Map<String, Integer> tiers = new AreaTierRanker(graph).rank(check, start);
        log.info("Connected {} with seed {} in {} repair attempts", graph.name(), seed, loop.totalAttempts());
        if (explain) {
            log.debug("{}", new GraphExplain(graph).dumpConnections(check));
            log.debug("Tiers:\n{}", GraphExplain.dumpTiers(tiers));
        }
        return ConnectionResult.solved(graph, check, tiers, loop.totalAttempts());
    }

    /**
     * Connects the unlinked edges that keep their vanilla destination: those
     * touching excluded areas and, with {@code vanillaPeriphery}, those between
     * two optional sides. Such links are fixed from then on.
     */
    private void propagateFixedLinks() {
        int count = 0;
        for (AreaNode node : graph.nodes()) {
            for (Edge exit : node.to()) {
                Edge target = exit.fixedLink();
                if (target == null || exit.isLinked() || target.isLinked()) {
                    continue;
                }
                boolean excluded = exit.side().isExcluded() || target.side().isExcluded();
                boolean vanilla = options.isVanillaPeriphery() && !exit.side().isCore() && !target.side().isCore();
                if (!excluded && !vanilla) {
                    continue;
                }
                graph.connect(exit, target);
                makeFixed(target);
                if (exit.pair() != null) {
                    makeFixed(exit.pair());
                }
                count++;
            }
        }
        if (count > 0) {
            log.info("Kept {} vanilla connections", count);
        }
    }

    private static void makeFixed(Edge e) {
        e.setFixed(true);
        if (e.link() != null) {
            e.link().setFixed(true);
        }
    }
}
