package com.gaming.rewire.util;

import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.engine.UnsolvableSeed;
import com.gaming.rewire.node.Edge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks wall time, attempts and swaps per phase of a connect run.
 *
 * Phases that run more than once (the periphery repair passes) accumulate.
 */
public final class PhaseTimingListener implements ConnectionListener {
    private static final Logger log = LogManager.getLogger(PhaseTimingListener.class);

    private final Map<String, Long> nanosByPhase = new LinkedHashMap<>();
    private final Map<String, Integer> attemptsByPhase = new LinkedHashMap<>();
    private final Map<String, Integer> swapsByPhase = new LinkedHashMap<>();
    private String currentPhase;
    private long phaseStartNanos;
    private boolean failed;

    @Override
    public void onPhaseStart(String phase) {
        currentPhase = phase;
        phaseStartNanos = System.nanoTime();
    }

    @Override
    public void onSwap(String phase, int attempt, Edge redundant, Edge unreached) {
        swapsByPhase.merge(phase, 1, Integer::sum);
    }

    @Override
    public void onPhaseEnd(String phase, int attempts) {
        long elapsed = phase.equals(currentPhase) ? System.nanoTime() - phaseStartNanos : 0;
        nanosByPhase.merge(phase, elapsed, Long::sum);
        attemptsByPhase.merge(phase, attempts, Integer::sum);
        currentPhase = null;
    }

    @Override
    public void onUnsolvable(UnsolvableSeed reason) {
        failed = true;
        log.warn("Run failed in phase {} after {} ms", reason.phase(),
                currentPhase == null ? 0 : (System.nanoTime() - phaseStartNanos) / 1_000_000);
    }

    public Map<String, Long> nanosByPhase() {
        return Collections.unmodifiableMap(nanosByPhase);
    }

    public int attempts(String phase) {
        return attemptsByPhase.getOrDefault(phase, 0);
    }

    public int swaps(String phase) {
        return swapsByPhase.getOrDefault(phase, 0);
    }

    public int totalSwaps() {
        return swapsByPhase.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean failed() {
        return failed;
    }

    public void reset() {
        nanosByPhase.clear();
        attemptsByPhase.clear();
        swapsByPhase.clear();
        currentPhase = null;
        failed = false;
    }
}
