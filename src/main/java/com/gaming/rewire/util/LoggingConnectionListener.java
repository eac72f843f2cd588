package com.gaming.rewire.util;

import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.engine.UnsolvableSeed;
import com.gaming.rewire.node.Edge;
import lombok.extern.log4j.Log4j2;

/**
 * Writes every phase transition and swap to the log at debug level.
 * Registered automatically when a run is configured with {@code explain}.
 */
@Log4j2
public final class LoggingConnectionListener implements ConnectionListener {

    @Override
    public void onPhaseStart(String phase) {
        log.debug("Phase {} started", phase);
    }

    @Override
    public void onSwap(String phase, int attempt, Edge redundant, Edge unreached) {
        log.debug("[{} #{}] {}", phase, attempt, GraphExplain.describeSwap(redundant, unreached));
    }

    @Override
    public void onPhaseEnd(String phase, int attempts) {
        log.debug("Phase {} finished after {} attempts", phase, attempts);
    }

    @Override
    public void onUnsolvable(UnsolvableSeed reason) {
        log.debug("Unsolvable in phase {}: {}", reason.phase(), reason.describe());
    }
}
