package com.gaming.rewire.engine;

import java.util.List;

/**
 * Raised inside the engine when a phase runs out of repair options.
 * {@link GraphConnector#connect()} turns it into an unsolvable
 * {@link ConnectionResult}; {@link ConnectionResult#orElseThrow()} raises it
 * again for callers that prefer exceptions.
 */
public class UnsolvableSeedException extends RuntimeException {
    private final transient UnsolvableSeed reason;

    public UnsolvableSeedException(UnsolvableSeed reason) {
        super(reason.describe());
        this.reason = reason;
    }

    /** Failure without a known seed or phase yet; the connector fills those in. */
    public UnsolvableSeedException(String message, List<String> unreachedAreas, List<String> missingItems) {
        this(new UnsolvableSeed(0, null, unreachedAreas, missingItems, message));
    }

    public UnsolvableSeedException(String message) {
        this(message, List.of(), List.of());
    }

    public UnsolvableSeed reason() {
        return reason;
    }
}
