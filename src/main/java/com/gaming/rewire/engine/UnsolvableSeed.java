package com.gaming.rewire.engine;

import java.util.List;

/**
 * Why a connect run gave up: the seed, the phase that ran out of options and
 * the areas and items still out of reach at that point.
 */
public record UnsolvableSeed(long seed, String phase, List<String> unreachedAreas, List<String> missingItems,
        String message) {

    public UnsolvableSeed {
        unreachedAreas = List.copyOf(unreachedAreas);
        missingItems = List.copyOf(missingItems);
    }

    /** Human-readable report naming the seed, the unreached areas and the missing items. */
    public String describe() {
        StringBuilder sb = new StringBuilder(message);
        if (!unreachedAreas.isEmpty()) {
            sb.append(" (unreached: ").append(String.join(", ", unreachedAreas)).append(')');
        }
        if (!missingItems.isEmpty()) {
            sb.append(" (missing items: ").append(String.join(", ", missingItems)).append(')');
        }
        return sb.toString();
    }
}
