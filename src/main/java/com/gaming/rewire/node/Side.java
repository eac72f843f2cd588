package com.gaming.rewire.node;

import com.gaming.rewire.api.Expr;
import lombok.Getter;
import lombok.Setter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One end of a connection definition: the area it sits in, its label, its
 * tags and its gating condition.
 *
 * Both edges created for the same end (the exit and the entrance of a door
 * side) share a single Side instance, so flags flipped during randomization
 * (core, pseudo-core) are seen through either edge.
 */
@Getter
public final class Side {
    private final String area;
    private final String text;
    private final Set<String> tags;

    @Setter
    private Expr expr;

    /** Whether an edge through this side must be routed within mandatory territory. */
    @Setter
    private boolean core = true;

    /** Exit of an optional area bordering a mandatory one. */
    @Setter
    private boolean pseudoCore;

    /** Always-present connection that is never randomized. */
    @Setter
    private boolean world;

    @Setter
    private boolean excluded;

    public Side(String area, String text, Collection<String> tags) {
        if (area == null) {
            throw new IllegalArgumentException("Side without area");
        }
        this.area = area;
        this.text = text;
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
    }

    public Side(String area, String text) {
        this(area, text, null);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public void addTag(String tag) {
        tags.add(tag);
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    @Override
    public String toString() {
        return text == null ? area : area + " (" + text + ")";
    }
}
