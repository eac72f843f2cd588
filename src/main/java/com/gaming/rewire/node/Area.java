package com.gaming.rewire.node;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A discrete region of the world. Areas are the vertices of the rewired graph.
 *
 * Identity, label, boss status and traversal cost are fixed at construction.
 * The core and excluded flags are assigned by construction and classification
 * before randomization starts; tags may gain derived entries such as
 * {@code overworld_adjacent} or {@code avoidstart}.
 */
public final class Area {
    private final String name;
    private final String text;
    private final Set<String> tags;
    private final boolean boss;
    private final boolean required;
    private final String openArea;
    private final int cost;

    private boolean core;
    private boolean excluded;

    public Area(String name, String text, Collection<String> tags, boolean boss, boolean required,
            String openArea, Integer cost) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Area without name");
        }
        this.name = name;
        this.text = text == null ? name : text;
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
        this.boss = boss;
        this.required = required;
        this.openArea = openArea;
        this.cost = cost != null ? cost : defaultCost(this.tags, boss);
    }

    /**
     * Traversal weight used by reachability distances: trivial areas are free,
     * minor areas cheap, bosses and open world expensive.
     */
    public static int defaultCost(Set<String> tags, boolean boss) {
        if (tags.contains("trivial")) {
            return 0;
        }
        if (tags.contains("minor") || tags.contains("minidungeon")) {
            return 1;
        }
        if (boss || tags.contains("overworld")) {
            return 3;
        }
        return 1;
    }

    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public void addTag(String tag) {
        tags.add(tag);
    }

    /** Cleared by defeating a boss. */
    public boolean isBoss() {
        return boss;
    }

    /** Mandatory regardless of its edges. */
    public boolean isRequired() {
        return required;
    }

    public String openArea() {
        return openArea;
    }

    public int cost() {
        return cost;
    }

    public boolean isCore() {
        return core;
    }

    public void setCore(boolean core) {
        this.core = core;
    }

    public boolean isExcluded() {
        return excluded;
    }

    public void setExcluded(boolean excluded) {
        this.excluded = excluded;
    }

    @Override
    public String toString() {
        return name;
    }
}
