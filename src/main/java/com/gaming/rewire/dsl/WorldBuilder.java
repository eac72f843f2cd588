package com.gaming.rewire.dsl;

import com.gaming.rewire.engine.WorldGraph;
import com.gaming.rewire.io.WorldCompiler;
import com.gaming.rewire.io.WorldDefinition;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * World Builder -- fluent in-code alternative to a JSON catalog.
 *
 * Usage Pattern:
 * 1. Create a builder: WorldBuilder w = WorldBuilder.create("my_world");
 * 2. Define areas: w.area("start").area("keep", "minor").boss("keep");
 * 3. Connect them: w.world("start", "gate").entrance("keep_door", "gate", "keep");
 * 4. Build: WorldGraph graph = w.start("start").build();
 *
 * Everything goes through the same {@link WorldCompiler} as JSON catalogs,
 * so the same validation applies.
 */
@Log4j2
public final class WorldBuilder {
    private final WorldDefinition def = new WorldDefinition();
    private final Map<String, WorldDefinition.AreaDef> areas = new LinkedHashMap<>();
    private final Map<String, WorldDefinition.EntranceDef> entrances = new LinkedHashMap<>();

    // Flag to prevent modification after building
    private boolean built;

    private WorldBuilder(String name) {
        def.setName(name);
    }

    public static WorldBuilder create(String name) {
        return new WorldBuilder(name);
    }

    // ── Areas ────────────────────────────────────────────────────

    public WorldBuilder area(String name, String... tags) {
        checkNotBuilt();
        WorldDefinition.AreaDef area = new WorldDefinition.AreaDef();
        area.setName(name);
        area.setTags(new ArrayList<>(Arrays.asList(tags)));
        def.getAreas().add(area);
        areas.put(name, area);
        return this;
    }

    public WorldBuilder boss(String area) {
        areaDef(area).setBoss(true);
        return this;
    }

    /** Marks an area mandatory regardless of its connections. */
    public WorldBuilder required(String area) {
        areaDef(area).setRequired(true);
        return this;
    }

    public WorldBuilder excluded(String area) {
        areaDef(area).setExcluded(true);
        return this;
    }

    public WorldBuilder cost(String area, int cost) {
        areaDef(area).setCost(cost);
        return this;
    }

    public WorldBuilder openArea(String area, String openArea) {
        areaDef(area).setOpenArea(openArea);
        return this;
    }

    public WorldBuilder start(String area) {
        checkNotBuilt();
        def.setStart(area);
        return this;
    }

    // ── Connections ──────────────────────────────────────────────

    /** Always-present one-way connection. */
    public WorldBuilder world(String from, String to) {
        return world(from, to, null);
    }

    /**
     * One-way connection gated by {@code cond} (may be null). Tags such as
     * {@code shortcut} or {@code openonly} follow the condition.
     */
    public WorldBuilder world(String from, String to, String cond, String... tags) {
        WorldDefinition.ConnectionDef c = new WorldDefinition.ConnectionDef();
        c.setArea(to);
        c.setCond(cond);
        c.setTags(new ArrayList<>(Arrays.asList(tags)));
        areaDef(from).getTo().add(c);
        return this;
    }

    /** Randomizable two-way entrance between {@code a} and {@code b}. */
    public WorldBuilder entrance(String name, String a, String b, String... tags) {
        WorldDefinition.EntranceDef e = entranceDef(name, tags);
        e.setSideA(sideDef(a));
        e.setSideB(sideDef(b));
        def.getEntrances().add(e);
        return this;
    }

    /** Entrance with a single usable side, such as a dead end. */
    public WorldBuilder deadEnd(String name, String area, String... tags) {
        WorldDefinition.EntranceDef e = entranceDef(name, tags);
        e.setSideA(sideDef(area));
        def.getEntrances().add(e);
        return this;
    }

    /** Fixed two-way door opened by {@code doorCond} (may be null). */
    public WorldBuilder door(String name, String a, String b, String doorCond) {
        WorldDefinition.EntranceDef e = entranceDef(name, new String[] { "door" });
        e.setDoorCond(doorCond);
        e.setSideA(sideDef(a));
        e.setSideB(sideDef(b));
        def.getEntrances().add(e);
        return this;
    }

    /** One-way warp from {@code from} landing in {@code to}. */
    public WorldBuilder warp(String name, String from, String to, String... tags) {
        WorldDefinition.EntranceDef w = entranceDef(name, tags);
        w.setSideA(sideDef(from));
        w.setSideB(sideDef(to));
        def.getWarps().add(w);
        return this;
    }

    /** Opposite direction of {@code other}, for warps not keyed by their areas. */
    public WorldBuilder pairWith(String warp, String other) {
        existing(warp).setPairWith(other);
        return this;
    }

    public WorldBuilder fixed(String entrance) {
        existing(entrance).setFixed(true);
        return this;
    }

    /** Gating condition on the side of {@code entrance} in {@code area}. */
    public WorldBuilder condition(String entrance, String area, String cond) {
        side(entrance, area).setCond(cond);
        return this;
    }

    public WorldBuilder sideTag(String entrance, String area, String tag) {
        side(entrance, area).getTags().add(tag);
        return this;
    }

    // ── Gating vocabulary ────────────────────────────────────────

    public WorldBuilder item(String name, String... locations) {
        checkNotBuilt();
        WorldDefinition.ItemDef item = new WorldDefinition.ItemDef();
        item.setName(name);
        item.setAreas(new ArrayList<>(Arrays.asList(locations)));
        def.getItems().add(item);
        return this;
    }

    public WorldBuilder config(String name, String cond) {
        checkNotBuilt();
        def.getConfig().put(name, cond);
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /** The accumulated catalog, e.g. for serialization. */
    public WorldDefinition definition() {
        return def;
    }

    /**
     * Compiles the world. The builder cannot be modified afterwards.
     *
     * @throws IllegalArgumentException for an inconsistent world.
     */
    public WorldGraph build() {
        checkNotBuilt();
        built = true;
        log.debug("Building world {} with {} areas, {} entrances, {} warps", def.getName(), def.getAreas().size(),
                def.getEntrances().size(), def.getWarps().size());
        return new WorldCompiler().compile(def);
    }

    private WorldDefinition.AreaDef areaDef(String name) {
        checkNotBuilt();
        WorldDefinition.AreaDef area = areas.get(name);
        if (area == null) {
            throw new IllegalArgumentException("Unknown area: " + name);
        }
        return area;
    }

    private WorldDefinition.EntranceDef entranceDef(String name, String[] tags) {
        checkNotBuilt();
        if (entrances.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate entrance " + name);
        }
        WorldDefinition.EntranceDef e = new WorldDefinition.EntranceDef();
        e.setName(name);
        e.setTags(new ArrayList<>(Arrays.asList(tags)));
        entrances.put(name, e);
        return e;
    }

    private WorldDefinition.EntranceDef existing(String name) {
        checkNotBuilt();
        WorldDefinition.EntranceDef e = entrances.get(name);
        if (e == null) {
            throw new IllegalArgumentException("Unknown entrance: " + name);
        }
        return e;
    }

    private WorldDefinition.SideDef side(String entrance, String area) {
        WorldDefinition.EntranceDef e = existing(entrance);
        List<WorldDefinition.SideDef> sides = new ArrayList<>();
        if (e.getSideA() != null) {
            sides.add(e.getSideA());
        }
        if (e.getSideB() != null) {
            sides.add(e.getSideB());
        }
        for (WorldDefinition.SideDef s : sides) {
            if (s.getArea().equals(area)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Entrance " + entrance + " has no side in " + area);
    }

    private static WorldDefinition.SideDef sideDef(String area) {
        WorldDefinition.SideDef s = new WorldDefinition.SideDef();
        s.setArea(area);
        return s;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Builder already built");
        }
    }
}
