package com.gaming.rewire.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a world catalog: its areas with their fixed world
 * connections, the randomizable entrances and warps between them, key item
 * locations and named config conditions.
 *
 * Conditions are strings in prefix notation, see {@link ExprParser}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class WorldDefinition {
    private String name;
    private String start;
    private List<AreaDef> areas = new ArrayList<>();
    private List<EntranceDef> entrances = new ArrayList<>();
    private List<EntranceDef> warps = new ArrayList<>();
    private List<ItemDef> items = new ArrayList<>();
    private Map<String, String> config = new LinkedHashMap<>();

    /** A region of the world. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class AreaDef {
        private String name, text, openArea;
        private List<String> tags = new ArrayList<>();
        private boolean boss, required, excluded;
        /** Overrides the cost derived from tags. */
        private Integer cost;
        /** Always-present connections out of this area. */
        private List<ConnectionDef> to = new ArrayList<>();
    }

    /** World connection from the enclosing area into {@code area}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ConnectionDef {
        private String area, text, cond;
        private List<String> tags = new ArrayList<>();
    }

    /**
     * A two-sided entrance (door, passage) or a one-way warp. For warps,
     * {@code sideA} is where the warp is taken and {@code sideB} where it
     * lands.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EntranceDef {
        private String name, text, doorCond, pairWith;
        private List<String> tags = new ArrayList<>();
        private boolean fixed;
        private SideDef sideA, sideB;
    }

    /** One end of an entrance. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SideDef {
        private String area, text, cond;
        private List<String> tags = new ArrayList<>();
    }

    /** A key item and the areas it can be found in. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ItemDef {
        private String name;
        private List<String> areas = new ArrayList<>();
    }
}
