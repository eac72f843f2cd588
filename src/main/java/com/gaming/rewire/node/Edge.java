package com.gaming.rewire.node;

import com.gaming.rewire.api.EdgeType;
import com.gaming.rewire.api.Expr;

/**
 * One directed half of a connection point.
 *
 * Relations to other edges (pair, link, fixed link) are stored as integer ids
 * into the owning {@link EdgeArena}, never as object references. Equality is
 * identity: two edges are only equal if they are the same arena slot.
 *
 * Mutation goes through the graph's connect/disconnect primitives; the
 * setters here only enforce the local type invariants.
 */
public final class Edge {
    static final int NONE = -1;

    private final EdgeArena arena;
    private final int id;
    private final EdgeType type;
    private final Side side;
    private final String name;
    private final String text;

    private boolean fixed;
    private String from;
    private String to;
    private Expr linkedExpr;
    private int pair = NONE;
    private int link = NONE;
    private int fixedLink = NONE;

    Edge(EdgeArena arena, int id, EdgeType type, Side side, String name, String text, boolean fixed) {
        this.arena = arena;
        this.id = id;
        this.type = type;
        this.side = side;
        this.name = name;
        this.text = text;
        this.fixed = fixed;
        if (type == EdgeType.EXIT) {
            this.from = side.getArea();
        } else {
            this.to = side.getArea();
        }
    }

    public int id() {
        return id;
    }

    public EdgeType type() {
        return type;
    }

    public boolean isExit() {
        return type == EdgeType.EXIT;
    }

    public Side side() {
        return side;
    }

    /** Identifier of the originating connection, shared by both directions. Null for world edges. */
    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    /** The side's own gating condition. */
    public Expr expr() {
        return side.getExpr();
    }

    public Expr linkedExpr() {
        return linkedExpr;
    }

    public boolean isFixed() {
        return fixed;
    }

    public boolean isWorld() {
        return side.isWorld();
    }

    public Edge pair() {
        return arena.get(pair);
    }

    public Edge link() {
        return arena.get(link);
    }

    public Edge fixedLink() {
        return arena.get(fixedLink);
    }

    public boolean isLinked() {
        return link != NONE;
    }

    /** The area this edge belongs to: {@code from} for exits, {@code to} for entrances. */
    public String ownArea() {
        return type == EdgeType.EXIT ? from : to;
    }

    public void setFixed(boolean fixed) {
        this.fixed = fixed;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public void setLinkedExpr(Expr linkedExpr) {
        this.linkedExpr = linkedExpr;
    }

    public void setPair(Edge other) {
        if (other != null && other.type == type) {
            throw new IllegalStateException("Cannot pair " + this + " and " + other);
        }
        checkArena(other);
        this.pair = other == null ? NONE : other.id;
    }

    public void setLink(Edge other) {
        if (other != null && other.type == type) {
            throw new IllegalStateException("Cannot link " + this + " and " + other);
        }
        checkArena(other);
        this.link = other == null ? NONE : other.id;
    }

    public void setFixedLink(Edge other) {
        checkArena(other);
        this.fixedLink = other == null ? NONE : other.id;
    }

    private void checkArena(Edge other) {
        if (other != null && other.arena != arena) {
            throw new IllegalStateException("Edge " + other + " belongs to another graph");
        }
    }

    @Override
    public String toString() {
        boolean exit = type == EdgeType.EXIT;
        StringBuilder sb = new StringBuilder();
        if (fixed) {
            sb.append('&');
        }
        if (side.isCore()) {
            sb.append('+');
        }
        sb.append("Edge[Name=").append(name)
                .append(", ").append(exit ? "*" : "").append("From=").append(from)
                .append(", ").append(exit ? "" : "*").append("To=").append(to);
        if (side.getExpr() != null) {
            sb.append(", Expr=").append(side.getExpr());
        }
        return sb.append(']').toString();
    }
}
