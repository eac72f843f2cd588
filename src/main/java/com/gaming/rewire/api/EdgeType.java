package com.gaming.rewire.api;

/**
 * Direction of one half of a connection point.
 *
 * An EXIT edge lives in its owning area's outgoing list and knows its
 * {@code from} area from construction. An ENTRANCE edge lives in the incoming
 * list and knows its {@code to} area. The opposite endpoint is only filled in
 * once the edge is linked.
 */
public enum EdgeType {
    EXIT,
    ENTRANCE;

    public EdgeType opposite() {
        return this == EXIT ? ENTRANCE : EXIT;
    }
}
