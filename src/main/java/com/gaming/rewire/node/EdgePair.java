package com.gaming.rewire.node;

/** Exit and entrance created together for the same side. Either may be null. */
public record EdgePair(Edge exit, Edge entrance) {
}
