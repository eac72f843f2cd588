package com.gaming.rewire.node;

/**
 * The catalog connection an edge was created from: its full identifier, its
 * label and whether it takes part in randomization. World edges have none.
 */
public record EdgeSource(String name, String text, boolean fixed) {
}
