package com.gaming.rewire.node;

/**
 * Unordered pair of identifiers, used to deduplicate symmetric definitions.
 * The smaller identifier is always stored in {@code a}.
 */
public record Connection(String a, String b) {

    public Connection {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Connection endpoints must not be null");
        }
        if (a.compareTo(b) > 0) {
            String tmp = a;
            a = b;
            b = tmp;
        }
    }

    public static Connection of(String a, String b) {
        return new Connection(a, b);
    }

    @Override
    public String toString() {
        return a + "," + b;
    }
}
