package com.gaming.rewire.util;

import java.util.List;
import java.util.Random;

/**
 * Seeded random helpers. Every random decision of a run goes through the
 * {@link Random} instance passed in, never through shared state.
 */
public final class Shuffles {

    private Shuffles() {
    }

    /** Forward Fisher-Yates: position i swaps with a uniform index in [i, n). */
    public static <T> void shuffle(Random random, List<T> list) {
        int n = list.size();
        for (int i = 0; i < n - 1; i++) {
            int j = i + random.nextInt(n - i);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }
}
