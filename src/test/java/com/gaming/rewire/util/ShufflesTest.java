package com.gaming.rewire.util;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class ShufflesTest {

    private static List<Integer> range(int n) {
        List<Integer> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(i);
        }
        return list;
    }

    @Test
    public void testSameSeedSameOrder() {
        List<Integer> first = range(20);
        List<Integer> second = range(20);
        Shuffles.shuffle(new Random(7), first);
        Shuffles.shuffle(new Random(7), second);
        assertEquals(first, second);
    }

    @Test
    public void testShuffleIsPermutation() {
        List<Integer> list = range(50);
        Shuffles.shuffle(new Random(1), list);
        assertEquals(50, list.size());
        List<Integer> sorted = new ArrayList<>(list);
        sorted.sort(null);
        assertEquals(range(50), sorted);
    }

    @Test
    public void testShuffleTinyLists() {
        List<Integer> empty = new ArrayList<>();
        Shuffles.shuffle(new Random(3), empty);
        assertTrue(empty.isEmpty());

        List<Integer> one = range(1);
        Shuffles.shuffle(new Random(3), one);
        assertEquals(List.of(0), one);
    }
}
