package com.gaming.rewire.util;

import com.gaming.rewire.engine.UnsolvableSeed;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PhaseTimingListenerTest {

    private PhaseTimingListener timing;

    @Before
    public void setUp() {
        timing = new PhaseTimingListener();
    }

    @Test
    public void testAttemptsAccumulatePerPhase() {
        timing.onPhaseStart("main");
        timing.onPhaseEnd("main", 4);
        timing.onPhaseStart("periphery-fixup");
        timing.onPhaseEnd("periphery-fixup", 2);
        timing.onPhaseStart("periphery-fixup");
        timing.onPhaseEnd("periphery-fixup", 3);

        assertEquals(4, timing.attempts("main"));
        assertEquals(5, timing.attempts("periphery-fixup"));
        assertEquals(0, timing.attempts("general"));
        assertEquals(List.of("main", "periphery-fixup"), List.copyOf(timing.nanosByPhase().keySet()));
        assertTrue(timing.nanosByPhase().get("main") >= 0);
    }

    @Test
    public void testSwapsCounted() {
        timing.onPhaseStart("general");
        timing.onSwap("general", 1, null, null);
        timing.onSwap("general", 2, null, null);
        timing.onSwap("main", 1, null, null);

        assertEquals(2, timing.swaps("general"));
        assertEquals(1, timing.swaps("main"));
        assertEquals(3, timing.totalSwaps());
    }

    @Test
    public void testFailureAndReset() {
        timing.onPhaseStart("main");
        timing.onSwap("main", 1, null, null);
        timing.onUnsolvable(new UnsolvableSeed(5, "main", List.of("keep"), List.of(), "Couldn't solve seed 5"));
        assertTrue(timing.failed());

        timing.reset();
        assertFalse(timing.failed());
        assertEquals(0, timing.totalSwaps());
        assertTrue(timing.nanosByPhase().isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testTimingsAreReadOnly() {
        timing.onPhaseStart("main");
        timing.onPhaseEnd("main", 0);
        timing.nanosByPhase().clear();
    }
}
