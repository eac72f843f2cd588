package com.gaming.rewire.util;

import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.engine.UnsolvableSeed;
import com.gaming.rewire.node.Edge;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeConnectionListenerTest {

    private static final class Recorder implements ConnectionListener {
        private final String id;
        private final List<String> events;

        Recorder(String id, List<String> events) {
            this.id = id;
            this.events = events;
        }

        @Override
        public void onPhaseStart(String phase) {
            events.add(id + ":start:" + phase);
        }

        @Override
        public void onSwap(String phase, int attempt, Edge redundant, Edge unreached) {
            events.add(id + ":swap:" + attempt);
        }

        @Override
        public void onPhaseEnd(String phase, int attempts) {
            events.add(id + ":end:" + phase + ":" + attempts);
        }

        @Override
        public void onUnsolvable(UnsolvableSeed reason) {
            events.add(id + ":unsolvable:" + reason.phase());
        }
    }

    @Test
    public void testEmptyCompositeIsNoOp() {
        CompositeConnectionListener composite = new CompositeConnectionListener();
        assertEquals(0, composite.size());
        composite.onPhaseStart("main");
        composite.onPhaseEnd("main", 0);
    }

    @Test
    public void testFansOutInRegistrationOrder() {
        List<String> events = new ArrayList<>();
        CompositeConnectionListener composite = new CompositeConnectionListener();
        composite.addForComposite(new Recorder("a", events));
        composite.addForComposite(new Recorder("b", events));
        assertEquals(2, composite.size());

        composite.onPhaseStart("general");
        composite.onSwap("general", 1, null, null);
        composite.onPhaseEnd("general", 1);
        composite.onUnsolvable(new UnsolvableSeed(1, "general", List.of(), List.of(), "failed"));

        assertEquals(List.of(
                "a:start:general", "b:start:general",
                "a:swap:1", "b:swap:1",
                "a:end:general:1", "b:end:general:1",
                "a:unsolvable:general", "b:unsolvable:general"), events);
    }
}
