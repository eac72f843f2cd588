package com.gaming.rewire.util;

import com.gaming.rewire.api.ConnectionListener;
import com.gaming.rewire.engine.UnsolvableSeed;
import com.gaming.rewire.node.Edge;

import java.util.Arrays;

/**
 * Fans {@link ConnectionListener} callbacks out to any number of listeners,
 * in registration order.
 */
public class CompositeConnectionListener implements ConnectionListener {
    private ConnectionListener[] listeners = new ConnectionListener[0];

    public void addForComposite(ConnectionListener listener) {
        ConnectionListener[] old = listeners;
        ConnectionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPhaseStart(String phase) {
        for (ConnectionListener l : listeners)
            l.onPhaseStart(phase);
    }

    @Override
    public void onSwap(String phase, int attempt, Edge redundant, Edge unreached) {
        for (ConnectionListener l : listeners)
            l.onSwap(phase, attempt, redundant, unreached);
    }

    @Override
    public void onPhaseEnd(String phase, int attempts) {
        for (ConnectionListener l : listeners)
            l.onPhaseEnd(phase, attempts);
    }

    @Override
    public void onUnsolvable(UnsolvableSeed reason) {
        for (ConnectionListener l : listeners)
            l.onUnsolvable(reason);
    }
}
