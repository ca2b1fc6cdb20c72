package com.dynamics.sfg.util;

import com.dynamics.sfg.api.SimulationListener;
import java.util.Arrays;

/**
 * Fans callbacks out to several {@link SimulationListener}s.
 *
 * Registration replaces the backing array (copy on write), so callbacks from
 * worker threads iterate a stable snapshot without locking.
 */
public class CompositeSimulationListener implements SimulationListener {
    private volatile SimulationListener[] listeners = new SimulationListener[0];

    public synchronized void add(SimulationListener listener) {
        SimulationListener[] old = listeners;
        SimulationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean isEmpty() {
        return listeners.length == 0;
    }

    @Override
    public void onRunStart(int repetition, int steps) {
        for (SimulationListener l : listeners)
            l.onRunStart(repetition, steps);
    }

    @Override
    public void onReferenceError(int repetition, int step, String reference, Throwable error) {
        for (SimulationListener l : listeners)
            l.onReferenceError(repetition, step, reference, error);
    }

    @Override
    public void onRunEnd(int repetition, long durationNanos) {
        for (SimulationListener l : listeners)
            l.onRunEnd(repetition, durationNanos);
    }
}
