package com.hydro.petcmp.util;

import com.hydro.petcmp.api.ExecutionListener;
import java.util.Arrays;

/**
 * Fans out {@link ExecutionListener} callbacks to several listeners, in the
 * order they were added.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private ExecutionListener[] listeners = new ExecutionListener[0];

    public void add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long runId, int formulaCount) {
        for (ExecutionListener l : listeners)
            l.onRunStart(runId, formulaCount);
    }

    @Override
    public void onFormulaComputed(long runId, String formula, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onFormulaComputed(runId, formula, durationNanos);
    }

    @Override
    public void onFormulaSkipped(long runId, String formula, String reason) {
        for (ExecutionListener l : listeners)
            l.onFormulaSkipped(runId, formula, reason);
    }

    @Override
    public void onFormulaError(long runId, String formula, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onFormulaError(runId, formula, error);
    }

    @Override
    public void onFormulaWarning(long runId, String formula, String message) {
        for (ExecutionListener l : listeners)
            l.onFormulaWarning(runId, formula, message);
    }

    @Override
    public void onRunEnd(long runId, int succeeded) {
        for (ExecutionListener l : listeners)
            l.onRunEnd(runId, succeeded);
    }
}
