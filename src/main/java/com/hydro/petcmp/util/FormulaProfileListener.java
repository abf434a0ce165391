package com.hydro.petcmp.util;

import com.hydro.petcmp.api.ExecutionListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates timing and outcome counts per formula across runs. */
public class FormulaProfileListener implements ExecutionListener {

    /** Counters for one formula. Timings cover computed invocations only. */
    public static class FormulaTiming {
        public final String formula;
        public long computed;
        public long skipped;
        public long failed;
        public long warnings;
        public long totalNanos;
        public long minNanos;
        public long maxNanos;
        public long lastNanos;

        public FormulaTiming(String formula) {
            this.formula = formula;
        }

        void record(long nanos) {
            minNanos = computed == 0 ? nanos : Math.min(minNanos, nanos);
            maxNanos = computed == 0 ? nanos : Math.max(maxNanos, nanos);
            lastNanos = nanos;
            totalNanos += nanos;
            computed++;
        }

        public double meanMicros() {
            return computed == 0 ? 0.0 : totalNanos / 1000.0 / computed;
        }
    }

    private final Map<String, FormulaTiming> timings = new LinkedHashMap<>();
    private long runs;

    private FormulaTiming timing(String formula) {
        return timings.computeIfAbsent(formula, FormulaTiming::new);
    }

    /** Counters for one formula, or null if it has never been seen. */
    public FormulaTiming get(String formula) {
        return timings.get(formula);
    }

    /** Every formula seen so far, in first-seen order. */
    public List<FormulaTiming> all() {
        return new ArrayList<>(timings.values());
    }

    public long runs() {
        return runs;
    }

    @Override
    public void onRunStart(long runId, int formulaCount) {
        runs++;
    }

    @Override
    public void onFormulaComputed(long runId, String formula, long durationNanos) {
        timing(formula).record(durationNanos);
    }

    @Override
    public void onFormulaSkipped(long runId, String formula, String reason) {
        timing(formula).skipped++;
    }

    @Override
    public void onFormulaError(long runId, String formula, Throwable error) {
        timing(formula).failed++;
    }

    @Override
    public void onFormulaWarning(long runId, String formula, String message) {
        timing(formula).warnings++;
    }

    @Override
    public void onRunEnd(long runId, int succeeded) {
    }

    public void reset() {
        timings.clear();
        runs = 0;
    }

    /**
     * Formats one row per formula, most total time first. Formulas that were
     * never computed sort last and show zero timings.
     */
    public String dump() {
        List<FormulaTiming> rows = all();
        rows.sort(Comparator.comparingLong((FormulaTiming t) -> t.totalNanos).reversed());

        StringBuilder out = new StringBuilder(128 * (rows.size() + 2));
        out.append(String.format("%-20s %5s %5s %5s %5s %11s %11s %11s%n",
                "Formula", "Runs", "Skip", "Fail", "Warn", "Mean (us)", "Min (us)", "Max (us)"));
        for (FormulaTiming t : rows) {
            out.append(String.format("%-20s %5d %5d %5d %5d %11.2f %11.2f %11.2f%n",
                    abbreviate(t.formula),
                    t.computed, t.skipped, t.failed, t.warnings,
                    t.meanMicros(), t.minNanos / 1000.0, t.maxNanos / 1000.0));
        }
        return out.toString();
    }

    private static String abbreviate(String name) {
        return name.length() > 20 ? name.substring(0, 19) + "~" : name;
    }
}
