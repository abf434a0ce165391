package com.hydro.petcmp.engine;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of a comparison run keyed by formula name, sharing one timestamp
 * axis.
 *
 * <p>
 * Column order follows registry registration order. Formulas that were
 * skipped or failed are simply absent. Tables are never updated in place;
 * {@link #replace(ComputationResult)} returns a new table.
 */
public final class ResultsTable {
    private final List<Instant> timestamps;
    private final Map<String, ComputationResult> results;

    public ResultsTable(List<Instant> timestamps, Map<String, ComputationResult> results) {
        this.timestamps = List.copyOf(timestamps);
        for (ComputationResult r : results.values()) {
            if (r.length() != this.timestamps.size()) {
                throw new IllegalArgumentException("Result " + r.formula() + " has " + r.length()
                        + " values, expected " + this.timestamps.size());
            }
        }
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public int length() {
        return timestamps.size();
    }

    /** Formula names in column order. */
    public List<String> formulas() {
        return List.copyOf(results.keySet());
    }

    public Collection<ComputationResult> results() {
        return results.values();
    }

    public Optional<ComputationResult> get(String formula) {
        return Optional.ofNullable(results.get(formula));
    }

    public ComputationResult require(String formula) {
        ComputationResult r = results.get(formula);
        if (r == null)
            throw new IllegalArgumentException("No result for formula: " + formula);
        return r;
    }

    public boolean contains(String formula) {
        return results.containsKey(formula);
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /** The output-schema view: one {@code total} column per formula. */
    public Map<String, double[]> totals() {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (ComputationResult r : results.values())
            out.put(r.formula(), r.total());
        return out;
    }

    /**
     * Returns a new table in which the result of the same formula is replaced.
     *
     * @throws IllegalArgumentException if the formula is not in this table.
     */
    public ResultsTable replace(ComputationResult result) {
        if (!results.containsKey(result.formula()))
            throw new IllegalArgumentException("No result for formula: " + result.formula());
        Map<String, ComputationResult> next = new LinkedHashMap<>(results);
        next.put(result.formula(), result);
        return new ResultsTable(timestamps, next);
    }
}
