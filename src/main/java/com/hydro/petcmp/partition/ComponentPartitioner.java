package com.hydro.petcmp.partition;

import com.hydro.petcmp.engine.ComputationResult;
import com.hydro.petcmp.engine.ResultsTable;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts component series from partitioning formulas and checks that they
 * add up to the reported total.
 *
 * <p>
 * The check is per timestep: {@code |total - sum(components)| <= tol * |total|},
 * and {@code |sum(components)| <= tol} where the total is exactly zero.
 * Timesteps where the total or any component is NaN are not checked.
 */
@Log4j2
public final class ComponentPartitioner {
    public static final double DEFAULT_TOLERANCE = 0.01;

    @Getter
    private final double tolerance;

    public ComponentPartitioner() {
        this(DEFAULT_TOLERANCE);
    }

    public ComponentPartitioner(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance))
            throw new IllegalArgumentException("Tolerance must be a finite non-negative number: " + tolerance);
        this.tolerance = tolerance;
    }

    /**
     * Component series of a result, excluding the total. Empty when the formula
     * does not declare partition support or the result carries no components.
     */
    public Map<String, double[]> partition(FormulaSpec spec, ComputationResult result) {
        if (!spec.supportsPartition() || !result.hasComponents())
            return Collections.emptyMap();
        return result.components();
    }

    /** Checks the sum of components against the total. */
    public Optional<PartitionMismatch> check(ComputationResult result) {
        if (!result.hasComponents())
            return Optional.empty();

        double[][] parts = result.components().values().toArray(new double[0][]);
        int violations = 0;
        int worstIndex = -1;
        double worstError = 0.0;

        for (int t = 0; t < result.length(); t++) {
            double total = result.totalAt(t);
            if (Double.isNaN(total))
                continue;
            double sum = 0.0;
            boolean hasNaN = false;
            for (double[] part : parts) {
                if (Double.isNaN(part[t])) {
                    hasNaN = true;
                    break;
                }
                sum += part[t];
            }
            if (hasNaN)
                continue;

            double diff = Math.abs(total - sum);
            double error = total == 0.0 ? diff : diff / Math.abs(total);
            if (error > tolerance) {
                violations++;
                if (error > worstError || worstIndex < 0) {
                    worstError = error;
                    worstIndex = t;
                }
            }
        }

        if (violations == 0)
            return Optional.empty();
        return Optional.of(new PartitionMismatch(result.formula(), worstIndex, worstError, violations, tolerance));
    }

    /**
     * Returns a table in which every partitioned result failing the check
     * carries a warning. Results of formulas without partition support are
     * left untouched.
     */
    public ResultsTable enrich(ResultsTable table, FormulaRegistry registry) {
        ResultsTable out = table;
        for (ComputationResult result : table.results()) {
            Optional<FormulaSpec> spec = registry.get(result.formula());
            if (spec.isEmpty() || partition(spec.get(), result).isEmpty())
                continue;
            Optional<PartitionMismatch> mismatch = check(result);
            if (mismatch.isPresent()) {
                log.warn("Partition mismatch for {}: {}", result.formula(), mismatch.get().describe());
                out = out.replace(result.withWarning(mismatch.get().describe()));
            }
        }
        return out;
    }

    /** Mismatches for every partitioned result in the table, in column order. */
    public Map<String, PartitionMismatch> mismatches(ResultsTable table, FormulaRegistry registry) {
        Map<String, PartitionMismatch> out = new LinkedHashMap<>();
        for (ComputationResult result : table.results()) {
            Optional<FormulaSpec> spec = registry.get(result.formula());
            if (spec.isEmpty() || partition(spec.get(), result).isEmpty())
                continue;
            check(result).ifPresent(m -> out.put(result.formula(), m));
        }
        return out;
    }

    /** Side structure formula name to component map, for partitioned results only. */
    public Map<String, Map<String, double[]>> components(ResultsTable table, FormulaRegistry registry) {
        Map<String, Map<String, double[]>> out = new LinkedHashMap<>();
        for (ComputationResult result : table.results()) {
            Optional<FormulaSpec> spec = registry.get(result.formula());
            if (spec.isEmpty())
                continue;
            Map<String, double[]> parts = partition(spec.get(), result);
            if (!parts.isEmpty())
                out.put(result.formula(), parts);
        }
        return out;
    }
}
