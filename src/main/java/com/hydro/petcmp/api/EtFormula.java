package com.hydro.petcmp.api;

/**
 * Functional interface for an evapotranspiration formula over whole series.
 *
 * <p>
 * The engine hands every invocation a complete argument set: each required
 * input from the dataset, each optional input either from the dataset or
 * expanded from its declared default, and every configured parameter.
 * Implementations must be pure; the same inputs must always produce the same
 * output. Arrays obtained from {@link FormulaInputs} belong to this
 * invocation only and must not be retained.
 */
@FunctionalInterface
public interface EtFormula {
    /**
     * Computes the formula for every timestep.
     *
     * @param inputs The assembled inputs (read-only, transient).
     * @return The total series and, for partitioning formulas, its components.
     */
    FormulaOutput compute(FormulaInputs inputs);
}
