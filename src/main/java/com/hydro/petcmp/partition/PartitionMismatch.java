package com.hydro.petcmp.partition;

/**
 * Components of a partitioning formula that do not sum to its total within
 * tolerance. A warning, never an error.
 *
 * @param formula       Formula name.
 * @param worstIndex    Timestep with the largest relative error.
 * @param worstError    Largest relative error observed (absolute error where
 *                      the total is zero).
 * @param violations    Number of timesteps outside tolerance.
 * @param tolerance     Tolerance the check was run with.
 */
public record PartitionMismatch(String formula, int worstIndex, double worstError, int violations,
        double tolerance) {

    /** Warning text attached to the result. */
    public String describe() {
        return String.format("components do not sum to total at %d timestep(s); worst error %.4g at index %d (tolerance %.4g)",
                violations, worstError, worstIndex, tolerance);
    }
}
