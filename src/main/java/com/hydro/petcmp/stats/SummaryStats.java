package com.hydro.petcmp.stats;

/**
 * Descriptive statistics of one formula's total series over its finite
 * values.
 *
 * @param formula Formula name.
 * @param mean    Arithmetic mean; NaN when there are no finite values.
 * @param std     Sample standard deviation (n - 1); NaN below two values.
 * @param cv      Coefficient of variation {@code std / mean}; NaN when the
 *                mean is zero.
 * @param count   Number of finite values used.
 * @param min     Smallest finite value; NaN when there are none.
 * @param max     Largest finite value; NaN when there are none.
 */
public record SummaryStats(String formula, double mean, double std, double cv, int count, double min,
        double max) {
}
