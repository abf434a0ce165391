package com.hydro.petcmp.stats;

import com.hydro.petcmp.engine.ResultsTable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-formula statistics over the {@code total} series of a results table.
 *
 * NaN and infinite values are treated as missing. The matrices use
 * pairwise-complete observations: each pair of formulas is compared over the
 * timesteps where both have finite values. Both matrices are computed for
 * the upper triangle only and mirrored, so they are symmetric by
 * construction.
 */
public final class StatisticsEngine {
    private static final Logger log = LogManager.getLogger(StatisticsEngine.class);

    /** Population variance at or below this fraction of the squared mean is treated as constant. */
    static final double RELATIVE_VARIANCE_EPSILON = 1e-12;

    /** Per-formula summary, in column order. */
    public Map<String, SummaryStats> summary(ResultsTable table) {
        Map<String, SummaryStats> out = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : table.totals().entrySet())
            out.put(e.getKey(), summarize(e.getKey(), e.getValue()));
        return out;
    }

    /**
     * Pearson correlation between every pair of formulas.
     *
     * The diagonal is exactly 1 for a series with non-zero variance. Pairs
     * with fewer than two common finite timesteps, or with a constant series
     * over those timesteps, are NaN. Values are clamped to [-1, 1].
     */
    public FormulaMatrix correlationMatrix(ResultsTable table) {
        List<String> labels = new ArrayList<>();
        List<double[]> series = new ArrayList<>();
        collect(table, labels, series);

        int k = labels.size();
        double[][] m = new double[k][k];
        for (int i = 0; i < k; i++) {
            m[i][i] = hasVariance(series.get(i)) ? 1.0 : Double.NaN;
            for (int j = i + 1; j < k; j++) {
                double r = pearson(series.get(i), series.get(j));
                m[i][j] = r;
                m[j][i] = r;
            }
        }
        log.debug("Correlation matrix computed for {} formulas", k);
        return new FormulaMatrix(labels, m);
    }

    /**
     * Mean absolute difference between every pair of formulas over their
     * common finite timesteps. The diagonal is exactly 0; pairs with no
     * common timestep are NaN.
     */
    public FormulaMatrix pairwiseDifferenceMatrix(ResultsTable table) {
        List<String> labels = new ArrayList<>();
        List<double[]> series = new ArrayList<>();
        collect(table, labels, series);

        int k = labels.size();
        double[][] m = new double[k][k];
        for (int i = 0; i < k; i++) {
            m[i][i] = 0.0;
            for (int j = i + 1; j < k; j++) {
                double d = meanAbsoluteDifference(series.get(i), series.get(j));
                m[i][j] = d;
                m[j][i] = d;
            }
        }
        return new FormulaMatrix(labels, m);
    }

    public StatisticsArtifacts artifacts(ResultsTable table) {
        return new StatisticsArtifacts(summary(table), correlationMatrix(table), pairwiseDifferenceMatrix(table));
    }

    static SummaryStats summarize(String formula, double[] values) {
        int n = 0;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isFinite(v))
                continue;
            n++;
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (n == 0)
            return new SummaryStats(formula, Double.NaN, Double.NaN, Double.NaN, 0, Double.NaN, Double.NaN);

        double mean = sum / n;
        double std = Double.NaN;
        if (n > 1) {
            double ss = 0.0;
            for (double v : values) {
                if (Double.isFinite(v))
                    ss += (v - mean) * (v - mean);
            }
            std = Math.sqrt(ss / (n - 1));
        }
        double cv = mean == 0.0 ? Double.NaN : std / mean;
        return new SummaryStats(formula, mean, std, cv, n, min, max);
    }

    static double pearson(double[] x, double[] y) {
        int n = 0;
        double sx = 0.0;
        double sy = 0.0;
        for (int t = 0; t < x.length; t++) {
            if (Double.isFinite(x[t]) && Double.isFinite(y[t])) {
                n++;
                sx += x[t];
                sy += y[t];
            }
        }
        if (n < 2)
            return Double.NaN;

        double mx = sx / n;
        double my = sy / n;
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int t = 0; t < x.length; t++) {
            if (Double.isFinite(x[t]) && Double.isFinite(y[t])) {
                double dx = x[t] - mx;
                double dy = y[t] - my;
                sxy += dx * dy;
                sxx += dx * dx;
                syy += dy * dy;
            }
        }
        if (isConstant(sxx / n, mx) || isConstant(syy / n, my))
            return Double.NaN;
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    static double meanAbsoluteDifference(double[] x, double[] y) {
        int n = 0;
        double sum = 0.0;
        for (int t = 0; t < x.length; t++) {
            if (Double.isFinite(x[t]) && Double.isFinite(y[t])) {
                n++;
                sum += Math.abs(x[t] - y[t]);
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    private static boolean hasVariance(double[] x) {
        return !Double.isNaN(finiteVariance(x));
    }

    // Population variance over finite values; NaN below two values or when constant.
    private static double finiteVariance(double[] x) {
        int n = 0;
        double sum = 0.0;
        for (double v : x) {
            if (Double.isFinite(v)) {
                n++;
                sum += v;
            }
        }
        if (n < 2)
            return Double.NaN;
        double mean = sum / n;
        double ss = 0.0;
        for (double v : x) {
            if (Double.isFinite(v))
                ss += (v - mean) * (v - mean);
        }
        double var = ss / n;
        return isConstant(var, mean) ? Double.NaN : var;
    }

    // Variance negligible against the squared level of the series.
    static boolean isConstant(double variance, double mean) {
        return variance <= RELATIVE_VARIANCE_EPSILON * Math.max(mean * mean, Double.MIN_NORMAL);
    }

    private static void collect(ResultsTable table, List<String> labels, List<double[]> series) {
        for (Map.Entry<String, double[]> e : table.totals().entrySet()) {
            labels.add(e.getKey());
            series.add(e.getValue());
        }
    }
}
