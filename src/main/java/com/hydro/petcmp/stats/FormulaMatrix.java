package com.hydro.petcmp.stats;

import java.util.List;

/**
 * Square matrix indexed by formula name on both axes.
 */
public final class FormulaMatrix {
    private final List<String> labels;
    private final double[][] values;

    FormulaMatrix(List<String> labels, double[][] values) {
        this.labels = List.copyOf(labels);
        this.values = values;
    }

    /** Formula names in row and column order. */
    public List<String> labels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public double get(int row, int col) {
        return values[row][col];
    }

    public double get(String row, String col) {
        return values[indexOf(row)][indexOf(col)];
    }

    /** Copy of one row. */
    public double[] row(String formula) {
        return values[indexOf(formula)].clone();
    }

    /** Copy of the full matrix. */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++)
            copy[i] = values[i].clone();
        return copy;
    }

    /** True when every cell equals its mirror; NaN cells match NaN. */
    public boolean isSymmetric() {
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (Double.compare(values[i][j], values[j][i]) != 0)
                    return false;
            }
        }
        return true;
    }

    private int indexOf(String formula) {
        int idx = labels.indexOf(formula);
        if (idx < 0)
            throw new IllegalArgumentException("Formula not in matrix: " + formula);
        return idx;
    }
}
