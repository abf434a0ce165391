package com.hydro.petcmp.api;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * The complete argument set for one formula invocation.
 */
public final class FormulaInputs {
    private final String formula;
    private final int length;
    private final Map<String, double[]> series;
    private final Set<String> provided;
    private final Map<String, Double> parameters;

    /**
     * @param formula    Name of the formula being invoked (for error messages).
     * @param length     Number of timesteps.
     * @param series     Every declared input, each of {@code length} values.
     * @param provided   Inputs whose values came from the dataset rather than
     *                   from a declared default.
     * @param parameters Configured parameter values.
     */
    public FormulaInputs(String formula, int length, Map<String, double[]> series,
            Set<String> provided, Map<String, Double> parameters) {
        this.formula = formula;
        this.length = length;
        this.series = Collections.unmodifiableMap(series);
        this.provided = Collections.unmodifiableSet(provided);
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public String formula() {
        return formula;
    }

    public int length() {
        return length;
    }

    /** Returns the series for a declared input. */
    public double[] get(String name) {
        double[] values = series.get(name);
        if (values == null)
            throw new IllegalArgumentException("Input '" + name + "' is not declared by formula " + formula);
        return values;
    }

    /** True when the input came from the dataset, false when it is a default. */
    public boolean isProvided(String name) {
        return provided.contains(name);
    }

    public double param(String name) {
        Double value = parameters.get(name);
        if (value == null)
            throw new IllegalArgumentException("Parameter '" + name + "' is not declared by formula " + formula);
        return value;
    }

    public Set<String> inputNames() {
        return series.keySet();
    }

    public Map<String, Double> parameters() {
        return parameters;
    }
}
