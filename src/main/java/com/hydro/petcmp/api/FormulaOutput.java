package com.hydro.petcmp.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a formula returns: a {@code total} series plus optional named
 * component series (e.g. transpiration, evaporation).
 */
public final class FormulaOutput {
    public static final String TOTAL = "total";

    private final double[] total;
    private final Map<String, double[]> components;

    private FormulaOutput(double[] total, Map<String, double[]> components) {
        this.total = total;
        this.components = components;
    }

    /** Output of a single-series formula. */
    public static FormulaOutput of(double[] total) {
        return new FormulaOutput(total, Collections.emptyMap());
    }

    public static Builder builder(double[] total) {
        return new Builder(total);
    }

    public double[] total() {
        return total;
    }

    /** Component series in declaration order; empty for single-series formulas. */
    public Map<String, double[]> components() {
        return components;
    }

    public boolean hasComponents() {
        return !components.isEmpty();
    }

    public static final class Builder {
        private final double[] total;
        private final Map<String, double[]> components = new LinkedHashMap<>();

        private Builder(double[] total) {
            this.total = total;
        }

        public Builder component(String name, double[] values) {
            if (TOTAL.equals(name))
                throw new IllegalArgumentException("'total' is not a component name");
            components.put(name, values);
            return this;
        }

        public FormulaOutput build() {
            return new FormulaOutput(total, Collections.unmodifiableMap(components));
        }
    }
}
