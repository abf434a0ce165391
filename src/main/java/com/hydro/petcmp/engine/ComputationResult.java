package com.hydro.petcmp.engine;

import com.hydro.petcmp.api.FormulaOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of one formula over the whole time axis: a {@code total} series and,
 * for partitioning formulas, named component series.
 *
 * <p>
 * Immutable. Series are copied out, and attaching a warning yields a new
 * instance.
 */
public final class ComputationResult {
    private final String formula;
    private final double[] total;
    private final Map<String, double[]> components;
    private final List<String> warnings;

    public ComputationResult(String formula, double[] total, Map<String, double[]> components) {
        this(formula, total.clone(), copyOf(components), List.of());
    }

    private ComputationResult(String formula, double[] total, Map<String, double[]> components,
            List<String> warnings) {
        this.formula = formula;
        this.total = total;
        this.components = components;
        this.warnings = warnings;
    }

    /** Wraps a formula's output without further validation. */
    static ComputationResult from(String formula, FormulaOutput output) {
        return new ComputationResult(formula, output.total(), output.components());
    }

    public String formula() {
        return formula;
    }

    public int length() {
        return total.length;
    }

    public double[] total() {
        return total.clone();
    }

    public double totalAt(int index) {
        return total[index];
    }

    public boolean hasComponents() {
        return !components.isEmpty();
    }

    public Set<String> componentNames() {
        return components.keySet();
    }

    public double[] component(String name) {
        double[] values = components.get(name);
        if (values == null)
            throw new IllegalArgumentException("Formula " + formula + " has no component '" + name + "'");
        return values.clone();
    }

    /** Copies of all component series, in the order the formula produced them. */
    public Map<String, double[]> components() {
        return copyOf(components);
    }

    /** Data-quality warnings attached to this result. */
    public List<String> warnings() {
        return warnings;
    }

    public ComputationResult withWarning(String warning) {
        List<String> next = new ArrayList<>(warnings);
        next.add(warning);
        return new ComputationResult(formula, total, components, Collections.unmodifiableList(next));
    }

    private static Map<String, double[]> copyOf(Map<String, double[]> source) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : source.entrySet())
            copy.put(e.getKey(), e.getValue().clone());
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ComputationResult[" + formula + ", components=" + components.keySet()
                + ", warnings=" + warnings.size() + "]";
    }
}
