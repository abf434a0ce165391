package com.hydro.petcmp.fn;

import com.hydro.petcmp.api.EtFormula;
import com.hydro.petcmp.api.FormulaInputs;
import com.hydro.petcmp.api.FormulaOutput;

import java.util.Arrays;

/**
 * Base class for formulas evaluated one timestep at a time.
 * <p>
 * The base loops over the time axis and hands each step to
 * {@link #calculate(Step, double[])}. A step where any input is NaN yields
 * NaN for the total and every component without calling the subclass.
 * Exceptions raised by the subclass propagate to the engine.
 * <p>
 * Output slot 0 is the total, slots 1..k are the components in the order
 * given to the constructor.
 */
public abstract class AbstractEtFormula implements EtFormula {
    private final String[] components;

    protected AbstractEtFormula(String... components) {
        this.components = components.clone();
    }

    @Override
    public final FormulaOutput compute(FormulaInputs inputs) {
        final int n = inputs.length();
        final int width = 1 + components.length;
        final double[][] columns = new double[width][n];
        final double[][] series = inputs.inputNames().stream().map(inputs::get).toArray(double[][]::new);
        final double[] out = new double[width];
        final Step step = new Step(inputs);

        for (int t = 0; t < n; t++) {
            if (anyNaN(series, t)) {
                for (double[] column : columns)
                    column[t] = Double.NaN;
                continue;
            }
            Arrays.fill(out, 0.0);
            step.t = t;
            calculate(step, out);
            for (int c = 0; c < width; c++)
                columns[c][t] = out[c];
        }

        FormulaOutput.Builder builder = FormulaOutput.builder(columns[0]);
        for (int c = 0; c < components.length; c++)
            builder.component(components[c], columns[c + 1]);
        return builder.build();
    }

    /**
     * Subclasses implement one timestep here.
     *
     * @param step Accessor for the current timestep's inputs and parameters.
     * @param out  Output slots, zeroed before each call.
     */
    protected abstract void calculate(Step step, double[] out);

    private static boolean anyNaN(double[][] series, int t) {
        for (double[] s : series) {
            if (Double.isNaN(s[t]))
                return true;
        }
        return false;
    }

    /** Read access to one timestep of an invocation. */
    protected static final class Step {
        private final FormulaInputs inputs;
        private int t;

        private Step(FormulaInputs inputs) {
            this.inputs = inputs;
        }

        public double get(String input) {
            return inputs.get(input)[t];
        }

        public double param(String name) {
            return inputs.param(name);
        }
    }
}
