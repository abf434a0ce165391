package com.hydro.petcmp.engine;

import com.hydro.petcmp.api.FormulaInputs;
import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.registry.FormulaSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which formulas can run against a dataset and assembles their
 * argument sets.
 *
 * <p>
 * Resolution is a pure membership test: a formula runs only when every
 * required input is a dataset variable. Nothing is coerced or defaulted for
 * required inputs. Optional inputs the dataset lacks are expanded from the
 * formula's declared default so that every invocation receives a complete
 * argument set.
 */
public final class CapabilityResolver {

    /** The result of resolving a list of specs against one dataset. */
    public record Resolution(List<FormulaSpec> runnable, List<FormulaIssue> skipped) {
        public Resolution {
            runnable = List.copyOf(runnable);
            skipped = List.copyOf(skipped);
        }
    }

    /** Specs whose required inputs are all present, in the given order. */
    public List<FormulaSpec> runnable(ForcingDataset dataset, List<FormulaSpec> specs) {
        List<FormulaSpec> out = new ArrayList<>();
        for (FormulaSpec spec : specs) {
            if (isRunnable(dataset, spec))
                out.add(spec);
        }
        return out;
    }

    public boolean isRunnable(ForcingDataset dataset, FormulaSpec spec) {
        for (String input : spec.requiredInputs()) {
            if (!dataset.has(input))
                return false;
        }
        return true;
    }

    /** Required inputs absent from the dataset, in declaration order. */
    public List<String> missingInputs(ForcingDataset dataset, FormulaSpec spec) {
        List<String> missing = new ArrayList<>();
        for (String input : spec.requiredInputs()) {
            if (!dataset.has(input))
                missing.add(input);
        }
        return missing;
    }

    /** Splits specs into runnable ones and skips, without running anything. */
    public Resolution resolve(ForcingDataset dataset, List<FormulaSpec> specs) {
        List<FormulaSpec> runnable = new ArrayList<>();
        List<FormulaIssue> skipped = new ArrayList<>();
        for (FormulaSpec spec : specs) {
            List<String> missing = missingInputs(dataset, spec);
            if (missing.isEmpty())
                runnable.add(spec);
            else
                skipped.add(FormulaIssue.skipped(spec.name(), missing));
        }
        return new Resolution(runnable, skipped);
    }

    /**
     * Builds the complete argument set for one invocation.
     *
     * @throws MissingInputsException if a required input is absent.
     */
    public FormulaInputs assemble(ForcingDataset dataset, FormulaSpec spec) {
        List<String> missing = missingInputs(dataset, spec);
        if (!missing.isEmpty())
            throw new MissingInputsException(spec.name(), missing);

        int n = dataset.length();
        Map<String, double[]> series = new LinkedHashMap<>();
        Set<String> provided = new HashSet<>();

        for (String input : spec.requiredInputs()) {
            series.put(input, dataset.values(input));
            provided.add(input);
        }
        for (Map.Entry<String, Double> opt : spec.optionalInputs().entrySet()) {
            if (dataset.has(opt.getKey())) {
                series.put(opt.getKey(), dataset.values(opt.getKey()));
                provided.add(opt.getKey());
            } else {
                double[] filled = new double[n];
                Arrays.fill(filled, opt.getValue());
                series.put(opt.getKey(), filled);
            }
        }
        return new FormulaInputs(spec.name(), n, series, provided, spec.parameters());
    }
}
