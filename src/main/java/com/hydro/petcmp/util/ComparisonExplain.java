package com.hydro.petcmp.util;

import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.engine.CapabilityResolver;
import com.hydro.petcmp.engine.ComputationResult;
import com.hydro.petcmp.engine.FormulaIssue;
import com.hydro.petcmp.engine.RunResult;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a catalog, its resolution against a
 * dataset, and the outcome of a run.
 *
 * <p>
 * Intended for debugging sessions and log output. Allocates strings freely.
 */
public final class ComparisonExplain {
    private final FormulaRegistry registry;
    private final CapabilityResolver resolver;

    public ComparisonExplain(FormulaRegistry registry) {
        this(registry, new CapabilityResolver());
    }

    public ComparisonExplain(FormulaRegistry registry, CapabilityResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    /**
     * Dumps the declaration of a single formula.
     */
    public String explainFormula(String name) {
        FormulaSpec spec = registry.require(name);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Formula: ").append(spec.name()).append('\n')
                .append("  Family: ").append(spec.family().tag()).append('\n')
                .append("  Required: ").append(String.join(", ", spec.requiredInputs())).append('\n');
        if (!spec.optionalInputs().isEmpty()) {
            sb.append("  Optional: ");
            appendPairs(sb, spec.optionalInputs());
            sb.append('\n');
        }
        if (!spec.parameters().isEmpty()) {
            sb.append("  Parameters: ");
            appendPairs(sb, spec.parameters());
            sb.append('\n');
        }
        if (spec.supportsPartition())
            sb.append("  Components: ").append(String.join(", ", spec.components())).append('\n');
        if (!spec.description().isEmpty())
            sb.append("  ").append(spec.description()).append('\n');
        return sb.toString();
    }

    /**
     * Lists which formulas would run against the dataset and why the others
     * would not. Nothing is executed.
     */
    public String explainResolution(ForcingDataset dataset) {
        CapabilityResolver.Resolution r = resolver.resolve(dataset, registry.allSpecs());
        StringBuilder sb = new StringBuilder(512);
        sb.append("Dataset: ").append(dataset.length()).append(" timesteps, variables ")
                .append(dataset.variables()).append('\n');
        sb.append("Runnable (").append(r.runnable().size()).append("/").append(registry.size()).append("):\n");
        for (FormulaSpec spec : r.runnable())
            sb.append("  ").append(spec.name()).append('\n');
        if (!r.skipped().isEmpty()) {
            sb.append("Skipped (").append(r.skipped().size()).append("):\n");
            for (FormulaIssue issue : r.skipped())
                sb.append("  ").append(issue.formula()).append(" - ").append(issue.reason()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Summarizes a finished run: computed formulas with their warnings, then
     * every skip and failure.
     */
    public String explainRun(RunResult run) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Computed: ").append(run.table().size()).append(", skipped: ").append(run.skipped().size())
                .append(", failed: ").append(run.failed().size()).append('\n');
        for (ComputationResult result : run.table().results()) {
            sb.append("  [OK]   ").append(result.formula());
            if (result.hasComponents())
                sb.append(" ").append(result.componentNames());
            sb.append('\n');
            for (String warning : result.warnings())
                sb.append("         warning: ").append(warning).append('\n');
        }
        List<FormulaIssue> issues = run.issues();
        for (FormulaIssue issue : issues) {
            sb.append(issue.isSkipped() ? "  [SKIP] " : "  [FAIL] ")
                    .append(issue.formula()).append(" - ").append(issue.reason()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the whole catalog, one line per formula.
     */
    public String dumpCatalog() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Catalog (").append(registry.size()).append(" formulas):\n");
        int i = 0;
        for (FormulaSpec spec : registry.allSpecs()) {
            sb.append("  [").append(i++).append("] ").append(spec.name())
                    .append(" (").append(spec.family().tag()).append(") <- ")
                    .append(String.join(", ", spec.requiredInputs()));
            if (spec.supportsPartition())
                sb.append(" => ").append(String.join(" + ", spec.components()));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendPairs(StringBuilder sb, Map<String, Double> pairs) {
        boolean first = true;
        for (Map.Entry<String, Double> e : pairs.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
    }
}
