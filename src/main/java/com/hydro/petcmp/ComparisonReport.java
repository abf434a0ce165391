package com.hydro.petcmp;

import com.hydro.petcmp.engine.FormulaIssue;
import com.hydro.petcmp.engine.ResultsTable;
import com.hydro.petcmp.engine.RunResult;
import com.hydro.petcmp.partition.PartitionMismatch;
import com.hydro.petcmp.stats.StatisticsArtifacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a comparison produces for one dataset.
 *
 * @param name              Comparison name, from configuration or a default.
 * @param table             Results with partition warnings attached.
 * @param issues            Skips and failures, in registration order.
 * @param components        Formula name to component series, for partitioned
 *                          results only.
 * @param partitionWarnings Formulas whose components do not sum to the total.
 * @param statistics        Summary, correlation and difference matrices.
 */
public record ComparisonReport(String name, ResultsTable table, List<FormulaIssue> issues,
        Map<String, Map<String, double[]>> components, Map<String, PartitionMismatch> partitionWarnings,
        StatisticsArtifacts statistics) {

    public ComparisonReport {
        issues = List.copyOf(issues);
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        partitionWarnings = Collections.unmodifiableMap(new LinkedHashMap<>(partitionWarnings));
    }

    /** The run result view of this report. */
    public RunResult run() {
        return new RunResult(table, issues);
    }
}
