package com.hydro.petcmp.engine;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a batch run: the table of whatever succeeded plus a parallel
 * list of skip and failure reasons, both in registration order.
 */
public record RunResult(ResultsTable table, List<FormulaIssue> issues) {

    public RunResult {
        issues = List.copyOf(issues);
    }

    public List<FormulaIssue> skipped() {
        return issues.stream().filter(FormulaIssue::isSkipped).toList();
    }

    public List<FormulaIssue> failed() {
        return issues.stream().filter(FormulaIssue::isFailed).toList();
    }

    public Optional<FormulaIssue> issueFor(String formula) {
        return issues.stream().filter(i -> i.formula().equals(formula)).findFirst();
    }

    /** True when every considered formula produced a result. */
    public boolean isComplete() {
        return issues.isEmpty();
    }
}
