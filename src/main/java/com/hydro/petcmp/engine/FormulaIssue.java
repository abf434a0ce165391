package com.hydro.petcmp.engine;

import java.util.List;

/**
 * Why a formula is missing from a results table.
 *
 * @param formula Formula name.
 * @param kind    Skipped (capability gap) or failed (raised during invocation).
 * @param reason  Human-readable reason, e.g. {@code missing: lai}.
 */
public record FormulaIssue(String formula, Kind kind, String reason) {

    public enum Kind {
        SKIPPED,
        FAILED
    }

    public static FormulaIssue skipped(String formula, List<String> missingInputs) {
        return new FormulaIssue(formula, Kind.SKIPPED, "missing: " + String.join(", ", missingInputs));
    }

    public static FormulaIssue failed(String formula, Throwable error) {
        String message = error.getMessage();
        return new FormulaIssue(formula, Kind.FAILED,
                error.getClass().getSimpleName() + (message != null ? ": " + message : ""));
    }

    public boolean isSkipped() {
        return kind == Kind.SKIPPED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
