package com.hydro.petcmp.api;

/**
 * Observability interface for monitoring a comparison run.
 *
 * <p>
 * Implementations can be registered with the ExecutionEngine to receive
 * callbacks while formulas are resolved and invoked. This is the primary
 * mechanism for:
 *
 * - Profiling: measuring how long each formula takes.
 * - Debugging: tracing which formulas were skipped or failed, and why.
 * - Reporting: collecting data-quality warnings as they happen.
 *
 * When the engine runs in parallel mode, per-formula callbacks are issued
 * from the calling thread after the results are merged, in registration
 * order. Implementations therefore never need to be thread-safe.
 */
public interface ExecutionListener {

    /**
     * Called before any formula is invoked.
     *
     * @param runId        Incrementing run number of the engine.
     * @param formulaCount Number of formulas considered in this run.
     */
    void onRunStart(long runId, int formulaCount);

    /**
     * Called after a formula produced a valid result.
     *
     * @param runId         Current run number.
     * @param formula       Formula name.
     * @param durationNanos Wall time spent inside the formula.
     */
    void onFormulaComputed(long runId, String formula, long durationNanos);

    /**
     * Called when a formula was excluded because required inputs are absent.
     *
     * @param reason Text of the form {@code missing: lai, co2}.
     */
    void onFormulaSkipped(long runId, String formula, String reason);

    /**
     * Called when a formula raised or returned an invalid output.
     */
    void onFormulaError(long runId, String formula, Throwable error);

    /**
     * Called for non-fatal data-quality findings, such as a total series
     * containing non-finite values.
     */
    void onFormulaWarning(long runId, String formula, String message);

    /**
     * Called when the run is complete.
     *
     * @param runId     Current run number.
     * @param succeeded Number of formulas present in the results table.
     */
    void onRunEnd(long runId, int succeeded);
}
