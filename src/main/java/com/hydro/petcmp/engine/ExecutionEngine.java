package com.hydro.petcmp.engine;

import com.hydro.petcmp.api.ExecutionListener;
import com.hydro.petcmp.api.FormulaInputs;
import com.hydro.petcmp.api.FormulaOutput;
import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs every registered formula against a dataset and collects the results.
 *
 * Algorithm:
 * 1. Resolve: split the catalog into runnable formulas and skips, using only
 * the dataset's variable names.
 * 2. Invoke: call each runnable formula with its assembled inputs. In
 * sequential mode this happens in registration order on the calling thread;
 * in parallel mode each formula is submitted to the supplied executor.
 * 3. Merge: walk the catalog in registration order and place every outcome
 * into the results table or the issue list, so the result is identical in
 * both modes.
 *
 * Failure isolation:
 * A formula that throws anything, Errors included, or returns a total of the
 * wrong length, is recorded as FAILED and excluded from the table. It never aborts the run and never
 * affects another formula's result. A total containing non-finite values is
 * kept but reported to the listener as a warning.
 *
 * The engine holds no per-run state besides the run counter, so one instance
 * may be reused across datasets. It is not safe to call {@link #runAll} from
 * several threads at once.
 */
public final class ExecutionEngine {
    private static final Logger log = LogManager.getLogger(ExecutionEngine.class);

    private final FormulaRegistry registry;
    private final CapabilityResolver resolver;
    private final ExecutorService executor;

    private long runId;
    private ExecutionListener listener;

    public ExecutionEngine(FormulaRegistry registry) {
        this(registry, new CapabilityResolver(), null);
    }

    private ExecutionEngine(FormulaRegistry registry, CapabilityResolver resolver, ExecutorService executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = resolver;
        this.executor = executor;
    }

    /**
     * Creates an engine that invokes formulas concurrently on the given
     * executor. The caller owns the executor and is responsible for shutting
     * it down.
     */
    public static ExecutionEngine parallel(FormulaRegistry registry, ExecutorService executor) {
        return new ExecutionEngine(registry, new CapabilityResolver(), Objects.requireNonNull(executor, "executor"));
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public FormulaRegistry registry() {
        return registry;
    }

    public CapabilityResolver resolver() {
        return resolver;
    }

    public boolean isParallel() {
        return executor != null;
    }

    /** Number of batch runs started so far. */
    public long runCount() {
        return runId;
    }

    /**
     * Runs every runnable formula in the registry.
     *
     * @return The results table plus the reason for every formula absent from
     *         it. Never throws because of a formula's behavior.
     */
    public RunResult runAll(ForcingDataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        final long id = ++runId;
        final List<FormulaSpec> specs = registry.allSpecs();
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onRunStart(id, specs.size());

        CapabilityResolver.Resolution resolution = resolver.resolve(dataset, specs);
        Map<String, Outcome> outcomes = executor == null
                ? invokeSequential(resolution.runnable(), dataset)
                : invokeParallel(resolution.runnable(), dataset);

        Map<String, FormulaIssue> skips = new HashMap<>();
        for (FormulaIssue skip : resolution.skipped())
            skips.put(skip.formula(), skip);

        Map<String, ComputationResult> results = new LinkedHashMap<>();
        List<FormulaIssue> issues = new ArrayList<>();
        try {
            for (FormulaSpec spec : specs) {
                String name = spec.name();
                FormulaIssue skip = skips.get(name);
                if (skip != null) {
                    issues.add(skip);
                    log.debug("Run {}: skipped {} ({})", id, name, skip.reason());
                    if (hasListener)
                        l.onFormulaSkipped(id, name, skip.reason());
                    continue;
                }

                Outcome outcome = outcomes.get(name);
                if (outcome.error != null) {
                    issues.add(FormulaIssue.failed(name, outcome.error));
                    log.warn("Run {}: formula {} failed: {}", id, name, outcome.error.toString());
                    if (hasListener)
                        l.onFormulaError(id, name, outcome.error);
                    continue;
                }

                ComputationResult result = outcome.result;
                if (hasListener)
                    l.onFormulaComputed(id, name, outcome.durationNanos);

                int nonFinite = countNonFinite(result);
                if (nonFinite > 0) {
                    String warning = "total has " + nonFinite + " non-finite value(s)";
                    result = result.withWarning(warning);
                    log.debug("Run {}: {} {}", id, name, warning);
                    if (hasListener)
                        l.onFormulaWarning(id, name, warning);
                }
                results.put(name, result);
            }
        } finally {
            if (hasListener)
                l.onRunEnd(id, results.size());
        }

        log.info("Run {}: {} computed, {} skipped, {} failed over {} timesteps",
                id, results.size(), resolution.skipped().size(),
                issues.size() - resolution.skipped().size(), dataset.length());
        return new RunResult(new ResultsTable(dataset.timestamps(), results), issues);
    }

    /**
     * Runs one formula by name with strict error semantics.
     *
     * @throws IllegalArgumentException   if the name is not registered.
     * @throws MissingInputsException     if a required input is absent.
     * @throws FormulaExecutionException  if the formula raises or returns an
     *                                    invalid output.
     */
    public ComputationResult runOne(String name, ForcingDataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        FormulaSpec spec = registry.require(name);
        FormulaInputs inputs = resolver.assemble(dataset, spec);
        Outcome outcome = invoke(spec, inputs);
        if (outcome.error != null)
            throw new FormulaExecutionException(name, outcome.error);
        return outcome.result;
    }

    private Map<String, Outcome> invokeSequential(List<FormulaSpec> runnable, ForcingDataset dataset) {
        Map<String, Outcome> out = new HashMap<>();
        for (FormulaSpec spec : runnable)
            out.put(spec.name(), invoke(spec, resolver.assemble(dataset, spec)));
        return out;
    }

    private Map<String, Outcome> invokeParallel(List<FormulaSpec> runnable, ForcingDataset dataset) {
        // Inputs are assembled up front so worker threads only touch their own arrays.
        Map<String, Future<Outcome>> futures = new LinkedHashMap<>();
        for (FormulaSpec spec : runnable) {
            FormulaInputs inputs = resolver.assemble(dataset, spec);
            futures.put(spec.name(), executor.submit(() -> invoke(spec, inputs)));
        }

        Map<String, Outcome> out = new HashMap<>();
        for (Map.Entry<String, Future<Outcome>> e : futures.entrySet()) {
            try {
                out.put(e.getKey(), e.getValue().get());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for formula " + e.getKey(), ie);
            } catch (ExecutionException ee) {
                out.put(e.getKey(), Outcome.failure(ee.getCause(), 0L));
            }
        }
        return out;
    }

    private Outcome invoke(FormulaSpec spec, FormulaInputs inputs) {
        long start = System.nanoTime();
        try {
            FormulaOutput output = spec.formula().compute(inputs);
            validate(spec, output, inputs.length());
            return Outcome.success(ComputationResult.from(spec.name(), output), System.nanoTime() - start);
        } catch (Throwable e) {
            return Outcome.failure(e, System.nanoTime() - start);
        }
    }

    private static void validate(FormulaSpec spec, FormulaOutput output, int length) {
        if (output == null || output.total() == null)
            throw new InvalidOutputException("Formula " + spec.name() + " returned no total");
        if (output.total().length != length) {
            throw new InvalidOutputException("Formula " + spec.name() + " returned " + output.total().length
                    + " values, expected " + length);
        }
        for (Map.Entry<String, double[]> c : output.components().entrySet()) {
            if (!spec.components().contains(c.getKey())) {
                throw new InvalidOutputException("Formula " + spec.name() + " returned undeclared component '"
                        + c.getKey() + "'");
            }
            if (c.getValue() == null || c.getValue().length != length) {
                throw new InvalidOutputException("Component '" + c.getKey() + "' of formula " + spec.name()
                        + " does not match the time axis");
            }
        }
    }

    private static int countNonFinite(ComputationResult result) {
        int count = 0;
        for (int i = 0; i < result.length(); i++) {
            if (!Double.isFinite(result.totalAt(i)))
                count++;
        }
        return count;
    }

    private static final class Outcome {
        final ComputationResult result;
        final Throwable error;
        final long durationNanos;

        private Outcome(ComputationResult result, Throwable error, long durationNanos) {
            this.result = result;
            this.error = error;
            this.durationNanos = durationNanos;
        }

        static Outcome success(ComputationResult result, long durationNanos) {
            return new Outcome(result, null, durationNanos);
        }

        static Outcome failure(Throwable error, long durationNanos) {
            return new Outcome(null, error, durationNanos);
        }
    }
}
