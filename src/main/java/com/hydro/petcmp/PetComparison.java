package com.hydro.petcmp;

import com.hydro.petcmp.api.ExecutionListener;
import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.engine.ComputationResult;
import com.hydro.petcmp.engine.ExecutionEngine;
import com.hydro.petcmp.engine.ResultsTable;
import com.hydro.petcmp.engine.RunResult;
import com.hydro.petcmp.io.ComparisonConfigLoader;
import com.hydro.petcmp.io.ComparisonDefinition;
import com.hydro.petcmp.partition.ComponentPartitioner;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.stats.StatisticsArtifacts;
import com.hydro.petcmp.stats.StatisticsEngine;
import com.hydro.petcmp.util.ComparisonExplain;
import com.hydro.petcmp.util.CompositeExecutionListener;
import com.hydro.petcmp.util.FormulaProfileListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

/**
 * High-level entry point that wires the registry, execution engine,
 * partitioner and statistics together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the registry from the built-in catalog or a JSON
 * configuration</li>
 * <li>Running every applicable formula against a dataset</li>
 * <li>Checking partition consistency and computing cross-formula
 * statistics</li>
 * <li>Fanning engine callbacks out to registered listeners</li>
 * </ul>
 */
public class PetComparison {
    private static final Logger log = LogManager.getLogger(PetComparison.class);
    static final String DEFAULT_NAME = "pet-comparison";

    private final String name;
    private final FormulaRegistry registry;
    private final ExecutionEngine engine;
    private final ComponentPartitioner partitioner;
    private final StatisticsEngine statistics = new StatisticsEngine();
    private final CompositeExecutionListener compositeListener = new CompositeExecutionListener();

    public PetComparison(FormulaRegistry registry) {
        this(DEFAULT_NAME, registry, new ExecutionEngine(registry), new ComponentPartitioner());
    }

    private PetComparison(String name, FormulaRegistry registry, ExecutionEngine engine,
            ComponentPartitioner partitioner) {
        this.name = name;
        this.registry = registry;
        this.engine = engine;
        this.partitioner = partitioner;
        this.engine.setListener(compositeListener);
    }

    /** A comparison over the full built-in catalog. */
    public static PetComparison withBuiltIns() {
        return new PetComparison(FormulaRegistry.withBuiltIns());
    }

    /** A comparison that runs formulas concurrently on the given executor. */
    public static PetComparison parallel(FormulaRegistry registry, ExecutorService executor) {
        return new PetComparison(DEFAULT_NAME, registry, ExecutionEngine.parallel(registry, executor),
                new ComponentPartitioner());
    }

    /**
     * A comparison built from a parsed configuration. Unknown formulas or
     * options fail here with a RegistrationException.
     */
    public static PetComparison fromConfig(ComparisonDefinition def) {
        FormulaRegistry registry = ComparisonConfigLoader.toRegistry(def);
        String name = def.getComparison().getName() != null ? def.getComparison().getName() : DEFAULT_NAME;
        return new PetComparison(name, registry, new ExecutionEngine(registry),
                new ComponentPartitioner(ComparisonConfigLoader.partitionTolerance(def)));
    }

    /** A comparison built from a JSON configuration file. */
    public static PetComparison fromConfig(Path path) {
        return fromConfig(ComparisonConfigLoader.load(path));
    }

    /**
     * Runs every applicable formula and derives partitions and statistics.
     * Never fails because of an individual formula.
     */
    public ComparisonReport compare(ForcingDataset dataset) {
        RunResult run = engine.runAll(dataset);
        ResultsTable table = partitioner.enrich(run.table(), registry);
        StatisticsArtifacts stats = statistics.artifacts(table);
        log.info("Comparison '{}' finished: {} of {} formulas produced results", name, table.size(),
                registry.size());
        return new ComparisonReport(name, table, run.issues(), partitioner.components(table, registry),
                partitioner.mismatches(table, registry), stats);
    }

    /**
     * Runs one formula directly; errors propagate to the caller.
     *
     * @see ExecutionEngine#runOne(String, ForcingDataset)
     */
    public ComputationResult run(String formula, ForcingDataset dataset) {
        return engine.runOne(formula, dataset);
    }

    /**
     * Registers a listener for engine callbacks. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(ExecutionListener listener) {
        compositeListener.add(listener);
    }

    /**
     * Enables per-formula profiling.
     * Use the returned listener to dump statistics.
     */
    public FormulaProfileListener enableProfiling() {
        var profileListener = new FormulaProfileListener();
        compositeListener.add(profileListener);
        return profileListener;
    }

    public ComparisonExplain explain() {
        return new ComparisonExplain(registry, engine.resolver());
    }

    public String getName() {
        return name;
    }

    public FormulaRegistry getRegistry() {
        return registry;
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    public ComponentPartitioner getPartitioner() {
        return partitioner;
    }
}
