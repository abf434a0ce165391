package com.hydro.petcmp.engine;

import com.hydro.petcmp.TestDatasets;
import com.hydro.petcmp.api.ExecutionListener;
import com.hydro.petcmp.api.FormulaOutput;
import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.registry.AlgorithmFamily;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.hydro.petcmp.data.Variables.*;
import static org.junit.Assert.*;

public class ExecutionEngineTest {

    private FormulaRegistry registry;
    private ExecutionEngine engine;

    // Tracking callbacks
    private List<String> events;

    @Before
    public void setUp() {
        registry = FormulaRegistry.withBuiltIns();
        engine = new ExecutionEngine(registry);
        events = new ArrayList<>();
        engine.setListener(new RecordingListener(events));
    }

    private static FormulaSpec divideByZero() {
        return FormulaSpec.builder("Broken", AlgorithmFamily.RADIATION_BASED)
                .requires(TEMPERATURE)
                .formula(in -> {
                    int zero = 0;
                    int n = in.length() / zero;
                    return FormulaOutput.of(new double[n]);
                })
                .build();
    }

    @Test
    public void testCoreFourScenario() {
        RunResult run = engine.runAll(TestDatasets.coreFour());

        assertEquals(List.of("PM", "PM-General", "PT", "PT-JPL", "CR-Bouchet", "CR-AA", "CR-GG", "CR-Nonlinear"),
                run.table().formulas());
        assertEquals(7, run.skipped().size());
        assertTrue(run.failed().isEmpty());
        assertEquals("missing: lai", run.issueFor("PML").orElseThrow().reason());
        assertEquals("missing: co2", run.issueFor("PM-CO2").orElseThrow().reason());
        assertEquals("missing: lai, co2", run.issueFor("PM-CO2-LAI").orElseThrow().reason());
        assertEquals("missing: vpd", run.issueFor("PT-Advection").orElseThrow().reason());

        for (ComputationResult r : run.table().results()) {
            assertEquals(3, r.length());
            for (int i = 0; i < 3; i++)
                assertTrue(r.formula() + " should be finite", Double.isFinite(r.totalAt(i)));
        }
    }

    @Test
    public void testMissingWindScenario() {
        RunResult run = engine.runAll(TestDatasets.noWind());

        assertEquals(List.of("PT", "PT-JPL", "CR-Bouchet", "CR-GG", "CR-Nonlinear"), run.table().formulas());
        assertEquals("missing: wind_speed", run.issueFor("PM").orElseThrow().reason());
        assertEquals("missing: wind_speed", run.issueFor("CR-AA").orElseThrow().reason());
        assertEquals(FormulaIssue.Kind.SKIPPED, run.issueFor("PM-General").orElseThrow().kind());
        for (ComputationResult r : run.table().results()) {
            assertEquals(3, r.total().length);
            assertFalse(r.hasComponents());
        }
    }

    @Test
    public void testIssuesFollowRegistrationOrder() {
        RunResult run = engine.runAll(TestDatasets.coreFour());
        List<String> skipped = run.issues().stream().map(FormulaIssue::formula).toList();
        assertEquals(List.of("PT-Advection", "PT-JPL-Partition", "PML", "PML-V2", "PM-CO2", "PM-CO2-LAI",
                "Hargreaves"), skipped);
    }

    @Test
    public void testRunsAreDeterministic() {
        ForcingDataset ds = TestDatasets.full();
        RunResult first = engine.runAll(ds);
        RunResult second = engine.runAll(ds);

        assertEquals(first.table().formulas(), second.table().formulas());
        for (String name : first.table().formulas()) {
            assertArrayEquals(first.table().require(name).total(), second.table().require(name).total(), 0.0);
        }
        assertEquals(first.issues(), second.issues());
        assertEquals(2, engine.runCount());
    }

    @Test
    public void testFailingFormulaIsIsolated() {
        ForcingDataset ds = TestDatasets.coreFour();
        RunResult baseline = engine.runAll(ds);

        FormulaRegistry withBroken = FormulaRegistry.withBuiltIns().register(divideByZero());
        RunResult run = new ExecutionEngine(withBroken).runAll(ds);

        assertFalse(run.table().contains("Broken"));
        FormulaIssue issue = run.issueFor("Broken").orElseThrow();
        assertEquals(FormulaIssue.Kind.FAILED, issue.kind());
        assertTrue(issue.reason(), issue.reason().contains("ArithmeticException"));
        assertTrue(issue.reason(), issue.reason().contains("/ by zero"));

        assertEquals(baseline.table().formulas(), run.table().formulas());
        for (String name : baseline.table().formulas()) {
            assertArrayEquals(baseline.table().require(name).total(), run.table().require(name).total(), 0.0);
        }
    }

    private static FormulaSpec overflowing() {
        return FormulaSpec.builder("Recursive", AlgorithmFamily.RADIATION_BASED)
                .requires(TEMPERATURE)
                .formula(in -> {
                    throw new StackOverflowError("deep recursion");
                })
                .build();
    }

    @Test
    public void testFormulaThrowingErrorIsIsolated() {
        ForcingDataset ds = TestDatasets.coreFour();
        RunResult baseline = engine.runAll(ds);

        FormulaRegistry reg = FormulaRegistry.withBuiltIns().register(overflowing());
        ExecutionEngine e = new ExecutionEngine(reg);
        List<String> seen = new ArrayList<>();
        e.setListener(new RecordingListener(seen));
        RunResult run = e.runAll(ds);

        assertEquals(baseline.table().formulas(), run.table().formulas());
        FormulaIssue issue = run.issueFor("Recursive").orElseThrow();
        assertTrue(issue.isFailed());
        assertTrue(issue.reason(), issue.reason().contains("StackOverflowError"));
        assertTrue(seen.contains("error:Recursive:StackOverflowError"));
        assertEquals("end:1:8", seen.get(seen.size() - 1));
    }

    @Test
    public void testFormulaThrowingErrorIsIsolatedInParallel() {
        FormulaRegistry reg = FormulaRegistry.withBuiltIns().register(overflowing());
        ForcingDataset ds = TestDatasets.coreFour();
        RunResult sequential = new ExecutionEngine(reg).runAll(ds);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            RunResult concurrent = ExecutionEngine.parallel(reg, executor).runAll(ds);
            assertEquals(8, concurrent.table().size());
            assertEquals(sequential.issues(), concurrent.issues());
            assertTrue(concurrent.issueFor("Recursive").orElseThrow().isFailed());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testRunOneWrapsError() {
        ExecutionEngine e = new ExecutionEngine(new FormulaRegistry().register(overflowing()));
        try {
            e.runOne("Recursive", TestDatasets.coreFour());
            fail("Expected FormulaExecutionException");
        } catch (FormulaExecutionException ex) {
            assertTrue(ex.getCause() instanceof StackOverflowError);
        }
    }

    @Test
    public void testListenerSeesRunInRegistrationOrder() {
        engine.runAll(TestDatasets.coreFour());

        assertEquals("start:1:15", events.get(0));
        assertEquals("computed:PM", events.get(1));
        assertEquals("computed:PM-General", events.get(2));
        assertEquals("computed:PT", events.get(3));
        assertEquals("skipped:PT-Advection:missing: vpd", events.get(4));
        assertEquals("end:1:8", events.get(events.size() - 1));
        assertEquals(17, events.size());
    }

    @Test
    public void testListenerSeesErrors() {
        FormulaRegistry reg = new FormulaRegistry().register(divideByZero());
        ExecutionEngine e = new ExecutionEngine(reg);
        e.setListener(new RecordingListener(events));
        e.runAll(TestDatasets.coreFour());
        assertEquals(List.of("start:1:1", "error:Broken:ArithmeticException", "end:1:0"), events);
    }

    @Test
    public void testWrongLengthOutputIsFailure() {
        FormulaRegistry reg = new FormulaRegistry().register(FormulaSpec.builder("Short", AlgorithmFamily.COMBINATION)
                .requires(TEMPERATURE)
                .formula(in -> FormulaOutput.of(new double[in.length() - 1]))
                .build());
        RunResult run = new ExecutionEngine(reg).runAll(TestDatasets.coreFour());

        assertTrue(run.table().isEmpty());
        FormulaIssue issue = run.issueFor("Short").orElseThrow();
        assertTrue(issue.isFailed());
        assertTrue(issue.reason(), issue.reason().startsWith("InvalidOutputException"));
    }

    @Test
    public void testUndeclaredComponentIsFailure() {
        FormulaRegistry reg = new FormulaRegistry().register(FormulaSpec.builder("Sneaky", AlgorithmFamily.COMBINATION)
                .requires(TEMPERATURE)
                .formula(in -> FormulaOutput.builder(new double[in.length()])
                        .component("runoff", new double[in.length()])
                        .build())
                .build());
        RunResult run = new ExecutionEngine(reg).runAll(TestDatasets.coreFour());
        assertTrue(run.issueFor("Sneaky").orElseThrow().isFailed());
    }

    @Test
    public void testNonFiniteTotalIsKeptWithWarning() {
        FormulaRegistry reg = new FormulaRegistry().register(FormulaSpec.builder("Gappy", AlgorithmFamily.COMBINATION)
                .requires(TEMPERATURE)
                .formula(in -> FormulaOutput.of(new double[] { Double.NaN, 1.0, 2.0 }))
                .build());
        ExecutionEngine e = new ExecutionEngine(reg);
        e.setListener(new RecordingListener(events));
        RunResult run = e.runAll(TestDatasets.coreFour());

        ComputationResult r = run.table().require("Gappy");
        assertEquals(1, r.warnings().size());
        assertTrue(run.isComplete());
        assertTrue(events.contains("warning:Gappy"));
    }

    @Test
    public void testNaNInputPropagatesToThatTimestepOnly() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 3)
                .variable(TEMPERATURE, 20, Double.NaN, 25)
                .variable(NET_RADIATION, 15, 18, 20)
                .build();
        ComputationResult pt = engine.runOne("PT", ds);
        assertTrue(Double.isFinite(pt.totalAt(0)));
        assertTrue(Double.isNaN(pt.totalAt(1)));
        assertTrue(Double.isFinite(pt.totalAt(2)));
    }

    @Test
    public void testRunOneMatchesBatchResult() {
        ForcingDataset ds = TestDatasets.coreFour();
        RunResult run = engine.runAll(ds);
        assertArrayEquals(run.table().require("PM").total(), engine.runOne("PM", ds).total(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunOneUnknownFormula() {
        engine.runOne("Thornthwaite", TestDatasets.coreFour());
    }

    @Test
    public void testRunOneMissingInputs() {
        try {
            engine.runOne("PML", TestDatasets.coreFour());
            fail("Expected MissingInputsException");
        } catch (MissingInputsException e) {
            assertEquals(List.of(LAI), e.missing());
        }
    }

    @Test
    public void testRunOnePropagatesFailure() {
        ExecutionEngine e = new ExecutionEngine(new FormulaRegistry().register(divideByZero()));
        try {
            e.runOne("Broken", TestDatasets.coreFour());
            fail("Expected FormulaExecutionException");
        } catch (FormulaExecutionException ex) {
            assertEquals("Broken", ex.formula());
            assertTrue(ex.getCause() instanceof ArithmeticException);
        }
    }

    @Test
    public void testParallelRunEqualsSequentialRun() {
        FormulaRegistry reg = FormulaRegistry.withBuiltIns().register(divideByZero());
        ForcingDataset ds = TestDatasets.full();
        RunResult sequential = new ExecutionEngine(reg).runAll(ds);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            ExecutionEngine parallel = ExecutionEngine.parallel(reg, executor);
            List<String> parallelEvents = new ArrayList<>();
            parallel.setListener(new RecordingListener(parallelEvents));
            RunResult concurrent = parallel.runAll(ds);

            assertTrue(parallel.isParallel());
            assertEquals(sequential.table().formulas(), concurrent.table().formulas());
            for (String name : sequential.table().formulas()) {
                assertArrayEquals(sequential.table().require(name).total(),
                        concurrent.table().require(name).total(), 0.0);
            }
            assertEquals(sequential.issues(), concurrent.issues());
            assertEquals("computed:PM", parallelEvents.get(1));
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class RecordingListener implements ExecutionListener {
        private final List<String> events;

        RecordingListener(List<String> events) {
            this.events = events;
        }

        @Override
        public void onRunStart(long runId, int formulaCount) {
            events.add("start:" + runId + ":" + formulaCount);
        }

        @Override
        public void onFormulaComputed(long runId, String formula, long durationNanos) {
            events.add("computed:" + formula);
        }

        @Override
        public void onFormulaSkipped(long runId, String formula, String reason) {
            events.add("skipped:" + formula + ":" + reason);
        }

        @Override
        public void onFormulaError(long runId, String formula, Throwable error) {
            events.add("error:" + formula + ":" + error.getClass().getSimpleName());
        }

        @Override
        public void onFormulaWarning(long runId, String formula, String message) {
            events.add("warning:" + formula);
        }

        @Override
        public void onRunEnd(long runId, int succeeded) {
            events.add("end:" + runId + ":" + succeeded);
        }
    }
}
