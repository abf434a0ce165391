package com.hydro.petcmp.util;

import com.hydro.petcmp.TestDatasets;
import com.hydro.petcmp.engine.ExecutionEngine;
import com.hydro.petcmp.engine.RunResult;
import com.hydro.petcmp.registry.FormulaRegistry;
import org.junit.Test;

import static org.junit.Assert.*;

public class ComparisonExplainTest {

    private final FormulaRegistry registry = FormulaRegistry.withBuiltIns();
    private final ComparisonExplain explain = new ComparisonExplain(registry);

    @Test
    public void testExplainFormula() {
        String text = explain.explainFormula("PML");
        assertTrue(text.contains("Formula: PML"));
        assertTrue(text.contains("vegetation-aware"));
        assertTrue(text.contains("gc_max=0.006"));
        assertTrue(text.contains("Components: transpiration, evaporation"));
    }

    @Test
    public void testExplainResolution() {
        String text = explain.explainResolution(TestDatasets.coreFour());
        assertTrue(text.contains("Runnable (8/15)"));
        assertTrue(text.contains("PM-CO2 - missing: co2"));
    }

    @Test
    public void testExplainRun() {
        RunResult run = new ExecutionEngine(registry).runAll(TestDatasets.coreFour());
        String text = explain.explainRun(run);
        assertTrue(text.startsWith("Computed: 8, skipped: 7, failed: 0"));
        assertTrue(text.contains("[SKIP] PML - missing: lai"));
    }

    @Test
    public void testDumpCatalog() {
        String text = explain.dumpCatalog();
        assertTrue(text.startsWith("Catalog (15 formulas)"));
        assertTrue(text.contains("PT-JPL-Partition (vegetation-aware)"));
        assertTrue(text.contains("transpiration + canopy_evap + soil_evap"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownFormula() {
        explain.explainFormula("Nope");
    }
}
