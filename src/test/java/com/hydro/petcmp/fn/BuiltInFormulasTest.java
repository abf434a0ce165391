package com.hydro.petcmp.fn;

import com.hydro.petcmp.TestDatasets;
import com.hydro.petcmp.data.ForcingDataset;
import com.hydro.petcmp.engine.ComputationResult;
import com.hydro.petcmp.engine.ExecutionEngine;
import com.hydro.petcmp.engine.RunResult;
import com.hydro.petcmp.fn.et.Co2Response;
import com.hydro.petcmp.fn.et.PenmanMonteithCo2;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static com.hydro.petcmp.data.Variables.*;
import static org.junit.Assert.*;

public class BuiltInFormulasTest {

    private FormulaRegistry registry;
    private ExecutionEngine engine;

    @Before
    public void setUp() {
        registry = FormulaRegistry.withBuiltIns();
        engine = new ExecutionEngine(registry);
    }

    @Test
    public void testCatalogHasFifteenUniqueFormulas() {
        assertEquals(15, BuiltInFormulas.catalog().size());
        assertEquals(15, registry.size());
    }

    @Test
    public void testEveryFormulaRunsOnFullDataset() {
        RunResult run = engine.runAll(TestDatasets.full());
        assertTrue(run.issues().toString(), run.isComplete());
        for (ComputationResult r : run.table().results()) {
            for (int i = 0; i < r.length(); i++) {
                double v = r.totalAt(i);
                assertTrue(r.formula() + "[" + i + "] = " + v, Double.isFinite(v) && v >= 0.0);
            }
        }
    }

    @Test
    public void testPartitionedComponentsSumToTotal() {
        RunResult run = engine.runAll(TestDatasets.full());
        for (FormulaSpec spec : registry.allSpecs()) {
            ComputationResult r = run.table().require(spec.name());
            assertEquals(spec.name(), spec.supportsPartition(), r.hasComponents());
            if (!spec.supportsPartition())
                continue;
            assertEquals(spec.components(), java.util.List.copyOf(r.componentNames()));
            Map<String, double[]> parts = r.components();
            for (int i = 0; i < r.length(); i++) {
                double sum = 0;
                for (double[] p : parts.values())
                    sum += p[i];
                assertEquals(spec.name() + "[" + i + "]", r.totalAt(i), sum, 1e-9);
            }
        }
    }

    @Test
    public void testPriestleyTaylorKnownValue() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 1)
                .variable(TEMPERATURE, 20)
                .variable(NET_RADIATION, 15)
                .build();
        assertEquals(5.264, engine.runOne("PT", ds).totalAt(0), 0.01);
    }

    @Test
    public void testBouchetEqualsPriestleyTaylorWithSameAlpha() {
        ForcingDataset ds = TestDatasets.coreFour();
        assertArrayEquals(engine.runOne("PT", ds).total(), engine.runOne("CR-Bouchet", ds).total(), 1e-12);
    }

    @Test
    public void testAlphaOptionScalesPriestleyTaylor() {
        FormulaRegistry tuned = new FormulaRegistry()
                .register(registry.require("PT"), Map.of("alpha", 2.52));
        ForcingDataset ds = TestDatasets.coreFour();
        double base = engine.runOne("PT", ds).totalAt(0);
        double doubled = new ExecutionEngine(tuned).runOne("PT", ds).totalAt(0);
        assertEquals(2 * base, doubled, 1e-9);
    }

    @Test
    public void testElevatedCo2ReducesPenmanMonteithCo2() {
        ForcingDataset.Builder b = ForcingDataset.builder()
                .daily(TestDatasets.START, 2)
                .variable(TEMPERATURE, 25, 25)
                .variable(RELATIVE_HUMIDITY, 50, 50)
                .variable(WIND_SPEED, 2, 2)
                .variable(NET_RADIATION, 15, 15)
                .variable(CO2, 380, 760);
        ComputationResult r = engine.runOne("PM-CO2", b.build());
        assertTrue(r.totalAt(1) < r.totalAt(0));
    }

    @Test
    public void testCo2ResponseMethodsSelectable() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 2)
                .variable(TEMPERATURE, 25, 25)
                .variable(RELATIVE_HUMIDITY, 50, 50)
                .variable(WIND_SPEED, 2, 2)
                .variable(NET_RADIATION, 15, 15)
                .variable(CO2, 380, 760)
                .build();
        double[] totals = new double[3];
        for (Co2Response response : Co2Response.values()) {
            FormulaRegistry reg = new FormulaRegistry()
                    .register(registry.require("PM-CO2"), Map.of(PenmanMonteithCo2.CO2_RESPONSE, response.code()));
            ComputationResult r = new ExecutionEngine(reg).runOne("PM-CO2", ds);
            assertEquals(engine.runOne("PM-CO2", ds).totalAt(0), r.totalAt(0), 1e-12);
            totals[response.code()] = r.totalAt(1);
        }
        assertNotEquals(totals[0], totals[1], 1e-9);
        assertNotEquals(totals[0], totals[2], 1e-9);
    }

    @Test
    public void testCo2ResponseFactors() {
        assertEquals(1.0, Co2Response.SQRT.factor(380, 380), 0.0);
        assertEquals(Math.sqrt(0.5), Co2Response.SQRT.factor(380, 760), 1e-12);
        assertEquals(0.7, Co2Response.LINEAR.factor(380, 760), 1e-12);
        assertEquals(0.5, Co2Response.LINEAR.factor(380, 1900), 0.0);
        assertEquals(1.0 - 0.15 * Math.log(2.0), Co2Response.LOG.factor(380, 760), 1e-12);
        assertSame(Co2Response.LOG, Co2Response.fromCode(2.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCo2ResponseCode() {
        Co2Response.fromCode(3.0);
    }

    @Test
    public void testNegativeRadiationClipsToZero() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 1)
                .variable(TEMPERATURE, 5)
                .variable(NET_RADIATION, -4)
                .build();
        assertEquals(0.0, engine.runOne("PT", ds).totalAt(0), 0.0);
    }

    @Test
    public void testPartitionTotalIsSumOfClippedComponentsOnNegativeRadiation() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 1)
                .variable(TEMPERATURE, 25)
                .variable(RELATIVE_HUMIDITY, 30)
                .variable(WIND_SPEED, 3)
                .variable(NET_RADIATION, -4)
                .variable(LAI, 2)
                .variable(SOIL_MOISTURE, 0.6)
                .variable(CO2, 420)
                .build();
        for (String name : new String[] { "PT-JPL-Partition", "PML", "PML-V2", "PM-CO2-LAI" }) {
            ComputationResult r = engine.runOne(name, ds);
            double sum = 0.0;
            for (double[] c : r.components().values()) {
                assertTrue(name, c[0] >= 0.0);
                sum += c[0];
            }
            assertEquals(name, sum, r.totalAt(0), 0.0);
        }

        ComputationResult pml = engine.runOne("PML", ds);
        assertEquals(0.0, pml.component("evaporation")[0], 0.0);
        assertTrue(pml.totalAt(0) > 0.0);
    }

    @Test
    public void testHargreavesRisesWithTemperatureRange() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 2)
                .variable(TEMPERATURE, 20, 20)
                .variable(TMAX, 24, 30)
                .variable(TMIN, 16, 10)
                .constant(LATITUDE, 40)
                .variable(DOY, 180, 180)
                .build();
        ComputationResult r = engine.runOne("Hargreaves", ds);
        assertTrue(r.totalAt(1) > r.totalAt(0));
    }

    @Test
    public void testPtJplUsesDefaultsWhenVegetationAbsent() {
        ComputationResult r = engine.runOne("PT-JPL", TestDatasets.coreFour());
        double pt = engine.runOne("PT", TestDatasets.coreFour()).totalAt(0);
        double fGreen = 1 - Math.exp(-1.5);
        double fSm = (0.5 - 0.3) / 0.7;
        assertEquals(pt * fGreen * fSm, r.totalAt(0), 1e-9);
    }

    @Test
    public void testNonlinearComplementaryIsAtLeastWetEnvironment() {
        ForcingDataset ds = TestDatasets.coreFour();
        double[] wet = engine.runOne("PT", ds).total();
        double[] cr = engine.runOne("CR-Nonlinear", ds).total();
        for (int i = 0; i < wet.length; i++)
            assertTrue(cr[i] >= wet[i]);
    }
}
