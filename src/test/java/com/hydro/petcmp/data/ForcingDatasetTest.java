package com.hydro.petcmp.data;

import com.hydro.petcmp.TestDatasets;
import org.junit.Test;

import java.time.Instant;

import static com.hydro.petcmp.data.Variables.*;
import static org.junit.Assert.*;

public class ForcingDatasetTest {

    @Test
    public void testBuildExposesVariablesInInsertionOrder() {
        ForcingDataset ds = TestDatasets.coreFour();

        assertEquals(3, ds.length());
        assertEquals(3, ds.timestamps().size());
        assertArrayEquals(new Object[] { TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION },
                ds.variables().toArray());
        assertTrue(ds.has(WIND_SPEED));
        assertFalse(ds.has(LAI));
        assertEquals(22.0, ds.valueAt(TEMPERATURE, 1), 0.0);
    }

    @Test
    public void testValuesReturnsCopy() {
        ForcingDataset ds = TestDatasets.coreFour();
        double[] t = ds.values(TEMPERATURE);
        t[0] = -999;
        assertEquals(20.0, ds.valueAt(TEMPERATURE, 0), 0.0);
    }

    @Test
    public void testBuilderCopiesInputArrays() {
        double[] temps = { 1, 2 };
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 2)
                .variable(TEMPERATURE, temps)
                .build();
        temps[0] = 42;
        assertEquals(1.0, ds.valueAt(TEMPERATURE, 0), 0.0);
    }

    @Test
    public void testConstantIsExpandedToFullLength() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 4)
                .constant(PRESSURE, 98.0)
                .build();
        assertArrayEquals(new double[] { 98, 98, 98, 98 }, ds.values(PRESSURE), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingVariableThrows() {
        TestDatasets.coreFour().values(LAI);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatchRejected() {
        ForcingDataset.builder()
                .daily(TestDatasets.START, 3)
                .variable(TEMPERATURE, 1, 2)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonIncreasingTimestampsRejected() {
        Instant t = TestDatasets.START;
        ForcingDataset.builder()
                .timestamps(t, t)
                .variable(TEMPERATURE, 1, 2)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateVariableRejected() {
        ForcingDataset.builder()
                .daily(TestDatasets.START, 1)
                .variable(TEMPERATURE, 1)
                .constant(TEMPERATURE, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNameRejected() {
        ForcingDataset.builder()
                .daily(TestDatasets.START, 1)
                .variable("Temperature", 1)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTimestampsRequired() {
        ForcingDataset.builder().variable(TEMPERATURE, 1).build();
    }

    @Test
    public void testUnknownVocabularyIsAcceptedWithWarning() {
        ForcingDataset ds = ForcingDataset.builder()
                .daily(TestDatasets.START, 2)
                .variable("albedo", 0.23, 0.25)
                .build();
        assertTrue(ds.has("albedo"));
        assertFalse(Variables.isKnown("albedo"));
    }
}
