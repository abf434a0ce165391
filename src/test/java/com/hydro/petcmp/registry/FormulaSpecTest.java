package com.hydro.petcmp.registry;

import com.hydro.petcmp.api.EtFormula;
import com.hydro.petcmp.api.FormulaOutput;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class FormulaSpecTest {

    private static final EtFormula ZERO = in -> FormulaOutput.of(new double[in.length()]);

    private static FormulaSpec.Builder base() {
        return FormulaSpec.builder("Test", AlgorithmFamily.RADIATION_BASED)
                .requires("temperature", "net_radiation")
                .optional("pressure", 101.3)
                .parameter("alpha", 1.26)
                .formula(ZERO);
    }

    @Test
    public void testBuildKeepsDeclarations() {
        FormulaSpec spec = base().description("a test formula").build();

        assertEquals("Test", spec.name());
        assertEquals(AlgorithmFamily.RADIATION_BASED, spec.family());
        assertEquals(java.util.List.of("temperature", "net_radiation"), spec.requiredInputs());
        assertEquals(101.3, spec.optionalInputs().get("pressure"), 0.0);
        assertEquals(1.26, spec.parameters().get("alpha"), 0.0);
        assertFalse(spec.supportsPartition());
        assertEquals("a test formula", spec.description());
    }

    @Test
    public void testPartitionDeclaration() {
        FormulaSpec spec = base().partitions("transpiration", "evaporation").build();
        assertTrue(spec.supportsPartition());
        assertEquals(java.util.List.of("transpiration", "evaporation"), spec.components());
    }

    @Test
    public void testConfigureReturnsNewSpec() {
        FormulaSpec spec = base().build();
        FormulaSpec tuned = spec.configure(Map.of("alpha", 1.3));

        assertEquals(1.3, tuned.parameters().get("alpha"), 0.0);
        assertEquals(1.26, spec.parameters().get("alpha"), 0.0);
        assertSame(spec.formula(), tuned.formula());
        assertSame(spec, spec.configure(Map.of()));
    }

    @Test
    public void testConfigureRejectsUnknownOption() {
        try {
            base().build().configure(Map.of("beta", 2));
            fail("Expected RegistrationException");
        } catch (RegistrationException e) {
            assertTrue(e.getMessage().contains("beta"));
        }
    }

    @Test(expected = RegistrationException.class)
    public void testMissingCallableRejected() {
        FormulaSpec.builder("NoFn", AlgorithmFamily.COMBINATION).requires("temperature").build();
    }

    @Test(expected = RegistrationException.class)
    public void testBlankNameRejected() {
        FormulaSpec.builder(" ", AlgorithmFamily.COMBINATION).formula(ZERO).build();
    }

    @Test(expected = RegistrationException.class)
    public void testRequiredAndOptionalOverlapRejected() {
        base().optional("temperature", 20.0).build();
    }

    @Test(expected = RegistrationException.class)
    public void testTotalAsComponentRejected() {
        base().partitions("total").build();
    }

    @Test
    public void testFamilyFromString() {
        assertEquals(AlgorithmFamily.CO2_AWARE, AlgorithmFamily.fromString("co2-aware"));
        assertEquals(AlgorithmFamily.COMPLEMENTARY_RELATIONSHIP,
                AlgorithmFamily.fromString("complementary_relationship"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFamilyFromStringRejectsUnknown() {
        AlgorithmFamily.fromString("empirical");
    }
}
