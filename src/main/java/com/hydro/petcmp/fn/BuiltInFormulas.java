package com.hydro.petcmp.fn;

import com.hydro.petcmp.fn.et.AdvectionAridity;
import com.hydro.petcmp.fn.et.Bouchet;
import com.hydro.petcmp.fn.et.Co2Response;
import com.hydro.petcmp.fn.et.GrangerGray;
import com.hydro.petcmp.fn.et.Hargreaves;
import com.hydro.petcmp.fn.et.NonlinearComplementary;
import com.hydro.petcmp.fn.et.PenmanMonteith;
import com.hydro.petcmp.fn.et.PenmanMonteithCo2;
import com.hydro.petcmp.fn.et.PenmanMonteithCo2Lai;
import com.hydro.petcmp.fn.et.PenmanMonteithGeneral;
import com.hydro.petcmp.fn.et.PenmanMonteithLeuning;
import com.hydro.petcmp.fn.et.PenmanMonteithLeuningV2;
import com.hydro.petcmp.fn.et.PriestleyTaylor;
import com.hydro.petcmp.fn.et.PriestleyTaylorAdvection;
import com.hydro.petcmp.fn.et.PriestleyTaylorJpl;
import com.hydro.petcmp.fn.et.PriestleyTaylorJplPartition;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;

import java.util.List;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.registry.AlgorithmFamily.*;

/**
 * The built-in formula catalog, in the order results tables list it.
 */
public final class BuiltInFormulas {
    public static final double DEFAULT_PRESSURE = 101.3;
    public static final double DEFAULT_SOIL_HEAT_FLUX = 0.0;
    public static final double DEFAULT_ALPHA = 1.26;

    private BuiltInFormulas() {
    }

    /** Registers every built-in formula. */
    public static void registerAll(FormulaRegistry registry) {
        for (FormulaSpec spec : catalog())
            registry.register(spec);
    }

    /** Fresh specs for the whole catalog. */
    public static List<FormulaSpec> catalog() {
        return List.of(
                meteo(FormulaSpec.builder("PM", COMBINATION))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION)
                        .parameter(PenmanMonteith.MIN_WIND_SPEED, 0.5)
                        .formula(new PenmanMonteith())
                        .description("FAO-56 Penman-Monteith grass reference ET0")
                        .build(),
                meteo(FormulaSpec.builder("PM-General", COMBINATION))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION)
                        .parameter(PenmanMonteithGeneral.SURFACE_RESISTANCE, 70.0)
                        .formula(new PenmanMonteithGeneral())
                        .description("Penman-Monteith with fixed surface resistance")
                        .build(),
                meteo(FormulaSpec.builder("PT", RADIATION_BASED))
                        .requires(TEMPERATURE, NET_RADIATION)
                        .parameter(PriestleyTaylor.ALPHA, DEFAULT_ALPHA)
                        .formula(new PriestleyTaylor())
                        .description("Priestley-Taylor")
                        .build(),
                meteo(FormulaSpec.builder("PT-Advection", RADIATION_BASED))
                        .requires(TEMPERATURE, NET_RADIATION, VPD)
                        .parameter(PriestleyTaylorAdvection.ALPHA, DEFAULT_ALPHA)
                        .parameter(PriestleyTaylorAdvection.ADVECTION_COEFFICIENT, 0.1)
                        .formula(new PriestleyTaylorAdvection())
                        .description("Priestley-Taylor with VPD advection factor")
                        .build(),
                FormulaSpec.builder("PT-JPL", VEGETATION_AWARE)
                        .requires(TEMPERATURE, NET_RADIATION)
                        .optional(LAI, 3.0)
                        .optional(SOIL_MOISTURE, 0.5)
                        .optional(PRESSURE, DEFAULT_PRESSURE)
                        .optional(SOIL_HEAT_FLUX, DEFAULT_SOIL_HEAT_FLUX)
                        .parameter(PriestleyTaylorJpl.ALPHA, DEFAULT_ALPHA)
                        .parameter(PriestleyTaylorJpl.SM_CRITICAL, 0.3)
                        .formula(new PriestleyTaylorJpl())
                        .description("PT-JPL with canopy and soil moisture constraints")
                        .build(),
                meteo(FormulaSpec.builder("PT-JPL-Partition", VEGETATION_AWARE))
                        .requires(TEMPERATURE, NET_RADIATION, LAI, SOIL_MOISTURE)
                        .parameter(PriestleyTaylorJpl.ALPHA, DEFAULT_ALPHA)
                        .parameter(PriestleyTaylorJpl.SM_CRITICAL, 0.3)
                        .partitions(PriestleyTaylorJplPartition.TRANSPIRATION,
                                PriestleyTaylorJplPartition.CANOPY_EVAP,
                                PriestleyTaylorJplPartition.SOIL_EVAP)
                        .formula(new PriestleyTaylorJplPartition())
                        .description("PT-JPL partitioned into transpiration, interception and soil evaporation")
                        .build(),
                meteo(FormulaSpec.builder("PML", VEGETATION_AWARE))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION, LAI)
                        .parameter(PenmanMonteithLeuning.GC_MAX, 0.006)
                        .partitions(PenmanMonteithLeuning.TRANSPIRATION, PenmanMonteithLeuning.EVAPORATION)
                        .formula(new PenmanMonteithLeuning())
                        .description("Penman-Monteith-Leuning two-source model")
                        .build(),
                meteo(FormulaSpec.builder("PML-V2", VEGETATION_AWARE))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION, LAI, SOIL_MOISTURE)
                        .parameter(PenmanMonteithLeuning.GC_MAX, 0.006)
                        .parameter(PenmanMonteithLeuningV2.SM_CRITICAL, 0.3)
                        .partitions(PenmanMonteithLeuning.TRANSPIRATION, PenmanMonteithLeuning.EVAPORATION)
                        .formula(new PenmanMonteithLeuningV2())
                        .description("PML with soil moisture constraints")
                        .build(),
                meteo(FormulaSpec.builder("PM-CO2", CO2_AWARE))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION, CO2)
                        .parameter(PenmanMonteithCo2.CO2_REF, 380.0)
                        .parameter(PenmanMonteithCo2.RS_REF, 70.0)
                        .parameter(PenmanMonteithCo2.CO2_RESPONSE, Co2Response.SQRT.code())
                        .formula(new PenmanMonteithCo2())
                        .description("Penman-Monteith with CO2 stomatal response")
                        .build(),
                meteo(FormulaSpec.builder("PM-CO2-LAI", CO2_AWARE))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION, LAI, CO2)
                        .parameter(PenmanMonteithCo2Lai.CO2_REF, 380.0)
                        .parameter(PenmanMonteithCo2Lai.GS_MAX, 0.01)
                        .parameter(PenmanMonteithCo2Lai.CO2_RESPONSE, Co2Response.SQRT.code())
                        .partitions(PenmanMonteithCo2Lai.TRANSPIRATION, PenmanMonteithCo2Lai.EVAPORATION)
                        .formula(new PenmanMonteithCo2Lai())
                        .description("Two-source Penman-Monteith with LAI and CO2 conductance")
                        .build(),
                meteo(FormulaSpec.builder("CR-Bouchet", COMPLEMENTARY_RELATIONSHIP))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, NET_RADIATION)
                        .parameter(Bouchet.ALPHA, DEFAULT_ALPHA)
                        .formula(new Bouchet())
                        .description("Bouchet complementary relationship")
                        .build(),
                meteo(FormulaSpec.builder("CR-AA", COMPLEMENTARY_RELATIONSHIP))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION)
                        .formula(new AdvectionAridity())
                        .description("Advection-aridity complementary relationship")
                        .build(),
                meteo(FormulaSpec.builder("CR-GG", COMPLEMENTARY_RELATIONSHIP))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, NET_RADIATION)
                        .parameter(GrangerGray.G_PARAM, 0.07)
                        .formula(new GrangerGray())
                        .description("Granger-Gray relative evaporation")
                        .build(),
                meteo(FormulaSpec.builder("CR-Nonlinear", COMPLEMENTARY_RELATIONSHIP))
                        .requires(TEMPERATURE, RELATIVE_HUMIDITY, NET_RADIATION)
                        .parameter(NonlinearComplementary.B, 2.0)
                        .formula(new NonlinearComplementary())
                        .description("Nonlinear complementary relationship")
                        .build(),
                FormulaSpec.builder("Hargreaves", TEMPERATURE_BASED)
                        .requires(TEMPERATURE, TMAX, TMIN, LATITUDE, DOY)
                        .formula(new Hargreaves())
                        .description("Hargreaves-Samani temperature-based ET0")
                        .build());
    }

    private static FormulaSpec.Builder meteo(FormulaSpec.Builder builder) {
        return builder
                .optional(PRESSURE, DEFAULT_PRESSURE)
                .optional(SOIL_HEAT_FLUX, DEFAULT_SOIL_HEAT_FLUX);
    }
}
