package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * PT-JPL split into transpiration, canopy interception evaporation and soil
 * evaporation. Net radiation is divided between canopy and soil by the green
 * canopy fraction. Each component is clipped at zero and the total is their
 * sum, which can exceed the clipped unpartitioned sum when a component is
 * negative.
 */
public class PriestleyTaylorJplPartition extends AbstractEtFormula {
    public static final String TRANSPIRATION = "transpiration";
    public static final String CANOPY_EVAP = "canopy_evap";
    public static final String SOIL_EVAP = "soil_evap";

    public PriestleyTaylorJplPartition() {
        super(TRANSPIRATION, CANOPY_EVAP, SOIL_EVAP);
    }

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double rn = s.get(NET_RADIATION);
        double delta = slope(t);
        double gamma = psychrometric(s.get(PRESSURE));
        double weight = delta / (delta + gamma);

        double fGreen = coverFraction(s.get(LAI), 0.5);
        double fSm = moistureStress(s.get(SOIL_MOISTURE), s.param(PriestleyTaylorJpl.SM_CRITICAL));
        double rnCanopy = rn * fGreen;
        double rnSoil = rn * (1.0 - fGreen);

        double transpiration = Math.max(s.param(PriestleyTaylorJpl.ALPHA) * weight * rnCanopy / LAMBDA * fSm, 0.0);
        double canopyEvap = Math.max(0.1 * rnCanopy / LAMBDA, 0.0);
        double soilEvap = Math.max(weight * (rnSoil - s.get(SOIL_HEAT_FLUX)) / LAMBDA * Math.sqrt(fSm), 0.0);

        out[1] = transpiration;
        out[2] = canopyEvap;
        out[3] = soilEvap;
        out[0] = transpiration + canopyEvap + soilEvap;
    }
}
