package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * PT-JPL: Priestley-Taylor potential reduced by green canopy fraction
 * {@code 1 - exp(-lai/2)} and a linear soil moisture constraint.
 */
public class PriestleyTaylorJpl extends AbstractEtFormula {
    public static final String ALPHA = "alpha";
    public static final String SM_CRITICAL = "sm_critical";

    @Override
    protected void calculate(Step s, double[] out) {
        double petMax = s.param(ALPHA)
                * equilibrium(s.get(TEMPERATURE), s.get(PRESSURE), s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX));
        double fGreen = coverFraction(s.get(LAI), 0.5);
        double fSm = moistureStress(s.get(SOIL_MOISTURE), s.param(SM_CRITICAL));
        out[0] = Math.max(petMax * fGreen * fSm, 0.0);
    }
}
