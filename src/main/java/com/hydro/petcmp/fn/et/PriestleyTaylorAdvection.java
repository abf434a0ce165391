package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Priestley-Taylor scaled by a linear vapour pressure deficit advection
 * factor {@code 1 + c * vpd}. Reads vpd from the dataset.
 */
public class PriestleyTaylorAdvection extends AbstractEtFormula {
    public static final String ALPHA = "alpha";
    public static final String ADVECTION_COEFFICIENT = "advection_coefficient";

    @Override
    protected void calculate(Step s, double[] out) {
        double eq = equilibrium(s.get(TEMPERATURE), s.get(PRESSURE), s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX));
        double advection = 1.0 + s.param(ADVECTION_COEFFICIENT) * s.get(VPD);
        out[0] = Math.max(s.param(ALPHA) * eq * advection, 0.0);
    }
}
