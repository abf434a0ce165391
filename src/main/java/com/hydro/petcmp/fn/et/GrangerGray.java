package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Granger-Gray: equilibrium evaporation scaled by the relative evaporation
 * {@code 1 / (1 + vpd / g_param)}, or 1 when there is no deficit.
 */
public class GrangerGray extends AbstractEtFormula {
    public static final String G_PARAM = "g_param";

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double vpd = vapourPressureDeficit(t, s.get(RELATIVE_HUMIDITY));
        double relative = vpd > 0.0 ? 1.0 / (1.0 + vpd / s.param(G_PARAM)) : 1.0;
        double eq = equilibrium(t, s.get(PRESSURE), s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX));
        out[0] = Math.max(relative * eq, 0.0);
    }
}
