package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Bouchet complementary relationship, reporting the potential side
 * {@code alpha * ETwet} with {@code ETwet = D/(D+g) (Rn - G) / lambda}.
 */
public class Bouchet extends AbstractEtFormula {
    public static final String ALPHA = "alpha";

    @Override
    protected void calculate(Step s, double[] out) {
        double wet = equilibrium(s.get(TEMPERATURE), s.get(PRESSURE), s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX));
        out[0] = Math.max(s.param(ALPHA) * wet, 0.0);
    }
}
