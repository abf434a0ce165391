package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Nonlinear complementary relationship. Actual evaporation is
 * {@code ETwet (1 - x^b)^(1/b)} with dryness {@code x = 1 - RH/100}; the
 * reported potential is its complement {@code 2 ETwet - actual}.
 */
public class NonlinearComplementary extends AbstractEtFormula {
    public static final String B = "b";

    @Override
    protected void calculate(Step s, double[] out) {
        double b = s.param(B);
        double wet = 1.26
                * equilibrium(s.get(TEMPERATURE), s.get(PRESSURE), s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX));
        double x = clip(1.0 - s.get(RELATIVE_HUMIDITY) / 100.0, 0.0, 1.0);
        double relative = Math.pow(1.0 - Math.pow(x, b), 1.0 / b);
        double actual = wet * relative;
        out[0] = Math.max(2.0 * wet - actual, 0.0);
    }
}
