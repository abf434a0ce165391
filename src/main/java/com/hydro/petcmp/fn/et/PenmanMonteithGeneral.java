package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * General Penman-Monteith for an arbitrary surface with a fixed surface
 * resistance and moist air density.
 */
public class PenmanMonteithGeneral extends AbstractEtFormula {
    public static final String SURFACE_RESISTANCE = "surface_resistance";

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double rh = s.get(RELATIVE_HUMIDITY);
        double p = s.get(PRESSURE);
        double delta = slope(t);
        double gamma = psychrometric(p);
        double vpd = vapourPressureDeficit(t, rh);
        double ra = aerodynamicResistance(s.get(WIND_SPEED));
        double rho = airDensity(t, p, rh);
        double rs = s.param(SURFACE_RESISTANCE);

        double numerator = delta * (s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX))
                + rho * SPECIFIC_HEAT_AIR * vpd / ra / 1000.0;
        double denominator = LAMBDA * (delta + gamma * (1.0 + rs / ra));
        out[0] = Math.max(numerator / denominator, 0.0);
    }
}
