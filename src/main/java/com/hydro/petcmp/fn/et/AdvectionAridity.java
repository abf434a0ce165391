package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Brutsaert-Stricker advection-aridity potential: wet-environment
 * evaporation plus the aerodynamic drying term weighted by {@code g/(D+g)}.
 */
public class AdvectionAridity extends AbstractEtFormula {

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double delta = slope(t);
        double gamma = psychrometric(s.get(PRESSURE));
        double vpd = vapourPressureDeficit(t, s.get(RELATIVE_HUMIDITY));
        double ra = aerodynamicResistance(s.get(WIND_SPEED));

        double wet = delta / (delta + gamma) * (s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX)) / LAMBDA;
        double aerodynamic = AIR_DENSITY * SPECIFIC_HEAT_AIR * vpd / ra / LAMBDA;
        out[0] = Math.max(wet + gamma / (delta + gamma) * aerodynamic, 0.0);
    }
}
