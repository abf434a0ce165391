package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * FAO-56 Penman-Monteith grass reference evapotranspiration ET0 (mm day-1).
 * <p>
 * Formula: {@code ET0 = (0.408 D (Rn - G) + g 900/(T+273) u vpd) / (D + g (1 + 0.34 u'))}
 * where {@code u' = max(u, min_wind_speed)}.
 */
public class PenmanMonteith extends AbstractEtFormula {
    public static final String MIN_WIND_SPEED = "min_wind_speed";

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double u = s.get(WIND_SPEED);
        double delta = slope(t);
        double gamma = psychrometric(s.get(PRESSURE));
        double vpd = vapourPressureDeficit(t, s.get(RELATIVE_HUMIDITY));
        double uSafe = Math.max(u, s.param(MIN_WIND_SPEED));

        double numerator = 0.408 * delta * (s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX))
                + gamma * (900.0 / (t + 273.0)) * u * vpd;
        double denominator = delta + gamma * (1.0 + 0.34 * uSafe);
        out[0] = Math.max(numerator / denominator, 0.0);
    }
}
