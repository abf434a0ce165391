package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Penman-Monteith with CO2-dependent stomatal resistance
 * {@code rs = rs_ref / f(co2)}, where {@code f} is the {@link Co2Response}
 * chosen by the {@code co2_response} parameter.
 */
public class PenmanMonteithCo2 extends AbstractEtFormula {
    public static final String CO2_REF = "co2_ref";
    public static final String RS_REF = "rs_ref";
    public static final String CO2_RESPONSE = "co2_response";

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double delta = slope(t);
        double gamma = psychrometric(s.get(PRESSURE));
        double vpd = vapourPressureDeficit(t, s.get(RELATIVE_HUMIDITY));
        double ra = aerodynamicResistance(s.get(WIND_SPEED));
        Co2Response response = Co2Response.fromCode(s.param(CO2_RESPONSE));
        double rs = s.param(RS_REF) / response.factor(s.param(CO2_REF), s.get(CO2));

        double numerator = delta * (s.get(NET_RADIATION) - s.get(SOIL_HEAT_FLUX))
                + AIR_DENSITY * SPECIFIC_HEAT_AIR * vpd / ra;
        double denominator = LAMBDA * (delta + gamma * (1.0 + rs / ra));
        out[0] = Math.max(numerator / denominator, 0.0);
    }
}
