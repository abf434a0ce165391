package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Two-source Penman-Monteith whose canopy conductance scales with LAI and
 * the CO2 stomatal response: {@code gc = gs_max lai (1 - e^(-lai/2)) f(co2)}, with
 * {@code f} the {@link Co2Response} chosen by {@code co2_response}.
 * <p>
 * Components are clipped at 0 and the total is their sum, so the total can
 * exceed {@code max(T + E, 0)} when one component is negative.
 */
public class PenmanMonteithCo2Lai extends AbstractEtFormula {
    public static final String CO2_REF = "co2_ref";
    public static final String GS_MAX = "gs_max";
    public static final String CO2_RESPONSE = PenmanMonteithCo2.CO2_RESPONSE;
    public static final String TRANSPIRATION = "transpiration";
    public static final String EVAPORATION = "evaporation";

    public PenmanMonteithCo2Lai() {
        super(TRANSPIRATION, EVAPORATION);
    }

    @Override
    protected void calculate(Step s, double[] out) {
        double t = s.get(TEMPERATURE);
        double lai = s.get(LAI);
        double rn = s.get(NET_RADIATION);
        double delta = slope(t);
        double gamma = psychrometric(s.get(PRESSURE));
        double vpd = vapourPressureDeficit(t, s.get(RELATIVE_HUMIDITY));
        double ra = aerodynamicResistance(s.get(WIND_SPEED));

        double factor = Co2Response.fromCode(s.param(CO2_RESPONSE)).factor(s.param(CO2_REF), s.get(CO2));
        double rs = surfaceResistance(s.param(GS_MAX) * lai * coverFraction(lai, 0.5) * factor);

        double fc = coverFraction(lai, TwoSource.CANOPY_EXTINCTION);
        out[1] = Math.max(TwoSource.transpiration(delta, gamma, rn * fc, vpd, ra, rs), 0.0);
        out[2] = Math.max(TwoSource.soilEvaporation(delta, gamma, rn * (1.0 - fc), s.get(SOIL_HEAT_FLUX)), 0.0);
        out[0] = out[1] + out[2];
    }
}
