package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Penman-Monteith-Leuning two-source model.
 * <p>
 * Canopy conductance {@code gc = gc_max (1 - e^(-lai/2)) exp(-(T-25)^2/200) exp(-vpd/3)}
 * drives Penman-Monteith transpiration over the canopy share of net
 * radiation; the soil share evaporates at the Priestley-Taylor rate.
 * <p>
 * Components are clipped at 0 and the total is their sum, so the total can
 * exceed {@code max(T + E, 0)} when one component is negative.
 */
public class PenmanMonteithLeuning extends AbstractEtFormula {
    public static final String GC_MAX = "gc_max";
    public static final String TRANSPIRATION = "transpiration";
    public static final String EVAPORATION = "evaporation";

    public PenmanMonteithLeuning() {
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

        double fLai = coverFraction(lai, 0.5);
        double fTemp = Math.exp(-((t - 25.0) * (t - 25.0)) / 200.0);
        double fVpd = Math.exp(-vpd / 3.0);
        double rs = surfaceResistance(s.param(GC_MAX) * fLai * fTemp * fVpd);

        double fc = coverFraction(lai, TwoSource.CANOPY_EXTINCTION);
        double transpiration = Math.max(TwoSource.transpiration(delta, gamma, rn * fc, vpd, ra, rs), 0.0);
        double evaporation = Math.max(
                TwoSource.soilEvaporation(delta, gamma, rn * (1.0 - fc), s.get(SOIL_HEAT_FLUX)), 0.0);

        out[1] = transpiration * transpirationScale(s);
        out[2] = evaporation * evaporationScale(s);
        out[0] = out[1] + out[2];
    }

    /** Multiplier on transpiration; 1 for the base model. */
    protected double transpirationScale(Step s) {
        return 1.0;
    }

    /** Multiplier on soil evaporation; 1 for the base model. */
    protected double evaporationScale(Step s) {
        return 1.0;
    }
}
