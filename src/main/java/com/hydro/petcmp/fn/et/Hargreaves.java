package com.hydro.petcmp.fn.et;

import com.hydro.petcmp.fn.AbstractEtFormula;

import static com.hydro.petcmp.data.Variables.*;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * Hargreaves-Samani: {@code ET0 = 0.0023 Ra sqrt(tmax - tmin) (T + 17.8)}
 * with extraterrestrial radiation Ra from latitude and day of year.
 */
public class Hargreaves extends AbstractEtFormula {

    @Override
    protected void calculate(Step s, double[] out) {
        double ra = extraterrestrialRadiation(s.get(LATITUDE), s.get(DOY));
        double range = Math.max(s.get(TMAX) - s.get(TMIN), 0.0);
        out[0] = Math.max(0.0023 * ra * Math.sqrt(range) * (s.get(TEMPERATURE) + 17.8), 0.0);
    }
}
