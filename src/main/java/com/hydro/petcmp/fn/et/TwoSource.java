package com.hydro.petcmp.fn.et;

import static com.hydro.petcmp.fn.Meteorology.*;

/** Canopy/soil split shared by the two-source Penman-Monteith variants. */
final class TwoSource {
    static final double CANOPY_EXTINCTION = 0.6;
    static final double SOIL_ALPHA = 1.26;

    private TwoSource() {
    }

    /** Penman-Monteith transpiration from canopy net radiation (no G term). */
    static double transpiration(double delta, double gamma, double rnCanopy, double vpd, double ra, double rs) {
        double numerator = delta * rnCanopy + AIR_DENSITY * SPECIFIC_HEAT_AIR * vpd / ra;
        double denominator = LAMBDA * (delta + gamma * (1.0 + rs / ra));
        return numerator / denominator;
    }

    /** Priestley-Taylor soil evaporation from soil net radiation minus G. */
    static double soilEvaporation(double delta, double gamma, double rnSoil, double soilHeatFlux) {
        return SOIL_ALPHA * delta / (delta + gamma) * (rnSoil - soilHeatFlux) / LAMBDA;
    }
}
