package com.hydro.petcmp.fn;

/**
 * FAO-56 meteorology helpers shared by the built-in formulas.
 *
 * Units: temperature in degC, pressure and vapour pressures in kPa,
 * radiation in MJ m-2 day-1, wind speed in m s-1, resistances in s m-1.
 */
public final class Meteorology {

    /** Latent heat of vaporization (MJ kg-1). */
    public static final double LAMBDA = 2.45;
    /** Specific heat of air at constant pressure (J kg-1 K-1). */
    public static final double SPECIFIC_HEAT_AIR = 1013.0;
    /** Mean air density used where the formula does not compute it (kg m-3). */
    public static final double AIR_DENSITY = 1.01;
    /** Solar constant (MJ m-2 min-1). */
    public static final double SOLAR_CONSTANT = 0.0820;
    public static final double KELVIN = 273.15;

    private static final double R_DRY_AIR = 287.05;
    private static final double R_WATER_VAPOUR = 461.5;

    private Meteorology() {
    }

    /** Saturation vapour pressure es (kPa). */
    public static double saturationVapourPressure(double temperature) {
        return 0.6108 * Math.exp(17.27 * temperature / (temperature + 237.3));
    }

    /** Slope of the saturation vapour pressure curve, Delta (kPa degC-1). */
    public static double slope(double temperature) {
        double es = saturationVapourPressure(temperature);
        double d = temperature + 237.3;
        return 4098.0 * es / (d * d);
    }

    /** Psychrometric constant gamma (kPa degC-1). */
    public static double psychrometric(double pressure) {
        return 0.665e-3 * pressure;
    }

    /** Actual vapour pressure ea from relative humidity in percent (kPa). */
    public static double actualVapourPressure(double temperature, double relativeHumidity) {
        return saturationVapourPressure(temperature) * relativeHumidity / 100.0;
    }

    public static double vapourPressureDeficit(double temperature, double relativeHumidity) {
        return saturationVapourPressure(temperature) - actualVapourPressure(temperature, relativeHumidity);
    }

    /** Grass reference aerodynamic resistance ra = 208 / u (s m-1). */
    public static double aerodynamicResistance(double windSpeed) {
        return 208.0 / windSpeed;
    }

    /** Moist air density from the ideal gas law for both constituents (kg m-3). */
    public static double airDensity(double temperature, double pressure, double relativeHumidity) {
        double tk = temperature + KELVIN;
        double ea = actualVapourPressure(temperature, relativeHumidity);
        return (pressure - ea) * 1000.0 / (R_DRY_AIR * tk) + ea * 1000.0 / (R_WATER_VAPOUR * tk);
    }

    /** Priestley-Taylor equilibrium evaporation Delta/(Delta+gamma) * (Rn - G) / lambda (mm day-1). */
    public static double equilibrium(double temperature, double pressure, double availableEnergy) {
        double delta = slope(temperature);
        double gamma = psychrometric(pressure);
        return delta / (delta + gamma) * availableEnergy / LAMBDA;
    }

    /**
     * Extraterrestrial radiation Ra (MJ m-2 day-1) for a latitude in degrees
     * and a day of year. The sunset hour angle argument is clamped so polar
     * day and polar night stay finite.
     */
    public static double extraterrestrialRadiation(double latitudeDeg, double dayOfYear) {
        double phi = Math.toRadians(latitudeDeg);
        double angle = 2.0 * Math.PI * dayOfYear / 365.0;
        double dr = 1.0 + 0.033 * Math.cos(angle);
        double decl = 0.409 * Math.sin(angle - 1.39);
        double x = clip(-Math.tan(phi) * Math.tan(decl), -1.0, 1.0);
        double ws = Math.acos(x);
        return 24.0 * 60.0 / Math.PI * SOLAR_CONSTANT * dr
                * (ws * Math.sin(phi) * Math.sin(decl) + Math.cos(phi) * Math.cos(decl) * Math.sin(ws));
    }

    /** Fraction of cover 1 - exp(-k * lai). */
    public static double coverFraction(double lai, double extinction) {
        return 1.0 - Math.exp(-extinction * lai);
    }

    /** Linear soil-moisture stress, 0 at {@code critical} rising to 1 at saturation. */
    public static double moistureStress(double soilMoisture, double critical) {
        return clip((soilMoisture - critical) / (1.0 - critical), 0.0, 1.0);
    }

    /** Surface resistance from a canopy conductance (m s-1), bounded to [10, 1000]. */
    public static double surfaceResistance(double conductance) {
        return clip(1.0 / (conductance + 1e-6), 10.0, 1000.0);
    }

    public static double clip(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
