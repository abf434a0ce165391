package com.hydro.petcmp.data;

import java.util.Set;

/**
 * Vocabulary of forcing variable names recognized by the built-in formulas.
 * <p>
 * Names are case-sensitive. Units follow FAO-56 daily conventions.
 */
public final class Variables {

    /** Mean air temperature (degC). */
    public static final String TEMPERATURE = "temperature";
    /** Daily maximum air temperature (degC). */
    public static final String TMAX = "tmax";
    /** Daily minimum air temperature (degC). */
    public static final String TMIN = "tmin";
    /** Relative humidity (%). */
    public static final String RELATIVE_HUMIDITY = "relative_humidity";
    /** Wind speed at 2 m (m s-1). */
    public static final String WIND_SPEED = "wind_speed";
    /** Net radiation (MJ m-2 day-1). */
    public static final String NET_RADIATION = "net_radiation";
    /** Soil heat flux (MJ m-2 day-1). */
    public static final String SOIL_HEAT_FLUX = "soil_heat_flux";
    /** Atmospheric pressure (kPa). */
    public static final String PRESSURE = "pressure";
    /** Leaf area index (m2 m-2). */
    public static final String LAI = "lai";
    public static final String NDVI = "ndvi";
    /** Atmospheric CO2 concentration (ppm). */
    public static final String CO2 = "co2";
    /** Vapour pressure deficit (kPa). */
    public static final String VPD = "vpd";
    /** Relative soil moisture (0..1). */
    public static final String SOIL_MOISTURE = "soil_moisture";
    /** Day of year (1..366). */
    public static final String DOY = "doy";
    /** Latitude (decimal degrees). */
    public static final String LATITUDE = "latitude";

    public static final Set<String> KNOWN = Set.of(
            TEMPERATURE, TMAX, TMIN, RELATIVE_HUMIDITY, WIND_SPEED, NET_RADIATION,
            SOIL_HEAT_FLUX, PRESSURE, LAI, NDVI, CO2, VPD, SOIL_MOISTURE, DOY, LATITUDE);

    private Variables() {
        // Constants holder
    }

    public static boolean isKnown(String name) {
        return KNOWN.contains(name);
    }
}
