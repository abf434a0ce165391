package com.hydro.petcmp.fn.et;

import static com.hydro.petcmp.data.Variables.SOIL_MOISTURE;
import static com.hydro.petcmp.fn.Meteorology.*;

/**
 * PML-V2: Penman-Monteith-Leuning with soil moisture constraints. Transpiration
 * is scaled linearly above {@code sm_critical}, soil evaporation by
 * {@code sqrt(sm)}.
 */
public class PenmanMonteithLeuningV2 extends PenmanMonteithLeuning {
    public static final String SM_CRITICAL = "sm_critical";

    @Override
    protected double transpirationScale(Step s) {
        return moistureStress(s.get(SOIL_MOISTURE), s.param(SM_CRITICAL));
    }

    @Override
    protected double evaporationScale(Step s) {
        return Math.sqrt(clip(s.get(SOIL_MOISTURE), 0.0, 1.0));
    }
}
