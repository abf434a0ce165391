package com.hydro.petcmp.fn.et;

/**
 * Stomatal conductance response to atmospheric CO2, normalized to 1 at the
 * reference concentration. Selected through the numeric {@code co2_response}
 * parameter by {@link #code()}.
 */
public enum Co2Response {
    /** {@code sqrt(co2_ref / co2)}. */
    SQRT(0) {
        @Override
        public double factor(double co2Ref, double co2) {
            return Math.sqrt(co2Ref / co2);
        }
    },
    /** {@code 1 - 0.3 (co2 - co2_ref) / co2_ref}, clipped to [0.5, 1.5]. */
    LINEAR(1) {
        @Override
        public double factor(double co2Ref, double co2) {
            double f = 1.0 - LINEAR_BETA * (co2 - co2Ref) / co2Ref;
            return Math.max(0.5, Math.min(1.5, f));
        }
    },
    /** {@code 1 - 0.15 ln(co2 / co2_ref)}. */
    LOG(2) {
        @Override
        public double factor(double co2Ref, double co2) {
            return 1.0 - LOG_SLOPE * Math.log(co2 / co2Ref);
        }
    };

    private static final double LINEAR_BETA = 0.3;
    private static final double LOG_SLOPE = 0.15;

    private final int code;

    Co2Response(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public abstract double factor(double co2Ref, double co2);

    public static Co2Response fromCode(double code) {
        for (Co2Response r : values()) {
            if (r.code == code)
                return r;
        }
        throw new IllegalArgumentException("Unknown co2_response code: " + code + " (0=sqrt, 1=linear, 2=log)");
    }
}
