package com.hydro.petcmp.registry;

/**
 * Grouping of formulas that share a core computational approach.
 */
public enum AlgorithmFamily {
    TEMPERATURE_BASED("temperature-based"),
    RADIATION_BASED("radiation-based"),
    COMBINATION("combination"),
    CO2_AWARE("co2-aware"),
    VEGETATION_AWARE("vegetation-aware"),
    COMPLEMENTARY_RELATIONSHIP("complementary-relationship");

    private final String tag;

    AlgorithmFamily(String tag) {
        this.tag = tag;
    }

    /** Hyphenated tag used in configuration files and reports. */
    public String tag() {
        return tag;
    }

    /** Accepts either the enum name or the tag, case-insensitively. */
    public static AlgorithmFamily fromString(String text) {
        for (AlgorithmFamily f : AlgorithmFamily.values()) {
            if (f.name().equalsIgnoreCase(text) || f.tag.equalsIgnoreCase(text)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown AlgorithmFamily: " + text);
    }
}
