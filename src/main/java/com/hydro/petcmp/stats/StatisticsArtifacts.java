package com.hydro.petcmp.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The three cross-formula statistics computed from one results table. */
public record StatisticsArtifacts(Map<String, SummaryStats> summary, FormulaMatrix correlation,
        FormulaMatrix difference) {

    public StatisticsArtifacts {
        summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }
}
