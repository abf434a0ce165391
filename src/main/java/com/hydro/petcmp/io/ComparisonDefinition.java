package com.hydro.petcmp.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a comparison configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ComparisonDefinition {
    private ComparisonInfo comparison;

    /** The comparison to run: which formulas, with which options. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ComparisonInfo {
        private String name;
        private Double partitionTolerance;
        /** Formulas to register, in order; absent means the full built-in catalog. */
        private List<FormulaDef> formulas;
        private List<String> exclude;
    }

    /** A built-in formula selected by name, with option overrides. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FormulaDef {
        private String name;
        private Map<String, Double> options;
    }
}
