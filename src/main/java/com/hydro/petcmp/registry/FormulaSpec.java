package com.hydro.petcmp.registry;

import com.hydro.petcmp.api.EtFormula;
import com.hydro.petcmp.api.FormulaOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static descriptor of a formula: its name, family, declared inputs and
 * parameters, the callable, and the components it can partition into.
 *
 * <p>
 * Instances are immutable. {@link #configure(Map)} returns a copy with
 * overridden parameter values and rejects options the formula does not
 * declare.
 */
public final class FormulaSpec {
    private final String name;
    private final AlgorithmFamily family;
    private final List<String> requiredInputs;
    private final Map<String, Double> optionalInputs;
    private final Map<String, Double> parameters;
    private final List<String> components;
    private final EtFormula formula;
    private final String description;

    private FormulaSpec(Builder b, Map<String, Double> parameters) {
        this.name = b.name;
        this.family = b.family;
        this.requiredInputs = List.copyOf(b.requiredInputs);
        this.optionalInputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.optionalInputs));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.components = List.copyOf(b.components);
        this.formula = b.formula;
        this.description = b.description;
    }

    private FormulaSpec(FormulaSpec base, Map<String, Double> parameters) {
        this.name = base.name;
        this.family = base.family;
        this.requiredInputs = base.requiredInputs;
        this.optionalInputs = base.optionalInputs;
        this.parameters = Collections.unmodifiableMap(parameters);
        this.components = base.components;
        this.formula = base.formula;
        this.description = base.description;
    }

    public static Builder builder(String name, AlgorithmFamily family) {
        return new Builder(name, family);
    }

    public String name() {
        return name;
    }

    public AlgorithmFamily family() {
        return family;
    }

    /** Required input names in declaration order. */
    public List<String> requiredInputs() {
        return requiredInputs;
    }

    /** Optional input names mapped to their defaults, in declaration order. */
    public Map<String, Double> optionalInputs() {
        return optionalInputs;
    }

    /** Recognized configuration options mapped to their current values. */
    public Map<String, Double> parameters() {
        return parameters;
    }

    public boolean supportsPartition() {
        return !components.isEmpty();
    }

    /** Component names a partitioning formula produces; empty otherwise. */
    public List<String> components() {
        return components;
    }

    public EtFormula formula() {
        return formula;
    }

    public String description() {
        return description;
    }

    /**
     * Returns a copy of this spec with the given options applied.
     *
     * @throws RegistrationException if an option is not a declared parameter
     *                               or has no value.
     */
    public FormulaSpec configure(Map<String, ? extends Number> options) {
        if (options == null || options.isEmpty())
            return this;

        Set<String> unknown = new TreeSet<>();
        for (String key : options.keySet()) {
            if (!parameters.containsKey(key))
                unknown.add(key);
        }
        if (!unknown.isEmpty()) {
            throw new RegistrationException("Formula '" + name + "' does not recognize option(s) " + unknown
                    + "; recognized: " + parameters.keySet());
        }

        Map<String, Double> merged = new LinkedHashMap<>(parameters);
        for (Map.Entry<String, ? extends Number> e : options.entrySet()) {
            if (e.getValue() == null)
                throw new RegistrationException("Option '" + e.getKey() + "' of formula '" + name + "' has no value");
            merged.put(e.getKey(), e.getValue().doubleValue());
        }
        return new FormulaSpec(this, merged);
    }

    @Override
    public String toString() {
        return name + " [" + family.tag() + "] requires " + requiredInputs;
    }

    /** Fluent builder; all invariants are checked in {@link #build()}. */
    public static final class Builder {
        private final String name;
        private final AlgorithmFamily family;
        private final List<String> requiredInputs = new ArrayList<>();
        private final Map<String, Double> optionalInputs = new LinkedHashMap<>();
        private final Map<String, Double> parameters = new LinkedHashMap<>();
        private final List<String> components = new ArrayList<>();
        private EtFormula formula;
        private String description = "";

        private Builder(String name, AlgorithmFamily family) {
            this.name = name;
            this.family = family;
        }

        public Builder requires(String... inputs) {
            Collections.addAll(requiredInputs, inputs);
            return this;
        }

        public Builder optional(String input, double defaultValue) {
            optionalInputs.put(input, defaultValue);
            return this;
        }

        public Builder parameter(String option, double defaultValue) {
            parameters.put(option, defaultValue);
            return this;
        }

        /** Declares partition support with the given component names. */
        public Builder partitions(String... componentNames) {
            Collections.addAll(components, componentNames);
            return this;
        }

        public Builder formula(EtFormula formula) {
            this.formula = formula;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public FormulaSpec build() {
            if (name == null || name.isBlank())
                throw new RegistrationException("Formula name must not be blank");
            if (family == null)
                throw new RegistrationException("Formula '" + name + "' has no algorithm family");
            if (formula == null)
                throw new RegistrationException("Formula '" + name + "' has no callable");
            if (new LinkedHashSet<>(requiredInputs).size() != requiredInputs.size())
                throw new RegistrationException("Formula '" + name + "' declares a required input twice");

            Set<String> overlap = new TreeSet<>(requiredInputs);
            overlap.retainAll(optionalInputs.keySet());
            if (!overlap.isEmpty()) {
                throw new RegistrationException("Formula '" + name
                        + "' declares inputs as both required and optional: " + overlap);
            }
            if (components.contains(FormulaOutput.TOTAL))
                throw new RegistrationException("Formula '" + name + "' declares 'total' as a component");
            return new FormulaSpec(this, parameters);
        }
    }
}
