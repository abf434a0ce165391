package com.hydro.petcmp.registry;

import com.hydro.petcmp.fn.BuiltInFormulas;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of {@link FormulaSpec}s keyed by name.
 *
 * <p>
 * Registration order is preserved; it fixes the column order of every
 * results table produced from this registry. The catalog is filled once at
 * startup and read many times afterwards, including concurrently from the
 * parallel execution mode.
 */
public final class FormulaRegistry {
    private static final Logger log = LogManager.getLogger(FormulaRegistry.class);

    private final Map<String, FormulaSpec> specs = new LinkedHashMap<>();

    /** Creates an empty registry. */
    public FormulaRegistry() {
    }

    /** Creates a registry holding the full built-in catalog. */
    public static FormulaRegistry withBuiltIns() {
        FormulaRegistry registry = new FormulaRegistry();
        BuiltInFormulas.registerAll(registry);
        return registry;
    }

    /**
     * Adds a spec.
     *
     * @throws DuplicateFormulaException if the name is already registered.
     */
    public FormulaRegistry register(FormulaSpec spec) {
        if (specs.containsKey(spec.name()))
            throw new DuplicateFormulaException(spec.name());
        specs.put(spec.name(), spec);
        log.debug("Registered formula {} ({})", spec.name(), spec.family().tag());
        return this;
    }

    /**
     * Applies configuration options to a spec and adds it.
     *
     * @throws RegistrationException if an option is not recognized by the
     *                               formula; nothing is registered in that case.
     */
    public FormulaRegistry register(FormulaSpec spec, Map<String, ? extends Number> options) {
        return register(spec.configure(options));
    }

    /** All specs in registration order. */
    public List<FormulaSpec> allSpecs() {
        return List.copyOf(specs.values());
    }

    public List<FormulaSpec> specsByFamily(AlgorithmFamily family) {
        List<FormulaSpec> out = new ArrayList<>();
        for (FormulaSpec spec : specs.values()) {
            if (spec.family() == family)
                out.add(spec);
        }
        return out;
    }

    public Optional<FormulaSpec> get(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /**
     * @throws IllegalArgumentException if no formula has that name.
     */
    public FormulaSpec require(String name) {
        FormulaSpec spec = specs.get(name);
        if (spec == null)
            throw new IllegalArgumentException("Unknown formula: " + name);
        return spec;
    }

    public boolean contains(String name) {
        return specs.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(specs.keySet());
    }

    public int size() {
        return specs.size();
    }
}
