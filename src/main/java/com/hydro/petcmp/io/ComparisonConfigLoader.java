package com.hydro.petcmp.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydro.petcmp.fn.BuiltInFormulas;
import com.hydro.petcmp.partition.ComponentPartitioner;
import com.hydro.petcmp.registry.FormulaRegistry;
import com.hydro.petcmp.registry.FormulaSpec;
import com.hydro.petcmp.registry.RegistrationException;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads comparison configurations and turns them into registries.
 *
 * <pre>
 * {"comparison": {"name": "...", "partitionTolerance": 0.01,
 *   "formulas": [{"name": "PT", "options": {"alpha": 1.3}}],
 *   "exclude": ["Hargreaves"]}}
 * </pre>
 *
 * Every problem with the selection (unknown formula, unknown option) is
 * reported here, before any dataset is touched.
 */
@Log4j2
public final class ComparisonConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ComparisonConfigLoader() {
    }

    /**
     * Parses a JSON string.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or has no
     *                                  {@code comparison} key.
     */
    public static ComparisonDefinition parse(String json) {
        ComparisonDefinition def;
        try {
            def = MAPPER.readValue(json, ComparisonDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed comparison config: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getComparison() == null)
            throw new IllegalArgumentException("Missing 'comparison' key");
        return def;
    }

    /** Parses a JSON file. I/O failures surface as {@link UncheckedIOException}. */
    public static ComparisonDefinition load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read comparison config from " + path, e);
        }
    }

    /** Parses a JSON document from the classpath. */
    public static ComparisonDefinition loadResource(String resource) {
        try (InputStream in = ComparisonConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read comparison config resource " + resource, e);
        }
    }

    /**
     * Builds a registry holding the selected built-in formulas with their
     * options applied.
     *
     * @throws RegistrationException if a formula name is unknown, an option is
     *                               not recognized, or a formula is listed twice.
     */
    public static FormulaRegistry toRegistry(ComparisonDefinition def) {
        ComparisonDefinition.ComparisonInfo info = def.getComparison();
        Map<String, FormulaSpec> catalog = new LinkedHashMap<>();
        for (FormulaSpec spec : BuiltInFormulas.catalog())
            catalog.put(spec.name(), spec);

        List<String> exclude = info.getExclude() != null ? info.getExclude() : List.of();
        Set<String> unknownExcludes = new TreeSet<>(exclude);
        unknownExcludes.removeAll(catalog.keySet());
        if (!unknownExcludes.isEmpty())
            throw new RegistrationException("Unknown formula(s) in exclude: " + unknownExcludes);

        FormulaRegistry registry = new FormulaRegistry();
        if (info.getFormulas() == null) {
            for (FormulaSpec spec : catalog.values()) {
                if (!exclude.contains(spec.name()))
                    registry.register(spec);
            }
        } else {
            for (ComparisonDefinition.FormulaDef fd : info.getFormulas()) {
                FormulaSpec spec = catalog.get(fd.getName());
                if (spec == null) {
                    throw new RegistrationException("Unknown formula '" + fd.getName() + "'; known: "
                            + catalog.keySet());
                }
                FormulaSpec configured = spec.configure(fd.getOptions());
                if (exclude.contains(spec.name()))
                    continue;
                registry.register(configured);
            }
        }
        log.info("Comparison '{}' selects {} formula(s)", info.getName(), registry.size());
        return registry;
    }

    /** The configured partition tolerance, or the default when absent. */
    public static double partitionTolerance(ComparisonDefinition def) {
        Double tol = def.getComparison().getPartitionTolerance();
        return tol != null ? tol : ComponentPartitioner.DEFAULT_TOLERANCE;
    }
}
