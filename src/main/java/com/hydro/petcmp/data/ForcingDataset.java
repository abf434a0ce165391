package com.hydro.petcmp.data;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable, time-indexed table of named forcing variables.
 *
 * <p>
 * Every variable holds exactly one value per timestamp. Arrays are copied on
 * the way in and on the way out, so formulas can never alter the shared data.
 * Missing observations are represented as {@code NaN}.
 *
 * <p>
 * Instances are built once per analysis run with {@link #builder()} and may be
 * shared freely between threads.
 */
public final class ForcingDataset {
    private static final Logger log = LogManager.getLogger(ForcingDataset.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][a-z0-9_]*");

    private final Instant[] timestamps;
    private final Map<String, double[]> columns;

    private ForcingDataset(Instant[] timestamps, Map<String, double[]> columns) {
        this.timestamps = timestamps;
        this.columns = columns;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of timesteps (rows). */
    public int length() {
        return timestamps.length;
    }

    public List<Instant> timestamps() {
        return List.of(timestamps);
    }

    /** Variable names in insertion order. */
    public Set<String> variables() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public boolean has(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns a copy of the series for a variable.
     *
     * @throws IllegalArgumentException if the variable is absent.
     */
    public double[] values(String name) {
        return column(name).clone();
    }

    public double valueAt(String name, int index) {
        return column(name)[index];
    }

    private double[] column(String name) {
        double[] col = columns.get(name);
        if (col == null)
            throw new IllegalArgumentException("Variable not in dataset: " + name);
        return col;
    }

    @Override
    public String toString() {
        return "ForcingDataset[rows=" + timestamps.length + ", variables=" + columns.keySet() + "]";
    }

    /** Collects timestamps and columns, validating everything in {@link #build()}. */
    public static final class Builder {
        private Instant[] timestamps;
        private final Map<String, double[]> columns = new LinkedHashMap<>();
        private final Map<String, Double> constants = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder timestamps(List<Instant> stamps) {
            this.timestamps = stamps.toArray(new Instant[0]);
            return this;
        }

        public Builder timestamps(Instant... stamps) {
            this.timestamps = stamps.clone();
            return this;
        }

        /** Generates {@code count} timestamps spaced one day apart from {@code start}. */
        public Builder daily(Instant start, int count) {
            Instant[] stamps = new Instant[count];
            for (int i = 0; i < count; i++)
                stamps[i] = start.plus(Duration.ofDays(i));
            this.timestamps = stamps;
            return this;
        }

        public Builder variable(String name, double... values) {
            if (columns.containsKey(name) || constants.containsKey(name))
                throw new IllegalArgumentException("Duplicate variable: " + name);
            columns.put(name, values.clone());
            return this;
        }

        /** Adds a variable holding the same value at every timestep. */
        public Builder constant(String name, double value) {
            if (columns.containsKey(name) || constants.containsKey(name))
                throw new IllegalArgumentException("Duplicate variable: " + name);
            constants.put(name, value);
            return this;
        }

        public ForcingDataset build() {
            if (timestamps == null)
                throw new IllegalArgumentException("Timestamps are required");
            for (int i = 0; i < timestamps.length; i++) {
                if (timestamps[i] == null)
                    throw new IllegalArgumentException("Null timestamp at row " + i);
                if (i > 0 && !timestamps[i].isAfter(timestamps[i - 1]))
                    throw new IllegalArgumentException("Timestamps must be strictly increasing (row " + i + ")");
            }

            int n = timestamps.length;
            Map<String, double[]> built = new LinkedHashMap<>();
            for (Map.Entry<String, double[]> e : columns.entrySet()) {
                checkName(e.getKey());
                if (e.getValue().length != n) {
                    throw new IllegalArgumentException("Variable '" + e.getKey() + "' has "
                            + e.getValue().length + " values, expected " + n);
                }
                built.put(e.getKey(), e.getValue());
            }
            for (Map.Entry<String, Double> e : constants.entrySet()) {
                checkName(e.getKey());
                double[] filled = new double[n];
                Arrays.fill(filled, e.getValue());
                built.put(e.getKey(), filled);
            }
            return new ForcingDataset(timestamps.clone(), Collections.unmodifiableMap(built));
        }

        private static void checkName(String name) {
            if (name == null || !NAME_PATTERN.matcher(name).matches())
                throw new IllegalArgumentException("Invalid variable name: " + name);
            if (!Variables.isKnown(name))
                log.warn("Variable '{}' is not part of the known forcing vocabulary", name);
        }
    }
}
