package com.hydro.petcmp.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hydro.petcmp.ComparisonReport;
import com.hydro.petcmp.engine.ComputationResult;
import com.hydro.petcmp.engine.FormulaIssue;
import com.hydro.petcmp.stats.FormulaMatrix;
import com.hydro.petcmp.stats.SummaryStats;

import lombok.Data;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link ComparisonReport} to JSON for reporting tools.
 * Non-finite numbers are written as {@code null}.
 */
public final class ComparisonReportWriter {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(ComparisonReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report " + report.name(), e);
        }
    }

    public void write(ComparisonReport report, Path path) {
        try {
            Files.writeString(path, toJson(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + path, e);
        }
    }

    /** Builds the serializable view of a report. */
    public ReportDocument toDocument(ComparisonReport report) {
        ReportDocument doc = new ReportDocument();
        doc.setName(report.name());

        List<String> stamps = new ArrayList<>();
        for (Instant t : report.table().timestamps())
            stamps.add(t.toString());
        doc.setTimestamps(stamps);

        List<FormulaEntry> formulas = new ArrayList<>();
        for (ComputationResult r : report.table().results()) {
            FormulaEntry fe = new FormulaEntry();
            fe.setName(r.formula());
            fe.setTotal(safe(r.total()));
            Map<String, List<Double>> comps = new LinkedHashMap<>();
            for (Map.Entry<String, double[]> c : r.components().entrySet())
                comps.put(c.getKey(), safe(c.getValue()));
            fe.setComponents(comps);
            fe.setWarnings(r.warnings());
            formulas.add(fe);
        }
        doc.setFormulas(formulas);

        List<IssueEntry> issues = new ArrayList<>();
        for (FormulaIssue issue : report.issues()) {
            IssueEntry ie = new IssueEntry();
            ie.setFormula(issue.formula());
            ie.setStatus(issue.kind().name());
            ie.setReason(issue.reason());
            issues.add(ie);
        }
        doc.setIssues(issues);

        List<SummaryEntry> summary = new ArrayList<>();
        for (SummaryStats s : report.statistics().summary().values()) {
            SummaryEntry se = new SummaryEntry();
            se.setFormula(s.formula());
            se.setMean(safe(s.mean()));
            se.setStd(safe(s.std()));
            se.setCv(safe(s.cv()));
            se.setCount(s.count());
            se.setMin(safe(s.min()));
            se.setMax(safe(s.max()));
            summary.add(se);
        }
        doc.setSummary(summary);
        doc.setCorrelation(matrix(report.statistics().correlation()));
        doc.setDifference(matrix(report.statistics().difference()));
        return doc;
    }

    private static MatrixEntry matrix(FormulaMatrix m) {
        MatrixEntry me = new MatrixEntry();
        me.setLabels(m.labels());
        List<List<Double>> rows = new ArrayList<>();
        for (double[] row : m.toArray())
            rows.add(safe(row));
        me.setValues(rows);
        return me;
    }

    private static List<Double> safe(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values)
            out.add(safe(v));
        return out;
    }

    private static Double safe(double v) {
        return Double.isFinite(v) ? v : null;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ReportDocument {
        private String name;
        private List<String> timestamps;
        private List<FormulaEntry> formulas;
        private List<IssueEntry> issues;
        private List<SummaryEntry> summary;
        private MatrixEntry correlation, difference;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FormulaEntry {
        private String name;
        private List<Double> total;
        private Map<String, List<Double>> components;
        private List<String> warnings;
    }

    @Data
    public static final class IssueEntry {
        private String formula, status, reason;
    }

    @Data
    public static final class SummaryEntry {
        private String formula;
        private Double mean, std, cv, min, max;
        private int count;
    }

    @Data
    public static final class MatrixEntry {
        private List<String> labels;
        private List<List<Double>> values;
    }
}
