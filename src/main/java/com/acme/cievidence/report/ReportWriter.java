package com.acme.cievidence.report;

import com.acme.cievidence.model.CiConfigResult;
import com.acme.cievidence.model.TestAnalysis;
import com.acme.cievidence.util.FsUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** JSON report for one analysis run. Field names are snake_case. */
public final class ReportWriter {

    public static final String TOOL_NAME = "ci_test_evidence";
    public static final String TOOL_VERSION = "1.0.0";

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public Map<String, Object> buildReport(Instant timestamp, Path repo, int staticScore,
                                           CiConfigResult ci, TestAnalysis analysis) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp_utc", timestamp);
        report.put("tool", Map.of("name", TOOL_NAME, "version", TOOL_VERSION));

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("repository", FsUtil.fileStat(repo));
        inputs.put("static_score", staticScore);
        report.put("inputs", inputs);

        report.put("ci_configuration", ci);
        report.put("test_analysis", analysis);
        return report;
    }

    public String toJson(Map<String, Object> report) throws IOException {
        return MAPPER.writeValueAsString(report);
    }

    public void write(Map<String, Object> report, Path out) throws IOException {
        MAPPER.writeValue(out.toFile(), report);
    }
}
