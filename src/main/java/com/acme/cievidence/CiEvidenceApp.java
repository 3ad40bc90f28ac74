/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence;

import com.acme.cievidence.analyzer.CiConfigAnalyzer;
import com.acme.cievidence.model.CiConfigResult;
import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.model.StaticInfrastructureResult;
import com.acme.cievidence.model.TestAnalysis;
import com.acme.cievidence.report.ReportWriter;
import com.acme.cievidence.scoring.ScoreCombiner;
import com.acme.cievidence.util.ScoreUtil;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@CommandLine.Command(
        name = "ci-test-evidence",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Detects test and coverage steps in a repository's CI configuration and scores them (0-13), "
                + "optionally combined with a static test-infrastructure score (0-25) into a capped testing score (0-35).",
        sortOptions = false
)
public class CiEvidenceApp implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Option(names = "--repo", required = true, description = "Repository root directory.")
    Path repo;

    @CommandLine.Option(names = "--static-score", defaultValue = "0",
            description = "Static test-infrastructure score, 0-25. Default: ${DEFAULT-VALUE}")
    int staticScore;

    @CommandLine.Option(names = "--out", description = "Output JSON report path. Default: ci_test_evidence_<timestamp>.json")
    Path out;

    @CommandLine.Option(names = "--parallel", defaultValue = "false",
            description = "Parse the detected CI platforms concurrently. Default: ${DEFAULT-VALUE}")
    boolean parallel;

    @CommandLine.Option(names = "--verbose", defaultValue = "false", description = "Debug logging.")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CiEvidenceApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");

        if (staticScore < 0 || staticScore > ScoreUtil.MAX_STATIC_SCORE) {
            System.err.println("--static-score must be between 0 and " + ScoreUtil.MAX_STATIC_SCORE + ", got " + staticScore);
            return EXIT_USAGE;
        }

        Instant now = Instant.now();
        CiConfigResult ci;
        ExecutorService pool = parallel ? Executors.newFixedThreadPool(CiPlatform.values().length) : null;
        try {
            CiConfigAnalyzer analyzer = pool == null ? new CiConfigAnalyzer() : new CiConfigAnalyzer(pool);
            ci = analyzer.analyze(repo);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } finally {
            if (pool != null) pool.shutdown();
        }

        TestAnalysis analysis = new ScoreCombiner().combine(StaticInfrastructureResult.ofScore(staticScore),
                ci.platform() == null ? null : ci);

        ReportWriter writer = new ReportWriter();
        Map<String, Object> report = writer.buildReport(now, repo, staticScore, ci, analysis);

        Path outPath = out != null
                ? out
                : Path.of(ReportWriter.TOOL_NAME + "_" + now.toString().replace(":", "").replace(".", "") + ".json");
        writer.write(report, outPath);

        System.out.println("\n=== CI Test Evidence ===");
        System.out.println("Platform: " + (ci.platform() == null ? "none" : ci.platform() + " (" + ci.configFilePath() + ")"));
        System.out.println("Test commands: " + ci.testCommands());
        System.out.println("Test jobs: " + ci.testJobCount() + ", coverage tools: " + ci.coverageTools());
        System.out.println("CI score: " + ci.calculatedScore() + "/" + ScoreUtil.MAX_CI_SCORE);
        System.out.println("Testing score: " + analysis.combinedScore() + "/" + ScoreUtil.COMBINED_CAP
                + " (raw " + analysis.scoreBreakdown().rawTotal() + ", truncated " + analysis.scoreBreakdown().truncatedPoints() + ")");
        if (!ci.parseErrors().isEmpty()) System.out.println("Parse errors: " + ci.parseErrors());
        System.out.println("Report: " + outPath + "\n");

        return ci.parseErrors().isEmpty() ? EXIT_OK : EXIT_PARSE_ERRORS;
    }
}
