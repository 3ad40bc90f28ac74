/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.analyzer;

import com.acme.cievidence.matchers.CoverageToolMatcher;
import com.acme.cievidence.model.CiConfigResult;
import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.model.TestStepInfo;
import com.acme.cievidence.util.ScoreUtil;

import java.util.*;

public final class CiConfigResultBuilder {

    /** Reported in coverage_tools when coverage comes only from a test command flag such as --cov. */
    public static final String INLINE_COVERAGE_TOOL = "coverage_flag";

    private final CoverageToolMatcher coverageMatcher = new CoverageToolMatcher();

    private CiPlatform platform;
    private String configFilePath;
    private final List<TestStepInfo> steps = new ArrayList<>();
    private final List<String> coverageCandidates = new ArrayList<>();
    private final List<String> parseErrors = new ArrayList<>();

    public void selectPlatform(CiPlatform p, String relativeConfigPath) {
        this.platform = p;
        this.configFilePath = relativeConfigPath;
    }

    public void addTestSteps(List<TestStepInfo> s) { if (s != null) steps.addAll(s); }
    public void addCoverageCandidates(List<String> commands) { if (commands != null) coverageCandidates.addAll(commands); }
    public void addParseError(String message) { if (message != null) parseErrors.add(message); }

    public CiConfigResult build() {
        List<String> testCommands = steps.stream().map(TestStepInfo::command).toList();
        int jobCount = ScoreUtil.distinctJobCount(steps);

        List<String> tools = new ArrayList<>(coverageMatcher.detectCoverageTools(coverageCandidates));
        if (tools.isEmpty() && ScoreUtil.anyCoverageFlag(steps)) tools.add(INLINE_COVERAGE_TOOL);

        boolean hasTests = !testCommands.isEmpty();
        boolean hasCoverage = !tools.isEmpty();
        int score = ScoreUtil.ciScore(hasTests, hasCoverage, jobCount);

        return new CiConfigResult(platform, configFilePath, hasTests, testCommands,
                hasCoverage, tools, jobCount, score, parseErrors);
    }
}
