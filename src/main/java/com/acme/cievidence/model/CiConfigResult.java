/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.model;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.util.ScoreUtil;

import java.util.HashSet;
import java.util.List;

/**
 * Outcome of the CI configuration analysis for one repository.
 *
 * <p>{@code platform} and {@code configFilePath} are both {@code null} when no CI
 * configuration was found. The boolean flags always agree with their lists:
 * {@code hasTestSteps} iff {@code testCommands} is non-empty, {@code hasCoverageUpload}
 * iff {@code coverageTools} is non-empty.
 *
 * <p>{@code coverageTools} normally names upload services ({@code codecov}, {@code coveralls},
 * {@code sonarqube}). The entry {@code coverage_flag} is not a service: it is recorded when
 * coverage is only collected inline by a test command flag such as {@code --cov}, with no
 * upload tool anywhere in the configuration.
 */
public record CiConfigResult(
        CiPlatform platform,
        String configFilePath,
        boolean hasTestSteps,
        List<String> testCommands,
        boolean hasCoverageUpload,
        List<String> coverageTools,
        int testJobCount,
        int calculatedScore,
        List<String> parseErrors
) {
    public CiConfigResult {
        testCommands = testCommands == null ? List.of() : List.copyOf(testCommands);
        coverageTools = coverageTools == null ? List.of() : List.copyOf(coverageTools);
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);

        if (calculatedScore < 0 || calculatedScore > ScoreUtil.MAX_CI_SCORE) {
            throw new IllegalArgumentException("calculatedScore must be in [0, " + ScoreUtil.MAX_CI_SCORE + "], got " + calculatedScore);
        }
        if (testJobCount < 0) {
            throw new IllegalArgumentException("testJobCount must be >= 0, got " + testJobCount);
        }
        if (hasTestSteps == testCommands.isEmpty()) {
            throw new IllegalArgumentException("hasTestSteps=" + hasTestSteps + " disagrees with " + testCommands.size() + " test commands");
        }
        if (hasCoverageUpload == coverageTools.isEmpty()) {
            throw new IllegalArgumentException("hasCoverageUpload=" + hasCoverageUpload + " disagrees with " + coverageTools.size() + " coverage tools");
        }
        if (new HashSet<>(coverageTools).size() != coverageTools.size()) {
            throw new IllegalArgumentException("coverageTools must not contain duplicates: " + coverageTools);
        }
        if ((platform == null) != (configFilePath == null)) {
            throw new IllegalArgumentException("platform and configFilePath must be both present or both absent");
        }
    }

    public static CiConfigResult none() {
        return new CiConfigResult(null, null, false, List.of(), false, List.of(), 0, 0, List.of());
    }

    public static CiConfigResult failed(CiPlatform platform, String configFilePath, List<String> parseErrors) {
        return new CiConfigResult(platform, configFilePath, false, List.of(), false, List.of(), 0, 0, parseErrors);
    }
}
