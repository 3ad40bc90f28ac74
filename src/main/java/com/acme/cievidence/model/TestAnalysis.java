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

import com.acme.cievidence.util.ScoreUtil;

/**
 * Testing dimension: static infrastructure plus CI configuration, capped.
 * {@code ciConfiguration} is {@code null} when the repository has no CI configuration.
 */
public record TestAnalysis(
        StaticInfrastructureScore staticInfrastructure,
        CiConfigResult ciConfiguration,
        int combinedScore,
        ScoreBreakdown scoreBreakdown
) {
    public TestAnalysis {
        if (staticInfrastructure == null) throw new IllegalArgumentException("staticInfrastructure must not be null");
        if (scoreBreakdown == null) throw new IllegalArgumentException("scoreBreakdown must not be null");

        int phase1 = staticInfrastructure.calculatedScore();
        int phase2 = ciConfiguration == null ? 0 : ciConfiguration.calculatedScore();
        int expected = ScoreUtil.capCombined(phase1 + phase2);

        if (combinedScore != expected) {
            throw new IllegalArgumentException("combinedScore must equal min(" + phase1 + " + " + phase2 + ", "
                    + ScoreUtil.COMBINED_CAP + ") = " + expected + ", got " + combinedScore);
        }
        if (combinedScore != scoreBreakdown.cappedTotal()) {
            throw new IllegalArgumentException("combinedScore (" + combinedScore + ") must match breakdown cappedTotal ("
                    + scoreBreakdown.cappedTotal() + ")");
        }
        if (scoreBreakdown.phase1Contribution() != phase1) {
            throw new IllegalArgumentException("breakdown phase1Contribution (" + scoreBreakdown.phase1Contribution()
                    + ") must match static score (" + phase1 + ")");
        }
        if (scoreBreakdown.phase2Contribution() != phase2) {
            throw new IllegalArgumentException("breakdown phase2Contribution (" + scoreBreakdown.phase2Contribution()
                    + ") must match CI score (" + phase2 + ")");
        }
    }
}
