package com.acme.cievidence.scoring;

import com.acme.cievidence.model.CiConfigResult;
import com.acme.cievidence.model.ScoreBreakdown;
import com.acme.cievidence.model.StaticInfrastructureScore;
import com.acme.cievidence.model.TestAnalysis;
import com.acme.cievidence.util.ScoreUtil;

/**
 * Folds the CI score into the static-infrastructure score. The sum is capped at
 * {@value ScoreUtil#COMBINED_CAP}; the points cut off are kept in the breakdown.
 */
public final class ScoreCombiner {

    public TestAnalysis combine(StaticInfrastructureScore staticInfrastructure, CiConfigResult ciConfiguration) {
        if (staticInfrastructure == null) {
            throw new IllegalArgumentException("static infrastructure result is required");
        }
        int phase1 = staticInfrastructure.calculatedScore();
        if (phase1 < 0 || phase1 > ScoreUtil.MAX_STATIC_SCORE) {
            throw new IllegalArgumentException("static infrastructure score must be in [0, "
                    + ScoreUtil.MAX_STATIC_SCORE + "], got " + phase1);
        }
        int phase2 = ciConfiguration == null ? 0 : ciConfiguration.calculatedScore();

        ScoreBreakdown breakdown = ScoreBreakdown.of(phase1, phase2);
        return new TestAnalysis(staticInfrastructure, ciConfiguration, breakdown.cappedTotal(), breakdown);
    }
}
