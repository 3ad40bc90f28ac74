package com.acme.cievidence.model;

import com.acme.cievidence.util.ScoreUtil;

/**
 * How the static-infrastructure score and the CI score add up, including the
 * points lost to the combined cap.
 */
public record ScoreBreakdown(
        int phase1Contribution,
        int phase2Contribution,
        int rawTotal,
        int cappedTotal,
        int truncatedPoints
) {
    public ScoreBreakdown {
        if (phase1Contribution < 0 || phase1Contribution > ScoreUtil.MAX_STATIC_SCORE) {
            throw new IllegalArgumentException("phase1Contribution must be in [0, " + ScoreUtil.MAX_STATIC_SCORE + "], got " + phase1Contribution);
        }
        if (phase2Contribution < 0 || phase2Contribution > ScoreUtil.MAX_CI_SCORE) {
            throw new IllegalArgumentException("phase2Contribution must be in [0, " + ScoreUtil.MAX_CI_SCORE + "], got " + phase2Contribution);
        }
        if (rawTotal != phase1Contribution + phase2Contribution) {
            throw new IllegalArgumentException("rawTotal must equal " + phase1Contribution + " + " + phase2Contribution + ", got " + rawTotal);
        }
        if (cappedTotal != Math.min(rawTotal, ScoreUtil.COMBINED_CAP)) {
            throw new IllegalArgumentException("cappedTotal must equal min(" + rawTotal + ", " + ScoreUtil.COMBINED_CAP + "), got " + cappedTotal);
        }
        if (truncatedPoints != rawTotal - cappedTotal || truncatedPoints < 0) {
            throw new IllegalArgumentException("truncatedPoints must equal " + rawTotal + " - " + cappedTotal + ", got " + truncatedPoints);
        }
    }

    public static ScoreBreakdown of(int phase1, int phase2) {
        int raw = phase1 + phase2;
        int capped = ScoreUtil.capCombined(raw);
        return new ScoreBreakdown(phase1, phase2, raw, capped, raw - capped);
    }
}
