package com.acme.cievidence.model;

import com.acme.cievidence.util.ScoreUtil;

public record StaticInfrastructureResult(
        int testFilesDetected,
        boolean testConfigDetected,
        boolean coverageConfigDetected,
        double testFileRatio,
        int calculatedScore,
        String inferredFramework
) implements StaticInfrastructureScore {
    public StaticInfrastructureResult {
        if (testFilesDetected < 0) throw new IllegalArgumentException("testFilesDetected must be >= 0, got " + testFilesDetected);
        if (testFileRatio < 0.0 || testFileRatio > 1.0) throw new IllegalArgumentException("testFileRatio must be in [0.0, 1.0], got " + testFileRatio);
        if (calculatedScore < 0 || calculatedScore > ScoreUtil.MAX_STATIC_SCORE) {
            throw new IllegalArgumentException("calculatedScore must be in [0, " + ScoreUtil.MAX_STATIC_SCORE + "], got " + calculatedScore);
        }
        if (inferredFramework == null || inferredFramework.isBlank()) inferredFramework = "none";
    }

    /** Wraps a score that arrived without the supporting detail, e.g. from the command line. */
    public static StaticInfrastructureResult ofScore(int calculatedScore) {
        return new StaticInfrastructureResult(0, false, false, 0.0, calculatedScore, "none");
    }
}
