package com.acme.cievidence.util;

import com.acme.cievidence.model.TestStepInfo;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ScoreUtil {
    private ScoreUtil() {}

    public static final int TEST_STEPS_POINTS = 5;
    public static final int COVERAGE_POINTS = 5;
    public static final int MULTI_JOB_POINTS = 3;
    public static final int MULTI_JOB_THRESHOLD = 2;

    public static final int MAX_CI_SCORE = 13;
    public static final int MAX_STATIC_SCORE = 25;
    public static final int COMBINED_CAP = 35;

    /**
     * CI score: 5 for any test step, 5 for coverage (upload tool or coverage flag),
     * 3 for at least two distinct test jobs, capped at {@link #MAX_CI_SCORE}.
     */
    public static int ciScore(boolean hasTestSteps, boolean hasCoverage, int testJobCount) {
        int score = 0;
        if (hasTestSteps) score += TEST_STEPS_POINTS;
        if (hasCoverage) score += COVERAGE_POINTS;
        if (testJobCount >= MULTI_JOB_THRESHOLD) score += MULTI_JOB_POINTS;
        return Math.min(score, MAX_CI_SCORE);
    }

    /** Score of one platform's steps, given the upload tools found in that platform's commands. */
    public static int platformScore(List<TestStepInfo> steps, Collection<String> coverageTools) {
        boolean hasCoverage = !coverageTools.isEmpty() || anyCoverageFlag(steps);
        return ciScore(!steps.isEmpty(), hasCoverage, distinctJobCount(steps));
    }

    public static int distinctJobCount(List<TestStepInfo> steps) {
        Set<String> jobs = new LinkedHashSet<>();
        for (TestStepInfo s : steps) jobs.add(s.jobName());
        return jobs.size();
    }

    public static boolean anyCoverageFlag(List<TestStepInfo> steps) {
        return steps.stream().anyMatch(TestStepInfo::hasCoverageFlag);
    }

    public static int capCombined(int rawTotal) {
        return Math.min(rawTotal, COMBINED_CAP);
    }
}
