package com.acme.cievidence.matchers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoverageToolMatcherTest {

    private final CoverageToolMatcher matcher = new CoverageToolMatcher();

    @Test
    void givenCodecovUpload_whenDetect_thenCodecovOnly() {
        List<String> tools = matcher.detectCoverageTools(List.of("pytest --cov=src", "codecov upload"));

        assertEquals(List.of("codecov"), tools);
        assertTrue(matcher.hasCoverageUpload(List.of("pytest --cov=src", "codecov upload")));
    }

    @Test
    void givenCoverageFlagOnly_whenDetect_thenNoTool() {
        // "--coverage" is a flag, not the codecov tool
        assertEquals(List.of(), matcher.detectCoverageTools(List.of("npm test -- --coverage", "go test -coverprofile=c.out")));
        assertFalse(matcher.hasCoverageUpload(List.of("npm test -- --coverage")));
    }

    @Test
    void givenAllThreeTools_whenDetect_thenFirstSeenOrderWithoutDuplicates() {
        List<String> tools = matcher.detectCoverageTools(List.of(
                "mvn sonarqube:sonar",
                "codecov/codecov-action@v4",
                "bash <(curl -s https://codecov.io/bash)",
                "coveralls --service=github",
                "sonar-scanner -Dsonar.projectKey=demo"
        ));

        assertEquals(List.of("sonarqube", "codecov", "coveralls"), tools);
    }

    @Test
    void givenUpperCaseNames_whenDetect_thenMatchesIgnoringCase() {
        assertEquals(List.of("codecov", "coveralls"), matcher.detectCoverageTools(List.of("CODECOV", "Python-Coveralls")));
    }

    @Test
    void givenNullOrBlankInput_whenDetect_thenEmpty() {
        assertEquals(List.of(), matcher.detectCoverageTools(null));
        assertEquals(List.of(), matcher.detectCoverageTools(List.of()));
        assertEquals(List.of(), matcher.detectCoverageTools(java.util.Arrays.asList("", null, "  ")));
        assertFalse(matcher.hasCoverageUpload(null));
    }
}
