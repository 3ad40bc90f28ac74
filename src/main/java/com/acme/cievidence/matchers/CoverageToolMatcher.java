package com.acme.cievidence.matchers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds coverage upload and reporting tools (Codecov, Coveralls, SonarQube) in CI commands.
 * {@code --coverage} is not a Codecov hit: "coverage" and "codecov" are different substrings.
 */
public final class CoverageToolMatcher {

    public static final String CODECOV = "codecov";
    public static final String COVERALLS = "coveralls";
    public static final String SONARQUBE = "sonarqube";

    /** Unique tool names in first-seen order. */
    public List<String> detectCoverageTools(List<String> commands) {
        List<String> found = new ArrayList<>();
        if (commands == null) return found;
        for (String cmd : commands) {
            if (cmd == null || cmd.isBlank()) continue;
            String lc = cmd.toLowerCase(Locale.ROOT);
            if (lc.contains("codecov")) addOnce(found, CODECOV);
            if (lc.contains("coveralls")) addOnce(found, COVERALLS);
            if (lc.contains("sonar-scanner") || lc.contains("sonarqube")) addOnce(found, SONARQUBE);
        }
        return found;
    }

    public boolean hasCoverageUpload(List<String> commands) {
        return !detectCoverageTools(commands).isEmpty();
    }

    private static void addOnce(List<String> found, String tool) {
        if (!found.contains(tool)) found.add(tool);
    }
}
