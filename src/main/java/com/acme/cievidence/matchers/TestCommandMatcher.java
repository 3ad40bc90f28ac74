/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.matchers;

import com.acme.cievidence.model.Enums.TestFramework;
import com.acme.cievidence.model.TestStepInfo;

import java.util.List;
import java.util.Locale;

/**
 * Recognises test runner invocations in CI commands by plain substring containment.
 * Python, JavaScript, Go and Java runners are covered; anything more exotic is missed on purpose.
 */
public final class TestCommandMatcher {

    static final List<String> TEST_COMMANDS = List.of(
            "pytest",
            "python -m pytest",
            "npm test",
            "npm run test",
            "go test",
            "mvn test",
            "gradle test",
            "./gradlew test",
            "gradlew test"
    );

    static final List<String> COVERAGE_FLAGS = List.of(
            "--cov",
            "--coverage",
            "-cover",
            "-coverprofile"
    );

    public boolean isTestCommand(String command) {
        if (command == null || command.isBlank()) return false;
        String lc = command.toLowerCase(Locale.ROOT);
        for (String t : TEST_COMMANDS) {
            if (lc.contains(t)) return true;
        }
        return false;
    }

    public List<String> extractTestCommands(List<String> commands) {
        if (commands == null) return List.of();
        return commands.stream().filter(this::isTestCommand).toList();
    }

    /** Best framework guess for a command, or {@code null}. Checked in order pytest, jest, go test, junit. */
    public TestFramework inferFramework(String command) {
        if (command == null || command.isBlank()) return null;
        String lc = command.toLowerCase(Locale.ROOT);
        if (lc.contains("pytest")) return TestFramework.PYTEST;
        if (lc.contains("npm test") || lc.contains("npm run test")) return TestFramework.JEST;
        if (lc.contains("go test")) return TestFramework.GO_TEST;
        if (lc.contains("mvn test") || lc.contains("gradle test") || lc.contains("gradlew test")) return TestFramework.JUNIT;
        return null;
    }

    /** Literal flag check; does not require the command to be a test invocation. */
    public boolean hasCoverageFlag(String command) {
        if (command == null || command.isEmpty()) return false;
        for (String f : COVERAGE_FLAGS) {
            if (command.contains(f)) return true;
        }
        return false;
    }

    public TestStepInfo toStep(String jobName, String command) {
        return new TestStepInfo(jobName, command, inferFramework(command), hasCoverageFlag(command));
    }
}
