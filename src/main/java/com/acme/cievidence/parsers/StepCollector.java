package com.acme.cievidence.parsers;

import com.acme.cievidence.matchers.TestCommandMatcher;
import com.acme.cievidence.model.TestStepInfo;

import java.util.ArrayList;
import java.util.List;

/** Accumulates candidate commands for one file and keeps the ones that look like test runs. */
final class StepCollector {
    private final TestCommandMatcher matcher;
    private final List<TestStepInfo> steps = new ArrayList<>();
    private final List<String> commands = new ArrayList<>();

    StepCollector(TestCommandMatcher matcher) { this.matcher = matcher; }

    void offer(String jobName, String command) {
        if (command == null) return;
        String c = command.trim();
        if (c.isEmpty()) return;
        commands.add(c);
        if (matcher.isTestCommand(c)) steps.add(matcher.toStep(jobName, c));
    }

    /** Action or orb references: visible to coverage-tool detection, never test steps. */
    void offerReference(String reference) {
        if (reference == null || reference.isBlank()) return;
        commands.add(reference.trim());
    }

    ParseOutcome.Parsed done() {
        return new ParseOutcome.Parsed(steps, commands);
    }
}
