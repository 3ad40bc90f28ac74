package com.acme.cievidence.model;

import com.acme.cievidence.model.Enums.TestFramework;

/**
 * One test step found while scanning a CI configuration file.
 * Used between the parsers and the analyzer only; never written to a report.
 */
public record TestStepInfo(String jobName, String command, TestFramework framework, boolean hasCoverageFlag) {
    public TestStepInfo {
        if (jobName == null || jobName.isBlank()) throw new IllegalArgumentException("jobName must be non-empty");
        if (command == null || command.isBlank()) throw new IllegalArgumentException("command must be non-empty");
    }
}
