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

import com.fasterxml.jackson.annotation.JsonValue;

public final class Enums {
    private Enums() {}

    /** Supported CI systems. Declaration order is the evaluation and tie-break order. */
    public enum CiPlatform {
        GITHUB_ACTIONS("github_actions"),
        GITLAB_CI("gitlab_ci"),
        CIRCLECI("circleci"),
        TRAVIS_CI("travis_ci"),
        JENKINS("jenkins");

        private final String id;

        CiPlatform(String id) { this.id = id; }

        @JsonValue
        public String id() { return id; }

        @Override public String toString() { return id; }
    }

    public enum TestFramework {
        PYTEST("pytest"),
        JEST("jest"),
        JUNIT("junit"),
        GO_TEST("go_test");

        private final String id;

        TestFramework(String id) { this.id = id; }

        @JsonValue
        public String id() { return id; }

        @Override public String toString() { return id; }
    }
}
