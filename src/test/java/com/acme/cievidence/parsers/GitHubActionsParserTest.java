package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.TestFramework;
import com.acme.cievidence.model.TestStepInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitHubActionsParserTest {

    @TempDir
    Path tempDir;

    private final GitHubActionsParser parser = new GitHubActionsParser();

    private Path write(String content) throws IOException {
        Path p = tempDir.resolve("ci.yml");
        Files.writeString(p, content);
        return p;
    }

    @Test
    void givenWorkflowWithMultilineRun_whenParse_thenEachTestLineBecomesStep() throws IOException {
        // given
        Path file = write("""
                name: CI
                on: [push, pull_request]
                jobs:
                  test:
                    runs-on: ubuntu-latest
                    steps:
                      - uses: actions/checkout@v4
                      - name: Install
                        run: pip install -r requirements.txt
                      - name: Test
                        run: |
                          pytest --cov=src tests/
                          echo done
                      - uses: codecov/codecov-action@v4
                  lint:
                    runs-on: ubuntu-latest
                    steps:
                      - run: flake8 .
                """);

        // when
        ParseOutcome outcome = parser.parse(file);

        // then
        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, outcome);
        assertEquals(List.of(new TestStepInfo("test", "pytest --cov=src tests/", TestFramework.PYTEST, true)),
                parsed.testSteps());
        assertEquals(List.of("actions/checkout@v4", "pip install -r requirements.txt", "pytest --cov=src tests/",
                "echo done", "codecov/codecov-action@v4", "flake8 ."), parsed.commands());
    }

    @Test
    void givenSeveralJobs_whenParse_thenStepsFollowJobOrder() throws IOException {
        Path file = write("""
                jobs:
                  unit:
                    steps:
                      - run: go test ./...
                  frontend:
                    steps:
                      - run: npm ci
                      - run: npm test
                """);

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertEquals(List.of("unit", "frontend"), parsed.testSteps().stream().map(TestStepInfo::jobName).toList());
        assertEquals(TestFramework.JEST, parsed.testSteps().get(1).framework());
    }

    @Test
    void givenWorkflowWithoutJobs_whenParse_thenEmptyParsed() throws IOException {
        Path file = write("""
                name: nothing
                on: push
                """);

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertTrue(parsed.testSteps().isEmpty());
    }

    @Test
    void givenOddlyTypedSteps_whenParse_thenIgnoredWithoutError() throws IOException {
        Path file = write("""
                jobs:
                  a: just-a-string
                  b:
                    steps: not-a-list
                  c:
                    steps:
                      - plain string step
                      - run: [not, a, string]
                """);

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertTrue(parsed.testSteps().isEmpty());
    }

    @Test
    void givenInvalidYaml_whenParse_thenMalformed() throws IOException {
        Path file = write("""
                jobs:
                  test:
                    steps: [ { run: pytest
                """);

        var malformed = assertInstanceOf(ParseOutcome.Malformed.class, parser.parse(file));

        assertEquals(file, malformed.file());
        assertTrue(malformed.reason().startsWith("invalid YAML"), malformed.reason());
    }

    @Test
    void givenTopLevelList_whenParse_thenMalformed() throws IOException {
        Path file = write("- a\n- b\n");

        assertInstanceOf(ParseOutcome.Malformed.class, parser.parse(file));
    }

    @Test
    void givenEmptyFile_whenParse_thenMalformed() throws IOException {
        Path file = write("");

        assertInstanceOf(ParseOutcome.Malformed.class, parser.parse(file));
    }

    @Test
    void givenMissingFile_whenParse_thenNotFound() {
        Path missing = tempDir.resolve("missing.yml");

        var notFound = assertInstanceOf(ParseOutcome.NotFound.class, parser.parse(missing));

        assertEquals(missing, notFound.file());
    }

    @Test
    void givenSameFile_whenParsedTwice_thenIdenticalOutcome() throws IOException {
        Path file = write("""
                jobs:
                  test:
                    steps:
                      - run: pytest
                      - run: go test -cover ./...
                """);

        assertEquals(parser.parse(file), parser.parse(file));
    }
}
