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

class GitLabCiParserTest {

    @TempDir
    Path tempDir;

    private final GitLabCiParser parser = new GitLabCiParser();

    private Path write(String content) throws IOException {
        Path p = tempDir.resolve(".gitlab-ci.yml");
        Files.writeString(p, content);
        return p;
    }

    @Test
    void givenJobsAndReservedKeys_whenParse_thenOnlyRealJobsScanned() throws IOException {
        // given
        Path file = write("""
                stages: [test]
                variables:
                  PIP_CACHE_DIR: .cache
                before_script:
                  - pytest --version
                .template:
                  script:
                    - pytest hidden/
                unit_tests:
                  stage: test
                  script:
                    - pip install -r requirements.txt
                    - pytest --cov=src tests/unit
                  after_script:
                    - codecov upload
                integration:
                  script: npm run test
                """);

        // when
        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        // then
        assertEquals(List.of(
                new TestStepInfo("unit_tests", "pytest --cov=src tests/unit", TestFramework.PYTEST, true),
                new TestStepInfo("integration", "npm run test", TestFramework.JEST, false)
        ), parsed.testSteps());
        assertEquals(List.of("pip install -r requirements.txt", "pytest --cov=src tests/unit", "codecov upload", "npm run test"),
                parsed.commands());
    }

    @Test
    void givenTestInAfterScript_whenParse_thenJobNameIsSuffixed() throws IOException {
        Path file = write("""
                e2e:
                  script:
                    - make e2e
                  after_script: go test ./e2e/...
                """);

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertEquals(1, parsed.testSteps().size());
        assertEquals("e2e (after_script)", parsed.testSteps().get(0).jobName());
    }

    @Test
    void givenStringAndListScripts_whenParse_thenSameSteps() throws IOException {
        Path asString = write("test:\n  script: mvn test\n");
        var fromString = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(asString));

        Path asList = write("test:\n  script:\n    - mvn test\n");
        var fromList = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(asList));

        assertEquals(fromString, fromList);
    }

    @Test
    void givenUnbalancedBrackets_whenParse_thenMalformed() throws IOException {
        Path file = write("""
                test:
                  script: [pytest --cov=src tests/
                """);

        assertInstanceOf(ParseOutcome.Malformed.class, parser.parse(file));
    }

    @Test
    void givenMissingFile_whenParse_thenNotFound() {
        assertInstanceOf(ParseOutcome.NotFound.class, parser.parse(tempDir.resolve(".gitlab-ci.yml")));
    }

    @Test
    void givenJobsMergingHiddenTemplate_whenParse_thenTemplateScriptsCountPerJob() throws IOException {
        // given
        Path file = write("""
                .test_template: &test_def
                  script:
                    - pytest --cov=src tests/
                unit:
                  <<: *test_def
                integration:
                  <<: *test_def
                  after_script:
                    - codecov
                """);

        // when
        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        // then
        assertEquals(List.of("unit", "integration"), parsed.testSteps().stream().map(TestStepInfo::jobName).toList());
        assertTrue(parsed.testSteps().stream().allMatch(TestStepInfo::hasCoverageFlag));
        assertEquals(List.of("pytest --cov=src tests/", "pytest --cov=src tests/", "codecov"), parsed.commands());
    }

    @Test
    void givenAliasedScriptList_whenParse_thenAliasResolved() throws IOException {
        Path file = write("""
                variables:
                  TESTS: &tests
                    - go test ./...
                unit:
                  script: *tests
                """);

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertEquals(List.of("go test ./..."), parsed.testSteps().stream().map(TestStepInfo::command).toList());
    }

    @Test
    void givenSpecHeaderDocument_whenParse_thenJobsAfterSeparatorScanned() throws IOException {
        // given
        Path file = write("""
                spec:
                  inputs:
                    stage:
                      default: test
                ---
                unit:
                  script: [pytest tests/]
                ---
                frontend:
                  script: [npm test]
                """);

        // when
        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        // then
        assertEquals(List.of("unit", "frontend"), parsed.testSteps().stream().map(TestStepInfo::jobName).toList());
        assertEquals(List.of("pytest tests/", "npm test"), parsed.commands());
    }

    @Test
    void givenLaterDocumentNotAMapping_whenParse_thenMalformed() throws IOException {
        Path file = write("""
                unit:
                  script: [pytest]
                ---
                - not
                - a mapping
                """);

        var malformed = assertInstanceOf(ParseOutcome.Malformed.class, parser.parse(file));
        assertTrue(malformed.reason().contains("not a mapping"), malformed.reason());
    }

    @Test
    void givenTrailingEmptyDocument_whenParse_thenIgnored() throws IOException {
        Path file = write("unit:\n  script: [pytest]\n---\n");

        var parsed = assertInstanceOf(ParseOutcome.Parsed.class, parser.parse(file));

        assertEquals(1, parsed.testSteps().size());
    }
}
