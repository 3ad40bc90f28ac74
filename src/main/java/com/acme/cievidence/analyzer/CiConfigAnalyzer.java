/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.analyzer;

import com.acme.cievidence.matchers.CoverageToolMatcher;
import com.acme.cievidence.model.CiConfigResult;
import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.model.TestStepInfo;
import com.acme.cievidence.parsers.*;
import com.acme.cievidence.util.FsUtil;
import com.acme.cievidence.util.ScoreUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point of the CI analysis: detects the platforms configured in a repository, parses
 * each one, and reports on the platform with the best score.
 *
 * <p>A malformed file costs only its own platform; it shows up in
 * {@link CiConfigResult#parseErrors()} and the remaining platforms are still evaluated.
 * Equal scores go to the platform declared first in {@link CiPlatform}.
 *
 * <p>Parses may run on a supplied {@link Executor}. All outcomes are collected in platform
 * order before anything is selected, so the result does not depend on completion order.
 */
@Slf4j
public final class CiConfigAnalyzer {

    private final PlatformDetector detector;
    private final Map<CiPlatform, CiParser> parsers;
    private final Executor executor;
    private final CoverageToolMatcher coverageMatcher = new CoverageToolMatcher();

    public CiConfigAnalyzer() {
        this(Runnable::run);
    }

    public CiConfigAnalyzer(Executor executor) {
        this(new PlatformDetector(), defaultParsers(), executor);
    }

    CiConfigAnalyzer(PlatformDetector detector, List<CiParser> parsers, Executor executor) {
        this.detector = detector;
        this.executor = executor;
        this.parsers = new EnumMap<>(CiPlatform.class);
        for (CiParser p : parsers) this.parsers.put(p.platform(), p);
    }

    static List<CiParser> defaultParsers() {
        return List.of(
                new GitHubActionsParser(),
                new GitLabCiParser(),
                new CircleCiParser(),
                new TravisCiParser(),
                new JenkinsParser()
        );
    }

    /**
     * @throws IllegalArgumentException if {@code repoRoot} is missing, not a directory, or cannot be listed
     * @throws IllegalStateException if a detected config file disappeared before it was parsed
     */
    public CiConfigResult analyze(Path repoRoot) {
        if (repoRoot == null || !Files.exists(repoRoot)) {
            throw new IllegalArgumentException("Repository path does not exist: " + repoRoot);
        }
        if (!Files.isDirectory(repoRoot)) {
            throw new IllegalArgumentException("Repository path is not a directory: " + repoRoot);
        }

        Map<CiPlatform, Path> detected;
        try {
            detected = detector.detect(repoRoot);
        } catch (UncheckedIOException e) {
            throw new IllegalArgumentException("Repository path cannot be scanned: " + repoRoot
                    + " (" + e.getCause().getMessage() + ")", e);
        }
        if (detected.isEmpty()) {
            log.info("No CI configuration found in {}", repoRoot);
            return CiConfigResult.none();
        }
        log.info("Detected CI platforms in {}: {}", repoRoot, detected.keySet());

        Map<CiPlatform, CompletableFuture<ParseOutcome>> pending = new EnumMap<>(CiPlatform.class);
        for (var e : detected.entrySet()) {
            CiPlatform platform = e.getKey();
            Path file = e.getValue();
            pending.put(platform, CompletableFuture.supplyAsync(() -> parseGuarded(platform, file), executor));
        }

        List<String> parseErrors = new ArrayList<>();
        List<PlatformCandidate> candidates = new ArrayList<>();
        for (var e : pending.entrySet()) {
            CiPlatform platform = e.getKey();
            ParseOutcome outcome = e.getValue().join();
            if (outcome instanceof ParseOutcome.Parsed parsed) {
                candidates.add(candidate(platform, detected.get(platform), parsed));
            } else if (outcome instanceof ParseOutcome.Malformed malformed) {
                parseErrors.add(platform.id() + ": " + malformed.reason());
            } else if (outcome instanceof ParseOutcome.NotFound notFound) {
                throw new IllegalStateException("Detected " + platform + " config vanished before parsing: " + notFound.file());
            }
        }

        if (candidates.isEmpty()) {
            var first = detected.entrySet().iterator().next();
            log.warn("No CI configuration in {} could be parsed: {}", repoRoot, parseErrors);
            return CiConfigResult.failed(first.getKey(), FsUtil.relativeUnixPath(repoRoot, first.getValue()), parseErrors);
        }

        PlatformCandidate best = selectBest(candidates);
        CiConfigResultBuilder out = new CiConfigResultBuilder();
        parseErrors.forEach(out::addParseError);
        out.selectPlatform(best.platform(), FsUtil.relativeUnixPath(repoRoot, best.configFile()));
        out.addTestSteps(best.testSteps());
        for (PlatformCandidate c : candidates) out.addCoverageCandidates(c.commands());

        CiConfigResult result = out.build();
        log.info("CI analysis of {}: platform={}, testSteps={}, jobs={}, coverageTools={}, score={}",
                repoRoot, result.platform(), result.testCommands().size(), result.testJobCount(),
                result.coverageTools(), result.calculatedScore());
        return result;
    }

    /** Highest score wins; on a tie the earlier candidate, i.e. the earlier platform, is kept. */
    static PlatformCandidate selectBest(List<PlatformCandidate> candidates) {
        PlatformCandidate best = null;
        for (PlatformCandidate c : candidates) {
            if (best == null || c.score() > best.score()) best = c;
        }
        return best;
    }

    private PlatformCandidate candidate(CiPlatform platform, Path file, ParseOutcome.Parsed parsed) {
        List<String> tools = coverageMatcher.detectCoverageTools(parsed.commands());
        int score = ScoreUtil.platformScore(parsed.testSteps(), tools);
        log.debug("{} scored {} ({} test steps, tools={})", platform, score, parsed.testSteps().size(), tools);
        return new PlatformCandidate(platform, file, parsed.testSteps(), parsed.commands(), score);
    }

    private ParseOutcome parseGuarded(CiPlatform platform, Path file) {
        CiParser parser = parsers.get(platform);
        if (parser == null) {
            return new ParseOutcome.Malformed(file, "no parser registered for " + platform);
        }
        try {
            return parser.parse(file);
        } catch (RuntimeException e) {
            log.warn("Parser for {} failed on {}", platform, file, e);
            return new ParseOutcome.Malformed(file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    record PlatformCandidate(CiPlatform platform, Path configFile, List<TestStepInfo> testSteps,
                             List<String> commands, int score) {}
}
