/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: CI Test Evidence Analyzer
 */

package com.acme.cievidence.parsers;

import com.acme.cievidence.matchers.TestCommandMatcher;
import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.util.FsUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jenkinsfile scanner. The pipeline DSL is not evaluated: only the quoted argument of
 * {@code sh '...'} and {@code bat '...'} calls is looked at, so tests run from a wrapper
 * script ({@code sh './run_tests.sh'}) are not seen. All steps share one job label.
 */
@Slf4j
public final class JenkinsParser implements CiParser {

    static final String JOB_NAME = "jenkins_pipeline";

    private static final Pattern SH = Pattern.compile("sh\\s+['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE);
    private static final Pattern BAT = Pattern.compile("bat\\s+['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE);

    private final TestCommandMatcher matcher = new TestCommandMatcher();
    private final int maxBytes;

    public JenkinsParser() {
        this(YamlCiParser.MAX_CONFIG_BYTES);
    }

    JenkinsParser(int maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override public CiPlatform platform() { return CiPlatform.JENKINS; }

    @Override
    public ParseOutcome parse(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            return new ParseOutcome.NotFound(configFile);
        }
        if (!Files.isRegularFile(configFile)) {
            return malformed(configFile, "not a regular file");
        }

        String text;
        try {
            if (Files.size(configFile) > maxBytes) {
                return malformed(configFile, "file larger than " + maxBytes + " bytes");
            }
            text = FsUtil.readUtf8(configFile, maxBytes);
        } catch (IOException e) {
            return malformed(configFile, "cannot read file: " + e.getMessage());
        }

        StepCollector out = new StepCollector(matcher);
        collect(SH, text, out);
        collect(BAT, text, out);
        return out.done();
    }

    private static ParseOutcome malformed(Path file, String reason) {
        log.warn("Failed to parse Jenkinsfile {}: {}", file, reason);
        return new ParseOutcome.Malformed(file, reason);
    }

    private static void collect(Pattern p, String text, StepCollector out) {
        Matcher m = p.matcher(text);
        while (m.find()) out.offer(JOB_NAME, m.group(1));
    }
}
