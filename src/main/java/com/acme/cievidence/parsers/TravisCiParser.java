package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** {@code .travis.yml}: top-level {@code script} and {@code after_success}, each a string or a list. */
public final class TravisCiParser extends YamlCiParser {

    static final String SCRIPT_JOB = "travis_script";
    static final String AFTER_SUCCESS_JOB = "travis_after_success";

    @Override public CiPlatform platform() { return CiPlatform.TRAVIS_CI; }

    @Override
    protected void extract(ObjectNode root, StepCollector out) {
        for (String cmd : scriptLines(root.get("script"))) out.offer(SCRIPT_JOB, cmd);
        for (String cmd : scriptLines(root.get("after_success"))) out.offer(AFTER_SUCCESS_JOB, cmd);
    }
}
