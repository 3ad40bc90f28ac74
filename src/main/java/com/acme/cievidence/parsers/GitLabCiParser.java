package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * {@code .gitlab-ci.yml}: every top-level mapping that is not a reserved keyword and not a
 * hidden {@code .template} is a job. {@code script} and {@code after_script} are scanned; the
 * latter under the job name suffixed with {@value #AFTER_SCRIPT_SUFFIX}.
 */
public final class GitLabCiParser extends YamlCiParser {

    static final Set<String> RESERVED_KEYWORDS = Set.of(
            "image", "services", "stages", "variables", "cache", "before_script",
            "after_script", "artifacts", "retry", "timeout", "parallel", "trigger",
            "include", "extends", "pages", "workflow", "default", "inherit", "spec"
    );

    static final String AFTER_SCRIPT_SUFFIX = " (after_script)";

    @Override public CiPlatform platform() { return CiPlatform.GITLAB_CI; }

    @Override
    protected void extract(ObjectNode root, StepCollector out) {
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String name = e.getKey();
            JsonNode job = e.getValue();
            if (RESERVED_KEYWORDS.contains(name) || name.startsWith(".") || !job.isObject()) continue;

            for (String cmd : scriptLines(job.get("script"))) out.offer(name, cmd);
            for (String cmd : scriptLines(job.get("after_script"))) out.offer(name + AFTER_SCRIPT_SUFFIX, cmd);
        }
    }
}
