package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * {@code .github/workflows/*.yml}: {@code jobs.<job>.steps[].run}. Multi-line {@code run}
 * blocks are checked line by line. {@code uses:} references feed coverage-tool detection only.
 */
public final class GitHubActionsParser extends YamlCiParser {
    @Override public CiPlatform platform() { return CiPlatform.GITHUB_ACTIONS; }

    @Override
    protected void extract(ObjectNode root, StepCollector out) {
        JsonNode jobs = root.get("jobs");
        if (jobs == null || !jobs.isObject()) return;

        Iterator<Map.Entry<String, JsonNode>> it = jobs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> job = it.next();
            JsonNode steps = job.getValue().get("steps");
            if (steps == null || !steps.isArray()) continue;

            for (JsonNode step : steps) {
                if (!step.isObject()) continue;
                JsonNode uses = step.get("uses");
                if (uses != null && uses.isTextual()) out.offerReference(uses.asText());

                JsonNode run = step.get("run");
                if (run == null || !run.isTextual()) continue;
                for (String line : run.asText().split("\n")) {
                    out.offer(job.getKey(), line);
                }
            }
        }
    }
}
