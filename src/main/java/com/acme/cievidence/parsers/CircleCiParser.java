package com.acme.cievidence.parsers;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * {@code .circleci/config.yml}: {@code jobs.<job>.steps[]}. A step is a bare string
 * ({@code checkout}), {@code run: <command>} or {@code run: {command: ...}}. Other keyed steps
 * are orb calls such as {@code codecov/upload}; their names only feed coverage-tool detection.
 */
public final class CircleCiParser extends YamlCiParser {
    @Override public CiPlatform platform() { return CiPlatform.CIRCLECI; }

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
                if (step.isTextual()) {
                    out.offer(job.getKey(), step.asText());
                } else if (step.isObject()) {
                    JsonNode run = step.get("run");
                    if (run != null) {
                        out.offer(job.getKey(), runCommand(run));
                    } else {
                        step.fieldNames().forEachRemaining(out::offerReference);
                    }
                }
            }
        }
    }

    static String runCommand(JsonNode run) {
        if (run.isTextual()) return run.asText();
        if (run.isObject()) {
            JsonNode cmd = run.get("command");
            if (cmd != null && cmd.isTextual()) return cmd.asText();
        }
        return null;
    }
}
