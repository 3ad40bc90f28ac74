package com.acme.cievidence.parsers;

import com.acme.cievidence.matchers.TestCommandMatcher;
import com.acme.cievidence.util.FsUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared plumbing for the YAML based platforms: file checks, YAML loading and the
 * structural sanity check that every document is a mapping. Subclasses only walk the tree.
 *
 * <p>Documents are loaded with SnakeYAML's safe constructor so anchors, aliases and
 * {@code <<} merge keys are resolved before the tree is walked. A multi-document stream is
 * walked document by document into the same collector.
 */
@Slf4j
abstract class YamlCiParser implements CiParser {

    static final int MAX_CONFIG_BYTES = 5_000_000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected final TestCommandMatcher matcher = new TestCommandMatcher();

    @Override
    public final ParseOutcome parse(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            return new ParseOutcome.NotFound(configFile);
        }
        if (!Files.isRegularFile(configFile)) {
            return malformed(configFile, "not a regular file");
        }

        String text;
        try {
            if (Files.size(configFile) > MAX_CONFIG_BYTES) {
                return malformed(configFile, "file larger than " + MAX_CONFIG_BYTES + " bytes");
            }
            text = FsUtil.readUtf8(configFile, MAX_CONFIG_BYTES);
        } catch (IOException e) {
            return malformed(configFile, "cannot read file: " + e.getMessage());
        }

        List<ObjectNode> documents = new ArrayList<>();
        try {
            for (Object doc : newYaml().loadAll(text)) {
                if (doc == null) continue;
                JsonNode node = MAPPER.valueToTree(doc);
                if (!node.isObject()) {
                    return malformed(configFile, "top-level YAML value is not a mapping");
                }
                documents.add((ObjectNode) node);
            }
        } catch (YAMLException e) {
            return malformed(configFile, "invalid YAML: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return malformed(configFile, "unsupported YAML structure: " + e.getMessage());
        }
        if (documents.isEmpty()) {
            return malformed(configFile, "top-level YAML value is not a mapping");
        }

        StepCollector out = new StepCollector(matcher);
        for (ObjectNode root : documents) extract(root, out);
        ParseOutcome.Parsed parsed = out.done();
        log.debug("{}: {} test steps out of {} commands in {}", platform(), parsed.testSteps().size(),
                parsed.commands().size(), configFile);
        return parsed;
    }

    /** Walks a structurally valid document. Missing or oddly typed keys mean "no steps", not an error. */
    protected abstract void extract(ObjectNode root, StepCollector out);

    /** Not thread-safe, so one per parse. */
    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setCodePointLimit(MAX_CONFIG_BYTES);
        return new Yaml(new SafeConstructor(options));
    }

    private ParseOutcome malformed(Path file, String reason) {
        log.warn("Failed to parse {} config {}: {}", platform(), file, reason);
        return new ParseOutcome.Malformed(file, reason);
    }

    /** A script entry may be a single string or a list of strings; both end up as a list. */
    protected static List<String> scriptLines(JsonNode node) {
        List<String> lines = new ArrayList<>();
        if (node == null || node.isNull()) return lines;
        if (node.isTextual()) {
            lines.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) lines.add(item.asText().trim());
            }
        }
        return lines;
    }
}
