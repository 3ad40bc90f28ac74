package com.acme.cievidence.analyzer;

import com.acme.cievidence.model.Enums.CiPlatform;
import com.acme.cievidence.util.FsUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds CI configuration files at the repository root. Only the well-known locations are
 * probed; nothing is searched recursively. Several platforms may be present at once.
 */
public class PlatformDetector {

    static final Path GITHUB_WORKFLOWS = Path.of(".github", "workflows");
    static final Set<String> WORKFLOW_EXTS = Set.of(".yml", ".yaml");

    private static final Map<CiPlatform, Path> FIXED_LOCATIONS = Map.of(
            CiPlatform.GITLAB_CI, Path.of(".gitlab-ci.yml"),
            CiPlatform.CIRCLECI, Path.of(".circleci", "config.yml"),
            CiPlatform.TRAVIS_CI, Path.of(".travis.yml"),
            CiPlatform.JENKINS, Path.of("Jenkinsfile")
    );

    /**
     * Detected platforms with their config file, iterated in {@link CiPlatform} order.
     *
     * @throws UncheckedIOException if {@code .github/workflows} exists but cannot be listed
     */
    public Map<CiPlatform, Path> detect(Path repoRoot) {
        Map<CiPlatform, Path> found = new EnumMap<>(CiPlatform.class);

        Path workflow = firstWorkflow(repoRoot.resolve(GITHUB_WORKFLOWS));
        if (workflow != null) found.put(CiPlatform.GITHUB_ACTIONS, workflow);

        for (var e : FIXED_LOCATIONS.entrySet()) {
            Path p = repoRoot.resolve(e.getValue());
            if (Files.isRegularFile(p)) found.put(e.getKey(), p);
        }
        return found;
    }

    /** First workflow file by file name; a repository usually has several and one is enough. */
    static Path firstWorkflow(Path workflowsDir) {
        try {
            List<Path> files = FsUtil.listFilesByExt(workflowsDir, WORKFLOW_EXTS);
            return files.isEmpty() ? null : files.get(0);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + workflowsDir, e);
        }
    }
}
