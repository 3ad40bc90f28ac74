package com.acme.cievidence.parsers;

import com.acme.cievidence.model.TestStepInfo;

import java.nio.file.Path;
import java.util.List;

/** Result of one {@link CiParser#parse} call. */
public sealed interface ParseOutcome {

    /**
     * The file was understood. {@code testSteps} may be empty. {@code commands} holds every
     * candidate command seen in the file, test or not, in file order.
     */
    record Parsed(List<TestStepInfo> testSteps, List<String> commands) implements ParseOutcome {
        public Parsed {
            testSteps = List.copyOf(testSteps);
            commands = List.copyOf(commands);
        }
    }

    record Malformed(Path file, String reason) implements ParseOutcome {}

    record NotFound(Path file) implements ParseOutcome {}
}
