package com.shipyard.core.stage;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts test counts from runner output. Counts are informational only;
 * pass/fail always comes from the exit status.
 */
public final class TestOutputParser {

    /** Maven/JUnit style: "Tests run: 10, Failures: 2" */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    public record TestCounts(int total, int failed) {}

    private TestOutputParser() {}

    public static Optional<TestCounts> parse(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }

        Matcher mavenMatcher = MAVEN_PATTERN.matcher(output);
        if (mavenMatcher.find()) {
            return Optional.of(new TestCounts(
                    Integer.parseInt(mavenMatcher.group(1)),
                    Integer.parseInt(mavenMatcher.group(2))));
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(output);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(output);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        if (foundPassed || foundFailed) {
            int passed = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
            int failed = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
            return Optional.of(new TestCounts(passed + failed, failed));
        }
        return Optional.empty();
    }
}
