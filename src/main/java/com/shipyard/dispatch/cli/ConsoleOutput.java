package com.shipyard.dispatch.cli;

import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.StageResult;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Shipyard CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHIPYARD v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHIPYARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(StageResult result) {
        String status = switch (result.status()) {
            case SUCCESS -> "@|fg(green) PASS|@";
            case SKIPPED -> "@|fg(white) SKIP|@";
            case FAILURE -> result.failureKind() == FailureKind.INFRASTRUCTURE
                    ? "@|fg(yellow) ERROR|@" : "@|fg(red) FAIL|@";
        };
        String policy = result.policy().name().toLowerCase(Locale.ROOT);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + result.stageName() + " (" + policy + ", "
                + formatDuration(result.durationMs()) + ")"
                + (result.message() != null ? " — " + result.message() : "")));
    }

    public static void run(PipelineRun run) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + run.pipeline().toUpperCase(Locale.ROOT) + " " + run.runId() + "|@ "
                + run.refName() + "@" + run.commitId()));
        for (StageResult result : run.results()) {
            stage(result);
        }
        for (var tag : run.tags()) {
            System.out.println("  tag " + tag.reference());
        }
        if (run.status() == RunStatus.SUCCESS) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green),bold SUCCESS|@"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red),bold FAILED|@"));
        }
    }

    public static void deploymentCheck(DeploymentCheck check) {
        String target = check.tag() != null ? check.tag().reference() : "(nothing pulled)";
        if (check.passed()) {
            success("Deployment check passed for " + target + ": output '" + check.stdout().trim() + "'");
        } else if (check.failureKind() == FailureKind.INFRASTRUCTURE) {
            warn("Deployment check could not run (" + target + "): " + check.message());
        } else {
            error("Deployment check failed for " + target + ": " + check.message());
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
