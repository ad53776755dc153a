package com.shipyard.core.report;

import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.TriggerContext;
import com.shipyard.core.stage.DeployVerifyStageHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReporterTest {

    private final Reporter reporter = new Reporter("https://ci.example.com/runs/");
    private final ArtifactTag tag = new ArtifactTag("ghcr.io", "acme", "adder", "abc123");

    @Test
    @DisplayName("a failed run lists every stage with its status and the run link")
    void failedRun() {
        var coverage = new Stage("coverage", List.of(), StageKind.COVERAGE_CHECK, GatePolicy.BLOCKING);
        var build = new Stage("build-and-publish", List.of("coverage"), StageKind.BUILD_AND_PUBLISH, GatePolicy.BLOCKING);
        var run = new PipelineRun("CI-2026-0003", "ci", TriggerContext.commit("2/merge", "abc123"),
                List.of("coverage", "build-and-publish"));
        run.record(StageResult.failure(coverage, FailureKind.ASSERTION, "coverage 71.00% (threshold 80.00%)",
                Map.of(), Instant.now()));
        run.record(StageResult.skipped(build, "upstream coverage failed"));
        run.complete(RunStatus.FAILED);

        String body = reporter.render(run);

        assertTrue(body.startsWith("### ❌ ci: FAIL"));
        assertTrue(body.contains("**Commit:** `abc123`"));
        assertTrue(body.contains("| coverage | blocking | ❌ failed | coverage 71.00% (threshold 80.00%) |"));
        assertTrue(body.contains("| build-and-publish | blocking | ⏭️ skipped |"));
        assertTrue(body.contains("[View run CI-2026-0003](https://ci.example.com/runs/CI-2026-0003)"));
        assertFalse(body.contains("Artifact tags"));
    }

    @Test
    @DisplayName("a run still in progress renders as running, neither pass nor fail")
    void pendingRun() {
        var lint = new Stage("lint", List.of(), StageKind.TEST, GatePolicy.BLOCKING);
        var run = new PipelineRun("CI-2026-0005", "ci", TriggerContext.commit("main", "abc123"),
                List.of("lint", "coverage"));
        run.record(StageResult.success(lint, "exit 0", Map.of(), Instant.now()));

        String body = reporter.render(run);

        assertTrue(body.startsWith("### ⏳ ci: RUNNING"), body);
        assertFalse(body.contains("FAIL"));
        assertFalse(body.contains("PASS"));
        assertTrue(body.contains("| lint | blocking | ✅ success |"));
    }

    @Test
    @DisplayName("infrastructure failures are worded as operational issues")
    void infrastructureWording() {
        var scan = new Stage("scan-blocking", List.of(), StageKind.SECURITY_SCAN, GatePolicy.BLOCKING);
        var run = new PipelineRun("CI-2026-0004", "ci", TriggerContext.commit("main", "abc123"), List.of("scan-blocking"));
        run.record(StageResult.failure(scan, FailureKind.INFRASTRUCTURE, "trivy | not found", Map.of(), Instant.now()));
        run.complete(RunStatus.FAILED);

        String body = reporter.render(run);

        assertTrue(body.contains("⚠️ error"));
        assertTrue(body.contains("operational issue, not a code defect: trivy \\| not found"));
    }

    @Test
    @DisplayName("a successful deploy run includes tags and the deployment check")
    void deploymentCheckIncluded() {
        var deploy = new Stage("deploy-verify", List.of(), StageKind.DEPLOY_VERIFY, GatePolicy.BLOCKING);
        var run = new PipelineRun("CD-2026-0005", "cd", TriggerContext.commit("main", "abc123"), List.of("deploy-verify"));
        run.addTags(List.of(tag));
        var check = DeploymentCheck.passed(tag, "5\n");
        run.record(StageResult.success(deploy, check.message(),
                Map.of(DeployVerifyStageHandler.PAYLOAD_CHECK, check), Instant.now()));
        run.complete(RunStatus.SUCCESS);

        String body = reporter.render(run);

        assertTrue(body.startsWith("### ✅ cd: PASS"));
        assertTrue(body.contains("- `ghcr.io/acme/adder:abc123`"));
        assertTrue(body.contains("#### Deployment check: PASS"));
        assertTrue(body.contains("```\n5\n```"));
    }

    @Test
    @DisplayName("a check that never pulled says so")
    void checkWithoutArtifact() {
        String body = reporter.render(DeploymentCheck.infrastructureFailure(null, "could not pull"));

        assertTrue(body.contains("#### Deployment check: FAIL"));
        assertTrue(body.contains("(not pulled)"));
        assertTrue(body.contains("Operational issue: could not pull"));
        assertFalse(body.contains("```"));
    }
}
