package com.shipyard.core.report;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.StageStatus;
import com.shipyard.core.stage.DeployVerifyStageHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders runs and deployment checks as Markdown for change-request comments.
 * Pure formatting; no I/O.
 */
@Component
public class Reporter {

    private static final int MAX_DETAIL = 120;
    private static final int MAX_STDOUT = 500;

    private final String runUrlBase;

    @Autowired
    public Reporter(ShipyardProperties properties) {
        this(properties.getPipeline().getRunUrlBase());
    }

    public Reporter(String runUrlBase) {
        this.runUrlBase = runUrlBase != null ? runUrlBase : "";
    }

    public String render(PipelineRun run) {
        var sb = new StringBuilder();
        sb.append("### ").append(headline(run)).append("\n\n");
        sb.append("**Ref:** `").append(run.refName().isEmpty() ? "(none)" : run.refName()).append("`  \n");
        sb.append("**Commit:** `").append(run.commitId()).append("`\n\n");

        sb.append("| Stage | Policy | Status | Detail |\n");
        sb.append("|-------|--------|--------|--------|\n");
        for (StageResult r : run.results()) {
            sb.append("| ").append(r.stageName())
              .append(" | ").append(r.policy().name().toLowerCase(Locale.ROOT))
              .append(" | ").append(statusCell(r))
              .append(" | ").append(cell(detail(r)))
              .append(" |\n");
        }

        if (!run.tags().isEmpty()) {
            sb.append("\n**Artifact tags:**\n");
            for (ArtifactTag tag : run.tags()) {
                sb.append("- `").append(tag.reference()).append("`\n");
            }
        }

        for (StageResult r : run.results()) {
            if (r.payload().get(DeployVerifyStageHandler.PAYLOAD_CHECK) instanceof DeploymentCheck check) {
                sb.append('\n').append(render(check));
            }
        }

        sb.append("\n[View run ").append(run.runId()).append("](").append(runUrlBase).append(run.runId()).append(")\n");
        return sb.toString();
    }

    public String render(DeploymentCheck check) {
        var sb = new StringBuilder();
        sb.append("#### Deployment check: ").append(check.passed() ? "PASS" : "FAIL").append("\n\n");
        sb.append("- Artifact: ").append(check.tag() != null ? "`" + check.tag().reference() + "`" : "(not pulled)").append('\n');
        if (check.failureKind() == FailureKind.INFRASTRUCTURE) {
            sb.append("- Operational issue: ").append(check.message()).append('\n');
        } else {
            sb.append("- Exit status: ").append(check.exitCode()).append('\n');
            sb.append("- Result: ").append(check.message()).append('\n');
        }
        if (check.stdout() != null && !check.stdout().isEmpty()) {
            String out = check.stdout().length() > MAX_STDOUT
                    ? check.stdout().substring(0, MAX_STDOUT) + "..." : check.stdout();
            sb.append("\n```\n").append(out.stripTrailing()).append("\n```\n");
        }
        return sb.toString();
    }

    /** Symbol and verdict for the title line; a run still in progress has neither passed nor failed. */
    private static String headline(PipelineRun run) {
        return switch (run.status()) {
            case SUCCESS -> "✅ " + run.pipeline() + ": PASS";
            case FAILED -> "❌ " + run.pipeline() + ": FAIL";
            case PENDING -> "⏳ " + run.pipeline() + ": RUNNING";
        };
    }

    private static String statusCell(StageResult r) {
        if (r.status() == StageStatus.SUCCESS) return "✅ success";
        if (r.status() == StageStatus.SKIPPED) return "⏭️ skipped";
        return r.failureKind() == FailureKind.INFRASTRUCTURE ? "⚠️ error" : "❌ failed";
    }

    private static String detail(StageResult r) {
        String message = r.message() != null ? r.message() : "";
        if (r.isInfrastructureFailure()) {
            return "operational issue, not a code defect: " + message;
        }
        return message;
    }

    private static String cell(String text) {
        String flat = text.replace("\r", " ").replace("\n", " ").replace("|", "\\|");
        return flat.length() > MAX_DETAIL ? flat.substring(0, MAX_DETAIL) + "..." : flat;
    }
}
