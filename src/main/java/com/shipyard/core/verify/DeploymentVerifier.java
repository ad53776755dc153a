package com.shipyard.core.verify;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.ArtifactRegistry;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.ExecutionSandbox;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.DerivedTags;
import com.shipyard.core.tagging.TagDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Smoke-tests a published artifact: pull it, run it with two fixed operands and
 * check that it prints their sum.
 * <p>
 * The mutable tag is tried first; if it cannot be pulled the immutable commit tag is
 * used. A newer push may have moved the mutable tag since this commit was published;
 * that staleness window is accepted. This class never pushes, tags or removes images.
 */
@Service
public class DeploymentVerifier {

    private static final Logger log = LoggerFactory.getLogger(DeploymentVerifier.class);

    static final List<String> INPUTS = List.of("2", "3");
    static final String EXPECTED_OUTPUT = "5";

    private final TagDeriver tagDeriver;
    private final ArtifactRegistry registry;
    private final ExecutionSandbox sandbox;
    private final Duration runTimeout;
    private final PipelineMetrics metrics;

    @Autowired
    public DeploymentVerifier(TagDeriver tagDeriver, ArtifactRegistry registry, ExecutionSandbox sandbox,
                              ShipyardProperties properties,
                              @Autowired(required = false) PipelineMetrics metrics) {
        this(tagDeriver, registry, sandbox, properties.getRunTimeout(), metrics);
    }

    public DeploymentVerifier(TagDeriver tagDeriver, ArtifactRegistry registry, ExecutionSandbox sandbox,
                              Duration runTimeout, PipelineMetrics metrics) {
        this.tagDeriver = tagDeriver;
        this.registry = registry;
        this.sandbox = sandbox;
        this.runTimeout = runTimeout;
        this.metrics = metrics;
    }

    public DeploymentCheck verify(String refName, String commitId) {
        DeploymentCheck check = doVerify(refName, commitId);
        log.info("Deployment check for {}@{}: {} ({})", refName, commitId,
                check.passed() ? "PASS" : "FAIL", check.message());
        if (metrics != null) {
            metrics.recordDeploymentCheck(check.passed(), check.failureKind());
        }
        return check;
    }

    private DeploymentCheck doVerify(String refName, String commitId) {
        DerivedTags tags = tagDeriver.deriveTags(refName, commitId);

        ArtifactTag pulled = pullWithFallback(tags);
        if (pulled == null) {
            return DeploymentCheck.infrastructureFailure(null,
                    "could not pull " + tags.mutableTag().reference() + " or " + tags.immutableTag().reference());
        }

        CommandResult result;
        try {
            result = sandbox.run(pulled, INPUTS, runTimeout);
        } catch (CollaboratorException e) {
            log.warn("Could not run {}: {}", pulled, e.getMessage());
            return DeploymentCheck.infrastructureFailure(pulled, "could not run artifact: " + e.getMessage());
        }

        String stdout = result.output();
        if (result.exitCode() != 0) {
            return DeploymentCheck.assertionFailure(pulled, stdout, result.exitCode(),
                    "exit status " + result.exitCode() + ", expected 0");
        }
        if (!EXPECTED_OUTPUT.equals(stdout.trim())) {
            return DeploymentCheck.assertionFailure(pulled, stdout, result.exitCode(),
                    "output '" + stdout.trim() + "', expected '" + EXPECTED_OUTPUT + "'");
        }
        return DeploymentCheck.passed(pulled, stdout);
    }

    /**
     * @return the tag that was pulled, or {@code null} if neither could be pulled
     */
    private ArtifactTag pullWithFallback(DerivedTags tags) {
        for (ArtifactTag candidate : tags.asList()) {
            try {
                registry.pull(candidate);
                log.info("Pulled {}", candidate);
                return candidate;
            } catch (CollaboratorException e) {
                log.warn("Pull of {} failed: {}", candidate, e.getMessage());
            }
        }
        return null;
    }
}
